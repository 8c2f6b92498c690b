package tech.yump.secretmanager.secrets;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class SecretNameSanitizerTest {

    @Test
    @DisplayName("sanitize: blank or missing names become the default name")
    void sanitize_blankNames_returnDefault() {
        assertThat(SecretNameSanitizer.sanitize("")).isEqualTo("secret");
        assertThat(SecretNameSanitizer.sanitize("   ")).isEqualTo("secret");
        assertThat(SecretNameSanitizer.sanitize(null)).isEqualTo("secret");
    }

    @Test
    @DisplayName("sanitize: disallowed characters become underscores")
    void sanitize_replacesDisallowedCharacters() {
        assertThat(SecretNameSanitizer.sanitize("my-secret name@2024!")).isEqualTo("my_secret_name_2024_");
    }

    @Test
    @DisplayName("sanitize: names starting with a digit get a leading underscore")
    void sanitize_leadingDigit_isPrefixed() {
        assertThat(SecretNameSanitizer.sanitize("123x")).isEqualTo("_123x");
    }

    @Test
    @DisplayName("sanitize: surrounding whitespace is trimmed before replacement")
    void sanitize_trimsWhitespace() {
        assertThat(SecretNameSanitizer.sanitize("  api key  ")).isEqualTo("api_key");
    }

    @Test
    @DisplayName("sanitize: result is cut to 64 characters")
    void sanitize_truncatesTo64() {
        String longName = "a".repeat(100);
        assertThat(SecretNameSanitizer.sanitize(longName)).hasSize(64);
        // Prefix counts towards the limit
        assertThat(SecretNameSanitizer.sanitize("9" + "b".repeat(100)))
                .hasSize(64)
                .startsWith("_9b");
    }

    @ParameterizedTest
    @ValueSource(strings = {"my-secret name@2024!", "123x", "ünïcødé", "__ok__", "   ", "a/b/c#d", "-"})
    @DisplayName("sanitize: output is a valid Vault name and sanitizing twice changes nothing")
    void sanitize_isIdempotentAndValid(String input) {
        String once = SecretNameSanitizer.sanitize(input);

        assertThat(once).matches("^[A-Za-z_][A-Za-z0-9_]{0,63}$");
        assertThat(SecretNameSanitizer.sanitize(once)).isEqualTo(once);
    }
}
