package tech.yump.secretmanager.config.validation;

import jakarta.validation.Constraint;
import jakarta.validation.Payload;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Class-level check that a Vault configuration carries the fields its auth method needs.
 */
@Documented
@Constraint(validatedBy = VaultAuthConfigValidator.class)
@Target({ ElementType.TYPE })
@Retention(RetentionPolicy.RUNTIME)
public @interface ValidVaultAuthConfig {
  String message() default "Vault configuration is incomplete for the selected authentication method.";
  Class<?>[] groups() default {};
  Class<? extends Payload>[] payload() default {};
}
