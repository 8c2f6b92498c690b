package tech.yump.secretmanager.config.validation;

import jakarta.validation.ConstraintValidator;
import jakarta.validation.ConstraintValidatorContext;
import org.springframework.util.StringUtils;
import tech.yump.secretmanager.secrets.vault.VaultConfig;

public class VaultAuthConfigValidator implements ConstraintValidator<ValidVaultAuthConfig, VaultConfig> {

  @Override
  public boolean isValid(VaultConfig value, ConstraintValidatorContext context) {
    if (value == null || value.authMethod() == null) {
      return true; // @NotNull on the field reports a missing method
    }

    String violation = switch (value.authMethod()) {
      case TOKEN -> StringUtils.hasText(value.token()) ? null
              : "token is required for token authentication";
      case K8S -> StringUtils.hasText(value.k8sRole()) ? null
              : "k8sRole is required for Kubernetes authentication";
      case AWS -> StringUtils.hasText(value.awsRole()) ? null
              : "awsRole is required for AWS IAM authentication";
    };

    if (violation == null) {
      return true;
    }
    // Report the method-specific message instead of the generic default
    context.disableDefaultConstraintViolation();
    context.buildConstraintViolationWithTemplate(violation).addConstraintViolation();
    return false;
  }
}
