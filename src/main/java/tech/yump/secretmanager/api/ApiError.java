package tech.yump.secretmanager.api;

import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Shape of error bodies, for the OpenAPI document. Handlers return RFC 7807 problem details.
 */
@Schema(description = "Standard error response format (RFC 7807 problem detail)")
public record ApiError(
        @Schema(description = "Short summary of the problem.", example = "Secrets Backend Error", requiredMode = Schema.RequiredMode.REQUIRED)
        String title,
        @Schema(description = "HTTP status code.", example = "500", requiredMode = Schema.RequiredMode.REQUIRED)
        int status,
        @Schema(description = "Explanation safe to show to the caller.",
                example = "An error occurred while accessing secrets. Please try again later or contact your administrator.")
        String detail
) {}
