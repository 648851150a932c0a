package taskescrow.registry.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request DTO for changing the platform fee.
 * PUT /api/v1/platform/fee
 */
public record UpdateFeeRequest(
        @JsonProperty("feePercentage") Integer feePercentage) {

    public void validate() {
        if (feePercentage == null) {
            throw new IllegalArgumentException("feePercentage is required");
        }
    }
}
