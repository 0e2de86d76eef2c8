package com.project.certredeem.eth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-network deployment record: where the service instance lives and who administers it.
 *
 * @param network         network name, also the file name stem.
 * @param serviceAddress  address bound into every redemption hash.
 * @param admin           administrator address.
 * @param condensedPolicy {@code recomputed} or {@code attested}; absent means the default.
 * @param deployedAt      ISO-8601 timestamp, informational.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeploymentMetadata(
        @JsonProperty("network") String network,
        @JsonProperty("address") String serviceAddress,
        @JsonProperty("admin") String admin,
        @JsonProperty("condensedPolicy") String condensedPolicy,
        @JsonProperty("deployedAt") String deployedAt
) {
}
