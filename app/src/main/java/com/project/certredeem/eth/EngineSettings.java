package com.project.certredeem.eth;

import com.project.certredeem.core.CondensedAmountPolicy;
import com.project.certredeem.core.InputValidator;
import com.project.certredeem.crypto.AccountAddress;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Settings for one service instance, resolved from environment variables with the
 * network's deployment file as fallback. Environment values always win.
 *
 * <ul>
 *     <li>{@code REDEEM_NETWORK} (default {@code local}) selects {@code <network>.json}</li>
 *     <li>{@code REDEEM_DEPLOYMENTS_DIR} (default {@code deployments})</li>
 *     <li>{@code REDEEM_SERVICE_ADDRESS}, {@code REDEEM_ADMIN_ADDRESS}: required unless the deployment file has them</li>
 *     <li>{@code REDEEM_CONDENSED_POLICY}: {@code recomputed} (default) or {@code attested}</li>
 * </ul>
 */
public record EngineSettings(
        String network,
        AccountAddress serviceAddress,
        AccountAddress admin,
        CondensedAmountPolicy condensedPolicy
) {
    public static final String ENV_NETWORK = "REDEEM_NETWORK";
    public static final String ENV_DEPLOYMENTS_DIR = "REDEEM_DEPLOYMENTS_DIR";
    public static final String ENV_SERVICE_ADDRESS = "REDEEM_SERVICE_ADDRESS";
    public static final String ENV_ADMIN_ADDRESS = "REDEEM_ADMIN_ADDRESS";
    public static final String ENV_CONDENSED_POLICY = "REDEEM_CONDENSED_POLICY";

    public static final String DEFAULT_NETWORK = "local";
    public static final String DEFAULT_DEPLOYMENTS_DIR = "deployments";

    public EngineSettings {
        Objects.requireNonNull(network, "network must not be null");
        Objects.requireNonNull(serviceAddress, "serviceAddress must not be null");
        Objects.requireNonNull(admin, "admin must not be null");
        Objects.requireNonNull(condensedPolicy, "condensedPolicy must not be null");
    }

    public static EngineSettings fromEnvironment() {
        return resolve(System.getenv());
    }

    public static EngineSettings resolve(Map<String, String> env) {
        String network = valueOr(env.get(ENV_NETWORK), DEFAULT_NETWORK);
        Path deploymentsDir = Paths.get(valueOr(env.get(ENV_DEPLOYMENTS_DIR), DEFAULT_DEPLOYMENTS_DIR));
        Optional<DeploymentMetadata> deployment = new DeploymentRegistry(deploymentsDir).load(network);

        String service = pick(env.get(ENV_SERVICE_ADDRESS), deployment, DeploymentMetadata::serviceAddress)
                .orElseThrow(() -> missing(ENV_SERVICE_ADDRESS, "address", network, deploymentsDir));
        String admin = pick(env.get(ENV_ADMIN_ADDRESS), deployment, DeploymentMetadata::admin)
                .orElseThrow(() -> missing(ENV_ADMIN_ADDRESS, "admin", network, deploymentsDir));
        String policy = pick(env.get(ENV_CONDENSED_POLICY), deployment, DeploymentMetadata::condensedPolicy)
                .orElse(null);

        return new EngineSettings(
                network,
                InputValidator.parseAddress(service, "service address"),
                InputValidator.parseAddress(admin, "admin address"),
                CondensedAmountPolicy.fromEnv(policy, CondensedAmountPolicy.RECOMPUTED)
        );
    }

    private static Optional<String> pick(String envValue,
                                         Optional<DeploymentMetadata> deployment,
                                         Function<DeploymentMetadata, String> field) {
        if (envValue != null && !envValue.isBlank()) {
            return Optional.of(envValue.trim());
        }
        return deployment.map(field).filter(value -> !value.isBlank());
    }

    private static String valueOr(String value, String fallback) {
        return value == null || value.isBlank() ? fallback : value.trim();
    }

    private static IllegalStateException missing(String envName, String field, String network, Path dir) {
        return new IllegalStateException(String.format(
                "%s not set and no '%s' in %s. Set the variable or add the field to the deployment file.",
                envName, field, dir.resolve(network + ".json")));
    }
}
