package com.project.certredeem.eth;

import com.project.certredeem.core.CondensedAmountPolicy;
import com.project.certredeem.crypto.AccountAddress;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Engine settings")
class EngineSettingsTest {

    private static final String SERVICE = "0x00000000000000000000000000000000000000aa";
    private static final String ADMIN = "0x00000000000000000000000000000000000000bb";
    private static final String OTHER = "0x00000000000000000000000000000000000000cc";

    @TempDir
    Path dir;

    private Map<String, String> env(String... pairs) {
        Map<String, String> env = new HashMap<>();
        env.put(EngineSettings.ENV_DEPLOYMENTS_DIR, dir.toString());
        for (int i = 0; i < pairs.length; i += 2) {
            env.put(pairs[i], pairs[i + 1]);
        }
        return env;
    }

    @Nested
    @DisplayName("From environment only")
    class EnvironmentOnly {

        @Test
        @DisplayName("Reads addresses and defaults the rest")
        void defaults() {
            EngineSettings settings = EngineSettings.resolve(env(
                EngineSettings.ENV_SERVICE_ADDRESS, SERVICE,
                EngineSettings.ENV_ADMIN_ADDRESS, ADMIN));

            assertEquals(EngineSettings.DEFAULT_NETWORK, settings.network());
            assertEquals(AccountAddress.fromHex(SERVICE), settings.serviceAddress());
            assertEquals(AccountAddress.fromHex(ADMIN), settings.admin());
            assertEquals(CondensedAmountPolicy.RECOMPUTED, settings.condensedPolicy());
        }

        @Test
        @DisplayName("Missing service address names the variable")
        void missingService() {
            IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> EngineSettings.resolve(env(EngineSettings.ENV_ADMIN_ADDRESS, ADMIN)));
            assertTrue(e.getMessage().contains(EngineSettings.ENV_SERVICE_ADDRESS));
        }

        @Test
        @DisplayName("Unknown policy names are rejected")
        void unknownPolicy() {
            assertThrows(IllegalArgumentException.class, () -> EngineSettings.resolve(env(
                EngineSettings.ENV_SERVICE_ADDRESS, SERVICE,
                EngineSettings.ENV_ADMIN_ADDRESS, ADMIN,
                EngineSettings.ENV_CONDENSED_POLICY, "trust-me")));
        }
    }

    @Nested
    @DisplayName("With a deployment file")
    class WithDeployment {

        @Test
        @DisplayName("Falls back to the deployment file and lets the environment override it")
        void fallbackAndOverride() throws IOException {
            new DeploymentRegistry(dir).save(new DeploymentMetadata("sepolia", SERVICE, ADMIN, "attested", null));

            EngineSettings fromFile = EngineSettings.resolve(env(EngineSettings.ENV_NETWORK, "sepolia"));
            assertEquals("sepolia", fromFile.network());
            assertEquals(AccountAddress.fromHex(SERVICE), fromFile.serviceAddress());
            assertEquals(CondensedAmountPolicy.ATTESTED, fromFile.condensedPolicy());

            EngineSettings overridden = EngineSettings.resolve(env(
                EngineSettings.ENV_NETWORK, "sepolia",
                EngineSettings.ENV_SERVICE_ADDRESS, OTHER,
                EngineSettings.ENV_CONDENSED_POLICY, "RECOMPUTED"));
            assertEquals(AccountAddress.fromHex(OTHER), overridden.serviceAddress());
            assertEquals(AccountAddress.fromHex(ADMIN), overridden.admin());
            assertEquals(CondensedAmountPolicy.RECOMPUTED, overridden.condensedPolicy());
        }
    }
}
