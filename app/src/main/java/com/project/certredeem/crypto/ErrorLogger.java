package com.project.certredeem.crypto;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Centralized logging for redemption and signature operations.
 * Every entry is tagged with the operation that produced it.
 */
public final class ErrorLogger {

    private static final Logger LOG = LogManager.getLogger("com.project.certredeem");

    private ErrorLogger() {
    }

    public static void logError(String operation, String message, Throwable error) {
        if (error == null) {
            LOG.error("ERROR in {}: {}", operation, message);
        } else {
            LOG.error("ERROR in {}: {}", operation, message, error);
        }
    }

    public static void logWarn(String operation, String message) {
        LOG.warn("WARN in {}: {}", operation, message);
    }

    public static void logInfo(String operation, String message) {
        LOG.info("INFO in {}: {}", operation, message);
    }
}
