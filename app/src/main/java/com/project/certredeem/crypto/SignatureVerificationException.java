package com.project.certredeem.crypto;

/**
 * Raised by {@link SignatureVerifier} when a signature cannot yield a signer address.
 */
public class SignatureVerificationException extends RuntimeException {

    public enum Reason {
        /** Wrong length, bad recovery byte, or out-of-range / malleable r and s. */
        INVALID_FORMAT,
        /** Well-formed signature from which no public key could be recovered. */
        RECOVERY_FAILED
    }

    private final Reason reason;

    public SignatureVerificationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public SignatureVerificationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }
}
