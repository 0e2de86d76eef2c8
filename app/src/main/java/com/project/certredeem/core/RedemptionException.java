package com.project.certredeem.core;

/**
 * Failure of an administrative or redemption call. A call that throws this has changed no state.
 */
public class RedemptionException extends RuntimeException {

    public enum Kind {
        /** Signature recovered to an address outside the required trust set. */
        UNAUTHORIZED,
        /** The holder already redeemed (one of) the certificate(s). */
        ALREADY_CLAIMED,
        INVALID_SIGNATURE_FORMAT,
        SIGNATURE_RECOVERY_FAILED,
        /** Caller is not the administrator. */
        ADMIN_REQUIRED,
        /** Condensed amount differs from the sum of the registered amounts. */
        AMOUNT_MISMATCH
    }

    private final Kind kind;

    public RedemptionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public RedemptionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
