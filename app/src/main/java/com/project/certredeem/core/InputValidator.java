package com.project.certredeem.core;

import com.project.certredeem.crypto.AccountAddress;
import com.project.certredeem.crypto.CertificateId;
import com.project.certredeem.crypto.IdentityHasher;

import java.math.BigInteger;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Input validation for administrative and redemption calls.
 *
 * <p>Only structural checks live here (nulls, uint256 range, list shape). Business rules such as
 * "amount must be positive" or "at least one delegate" are deliberately not enforced.</p>
 */
public final class InputValidator {

    private InputValidator() {}

    /**
     * Validate that an amount is a non-negative integer below 2^256.
     *
     * @throws InvalidInputException if validation fails
     */
    public static void validateAmount(BigInteger amount, String fieldName) {
        if (amount == null) {
            throw new InvalidInputException(fieldName + " must not be null");
        }
        if (!IdentityHasher.fitsUint256(amount)) {
            throw new InvalidInputException(
                String.format("%s must be in range [0, 2^256): got %s", fieldName, amount));
        }
    }

    public static void validateDelegates(List<AccountAddress> delegates) {
        if (delegates == null) {
            throw new InvalidInputException("delegates must not be null");
        }
        for (int i = 0; i < delegates.size(); i++) {
            if (delegates.get(i) == null) {
                throw new InvalidInputException("delegates[" + i + "] must not be null");
            }
        }
    }

    public static void validateMetadata(String metadata) {
        if (metadata == null) {
            throw new InvalidInputException("metadata must not be null");
        }
    }

    /**
     * Condensed redemption lists must be non-empty and contain no null entries.
     */
    public static void validateCertificateIds(List<CertificateId> certificateIds) {
        if (certificateIds == null) {
            throw new InvalidInputException("certificateIds must not be null");
        }
        if (certificateIds.isEmpty()) {
            throw new InvalidInputException("certificateIds must not be empty");
        }
        for (CertificateId id : certificateIds) {
            if (id == null) {
                throw new InvalidInputException("certificateIds must not contain null");
            }
        }
    }

    /**
     * Reject a list naming the same certificate twice. Needed wherever the list is summed.
     */
    public static void validateDistinct(List<CertificateId> certificateIds) {
        Set<CertificateId> seen = new HashSet<>();
        for (CertificateId id : certificateIds) {
            if (!seen.add(id)) {
                throw new InvalidInputException("certificateIds contains duplicate id " + id);
            }
        }
    }

    public static AccountAddress parseAddress(String hex, String fieldName) {
        if (hex == null || hex.isBlank()) {
            throw new InvalidInputException(fieldName + " must not be empty");
        }
        try {
            return AccountAddress.fromHex(hex);
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException(fieldName + ": " + e.getMessage(), e);
        }
    }

    public static CertificateId parseCertificateId(String hex, String fieldName) {
        if (hex == null || hex.isBlank()) {
            throw new InvalidInputException(fieldName + " must not be empty");
        }
        try {
            return CertificateId.fromHex(hex);
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException(fieldName + ": " + e.getMessage(), e);
        }
    }

    public static BigInteger parseAmount(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new InvalidInputException(fieldName + " must not be empty");
        }
        BigInteger amount;
        try {
            amount = new BigInteger(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidInputException(fieldName + " is not a decimal integer: '" + value + "'", e);
        }
        validateAmount(amount, fieldName);
        return amount;
    }

    /**
     * Exception thrown when input validation fails.
     */
    public static class InvalidInputException extends IllegalArgumentException {
        public InvalidInputException(String message) {
            super(message);
        }

        public InvalidInputException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
