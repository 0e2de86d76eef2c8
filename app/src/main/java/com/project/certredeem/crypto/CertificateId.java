package com.project.certredeem.crypto;

import org.web3j.utils.Numeric;

import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 32-byte Keccak-256 identifier of a certificate type.
 */
public final class CertificateId {

    public static final int LENGTH = 32;

    private static final Pattern HEX = Pattern.compile("[0-9a-fA-F]+");

    private final byte[] bytes;

    private CertificateId(byte[] bytes) {
        this.bytes = bytes;
    }

    public static CertificateId of(byte[] bytes) {
        Objects.requireNonNull(bytes, "certificate id bytes must not be null");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException(
                String.format("Certificate id must be %d bytes, got %d", LENGTH, bytes.length));
        }
        return new CertificateId(bytes.clone());
    }

    public static CertificateId fromHex(String hex) {
        Objects.requireNonNull(hex, "certificate id hex must not be null");
        String clean = Numeric.cleanHexPrefix(hex.trim());
        if (clean.length() != LENGTH * 2) {
            throw new IllegalArgumentException("Certificate id must be 64 hex characters: '" + hex + "'");
        }
        if (!HEX.matcher(clean).matches()) {
            throw new IllegalArgumentException("Certificate id is not valid hex: '" + hex + "'");
        }
        return new CertificateId(Numeric.hexStringToByteArray(clean));
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public String toHex() {
        return Numeric.toHexString(bytes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CertificateId)) {
            return false;
        }
        return Arrays.equals(bytes, ((CertificateId) o).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
