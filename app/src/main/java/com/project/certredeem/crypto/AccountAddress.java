package com.project.certredeem.crypto;

import org.web3j.crypto.Keys;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 20-byte account identity (Ethereum-style address) used for admins, delegates, condensers,
 * holders and the service instance itself.
 */
public final class AccountAddress {

    public static final int LENGTH = 20;

    /** Width of an address once left-padded to a full ABI word. */
    public static final int PADDED_LENGTH = 32;

    private static final Pattern HEX = Pattern.compile("[0-9a-fA-F]+");

    private final byte[] bytes;

    private AccountAddress(byte[] bytes) {
        this.bytes = bytes;
    }

    public static AccountAddress of(byte[] bytes) {
        Objects.requireNonNull(bytes, "address bytes must not be null");
        if (bytes.length != LENGTH) {
            throw new IllegalArgumentException(
                String.format("Address must be %d bytes, got %d", LENGTH, bytes.length));
        }
        return new AccountAddress(bytes.clone());
    }

    /**
     * Parse a {@code 0x}-prefixed (or bare) hex address. Checksum casing is not enforced.
     */
    public static AccountAddress fromHex(String hex) {
        Objects.requireNonNull(hex, "address hex must not be null");
        String clean = Numeric.cleanHexPrefix(hex.trim());
        if (clean.length() != LENGTH * 2) {
            throw new IllegalArgumentException("Address must be 40 hex characters: '" + hex + "'");
        }
        if (!HEX.matcher(clean).matches()) {
            throw new IllegalArgumentException("Address is not valid hex: '" + hex + "'");
        }
        return new AccountAddress(Numeric.hexStringToByteArray(clean));
    }

    /**
     * Derive the address of an uncompressed secp256k1 public key (64 bytes, no prefix).
     */
    public static AccountAddress fromPublicKey(BigInteger publicKey) {
        Objects.requireNonNull(publicKey, "publicKey must not be null");
        return fromHex(Keys.getAddress(publicKey));
    }

    public byte[] toBytes() {
        return bytes.clone();
    }

    public byte[] toPaddedBytes() {
        byte[] word = new byte[PADDED_LENGTH];
        System.arraycopy(bytes, 0, word, PADDED_LENGTH - LENGTH, LENGTH);
        return word;
    }

    public String toHex() {
        return Numeric.toHexString(bytes);
    }

    /**
     * EIP-55 mixed-case rendering, for display only.
     */
    public String toChecksumHex() {
        return Keys.toChecksumAddress(toHex());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AccountAddress)) {
            return false;
        }
        return Arrays.equals(bytes, ((AccountAddress) o).bytes);
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
