package com.project.certredeem.crypto;

import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.security.SignatureException;
import java.util.Arrays;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Recovers the signer address of a secp256k1 signature over a 32-byte message hash.
 *
 * <p>The hash is never recovered against directly: it is first wrapped in the Ethereum
 * signed-message envelope {@code "\x19Ethereum Signed Message:\n32" || hash} and re-hashed,
 * so a signature produced here cannot double as a raw-hash signature elsewhere.</p>
 *
 * <p>Accepted signature layout is {@code r(32) || s(32) || v(1)} with {@code v} in
 * {27, 28} ({0, 1} is normalized). High-s signatures are rejected.</p>
 */
public class SignatureVerifier {

    public static final int SIGNATURE_LENGTH = 65;
    public static final int MESSAGE_HASH_LENGTH = 32;

    /** secp256k1 group order. */
    static final BigInteger CURVE_ORDER =
        new BigInteger("FFFFFFFFFFFFFFFFFFFFFFFFFFFFFFFEBAAEDCE6AF48A03BBFD25E8CD0364141", 16);
    static final BigInteger HALF_CURVE_ORDER = CURVE_ORDER.shiftRight(1);

    private static final Pattern HEX = Pattern.compile("[0-9a-fA-F]+");

    public AccountAddress recoverSigner(byte[] messageHash, String signatureHex) {
        return recoverSigner(messageHash, decodeHex(signatureHex));
    }

    public AccountAddress recoverSigner(byte[] messageHash, byte[] signature) {
        Objects.requireNonNull(messageHash, "messageHash must not be null");
        if (messageHash.length != MESSAGE_HASH_LENGTH) {
            throw new IllegalArgumentException(
                String.format("messageHash must be %d bytes, got %d", MESSAGE_HASH_LENGTH, messageHash.length));
        }
        Sign.SignatureData signatureData = parse(signature);

        BigInteger publicKey;
        try {
            publicKey = Sign.signedPrefixedMessageToKey(messageHash, signatureData);
        } catch (SignatureException | RuntimeException e) {
            // RuntimeException covers an r that does not decode to a curve point
            throw new SignatureVerificationException(SignatureVerificationException.Reason.RECOVERY_FAILED,
                "Could not recover signer: " + e.getMessage(), e);
        }
        if (publicKey == null || publicKey.signum() == 0) {
            throw new SignatureVerificationException(SignatureVerificationException.Reason.RECOVERY_FAILED,
                "Could not recover signer: empty public key");
        }
        return AccountAddress.fromPublicKey(publicKey);
    }

    /**
     * Split a 65-byte signature into web3j's {@link Sign.SignatureData}, enforcing range checks.
     */
    static Sign.SignatureData parse(byte[] signature) {
        if (signature == null || signature.length != SIGNATURE_LENGTH) {
            throw new SignatureVerificationException(SignatureVerificationException.Reason.INVALID_FORMAT,
                String.format("Signature must be %d bytes, got %d",
                    SIGNATURE_LENGTH, signature == null ? 0 : signature.length));
        }
        byte[] r = Arrays.copyOfRange(signature, 0, 32);
        byte[] s = Arrays.copyOfRange(signature, 32, 64);
        int v = signature[64] & 0xFF;
        if (v == 0 || v == 1) {
            v += 27;
        }
        if (v != 27 && v != 28) {
            throw new SignatureVerificationException(SignatureVerificationException.Reason.INVALID_FORMAT,
                "Signature recovery byte must be 27 or 28, got " + (signature[64] & 0xFF));
        }

        BigInteger rValue = new BigInteger(1, r);
        BigInteger sValue = new BigInteger(1, s);
        if (rValue.signum() == 0 || rValue.compareTo(CURVE_ORDER) >= 0) {
            throw new SignatureVerificationException(SignatureVerificationException.Reason.INVALID_FORMAT,
                "Signature r value out of range");
        }
        if (sValue.signum() == 0 || sValue.compareTo(HALF_CURVE_ORDER) > 0) {
            throw new SignatureVerificationException(SignatureVerificationException.Reason.INVALID_FORMAT,
                "Signature s value out of range (high-s signatures are not accepted)");
        }
        return new Sign.SignatureData((byte) v, r, s);
    }

    /**
     * Decode a {@code 0x}-prefixed (or bare) 65-byte hex signature.
     */
    public static byte[] decodeHex(String signatureHex) {
        if (signatureHex == null) {
            throw new SignatureVerificationException(SignatureVerificationException.Reason.INVALID_FORMAT,
                "Signature must not be null");
        }
        String clean = Numeric.cleanHexPrefix(signatureHex.trim());
        if (clean.length() != SIGNATURE_LENGTH * 2 || !HEX.matcher(clean).matches()) {
            throw new SignatureVerificationException(SignatureVerificationException.Reason.INVALID_FORMAT,
                "Signature must be " + SIGNATURE_LENGTH + " bytes of hex");
        }
        return Numeric.hexStringToByteArray(clean);
    }

    /**
     * Inverse of {@link #parse(byte[])}: {@code r || s || v}.
     */
    public static byte[] toBytes(Sign.SignatureData signatureData) {
        Objects.requireNonNull(signatureData, "signatureData must not be null");
        byte[] out = new byte[SIGNATURE_LENGTH];
        System.arraycopy(signatureData.getR(), 0, out, 0, 32);
        System.arraycopy(signatureData.getS(), 0, out, 32, 32);
        out[64] = signatureData.getV()[0];
        return out;
    }
}
