package com.project.certredeem.crypto;

import com.project.certredeem.TestSigners;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Signature verification")
class SignatureVerifierTest {

    private final SignatureVerifier verifier = new SignatureVerifier();
    private final ECKeyPair signerKey = TestSigners.key("signer");
    private final AccountAddress signer = TestSigners.address(signerKey);
    private final byte[] hash = Hash.sha3("redeem me".getBytes(StandardCharsets.UTF_8));

    @Nested
    @DisplayName("Recovery")
    class Recovery {

        @Test
        @DisplayName("Recovers the address that signed the prefixed hash")
        void recoversSigner() {
            byte[] signature = TestSigners.sign(hash, signerKey);
            assertEquals(signer, verifier.recoverSigner(hash, signature));
        }

        @Test
        @DisplayName("Accepts hex with or without 0x prefix")
        void acceptsHex() {
            String hex = TestSigners.signHex(hash, signerKey);
            assertEquals(signer, verifier.recoverSigner(hash, hex));
            assertEquals(signer, verifier.recoverSigner(hash, Numeric.cleanHexPrefix(hex)));
        }

        @Test
        @DisplayName("Recovery byte 0/1 is treated as 27/28")
        void normalizesRecoveryByte() {
            byte[] signature = TestSigners.sign(hash, signerKey);
            signature[64] = (byte) (signature[64] - 27);
            assertEquals(signer, verifier.recoverSigner(hash, signature));
        }

        @Test
        @DisplayName("A signature over another hash recovers a different address")
        void differentHash() {
            byte[] signature = TestSigners.sign(hash, signerKey);
            byte[] otherHash = Hash.sha3("something else".getBytes(StandardCharsets.UTF_8));
            assertNotEquals(signer, verifier.recoverSigner(otherHash, signature));
        }

        @Test
        @DisplayName("A raw-hash signature without the message prefix does not verify as the signer")
        void prefixIsRequired() {
            Sign.SignatureData raw = Sign.signMessage(hash, signerKey, false);
            byte[] signature = SignatureVerifier.toBytes(raw);
            try {
                assertNotEquals(signer, verifier.recoverSigner(hash, signature));
            } catch (SignatureVerificationException e) {
                assertEquals(SignatureVerificationException.Reason.RECOVERY_FAILED, e.reason());
            }
        }

        @Test
        @DisplayName("Message hash must be 32 bytes")
        void hashLength() {
            byte[] signature = TestSigners.sign(hash, signerKey);
            assertThrows(IllegalArgumentException.class, () -> verifier.recoverSigner(new byte[31], signature));
        }
    }

    @Nested
    @DisplayName("Unrecoverable signatures")
    class Unrecoverable {

        @Test
        @DisplayName("r that is not the x-coordinate of a curve point fails recovery")
        void rOffCurve() {
            byte[] signature = withR(TestSigners.sign(hash, signerKey), BigInteger.valueOf(5));

            SignatureVerificationException e = assertThrows(SignatureVerificationException.class,
                () -> verifier.recoverSigner(hash, signature));
            assertEquals(SignatureVerificationException.Reason.RECOVERY_FAILED, e.reason());
        }
    }

    /** Replaces r, keeping the signature's valid s and v. */
    static byte[] withR(byte[] signature, BigInteger r) {
        byte[] copy = signature.clone();
        System.arraycopy(Numeric.toBytesPadded(r, 32), 0, copy, 0, 32);
        return copy;
    }

    @Nested
    @DisplayName("Malformed signatures")
    class Malformed {

        @Test
        @DisplayName("Wrong length is a format error")
        void wrongLength() {
            SignatureVerificationException e = assertThrows(SignatureVerificationException.class,
                () -> verifier.recoverSigner(hash, new byte[64]));
            assertEquals(SignatureVerificationException.Reason.INVALID_FORMAT, e.reason());
        }

        @Test
        @DisplayName("Recovery byte outside {0, 1, 27, 28} is a format error")
        void badRecoveryByte() {
            byte[] signature = TestSigners.sign(hash, signerKey);
            signature[64] = 29;
            SignatureVerificationException e = assertThrows(SignatureVerificationException.class,
                () -> verifier.recoverSigner(hash, signature));
            assertEquals(SignatureVerificationException.Reason.INVALID_FORMAT, e.reason());
        }

        @Test
        @DisplayName("High-s form of a valid signature is rejected")
        void highS() {
            byte[] signature = TestSigners.sign(hash, signerKey);
            BigInteger s = new BigInteger(1, java.util.Arrays.copyOfRange(signature, 32, 64));
            byte[] highS = Numeric.toBytesPadded(SignatureVerifier.CURVE_ORDER.subtract(s), 32);
            System.arraycopy(highS, 0, signature, 32, 32);
            signature[64] = (byte) (signature[64] == 27 ? 28 : 27);

            SignatureVerificationException e = assertThrows(SignatureVerificationException.class,
                () -> verifier.recoverSigner(hash, signature));
            assertEquals(SignatureVerificationException.Reason.INVALID_FORMAT, e.reason());
        }

        @Test
        @DisplayName("Zero r or s is rejected")
        void zeroComponents() {
            byte[] zeroR = TestSigners.sign(hash, signerKey);
            java.util.Arrays.fill(zeroR, 0, 32, (byte) 0);
            assertThrows(SignatureVerificationException.class, () -> verifier.recoverSigner(hash, zeroR));

            byte[] zeroS = TestSigners.sign(hash, signerKey);
            java.util.Arrays.fill(zeroS, 32, 64, (byte) 0);
            assertThrows(SignatureVerificationException.class, () -> verifier.recoverSigner(hash, zeroS));
        }

        @Test
        @DisplayName("Non-ASCII digits in signature text are a format error")
        void nonAsciiDigits() {
            String hex = Numeric.cleanHexPrefix(TestSigners.signHex(hash, signerKey));
            String arabicIndicThree = hex.substring(0, 10) + '\u0663' + hex.substring(11);
            assertEquals(130, arabicIndicThree.length());

            SignatureVerificationException e = assertThrows(SignatureVerificationException.class,
                () -> verifier.recoverSigner(hash, arabicIndicThree));
            assertEquals(SignatureVerificationException.Reason.INVALID_FORMAT, e.reason());
        }

        @Test
        @DisplayName("Null signature text is a format error")
        void nullHex() {
            SignatureVerificationException e = assertThrows(SignatureVerificationException.class,
                () -> verifier.recoverSigner(hash, (String) null));
            assertEquals(SignatureVerificationException.Reason.INVALID_FORMAT, e.reason());
        }

        @Test
        @DisplayName("Non-hex signature text is a format error")
        void badHex() {
            String notHex = "0x" + "zz".repeat(65);
            SignatureVerificationException e = assertThrows(SignatureVerificationException.class,
                () -> verifier.recoverSigner(hash, notHex));
            assertEquals(SignatureVerificationException.Reason.INVALID_FORMAT, e.reason());
        }
    }
}
