package com.project.certredeem;

import com.project.certredeem.crypto.AccountAddress;
import com.project.certredeem.crypto.SignatureVerifier;
import org.web3j.crypto.ECKeyPair;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.nio.charset.StandardCharsets;

/**
 * Deterministic secp256k1 keys and signing helpers shared by the tests.
 */
public final class TestSigners {

    private TestSigners() {
    }

    /** Private key derived from {@code keccak256(label)}, so every run sees the same addresses. */
    public static ECKeyPair key(String label) {
        return ECKeyPair.create(Hash.sha3(label.getBytes(StandardCharsets.UTF_8)));
    }

    public static AccountAddress address(ECKeyPair keyPair) {
        return AccountAddress.fromPublicKey(keyPair.getPublicKey());
    }

    public static AccountAddress address(String label) {
        return address(key(label));
    }

    /** Signs {@code hash} inside the Ethereum signed-message envelope. */
    public static byte[] sign(byte[] hash, ECKeyPair keyPair) {
        return SignatureVerifier.toBytes(Sign.signPrefixedMessage(hash, keyPair));
    }

    public static String signHex(byte[] hash, ECKeyPair keyPair) {
        return Numeric.toHexString(sign(hash, keyPair));
    }
}
