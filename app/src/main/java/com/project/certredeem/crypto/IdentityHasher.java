package com.project.certredeem.crypto;

import org.web3j.crypto.Hash;
import org.web3j.utils.Numeric;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Keccak-256 derivations for certificate identities and redemption contexts.
 *
 * <p>All four digests use packed encoding with fixed field widths, matching Solidity
 * {@code abi.encodePacked}, so an off-chain signer can reproduce them byte for byte:</p>
 * <ul>
 *     <li>certificate id: {@code uint256 amount || address service || address[] delegates
 *     (each left-padded to 32 bytes) || utf8 metadata}</li>
 *     <li>redemption hash: {@code bytes32 certificateId || address service || address holder}</li>
 *     <li>condensed ids hash: {@code bytes32 id_1 || ... || bytes32 id_n}</li>
 *     <li>condensed redemption hash: {@code bytes32 idsHash || uint256 combinedAmount ||
 *     address holder || address service}</li>
 * </ul>
 */
public final class IdentityHasher {

    public static final int UINT256_BYTES = 32;

    private static final BigInteger UINT256_LIMIT = BigInteger.ONE.shiftLeft(256);

    private IdentityHasher() {
    }

    public static CertificateId computeCertificateID(BigInteger amount,
                                                     AccountAddress service,
                                                     List<AccountAddress> delegates,
                                                     String metadata) {
        Objects.requireNonNull(service, "service must not be null");
        Objects.requireNonNull(delegates, "delegates must not be null");
        Objects.requireNonNull(metadata, "metadata must not be null");

        ByteArrayOutputStream packed = new ByteArrayOutputStream();
        packed.writeBytes(encodeUint256(amount));
        packed.writeBytes(service.toBytes());
        for (AccountAddress delegate : delegates) {
            packed.writeBytes(Objects.requireNonNull(delegate, "delegate must not be null").toPaddedBytes());
        }
        packed.writeBytes(metadata.getBytes(StandardCharsets.UTF_8));
        return CertificateId.of(Hash.sha3(packed.toByteArray()));
    }

    /**
     * Binds one holder to one certificate on one service instance.
     */
    public static byte[] computeRedemptionHash(CertificateId certificateId,
                                               AccountAddress service,
                                               AccountAddress holder) {
        Objects.requireNonNull(certificateId, "certificateId must not be null");
        Objects.requireNonNull(service, "service must not be null");
        Objects.requireNonNull(holder, "holder must not be null");

        ByteArrayOutputStream packed = new ByteArrayOutputStream(CertificateId.LENGTH + 2 * AccountAddress.LENGTH);
        packed.writeBytes(certificateId.toBytes());
        packed.writeBytes(service.toBytes());
        packed.writeBytes(holder.toBytes());
        return Hash.sha3(packed.toByteArray());
    }

    /**
     * Order-sensitive digest of a certificate id list.
     */
    public static byte[] computeCondensedIDsHash(List<CertificateId> certificateIds) {
        Objects.requireNonNull(certificateIds, "certificateIds must not be null");

        ByteArrayOutputStream packed = new ByteArrayOutputStream(certificateIds.size() * CertificateId.LENGTH);
        for (CertificateId id : certificateIds) {
            packed.writeBytes(Objects.requireNonNull(id, "certificate id must not be null").toBytes());
        }
        return Hash.sha3(packed.toByteArray());
    }

    public static byte[] computeCondensedRedemptionHash(byte[] condensedIdsHash,
                                                        BigInteger combinedAmount,
                                                        AccountAddress holder,
                                                        AccountAddress service) {
        Objects.requireNonNull(condensedIdsHash, "condensedIdsHash must not be null");
        Objects.requireNonNull(holder, "holder must not be null");
        Objects.requireNonNull(service, "service must not be null");
        if (condensedIdsHash.length != CertificateId.LENGTH) {
            throw new IllegalArgumentException(
                String.format("condensedIdsHash must be %d bytes, got %d", CertificateId.LENGTH, condensedIdsHash.length));
        }

        ByteArrayOutputStream packed = new ByteArrayOutputStream(2 * UINT256_BYTES + 2 * AccountAddress.LENGTH);
        packed.writeBytes(condensedIdsHash);
        packed.writeBytes(encodeUint256(combinedAmount));
        packed.writeBytes(holder.toBytes());
        packed.writeBytes(service.toBytes());
        return Hash.sha3(packed.toByteArray());
    }

    public static boolean fitsUint256(BigInteger value) {
        return value != null && value.signum() >= 0 && value.compareTo(UINT256_LIMIT) < 0;
    }

    static byte[] encodeUint256(BigInteger value) {
        Objects.requireNonNull(value, "amount must not be null");
        if (!fitsUint256(value)) {
            throw new IllegalArgumentException("Amount does not fit in uint256: " + value);
        }
        return Numeric.toBytesPadded(value, UINT256_BYTES);
    }
}
