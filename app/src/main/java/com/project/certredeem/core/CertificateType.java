package com.project.certredeem.core;

import com.project.certredeem.crypto.AccountAddress;
import com.project.certredeem.crypto.CertificateId;

import java.math.BigInteger;
import java.util.Set;

/**
 * Read-only snapshot of a registered certificate type.
 *
 * @param id        Keccak-256 identifier derived from the defining parameters.
 * @param amount    quantity credited per redemption.
 * @param metadata  opaque display pointer, e.g. an {@code ipfs://} URI.
 * @param delegates addresses whose signature alone authorizes a redemption.
 */
public record CertificateType(
        CertificateId id,
        BigInteger amount,
        String metadata,
        Set<AccountAddress> delegates
) {
    public CertificateType {
        delegates = Set.copyOf(delegates);
    }

    public boolean isDelegate(AccountAddress address) {
        return delegates.contains(address);
    }
}
