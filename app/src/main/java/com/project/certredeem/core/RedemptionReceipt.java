package com.project.certredeem.core;

import com.project.certredeem.crypto.AccountAddress;
import com.project.certredeem.crypto.CertificateId;

import java.math.BigInteger;
import java.util.List;

/**
 * Outcome of a successful redemption.
 *
 * @param holder         credited address (always the caller).
 * @param signer         delegate or condenser whose signature authorized the call.
 * @param amount         quantity credited.
 * @param certificateIds certificates now claimed by the holder, in request order.
 * @param condensed      whether the call went through the condenser path.
 */
public record RedemptionReceipt(
        AccountAddress holder,
        AccountAddress signer,
        BigInteger amount,
        List<CertificateId> certificateIds,
        boolean condensed
) {
    public RedemptionReceipt {
        certificateIds = List.copyOf(certificateIds);
    }
}
