package com.project.certredeem.events;

import com.project.certredeem.crypto.AccountAddress;
import com.project.certredeem.crypto.CertificateId;

import java.math.BigInteger;
import java.util.List;

/**
 * Notifications emitted by the registries and the redemption engine.
 * Observability only: nothing reads them back to decide correctness.
 */
public interface RedemptionEvent {

    String type();

    record CertificateTypeCreated(CertificateId certificateId,
                                  BigInteger amount,
                                  List<AccountAddress> delegates) implements RedemptionEvent {
        public CertificateTypeCreated {
            delegates = List.copyOf(delegates);
        }

        @Override
        public String type() {
            return "CertificateTypeCreated";
        }
    }

    record Redeemed(AccountAddress holder,
                    BigInteger amount,
                    CertificateId certificateId) implements RedemptionEvent {
        @Override
        public String type() {
            return "Redeemed";
        }
    }

    record CondensedRedeemed(AccountAddress holder,
                             BigInteger amount,
                             List<CertificateId> certificateIds) implements RedemptionEvent {
        public CondensedRedeemed {
            certificateIds = List.copyOf(certificateIds);
        }

        @Override
        public String type() {
            return "CondensedRedeemed";
        }
    }

    /**
     * @param trusted {@code true} when the delegate was added, {@code false} when removed
     */
    record CondenserDelegateChanged(AccountAddress delegate, boolean trusted) implements RedemptionEvent {
        @Override
        public String type() {
            return trusted ? "CondenserDelegateAdded" : "CondenserDelegateRemoved";
        }
    }
}
