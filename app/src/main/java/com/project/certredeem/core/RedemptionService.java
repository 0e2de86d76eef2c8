package com.project.certredeem.core;

import com.project.certredeem.crypto.AccountAddress;
import com.project.certredeem.crypto.CertificateId;
import com.project.certredeem.crypto.IdentityHasher;
import com.project.certredeem.crypto.SignatureVerifier;
import com.project.certredeem.events.RedemptionListener;

import java.math.BigInteger;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One service instance: the full admin, holder and read-only surface over a single set of
 * registries, claim ledger and credit ledger.
 *
 * <p>Every mutating call takes the authenticated caller explicitly.</p>
 */
public class RedemptionService {

    private final AccountAddress serviceAddress;
    private final CertificateRegistry registry;
    private final CondenserDelegateRegistry condensers;
    private final ClaimLedger claimLedger;
    private final RedemptionEngine engine;

    public RedemptionService(AccountAddress serviceAddress,
                             AdminGate adminGate,
                             CreditLedger creditLedger,
                             CondensedAmountPolicy condensedAmountPolicy,
                             RedemptionListener listener) {
        this.serviceAddress = Objects.requireNonNull(serviceAddress, "serviceAddress must not be null");
        this.claimLedger = new ClaimLedger();
        this.registry = new CertificateRegistry(serviceAddress, adminGate, claimLedger, listener);
        this.condensers = new CondenserDelegateRegistry(adminGate, listener);
        this.engine = new RedemptionEngine(registry, condensers, claimLedger, creditLedger,
                new SignatureVerifier(), condensedAmountPolicy, listener);
    }

    public RedemptionService(AccountAddress serviceAddress, AdminGate adminGate, CreditLedger creditLedger) {
        this(serviceAddress, adminGate, creditLedger, CondensedAmountPolicy.RECOMPUTED, RedemptionListener.NOOP);
    }

    // admin

    public CertificateId createCertificateType(AccountAddress caller,
                                               BigInteger amount,
                                               List<AccountAddress> delegates,
                                               String metadata) {
        return registry.createCertificateType(caller, amount, delegates, metadata);
    }

    public void addCondenserDelegate(AccountAddress caller, AccountAddress delegate) {
        condensers.addCondenserDelegate(caller, delegate);
    }

    public void removeCondenserDelegate(AccountAddress caller, AccountAddress delegate) {
        condensers.removeCondenserDelegate(caller, delegate);
    }

    // holder; failures surface as RedemptionException, so these only ever return true

    public boolean redeem(AccountAddress caller, String signatureHex, CertificateId certificateId) {
        engine.redeem(caller, signatureHex, certificateId);
        return true;
    }

    public boolean redeemCondensed(AccountAddress caller,
                                   String signatureHex,
                                   BigInteger combinedAmount,
                                   List<CertificateId> certificateIds) {
        engine.redeemCondensed(caller, signatureHex, combinedAmount, certificateIds);
        return true;
    }

    public RedemptionEngine engine() {
        return engine;
    }

    // reads

    public BigInteger getCertificateAmount(CertificateId id) {
        return registry.getCertificateAmount(id);
    }

    public String getCertificateMetadata(CertificateId id) {
        return registry.getCertificateMetadata(id);
    }

    public boolean isDelegate(CertificateId id, AccountAddress address) {
        return registry.isDelegate(id, address);
    }

    public boolean isClaimed(CertificateId id, AccountAddress holder) {
        return claimLedger.isClaimed(id, holder);
    }

    public boolean isCondenserDelegate(AccountAddress address) {
        return condensers.isCondenserDelegate(address);
    }

    public Optional<CertificateType> findCertificateType(CertificateId id) {
        return registry.findCertificateType(id);
    }

    // hash helpers bound to this service address

    public CertificateId computeCertificateID(BigInteger amount, List<AccountAddress> delegates, String metadata) {
        return IdentityHasher.computeCertificateID(amount, serviceAddress, delegates, metadata);
    }

    public byte[] computeRedemptionHash(CertificateId id, AccountAddress holder) {
        return IdentityHasher.computeRedemptionHash(id, serviceAddress, holder);
    }

    public byte[] computeCondensedIDsHash(List<CertificateId> ids) {
        return IdentityHasher.computeCondensedIDsHash(ids);
    }

    public byte[] computeCondensedRedemptionHash(byte[] condensedIdsHash, BigInteger combinedAmount, AccountAddress holder) {
        return IdentityHasher.computeCondensedRedemptionHash(condensedIdsHash, combinedAmount, holder, serviceAddress);
    }

    public AccountAddress serviceAddress() {
        return serviceAddress;
    }
}
