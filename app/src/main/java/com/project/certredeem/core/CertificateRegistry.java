package com.project.certredeem.core;

import com.project.certredeem.crypto.AccountAddress;
import com.project.certredeem.crypto.CertificateId;
import com.project.certredeem.crypto.ErrorLogger;
import com.project.certredeem.crypto.IdentityHasher;
import com.project.certredeem.events.RedemptionEvent;
import com.project.certredeem.events.RedemptionListener;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Certificate types keyed by their derived id.
 *
 * <p>Creation is idempotent: the id is a pure function of {@code (amount, service, delegates,
 * metadata)}, so re-creating with identical parameters lands on the same record and only re-adds
 * the delegates. Types and delegates are never removed.</p>
 *
 * <p>The plain accessors return zero values for unknown ids; use {@link #findCertificateType}
 * or {@link #exists} to tell "absent" from "zero".</p>
 */
public class CertificateRegistry {

    private final AccountAddress service;
    private final AdminGate adminGate;
    private final ClaimLedger claimLedger;
    private final RedemptionListener listener;
    private final Map<CertificateId, Entry> entries = new ConcurrentHashMap<>();

    private static final class Entry {
        private final BigInteger amount;
        private final String metadata;
        private final Set<AccountAddress> delegates = ConcurrentHashMap.newKeySet();

        private Entry(BigInteger amount, String metadata) {
            this.amount = amount;
            this.metadata = metadata;
        }
    }

    public CertificateRegistry(AccountAddress service,
                               AdminGate adminGate,
                               ClaimLedger claimLedger,
                               RedemptionListener listener) {
        this.service = Objects.requireNonNull(service, "service must not be null");
        this.adminGate = Objects.requireNonNull(adminGate, "adminGate must not be null");
        this.claimLedger = Objects.requireNonNull(claimLedger, "claimLedger must not be null");
        this.listener = RedemptionListener.compose(List.of(Objects.requireNonNull(listener, "listener must not be null")));
    }

    public CertificateId createCertificateType(AccountAddress caller,
                                               BigInteger amount,
                                               List<AccountAddress> delegates,
                                               String metadata) {
        adminGate.requireAdmin(caller);
        InputValidator.validateAmount(amount, "amount");
        InputValidator.validateDelegates(delegates);
        InputValidator.validateMetadata(metadata);

        CertificateId id = IdentityHasher.computeCertificateID(amount, service, delegates, metadata);
        Entry entry = entries.computeIfAbsent(id, key -> new Entry(amount, metadata));
        entry.delegates.addAll(delegates);

        ErrorLogger.logInfo("CertificateRegistry.createCertificateType",
            String.format("Certificate type %s: amount=%s, delegates=%d", id, amount, delegates.size()));
        listener.onEvent(new RedemptionEvent.CertificateTypeCreated(id, amount, delegates));
        return id;
    }

    public Optional<CertificateType> findCertificateType(CertificateId id) {
        Objects.requireNonNull(id, "certificateId must not be null");
        Entry entry = entries.get(id);
        if (entry == null) {
            return Optional.empty();
        }
        return Optional.of(new CertificateType(id, entry.amount, entry.metadata, entry.delegates));
    }

    public boolean exists(CertificateId id) {
        return entries.containsKey(Objects.requireNonNull(id, "certificateId must not be null"));
    }

    public BigInteger getCertificateAmount(CertificateId id) {
        Entry entry = entries.get(Objects.requireNonNull(id, "certificateId must not be null"));
        return entry == null ? BigInteger.ZERO : entry.amount;
    }

    public String getCertificateMetadata(CertificateId id) {
        Entry entry = entries.get(Objects.requireNonNull(id, "certificateId must not be null"));
        return entry == null ? "" : entry.metadata;
    }

    public boolean isDelegate(CertificateId id, AccountAddress address) {
        Objects.requireNonNull(address, "address must not be null");
        Entry entry = entries.get(Objects.requireNonNull(id, "certificateId must not be null"));
        return entry != null && entry.delegates.contains(address);
    }

    public boolean isClaimed(CertificateId id, AccountAddress holder) {
        return claimLedger.isClaimed(id, holder);
    }

    public AccountAddress service() {
        return service;
    }

    public int size() {
        return entries.size();
    }
}
