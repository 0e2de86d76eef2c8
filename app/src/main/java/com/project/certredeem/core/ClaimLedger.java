package com.project.certredeem.core;

import com.project.certredeem.crypto.AccountAddress;
import com.project.certredeem.crypto.CertificateId;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-(certificate, holder) claimed flags.
 *
 * <p>Reads are lock-free. Every check-and-set goes through one lock so that a whole list of
 * claims is taken atomically or not at all, and two callers can never both observe
 * "unclaimed" for the same entry.</p>
 */
public class ClaimLedger {

    private final Map<CertificateId, Set<AccountAddress>> claimed = new ConcurrentHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public boolean isClaimed(CertificateId certificateId, AccountAddress holder) {
        Objects.requireNonNull(certificateId, "certificateId must not be null");
        Objects.requireNonNull(holder, "holder must not be null");
        Set<AccountAddress> holders = claimed.get(certificateId);
        return holders != null && holders.contains(holder);
    }

    /**
     * Mark {@code holder} as having claimed {@code certificateId}.
     *
     * @throws RedemptionException ALREADY_CLAIMED if the flag is already set
     */
    public void claim(CertificateId certificateId, AccountAddress holder) {
        claimAll(List.of(certificateId), holder);
    }

    /**
     * Mark every listed certificate as claimed by {@code holder}, or none of them.
     *
     * @throws RedemptionException ALREADY_CLAIMED naming the first id already claimed, in list order
     */
    public void claimAll(List<CertificateId> certificateIds, AccountAddress holder) {
        Objects.requireNonNull(certificateIds, "certificateIds must not be null");
        Objects.requireNonNull(holder, "holder must not be null");
        lock.lock();
        try {
            for (CertificateId id : certificateIds) {
                if (isClaimed(id, holder)) {
                    throw new RedemptionException(RedemptionException.Kind.ALREADY_CLAIMED,
                        String.format("Certificate %s already claimed by %s", id, holder));
                }
            }
            for (CertificateId id : certificateIds) {
                claimed.computeIfAbsent(id, key -> ConcurrentHashMap.newKeySet()).add(holder);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Undo claims taken by a call whose credit step failed. Only the engine calls this,
     * before the failing call returns.
     */
    void release(List<CertificateId> certificateIds, AccountAddress holder) {
        lock.lock();
        try {
            for (CertificateId id : certificateIds) {
                Set<AccountAddress> holders = claimed.get(id);
                if (holders != null) {
                    holders.remove(holder);
                }
            }
        } finally {
            lock.unlock();
        }
    }

    public int claimCount(CertificateId certificateId) {
        Set<AccountAddress> holders = claimed.get(certificateId);
        return holders == null ? 0 : holders.size();
    }
}
