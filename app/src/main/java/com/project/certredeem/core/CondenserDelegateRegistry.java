package com.project.certredeem.core;

import com.project.certredeem.crypto.AccountAddress;
import com.project.certredeem.crypto.ErrorLogger;
import com.project.certredeem.events.RedemptionEvent;
import com.project.certredeem.events.RedemptionListener;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Addresses trusted to sign condensed redemptions. Independent of per-certificate delegates;
 * binary trust, no expiry.
 */
public class CondenserDelegateRegistry {

    private final AdminGate adminGate;
    private final RedemptionListener listener;
    private final Set<AccountAddress> condensers = ConcurrentHashMap.newKeySet();

    public CondenserDelegateRegistry(AdminGate adminGate, RedemptionListener listener) {
        this.adminGate = Objects.requireNonNull(adminGate, "adminGate must not be null");
        this.listener = RedemptionListener.compose(List.of(Objects.requireNonNull(listener, "listener must not be null")));
    }

    public void addCondenserDelegate(AccountAddress caller, AccountAddress delegate) {
        adminGate.requireAdmin(caller);
        Objects.requireNonNull(delegate, "delegate must not be null");
        if (condensers.add(delegate)) {
            ErrorLogger.logInfo("CondenserDelegateRegistry.add", "Condenser delegate added: " + delegate);
        }
        listener.onEvent(new RedemptionEvent.CondenserDelegateChanged(delegate, true));
    }

    public void removeCondenserDelegate(AccountAddress caller, AccountAddress delegate) {
        adminGate.requireAdmin(caller);
        Objects.requireNonNull(delegate, "delegate must not be null");
        if (condensers.remove(delegate)) {
            ErrorLogger.logInfo("CondenserDelegateRegistry.remove", "Condenser delegate removed: " + delegate);
        }
        listener.onEvent(new RedemptionEvent.CondenserDelegateChanged(delegate, false));
    }

    public boolean isCondenserDelegate(AccountAddress address) {
        return condensers.contains(Objects.requireNonNull(address, "address must not be null"));
    }

    public Set<AccountAddress> condenserDelegates() {
        return Set.copyOf(condensers);
    }
}
