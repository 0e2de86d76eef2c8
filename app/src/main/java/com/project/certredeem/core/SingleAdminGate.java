package com.project.certredeem.core;

import com.project.certredeem.crypto.AccountAddress;
import com.project.certredeem.crypto.ErrorLogger;

import java.util.Objects;

/**
 * Single-owner gate: exactly one administrator, who may hand the role over.
 */
public class SingleAdminGate implements AdminGate {

    private volatile AccountAddress admin;

    public SingleAdminGate(AccountAddress admin) {
        this.admin = Objects.requireNonNull(admin, "admin must not be null");
    }

    @Override
    public void requireAdmin(AccountAddress caller) {
        Objects.requireNonNull(caller, "caller must not be null");
        if (!caller.equals(admin)) {
            throw new RedemptionException(RedemptionException.Kind.ADMIN_REQUIRED,
                "Caller " + caller + " is not the administrator");
        }
    }

    public AccountAddress admin() {
        return admin;
    }

    public synchronized void transferAdmin(AccountAddress caller, AccountAddress newAdmin) {
        Objects.requireNonNull(newAdmin, "newAdmin must not be null");
        requireAdmin(caller);
        admin = newAdmin;
        ErrorLogger.logInfo("SingleAdminGate.transferAdmin", "Administrator changed from " + caller + " to " + newAdmin);
    }
}
