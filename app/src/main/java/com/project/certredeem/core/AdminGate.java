package com.project.certredeem.core;

import com.project.certredeem.crypto.AccountAddress;

/**
 * Access control for administrative calls.
 */
@FunctionalInterface
public interface AdminGate {

    /**
     * @throws RedemptionException of kind {@link RedemptionException.Kind#ADMIN_REQUIRED}
     *         if {@code caller} is not the administrator
     */
    void requireAdmin(AccountAddress caller);
}
