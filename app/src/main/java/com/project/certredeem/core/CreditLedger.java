package com.project.certredeem.core;

import com.project.certredeem.crypto.AccountAddress;

import java.math.BigInteger;

/**
 * The fungible-asset ledger that actually holds balances.
 * A call either fully succeeds or throws with no effect.
 */
@FunctionalInterface
public interface CreditLedger {

    void credit(AccountAddress holder, BigInteger amount);
}
