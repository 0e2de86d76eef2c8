package com.project.certredeem.core;

import com.project.certredeem.crypto.AccountAddress;

import java.math.BigInteger;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Balance map used by the demo runner and tests.
 */
public class InMemoryCreditLedger implements CreditLedger {

    private final Map<AccountAddress, BigInteger> balances = new ConcurrentHashMap<>();

    @Override
    public void credit(AccountAddress holder, BigInteger amount) {
        Objects.requireNonNull(holder, "holder must not be null");
        Objects.requireNonNull(amount, "amount must not be null");
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("amount must not be negative: " + amount);
        }
        balances.merge(holder, amount, BigInteger::add);
    }

    public BigInteger balanceOf(AccountAddress holder) {
        return balances.getOrDefault(holder, BigInteger.ZERO);
    }
}
