// file: core/src/main/java/io/dripline/core/ledger/InMemoryToken.java
package io.dripline.core.ledger;

import io.dripline.core.Address;
import io.dripline.core.Uint256;

import java.math.BigInteger;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-process fungible token with balances and allowances.
 * <p>
 * Used as the default ledger for single-process deployments, as the backing
 * store of the gRPC ledger service, and in tests. Refusals (insufficient
 * balance or allowance) return false and leave balances untouched.
 */
public final class InMemoryToken {
    private static final Logger log = Logger.getLogger(InMemoryToken.class.getName());

    private final Map<Address, BigInteger> balances = new HashMap<>();
    private final Map<Address, Map<Address, BigInteger>> allowances = new HashMap<>();

    public synchronized void mint(Address to, BigInteger amount) {
        Uint256.require(amount, "amount");
        BigInteger next = balanceOf(to).add(amount);
        Uint256.require(next, "balance");
        balances.put(to, next);
    }

    public synchronized BigInteger balanceOf(Address account) {
        return balances.getOrDefault(Objects.requireNonNull(account, "account"), BigInteger.ZERO);
    }

    public synchronized void approve(Address owner, Address spender, BigInteger amount) {
        Uint256.require(amount, "amount");
        allowances.computeIfAbsent(owner, k -> new HashMap<>()).put(spender, amount);
    }

    public synchronized BigInteger allowance(Address owner, Address spender) {
        return allowances.getOrDefault(owner, Map.of()).getOrDefault(spender, BigInteger.ZERO);
    }

    /** Move tokens owned by {@code caller}. */
    public synchronized boolean transfer(Address caller, Address to, BigInteger amount) {
        return move(caller, to, amount);
    }

    /** Move tokens owned by {@code from}, spending the allowance granted to {@code spender}. */
    public synchronized boolean transferFrom(Address spender, Address from, Address to, BigInteger amount) {
        if (amount == null || amount.signum() < 0) return false;
        BigInteger allowed = allowance(from, spender);
        if (allowed.compareTo(amount) < 0) {
            log.log(Level.FINE, "allowance {0} of {1} for {2} below {3}",
                    new Object[]{allowed, from, spender, amount});
            return false;
        }
        if (!move(from, to, amount)) return false;
        allowances.computeIfAbsent(from, k -> new HashMap<>()).put(spender, allowed.subtract(amount));
        return true;
    }

    /**
     * View of this token bound to {@code caller}, i.e. the ledger as that
     * account would call it.
     */
    public TokenLedger ledgerFor(Address caller) {
        Objects.requireNonNull(caller, "caller");
        return new TokenLedger() {
            @Override
            public boolean transfer(Address to, BigInteger amount) {
                return InMemoryToken.this.transfer(caller, to, amount);
            }

            @Override
            public boolean transferFrom(Address from, Address to, BigInteger amount) {
                return InMemoryToken.this.transferFrom(caller, from, to, amount);
            }
        };
    }

    private boolean move(Address from, Address to, BigInteger amount) {
        if (amount == null || amount.signum() < 0) return false;
        BigInteger have = balanceOf(from);
        if (have.compareTo(amount) < 0) {
            log.log(Level.FINE, "balance {0} of {1} below {2}", new Object[]{have, from, amount});
            return false;
        }
        balances.put(from, have.subtract(amount));
        balances.put(to, balanceOf(to).add(amount));
        return true;
    }
}
