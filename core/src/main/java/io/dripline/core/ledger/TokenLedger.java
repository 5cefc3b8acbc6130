// file: core/src/main/java/io/dripline/core/ledger/TokenLedger.java
package io.dripline.core.ledger;

import io.dripline.core.Address;

import java.math.BigInteger;

/**
 * External fungible-token ledger, as seen by the distributor.
 * <p>
 * An instance is bound to the distributor's custody address: {@link #transfer}
 * pushes out of custody and {@link #transferFrom} pulls into custody against an
 * allowance granted by {@code from}.
 * <p>
 * Both calls report refusal by returning false rather than throwing; the
 * distributor turns false into its own TRANSFER_FAILED error. Implementations
 * may run arbitrary code (including calls back into the distributor) before
 * returning.
 */
public interface TokenLedger {

    /** Move {@code amount} from custody to {@code to}. */
    boolean transfer(Address to, BigInteger amount);

    /** Move {@code amount} from {@code from} to {@code to}, spending custody's allowance. */
    boolean transferFrom(Address from, Address to, BigInteger amount);
}
