package io.dripline.core.ledger;

import io.dripline.core.Address;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryTokenTest {

    private static final Address ALICE = Address.ofLong(1);
    private static final Address BOB = Address.ofLong(2);
    private static final Address CUSTODY = Address.ofLong(99);

    @Test
    void transfer_moves_balance_and_refuses_overdraft() {
        var token = new InMemoryToken();
        token.mint(ALICE, BigInteger.valueOf(100));

        TokenLedger asAlice = token.ledgerFor(ALICE);
        assertTrue(asAlice.transfer(BOB, BigInteger.valueOf(40)));
        assertFalse(asAlice.transfer(BOB, BigInteger.valueOf(61)));

        assertEquals(BigInteger.valueOf(60), token.balanceOf(ALICE));
        assertEquals(BigInteger.valueOf(40), token.balanceOf(BOB));
    }

    @Test
    void transfer_from_requires_and_spends_allowance() {
        var token = new InMemoryToken();
        token.mint(ALICE, BigInteger.valueOf(100));
        TokenLedger custody = token.ledgerFor(CUSTODY);

        assertFalse(custody.transferFrom(ALICE, CUSTODY, BigInteger.TEN), "no allowance yet");

        token.approve(ALICE, CUSTODY, BigInteger.valueOf(30));
        assertTrue(custody.transferFrom(ALICE, CUSTODY, BigInteger.valueOf(25)));
        assertEquals(BigInteger.valueOf(5), token.allowance(ALICE, CUSTODY));
        assertFalse(custody.transferFrom(ALICE, CUSTODY, BigInteger.TEN), "allowance exhausted");

        assertEquals(BigInteger.valueOf(75), token.balanceOf(ALICE));
        assertEquals(BigInteger.valueOf(25), token.balanceOf(CUSTODY));
    }

    @Test
    void transfer_from_with_allowance_but_no_balance_leaves_allowance() {
        var token = new InMemoryToken();
        token.approve(ALICE, CUSTODY, BigInteger.valueOf(50));

        assertFalse(token.ledgerFor(CUSTODY).transferFrom(ALICE, CUSTODY, BigInteger.TEN));
        assertEquals(BigInteger.valueOf(50), token.allowance(ALICE, CUSTODY));
    }
}
