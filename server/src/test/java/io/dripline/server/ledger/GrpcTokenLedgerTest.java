package io.dripline.server.ledger;

import io.dripline.core.Address;
import io.dripline.core.ledger.InMemoryToken;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Specs for the gRPC ledger pair over an in-process channel:
 *  - GrpcTokenLedger sends custody as from/spender and maps replies to booleans.
 *  - GrpcLedgerService forwards to InMemoryToken and rejects malformed input.
 *  - An unreachable ledger reads as a refused transfer.
 */
class GrpcTokenLedgerTest {

    private static final Address CUSTODY = Address.ofLong(0xC0DE);
    private static final Address FUNDER = Address.ofLong(0xF00D);
    private static final Address ALICE = Address.ofLong(0xA1);

    private InMemoryToken token;
    private Server server;
    private ManagedChannel channel;
    private GrpcTokenLedger ledger;

    @BeforeEach
    void start() throws IOException {
        token = new InMemoryToken();
        String name = InProcessServerBuilder.generateName();
        server = InProcessServerBuilder.forName(name)
                .directExecutor()
                .addService(new GrpcLedgerService(token))
                .build()
                .start();
        channel = InProcessChannelBuilder.forName(name).directExecutor().build();
        ledger = new GrpcTokenLedger(name, channel, CUSTODY);
    }

    @AfterEach
    void stop() {
        ledger.shutdown();
        server.shutdownNow();
    }

    @Test
    void transfer_moves_custody_funds() {
        token.mint(CUSTODY, BigInteger.valueOf(50));

        assertTrue(ledger.transfer(ALICE, BigInteger.valueOf(20)));
        assertEquals(BigInteger.valueOf(20), token.balanceOf(ALICE));
        assertEquals(BigInteger.valueOf(30), ledger.balanceOf(CUSTODY));
    }

    @Test
    void transfer_beyond_balance_is_refused() {
        token.mint(CUSTODY, BigInteger.valueOf(5));

        assertFalse(ledger.transfer(ALICE, BigInteger.valueOf(6)));
        assertEquals(BigInteger.valueOf(5), token.balanceOf(CUSTODY));
    }

    @Test
    void transfer_from_spends_allowance_granted_to_custody() {
        token.mint(FUNDER, BigInteger.valueOf(100));
        token.approve(FUNDER, CUSTODY, BigInteger.valueOf(60));

        assertTrue(ledger.transferFrom(FUNDER, CUSTODY, BigInteger.valueOf(60)));
        assertFalse(ledger.transferFrom(FUNDER, CUSTODY, BigInteger.ONE), "allowance used up");
        assertEquals(BigInteger.valueOf(60), token.balanceOf(CUSTODY));
        assertEquals(BigInteger.ZERO, token.allowance(FUNDER, CUSTODY));
    }

    @Test
    void malformed_request_is_invalid_argument() {
        var stub = TokenLedgerGrpc.newBlockingStub(channel);
        var req = LedgerProto.TransferRequest.newBuilder()
                .setFrom("not-hex")
                .setTo(ALICE.toHex())
                .setAmount("1")
                .build();

        var ex = assertThrows(StatusRuntimeException.class, () -> stub.transfer(req));
        assertEquals(Status.Code.INVALID_ARGUMENT, ex.getStatus().getCode());
    }

    @Test
    void unreachable_ledger_reads_as_refused() {
        token.mint(CUSTODY, BigInteger.valueOf(50));
        server.shutdownNow();

        assertFalse(ledger.transfer(ALICE, BigInteger.ONE));
        assertEquals(BigInteger.ZERO, token.balanceOf(ALICE));
    }
}
