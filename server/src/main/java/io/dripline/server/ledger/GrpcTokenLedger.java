// file: server/src/main/java/io/dripline/server/ledger/GrpcTokenLedger.java
package io.dripline.server.ledger;

import io.dripline.core.Address;
import io.dripline.core.Uint256;
import io.dripline.core.ledger.TokenLedger;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.StatusRuntimeException;

import java.math.BigInteger;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link TokenLedger} backed by a remote ledger service over gRPC.
 *
 * One instance is bound to the distributor's custody address, which is sent as
 * the {@code from} / {@code spender} of every call. A failed RPC is reported as
 * a refused transfer, so the distributor rolls the call back.
 */
public final class GrpcTokenLedger implements TokenLedger {
    private static final Logger log = Logger.getLogger(GrpcTokenLedger.class.getName());
    private static final long DEADLINE_MS = 5_000;

    private final String target; // "host:port" or in-process name
    private final ManagedChannel channel;
    private final TokenLedgerGrpc.TokenLedgerBlockingStub stub;
    private final Address custody;

    public GrpcTokenLedger(String host, int port, Address custody) {
        this(host + ":" + port,
                ManagedChannelBuilder.forAddress(host, port).usePlaintext().build(),
                custody);
    }

    /** Constructor for a pre-built channel (e.g. in-process in tests). */
    public GrpcTokenLedger(String target, ManagedChannel channel, Address custody) {
        this.target = target;
        this.channel = channel;
        this.stub = TokenLedgerGrpc.newBlockingStub(channel);
        this.custody = custody;
    }

    @Override
    public boolean transfer(Address to, BigInteger amount) {
        var req = LedgerProto.TransferRequest.newBuilder()
                .setFrom(custody.toHex())
                .setTo(to.toHex())
                .setAmount(amount.toString())
                .build();
        try {
            return stub.withDeadlineAfter(DEADLINE_MS, TimeUnit.MILLISECONDS).transfer(req).getSuccess();
        } catch (StatusRuntimeException sre) {
            // A timed-out call may still have been applied remotely; the claim is rolled back regardless.
            log.log(Level.WARNING, "ledger " + target + " transfer to " + to + " failed", sre);
            return false;
        }
    }

    @Override
    public boolean transferFrom(Address from, Address to, BigInteger amount) {
        var req = LedgerProto.TransferFromRequest.newBuilder()
                .setSpender(custody.toHex())
                .setFrom(from.toHex())
                .setTo(to.toHex())
                .setAmount(amount.toString())
                .build();
        try {
            return stub.withDeadlineAfter(DEADLINE_MS, TimeUnit.MILLISECONDS).transferFrom(req).getSuccess();
        } catch (StatusRuntimeException sre) {
            log.log(Level.WARNING, "ledger " + target + " transferFrom " + from + " failed", sre);
            return false;
        }
    }

    /** Balance held by {@code account} on the remote ledger. */
    public BigInteger balanceOf(Address account) {
        var req = LedgerProto.BalanceRequest.newBuilder().setAccount(account.toHex()).build();
        try {
            String bal = stub.withDeadlineAfter(DEADLINE_MS, TimeUnit.MILLISECONDS).balanceOf(req).getBalance();
            return Uint256.parse(bal, "balance");
        } catch (StatusRuntimeException sre) {
            throw new RuntimeException("ledger " + target + " balanceOf " + account + " failed", sre);
        }
    }

    public void shutdown() {
        channel.shutdown();
        try {
            if (!channel.awaitTermination(2, TimeUnit.SECONDS)) {
                channel.shutdownNow();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            channel.shutdownNow();
        }
    }
}
