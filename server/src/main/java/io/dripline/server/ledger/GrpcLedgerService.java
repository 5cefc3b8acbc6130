// file: server/src/main/java/io/dripline/server/ledger/GrpcLedgerService.java
package io.dripline.server.ledger;

import io.dripline.core.Address;
import io.dripline.core.Uint256;
import io.dripline.core.ledger.InMemoryToken;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;

/**
 * Serves an {@link InMemoryToken} over the TokenLedger gRPC contract.
 *
 * Responsibilities:
 *  - Decode hex addresses and decimal amounts.
 *  - Forward to the token; a refused transfer is a normal reply with success=false.
 *  - Map IllegalArgumentException to INVALID_ARGUMENT, everything else to INTERNAL.
 *
 * Callers are trusted: the {@code from} / {@code spender} fields are taken as given.
 */
public final class GrpcLedgerService extends TokenLedgerGrpc.TokenLedgerImplBase {

    private final InMemoryToken token;

    public GrpcLedgerService(InMemoryToken token) {
        this.token = token;
    }

    @Override
    public void transfer(LedgerProto.TransferRequest request,
                         StreamObserver<LedgerProto.TransferReply> responseObserver) {
        try {
            boolean ok = token.transfer(
                    Address.fromHex(request.getFrom()),
                    Address.fromHex(request.getTo()),
                    Uint256.parse(request.getAmount(), "amount"));
            reply(responseObserver, ok);
        } catch (IllegalArgumentException iae) {
            responseObserver.onError(Status.INVALID_ARGUMENT.withDescription(iae.getMessage()).asException());
        } catch (Exception e) {
            responseObserver.onError(Status.INTERNAL.withDescription(e.getMessage()).asException());
        }
    }

    @Override
    public void transferFrom(LedgerProto.TransferFromRequest request,
                             StreamObserver<LedgerProto.TransferReply> responseObserver) {
        try {
            boolean ok = token.transferFrom(
                    Address.fromHex(request.getSpender()),
                    Address.fromHex(request.getFrom()),
                    Address.fromHex(request.getTo()),
                    Uint256.parse(request.getAmount(), "amount"));
            reply(responseObserver, ok);
        } catch (IllegalArgumentException iae) {
            responseObserver.onError(Status.INVALID_ARGUMENT.withDescription(iae.getMessage()).asException());
        } catch (Exception e) {
            responseObserver.onError(Status.INTERNAL.withDescription(e.getMessage()).asException());
        }
    }

    @Override
    public void balanceOf(LedgerProto.BalanceRequest request,
                          StreamObserver<LedgerProto.BalanceReply> responseObserver) {
        try {
            var balance = token.balanceOf(Address.fromHex(request.getAccount()));
            responseObserver.onNext(LedgerProto.BalanceReply.newBuilder().setBalance(balance.toString()).build());
            responseObserver.onCompleted();
        } catch (IllegalArgumentException iae) {
            responseObserver.onError(Status.INVALID_ARGUMENT.withDescription(iae.getMessage()).asException());
        } catch (Exception e) {
            responseObserver.onError(Status.INTERNAL.withDescription(e.getMessage()).asException());
        }
    }

    private static void reply(StreamObserver<LedgerProto.TransferReply> obs, boolean ok) {
        obs.onNext(LedgerProto.TransferReply.newBuilder().setSuccess(ok).build());
        obs.onCompleted();
    }
}
