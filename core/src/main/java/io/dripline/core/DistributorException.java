// file: core/src/main/java/io/dripline/core/DistributorException.java
package io.dripline.core;

import java.util.Objects;

/**
 * Domain failure raised by the distributor.
 * <p>
 * Carries an {@link ErrorCode} so transports (HTTP, CLI) can map failures
 * without parsing messages. Input that is malformed rather than refused
 * (bad hex, negative amounts) is reported with IllegalArgumentException instead.
 */
public class DistributorException extends RuntimeException {

    private final ErrorCode code;

    public DistributorException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode code() {
        return code;
    }

    public static DistributorException alreadyClaimed(long period, long index) {
        return new DistributorException(ErrorCode.ALREADY_CLAIMED,
                "index " + index + " already claimed for period " + period);
    }

    public static DistributorException invalidProof(long period, long index) {
        return new DistributorException(ErrorCode.INVALID_PROOF,
                "proof does not match root of period " + period + " for index " + index);
    }

    public static DistributorException rootAlreadySet(long period) {
        return new DistributorException(ErrorCode.ROOT_ALREADY_SET,
                "root already set for period " + period);
    }

    public static DistributorException lengthMismatch(int indices, long periods) {
        return new DistributorException(ErrorCode.LENGTH_MISMATCH,
                "got " + indices + " indices for " + periods + " periods");
    }

    public static DistributorException transferFailed(String what) {
        return new DistributorException(ErrorCode.TRANSFER_FAILED, what + " refused by ledger");
    }

    public static DistributorException unauthorized(Address caller) {
        return new DistributorException(ErrorCode.UNAUTHORIZED,
                "caller " + caller + " is not the owner");
    }
}
