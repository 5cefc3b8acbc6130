package io.dripline.core;

/**
 * Failure taxonomy for distributor operations.
 * Every code means the enclosing call (or batch) committed nothing.
 */
public enum ErrorCode {
    /** The (period, index) bit is already set. */
    ALREADY_CLAIMED,
    /** Leaf, proof and stored root do not reconcile. */
    INVALID_PROOF,
    /** Seeding attempted for a period that already has a root. */
    ROOT_ALREADY_SET,
    /** Query arity does not match the requested period range. */
    LENGTH_MISMATCH,
    /** The token ledger refused a push or pull transfer. */
    TRANSFER_FAILED,
    /** Caller lacks the administrator capability. */
    UNAUTHORIZED
}
