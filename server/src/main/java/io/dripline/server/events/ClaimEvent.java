package io.dripline.server.events;

import io.dripline.core.Address;

import java.math.BigInteger;

/**
 * Notification for one committed claim: (period, index, account, amount).
 * Emitted exactly once per committed index, never for failed or rolled-back work.
 */
public record ClaimEvent(long period, long index, Address account, BigInteger amount) {}
