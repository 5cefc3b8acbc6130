package io.dripline.server.events;

/**
 * Receives claim notifications after the claiming call has committed.
 * Runs on the committing thread while the distributor lock is held, so
 * implementations should be quick and must not call back into the distributor.
 */
@FunctionalInterface
public interface ClaimListener {
    void onClaimed(ClaimEvent event);
}
