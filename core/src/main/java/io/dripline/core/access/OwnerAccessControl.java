// file: core/src/main/java/io/dripline/core/access/OwnerAccessControl.java
package io.dripline.core.access;

import io.dripline.core.Address;
import io.dripline.core.DistributorException;
import io.dripline.core.ErrorCode;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * In-memory {@link AccessControl}. Not persisted: the owner comes from
 * configuration at startup.
 */
public final class OwnerAccessControl implements AccessControl {
    private static final Logger log = Logger.getLogger(OwnerAccessControl.class.getName());

    private Address owner;
    private Address pending;

    public OwnerAccessControl(Address owner) {
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    @Override
    public synchronized Address owner() {
        return owner;
    }

    @Override
    public synchronized Optional<Address> pendingOwner() {
        return Optional.ofNullable(pending);
    }

    @Override
    public synchronized void requireOwner(Address caller) {
        if (caller == null || !caller.equals(owner)) {
            throw DistributorException.unauthorized(caller);
        }
    }

    @Override
    public synchronized void transferOwnership(Address caller, Address newOwner) {
        requireOwner(caller);
        Objects.requireNonNull(newOwner, "newOwner");
        log.info(() -> "ownership transferred " + owner + " -> " + newOwner);
        owner = newOwner;
        pending = null;
    }

    @Override
    public synchronized void proposeOwner(Address caller, Address candidate) {
        requireOwner(caller);
        pending = Objects.requireNonNull(candidate, "candidate");
        log.info(() -> "ownership proposed to " + candidate);
    }

    @Override
    public synchronized void acceptOwnership(Address caller) {
        if (pending == null || !pending.equals(caller)) {
            throw new DistributorException(ErrorCode.UNAUTHORIZED,
                    "caller " + caller + " is not the pending owner");
        }
        log.info(() -> "ownership accepted " + owner + " -> " + caller);
        owner = caller;
        pending = null;
    }
}
