// file: core/src/main/java/io/dripline/core/access/AccessControl.java
package io.dripline.core.access;

import io.dripline.core.Address;

import java.util.Optional;

/**
 * Single-administrator capability gating seeding.
 * <p>
 * Ownership moves either in one step ({@link #transferOwnership}) or in two
 * ({@link #proposeOwner} by the owner, then {@link #acceptOwnership} by the
 * candidate). Every mutating method requires the current owner, except
 * acceptance which requires the pending candidate.
 */
public interface AccessControl {

    Address owner();

    Optional<Address> pendingOwner();

    /** @throws io.dripline.core.DistributorException with UNAUTHORIZED if caller is not the owner */
    void requireOwner(Address caller);

    void transferOwnership(Address caller, Address newOwner);

    void proposeOwner(Address caller, Address candidate);

    void acceptOwnership(Address caller);
}
