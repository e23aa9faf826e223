package io.satnet.storage;

import io.satnet.bundle.Bundle;
import io.satnet.bundle.BundleFilter;
import io.satnet.bundle.BundleStatus;
import io.satnet.exception.NotFoundException;
import io.satnet.exception.ValidationException;

import java.util.List;
import java.util.UUID;

/**
 * Custody store of a node: the single source of truth for the status of every stored
 * bundle copy.
 * <p>
 * Bundles are copied on the way in and on the way out, so a caller never shares an
 * instance with the store. Operations addressing an unknown id fail with
 * {@link NotFoundException}, none of them silently does nothing. Concurrent mutations of
 * one id are linearizable.
 */
public interface BundleStore {

    /**
     * Persists a copy of the bundle with status {@link BundleStatus#PENDING}.
     *
     * @throws ValidationException the bundle is invalid or expired, or a copy with the same id
     *                             already reached a terminal status
     */
    void store(Bundle bundle) throws ValidationException;

    Bundle retrieve(UUID id) throws NotFoundException;

    void delete(UUID id) throws NotFoundException;

    /**
     * Snapshot of the bundles matching the filter. Unordered unless the filter asks for an order.
     */
    List<Bundle> list(BundleFilter filter);

    /**
     * The only way a status changes. Setting the current status again is a no-op.
     *
     * @throws ValidationException the transition leaves a terminal status or goes back to pending
     */
    void updateStatus(UUID id, BundleStatus status) throws NotFoundException, ValidationException;

    BundleStatus getStatus(UUID id) throws NotFoundException;

    int count();

    /**
     * Removes every expired bundle regardless of its status.
     *
     * @return number of removed bundles
     */
    int purgeExpired();
}
