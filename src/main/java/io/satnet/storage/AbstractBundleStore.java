package io.satnet.storage;

import io.satnet.bundle.Bundle;
import io.satnet.bundle.BundleFilter;
import io.satnet.bundle.BundleStatus;
import io.satnet.exception.NotFoundException;
import io.satnet.exception.ValidationException;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.stream.Stream;

import static io.satnet.constant.NodeConstant.DEFAULT_MAX_BUNDLES;
import static java.util.Objects.nonNull;
import static java.util.stream.Collectors.toList;
import static org.apache.commons.lang3.StringUtils.isNotBlank;

/**
 * Custody semantics shared by every store variant: validation, status transitions,
 * filtering, capacity eviction and copy-on-read/copy-on-write. Variants only provide the
 * record primitives, which are always called under this store's lock.
 */
@Slf4j
public abstract class AbstractBundleStore implements BundleStore {

    @Getter(AccessLevel.PROTECTED)
    private final Clock clock;
    @Getter
    private final int maxSize;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    protected AbstractBundleStore(@NonNull final Clock clock, final int maxSize) {
        this.clock = clock;
        this.maxSize = maxSize > 0 ? maxSize : DEFAULT_MAX_BUNDLES;
    }

    protected abstract Optional<StoredBundle> find(UUID id);

    protected abstract void save(StoredBundle stored);

    protected abstract boolean remove(UUID id);

    /**
     * Records that may match the filter. Variants can narrow the candidates with native
     * queries, the full filter is applied afterwards anyway.
     */
    protected abstract Collection<StoredBundle> findCandidates(BundleFilter filter);

    protected abstract int size();

    @Override
    public void store(@NonNull final Bundle bundle) throws ValidationException {
        try {
            bundle.validate(clock);
        } catch (ValidationException e) {
            throw new ValidationException("invalid bundle: " + e.getMessage());
        }

        lock.writeLock().lock();
        try {
            var existing = find(bundle.getId());
            if (existing.isPresent()) {
                var status = existing.get().getStatus();
                if (status.isTerminal()) {
                    throw new ValidationException(String.format("bundle %s already %s", bundle.getId(), status.getValue()));
                }
            } else if (size() >= maxSize) {
                makeRoom();
            }

            save(new StoredBundle(bundle.copy(), BundleStatus.PENDING, clock.instant()));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Bundle retrieve(@NonNull final UUID id) throws NotFoundException {
        return doInReadLock(() -> find(id))
                .map(stored -> stored.getBundle().copy())
                .orElseThrow(() -> NotFoundException.bundle(id));
    }

    @Override
    public void delete(@NonNull final UUID id) throws NotFoundException {
        boolean removed;
        lock.writeLock().lock();
        try {
            removed = remove(id);
        } finally {
            lock.writeLock().unlock();
        }

        if (!removed) {
            throw NotFoundException.bundle(id);
        }
    }

    @Override
    public List<Bundle> list(@NonNull final BundleFilter filter) {
        var now = clock.instant();
        var matches = doInReadLock(() -> findCandidates(filter)).stream()
                .filter(stored -> matches(stored, filter, now));

        matches = sort(matches, filter);
        if (nonNull(filter.getLimit()) && filter.getLimit() > 0) {
            matches = matches.limit(filter.getLimit());
        }

        return matches
                .map(stored -> stored.getBundle().copy())
                .collect(toList());
    }

    @Override
    public void updateStatus(@NonNull final UUID id, @NonNull final BundleStatus status) throws NotFoundException, ValidationException {
        lock.writeLock().lock();
        try {
            var stored = find(id).orElseThrow(() -> NotFoundException.bundle(id));
            var current = stored.getStatus();
            if (current == status) {
                return;
            }
            if (!current.canTransitionTo(status)) {
                throw new ValidationException(String.format(
                        "illegal status transition %s -> %s for bundle %s", current.getValue(), status.getValue(), id
                ));
            }

            save(stored.withStatus(status));
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public BundleStatus getStatus(@NonNull final UUID id) throws NotFoundException {
        return doInReadLock(() -> find(id))
                .map(StoredBundle::getStatus)
                .orElseThrow(() -> NotFoundException.bundle(id));
    }

    @Override
    public int count() {
        return doInReadLock(this::size);
    }

    @Override
    public int purgeExpired() {
        lock.writeLock().lock();
        try {
            return evictExpired();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void makeRoom() {
        var purged = evictExpired();
        if (purged > 0) {
            log.debug("Store full, purged {} expired bundles", purged);
        }

        if (size() >= maxSize) {
            findCandidates(BundleFilter.ALL).stream()
                    .min(Comparator.comparing((StoredBundle stored) -> stored.getBundle().getPriority())
                            .thenComparing(StoredBundle::getStoredAt))
                    .ifPresent(victim -> {
                        remove(victim.getBundle().getId());
                        log.warn("Store full, evicted lowest priority {}", victim.getBundle());
                    });
        }
    }

    private int evictExpired() {
        var expired = findCandidates(BundleFilter.ALL).stream()
                .map(StoredBundle::getBundle)
                .filter(bundle -> bundle.isExpired(clock))
                .map(Bundle::getId)
                .collect(toList());
        expired.forEach(this::remove);

        return expired.size();
    }

    private boolean matches(StoredBundle stored, BundleFilter filter, Instant now) {
        var bundle = stored.getBundle();
        if (isNotBlank(filter.getDestinationEid()) && !filter.getDestinationEid().equals(bundle.getDestinationEid())) {
            return false;
        }
        if (isNotBlank(filter.getSourceEid()) && !filter.getSourceEid().equals(bundle.getSourceEid())) {
            return false;
        }
        if (nonNull(filter.getStatus()) && filter.getStatus() != stored.getStatus()) {
            return false;
        }
        if (nonNull(filter.getMinPriority()) && bundle.getPriority().getValue() < filter.getMinPriority().getValue()) {
            return false;
        }

        return filter.getMaxAge() == null
                || Duration.between(stored.getStoredAt(), now).compareTo(filter.getMaxAge()) <= 0;
    }

    private Stream<StoredBundle> sort(Stream<StoredBundle> stream, BundleFilter filter) {
        switch (filter.getOrder()) {
            case PRIORITY:
                return stream.sorted(
                        Comparator.comparing((StoredBundle stored) -> stored.getBundle().getPriority()).reversed()
                                .thenComparing(StoredBundle::getStoredAt)
                );
            case AGE:
                return stream.sorted(Comparator.comparing(StoredBundle::getStoredAt));
            case SIZE:
                return stream.sorted(Comparator.comparingInt(stored -> stored.getBundle().size()));
            default:
                return stream;
        }
    }

    private <Result> Result doInReadLock(Supplier<Result> supplier) {
        lock.readLock().lock();
        try {
            return supplier.get();
        } finally {
            lock.readLock().unlock();
        }
    }
}
