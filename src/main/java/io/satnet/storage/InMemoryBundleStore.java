package io.satnet.storage;

import io.satnet.bundle.BundleFilter;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static io.satnet.constant.NodeConstant.DEFAULT_MAX_BUNDLES;

/**
 * Volatile store for development, tests and nodes without persistence needs.
 */
@Slf4j
public class InMemoryBundleStore extends AbstractBundleStore {

    private final Map<UUID, StoredBundle> bundles = new HashMap<>();

    public InMemoryBundleStore() {
        this(Clock.systemUTC(), DEFAULT_MAX_BUNDLES);
    }

    public InMemoryBundleStore(final int maxSize) {
        this(Clock.systemUTC(), maxSize);
    }

    public InMemoryBundleStore(final Clock clock, final int maxSize) {
        super(clock, maxSize);
        log.debug("In-memory bundle store created with capacity {}", getMaxSize());
    }

    @Override
    protected Optional<StoredBundle> find(UUID id) {
        return Optional.ofNullable(bundles.get(id));
    }

    @Override
    protected void save(StoredBundle stored) {
        bundles.put(stored.getBundle().getId(), stored);
    }

    @Override
    protected boolean remove(UUID id) {
        return bundles.remove(id) != null;
    }

    @Override
    protected Collection<StoredBundle> findCandidates(BundleFilter filter) {
        return new ArrayList<>(bundles.values());
    }

    @Override
    protected int size() {
        return bundles.size();
    }
}
