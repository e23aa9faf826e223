package io.satnet.storage;

import io.satnet.bundle.Bundle;
import io.satnet.bundle.BundleFilter;
import io.satnet.bundle.BundlePriority;
import io.satnet.bundle.BundleStatus;
import io.satnet.bundle.CrcType;
import io.satnet.storage.converter.BundleEntityConverter;
import io.satnet.storage.entity.BundleEntity;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.dizitart.no2.Nitrite;
import org.dizitart.no2.common.mapper.SimpleNitriteMapper;
import org.dizitart.no2.mvstore.MVStoreModule;
import org.dizitart.no2.repository.ObjectRepository;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.UUID;

import static java.util.Objects.nonNull;
import static java.util.stream.Collectors.toList;
import static org.dizitart.no2.common.util.Iterables.setOf;
import static org.dizitart.no2.filters.FluentFilter.where;

/**
 * Durable store backed by an embedded Nitrite document database. Custody survives a node
 * restart: bundles and their statuses are read back from the database file.
 */
@Slf4j
public class NitriteBundleStore extends AbstractBundleStore implements AutoCloseable {

    //collection names
    public static final String BUNDLES = "bundles";

    private final Nitrite db;
    private final ObjectRepository<BundleEntity> repository;

    private NitriteBundleStore(final Nitrite db, final Clock clock, final int maxSize) {
        super(clock, maxSize);
        this.db = db;
        this.repository = db.getRepository(BundleEntity.class);
    }

    public static NitriteBundleStore open(@NonNull final Path dbFile, @NonNull final Clock clock, final int maxSize) {
        var storeModule = MVStoreModule.withConfig()
                .filePath(dbFile.toString())
                .compress(true)
                .build();

        var store = new NitriteBundleStore(openDatabase(storeModule), clock, maxSize);
        log.info("Bundle store opened at {} with {} bundles", dbFile, store.count());

        return store;
    }

    /**
     * Same database engine without a backing file.
     */
    public static NitriteBundleStore inMemory(@NonNull final Clock clock, final int maxSize) {
        var storeModule = MVStoreModule.withConfig().build();

        return new NitriteBundleStore(openDatabase(storeModule), clock, maxSize);
    }

    private static Nitrite openDatabase(MVStoreModule storeModule) {
        var documentMapper = new SimpleNitriteMapper();
        documentMapper.registerEntityConverter(new BundleEntityConverter());

        return Nitrite.builder()
                .loadModule(storeModule)
                .loadModule(() -> setOf(documentMapper))
                .openOrCreate();
    }

    @Override
    protected Optional<StoredBundle> find(UUID id) {
        return Optional.ofNullable(repository.getById(id.toString()))
                .map(NitriteBundleStore::toStoredBundle);
    }

    @Override
    protected void save(StoredBundle stored) {
        repository.update(toEntity(stored), true);
    }

    @Override
    protected boolean remove(UUID id) {
        return repository.remove(where("bundleId").eq(id.toString())).getAffectedCount() > 0;
    }

    @Override
    protected Collection<StoredBundle> findCandidates(BundleFilter filter) {
        var cursor = nonNull(filter.getStatus())
                ? repository.find(where("status").eq(filter.getStatus().getValue()))
                : repository.find();

        return cursor.toList().stream()
                .map(NitriteBundleStore::toStoredBundle)
                .collect(toList());
    }

    @Override
    protected int size() {
        return (int) repository.size();
    }

    @Override
    public void close() {
        if (!db.isClosed()) {
            db.commit();
            db.close();
            log.info("Bundle store closed");
        }
    }

    private static BundleEntity toEntity(StoredBundle stored) {
        var bundle = stored.getBundle();

        return BundleEntity.builder()
                .bundleId(bundle.getId().toString())
                .version(bundle.getVersion())
                .bundleFlags(bundle.getBundleFlags())
                .destinationEid(bundle.getDestinationEid())
                .sourceEid(bundle.getSourceEid())
                .reportTo(bundle.getReportTo())
                .creationTimestamp(bundle.getCreationTimestamp())
                .lifetime(bundle.getLifetime().toString())
                .payload(bundle.getPayload())
                .crcType(bundle.getCrcType().getValue())
                .previousNode(bundle.getPreviousNode())
                .hopCount(bundle.getHopCount())
                .priority(bundle.getPriority().getValue())
                .status(stored.getStatus().getValue())
                .storedAt(stored.getStoredAt())
                .build();
    }

    private static StoredBundle toStoredBundle(BundleEntity entity) {
        var bundle = Bundle.builder()
                .id(UUID.fromString(entity.getBundleId()))
                .version(entity.getVersion())
                .bundleFlags(entity.getBundleFlags())
                .destinationEid(entity.getDestinationEid())
                .sourceEid(entity.getSourceEid())
                .reportTo(entity.getReportTo())
                .creationTimestamp(entity.getCreationTimestamp())
                .lifetime(Duration.parse(entity.getLifetime()))
                .payload(entity.getPayload())
                .crcType(CrcType.fromValue(entity.getCrcType()))
                .previousNode(entity.getPreviousNode())
                .hopCount(entity.getHopCount())
                .priority(BundlePriority.fromValue(entity.getPriority()))
                .build();

        return new StoredBundle(bundle, BundleStatus.fromValue(entity.getStatus()), entity.getStoredAt());
    }
}
