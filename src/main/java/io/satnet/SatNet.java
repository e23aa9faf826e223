package io.satnet;

import io.satnet.config.NeighborConf;
import io.satnet.config.SatNetConfig;
import io.satnet.routing.RouterFactory;
import io.satnet.storage.BundleStore;
import io.satnet.storage.InMemoryBundleStore;
import io.satnet.storage.NitriteBundleStore;
import io.satnet.storage.StorageBackend;
import io.satnet.topology.TopologyManager;
import io.satnet.transport.BundleTransmitter;
import io.satnet.transport.DeliveryHandler;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

import static io.satnet.constant.BundleConstant.DEFAULT_LIFETIME;
import static io.satnet.constant.NodeConstant.DEFAULT_MAX_BUNDLES;
import static io.satnet.constant.NodeConstant.STATISTICS_INTERVAL;
import static io.satnet.constant.SatNetConstant.CONFIG_FILE_NAME;
import static io.satnet.constant.SatNetConstant.DEFAULT_CONFIG_RESOURCE;
import static io.satnet.constant.SatNetConstant.DEFAULT_STORAGE_FILE;
import static io.satnet.constant.SatNetConstant.ETC_DIR;
import static io.satnet.constant.SatNetConstant.STORAGE_DIR_NAME;
import static io.satnet.constant.SatNetConstant.USER_DIR_NAME;
import static io.satnet.constant.TopologyConstant.LOW_BATTERY_PERCENT;
import static io.satnet.constant.TopologyConstant.MAX_RANGE_KM;
import static io.satnet.utils.Scheduler.scheduleWithFixedDelaySafe;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.util.Objects.isNull;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.apache.commons.lang3.StringUtils.defaultIfBlank;
import static org.apache.commons.lang3.StringUtils.isAnyBlank;
import static org.apache.commons.lang3.StringUtils.isNotBlank;
import static org.apache.commons.lang3.SystemUtils.USER_HOME;

/**
 * Boots one node from a configuration directory: loads {@code config.yml}, opens the bundle
 * store, builds the router and topology manager, registers the configured neighbors and
 * starts the node.
 * <p>
 * The configuration directory is the given one, else {@code /etc/satnet} when it holds a
 * config file, else {@code ~/.satnet}. A missing config file is created from the bundled
 * default.
 */
@Slf4j
public class SatNet implements AutoCloseable {

    @Getter
    private final Path configPath;
    @Getter
    private final Path storagePath;
    @Getter
    private final SatNetConfig config;
    @Getter
    private final TopologyManager topologyManager;
    @Getter
    private final DtnNode node;

    private final BundleStore store;
    private ScheduledFuture<?> statisticsJob;

    public SatNet(final String configDir) throws IOException {
        this(configDir, Clock.systemUTC(), BundleTransmitter.NONE, DeliveryHandler.NONE);
    }

    public SatNet(
            final String configDir,
            final Clock clock,
            final BundleTransmitter transmitter,
            final DeliveryHandler deliveryHandler
    ) throws IOException {
        this.configPath = resolveConfigDir(configDir);
        Files.createDirectories(configPath);
        this.storagePath = configPath.resolve(STORAGE_DIR_NAME);
        Files.createDirectories(storagePath);

        this.config = loadConfig(configPath);

        var nodeConf = config.getNode();
        if (isAnyBlank(nodeConf.getId(), nodeConf.getEndpoint())) {
            throw new IllegalStateException("node.id and node.endpoint must be set in " + configPath.resolve(CONFIG_FILE_NAME));
        }

        this.store = openStore(clock);
        this.topologyManager = new TopologyManager(
                clock,
                Optional.ofNullable(config.getTopology().getMaxRangeKm()).orElse(MAX_RANGE_KM),
                Optional.ofNullable(config.getTopology().getLowBatteryPercent()).orElse(LOW_BATTERY_PERCENT)
        );

        this.node = DtnNode.builder()
                .nodeId(nodeConf.getId())
                .endpoint(nodeConf.getEndpoint())
                .store(store)
                .router(RouterFactory.create(config.getRouting()))
                .clock(clock)
                .transmitter(transmitter)
                .deliveryHandler(deliveryHandler)
                .ingressCapacity(nodeConf.getIngressCapacity())
                .egressCapacity(nodeConf.getEgressCapacity())
                .sweepInterval(Optional.ofNullable(nodeConf.getSweepIntervalSeconds()).map(Duration::ofSeconds).orElse(null))
                .neighborStaleTime(Optional.ofNullable(nodeConf.getNeighborStaleSeconds()).map(Duration::ofSeconds).orElse(null))
                .maxHopCount(nodeConf.getMaxHopCount())
                .defaultLifetime(
                        Optional.ofNullable(config.getBundle().getDefaultLifetimeSeconds())
                                .map(Duration::ofSeconds)
                                .orElse(DEFAULT_LIFETIME)
                )
                .build();

        registerNeighbors();
    }

    /**
     * Starts the node, periodic statistics logging and the shutdown hook.
     */
    public SatNet start() {
        node.start();
        statisticsJob = scheduleWithFixedDelaySafe(
                () -> log.info("{} | {}", node.getStatistics(), topologyManager.getNetworkStatistics()),
                STATISTICS_INTERVAL,
                SECONDS
        );
        Runtime.getRuntime().addShutdownHook(new Thread(this::close, "satnet-shutdown"));

        return this;
    }

    @Override
    public void close() {
        if (statisticsJob != null) {
            statisticsJob.cancel(false);
        }
        node.stop();
        if (store instanceof AutoCloseable) {
            try {
                ((AutoCloseable) store).close();
            } catch (Exception e) {
                log.error("Error while closing bundle store", e);
            }
        }
    }

    static Path resolveConfigDir(String configDir) {
        if (isNotBlank(configDir)) {
            return Path.of(configDir);
        }
        if (Files.isDirectory(Path.of(ETC_DIR)) && Files.exists(Path.of(ETC_DIR, CONFIG_FILE_NAME))) {
            return Path.of(ETC_DIR);
        }

        return Path.of(USER_HOME, USER_DIR_NAME);
    }

    static SatNetConfig loadConfig(Path configDir) throws IOException {
        var configFile = configDir.resolve(CONFIG_FILE_NAME);
        if (Files.notExists(configFile)) {
            try (var defaultConfig = SatNet.class.getClassLoader().getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
                if (isNull(defaultConfig)) {
                    throw new IOException("default configuration " + DEFAULT_CONFIG_RESOURCE + " is missing from the classpath");
                }
                Files.copy(defaultConfig, configFile, REPLACE_EXISTING);
            }
            log.info("Default config file created. Make any necessary changes in {} and restart if needed.", configFile);
        }

        try {
            var config = SatNetConfig.initConfig(configFile);
            log.info("Config loaded from {}", configFile);

            return config;
        } catch (IOException e) {
            log.error("Could not parse the configuration at {}. Check your configuration file for errors!", configFile);
            throw e;
        }
    }

    private BundleStore openStore(Clock clock) {
        var storageConf = config.getStorage();
        var maxBundles = Optional.ofNullable(storageConf.getMaxBundles()).orElse(DEFAULT_MAX_BUNDLES);
        var backend = Optional.ofNullable(storageConf.getBackend()).orElse(StorageBackend.MEMORY);

        if (backend == StorageBackend.NITRITE) {
            var dbFile = storagePath.resolve(defaultIfBlank(storageConf.getFileName(), DEFAULT_STORAGE_FILE));
            return NitriteBundleStore.open(dbFile, clock, maxBundles);
        }

        return new InMemoryBundleStore(clock, maxBundles);
    }

    private void registerNeighbors() {
        for (NeighborConf neighbor : config.getNeighbors()) {
            try {
                node.addNeighbor(neighbor.getId(), neighbor.getEndpoint(), Optional.ofNullable(neighbor.getLinkQuality()).orElse(1.0));
            } catch (RuntimeException e) {
                log.error("Skipping invalid neighbor {} in configuration", neighbor.getId(), e);
            }
        }
        log.info("Node {} registered {} configured neighbors", node.getNodeId(), node.neighborSnapshot().size());
    }
}
