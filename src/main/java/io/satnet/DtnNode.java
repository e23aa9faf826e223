package io.satnet;

import io.satnet.bundle.Bundle;
import io.satnet.bundle.BundleFilter;
import io.satnet.bundle.BundleOrder;
import io.satnet.bundle.BundlePriority;
import io.satnet.bundle.BundleStatus;
import io.satnet.exception.CapacityException;
import io.satnet.exception.DtnException;
import io.satnet.exception.NoRouteException;
import io.satnet.exception.NotFoundException;
import io.satnet.exception.ValidationException;
import io.satnet.routing.Router;
import io.satnet.storage.BundleStore;
import io.satnet.topology.TopologyManager;
import io.satnet.transport.BundleTransmitter;
import io.satnet.transport.DeliveryHandler;
import io.satnet.transport.Neighbor;
import io.satnet.transport.NodeMetrics;
import io.satnet.transport.NodeState;
import io.satnet.transport.NodeStatistics;
import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static io.satnet.constant.BundleConstant.DEFAULT_LIFETIME;
import static io.satnet.constant.BundleConstant.MAX_HOP_COUNT;
import static io.satnet.constant.NodeConstant.DEFAULT_QUEUE_CAPACITY;
import static io.satnet.constant.NodeConstant.NEIGHBOR_STALE_TIME;
import static io.satnet.constant.NodeConstant.QUEUE_POLL_TIMEOUT;
import static io.satnet.constant.NodeConstant.SHUTDOWN_TIMEOUT;
import static io.satnet.constant.NodeConstant.SWEEP_INTERVAL;
import static io.satnet.constant.NodeConstant.WORKER_THREADS;
import static io.satnet.utils.Scheduler.namedDaemonFactory;
import static io.satnet.utils.Scheduler.scheduleWithFixedDelaySafe;
import static java.util.Objects.requireNonNullElse;
import static java.util.concurrent.Executors.newScheduledThreadPool;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.apache.commons.lang3.StringUtils.defaultIfBlank;
import static org.apache.commons.lang3.Validate.inclusiveBetween;
import static org.apache.commons.lang3.Validate.isTrue;
import static org.apache.commons.lang3.Validate.notBlank;

/**
 * Store-and-forward engine of one node.
 * <p>
 * Producers hand bundles in with {@link #sendBundle(Bundle)}, the link layer with
 * {@link #receiveBundle(Bundle)}. Both only enqueue and fail fast with a
 * {@link CapacityException} when the queue is full. Three workers do the rest:
 * <ul>
 *     <li>ingress: validates arrivals, delivers the ones addressed to this node and stores
 *     the others for forwarding</li>
 *     <li>egress: asks the {@link Router} for a next hop over a snapshot of the neighbor
 *     table and hands the bundle to the {@link BundleTransmitter}</li>
 *     <li>maintenance: retires expired bundles, deactivates silent neighbors and re-drives
 *     bundles still waiting for a route</li>
 * </ul>
 * The {@link BundleStore} holds the authoritative custody status of every bundle. A bundle
 * without a route stays pending there and is offered to egress again whenever a neighbor
 * becomes active and on every maintenance run.
 */
@Slf4j
public class DtnNode {

    @Getter
    private final String nodeId;
    @Getter
    private final String endpoint;
    @Getter
    private final BundleStore store;
    @Getter
    private final Router router;
    private final Clock clock;
    private final BundleTransmitter transmitter;
    private final DeliveryHandler deliveryHandler;

    @Getter
    private final int maxHopCount;
    @Getter
    private final Duration defaultLifetime;
    private final Duration sweepInterval;
    private final Duration neighborStaleTime;

    private final int ingressCapacity;
    private final int egressCapacity;
    private final BlockingQueue<Bundle> ingressQueue;
    private final BlockingQueue<Bundle> egressQueue;
    private final Set<UUID> egressQueued = ConcurrentHashMap.newKeySet();
    // one queued re-drive covers every neighbor change that arrives before it runs
    private final AtomicBoolean redriveScheduled = new AtomicBoolean();

    private final Map<String, Neighbor> neighbors = new LinkedHashMap<>();
    private final ReentrantReadWriteLock neighborsLock = new ReentrantReadWriteLock();

    private final ReentrantLock lifecycleLock = new ReentrantLock();
    private final NodeMetrics metrics = new NodeMetrics();
    private volatile NodeState state = NodeState.CREATED;
    private volatile boolean cancelled = false;
    private ScheduledExecutorService executor;

    @Builder
    private DtnNode(
            @NonNull String nodeId,
            @NonNull String endpoint,
            @NonNull BundleStore store,
            @NonNull Router router,
            Clock clock,
            BundleTransmitter transmitter,
            DeliveryHandler deliveryHandler,
            Integer ingressCapacity,
            Integer egressCapacity,
            Duration sweepInterval,
            Duration neighborStaleTime,
            Integer maxHopCount,
            Duration defaultLifetime
    ) {
        notBlank(nodeId, "node id cannot be blank");
        notBlank(endpoint, "node endpoint cannot be blank");

        this.nodeId = nodeId;
        this.endpoint = endpoint;
        this.store = store;
        this.router = router;
        this.clock = requireNonNullElse(clock, Clock.systemUTC());
        this.transmitter = requireNonNullElse(transmitter, BundleTransmitter.NONE);
        this.deliveryHandler = requireNonNullElse(deliveryHandler, DeliveryHandler.NONE);

        this.ingressCapacity = requireNonNullElse(ingressCapacity, DEFAULT_QUEUE_CAPACITY);
        this.egressCapacity = requireNonNullElse(egressCapacity, DEFAULT_QUEUE_CAPACITY);
        isTrue(this.ingressCapacity > 0, "ingress capacity must be positive");
        isTrue(this.egressCapacity > 0, "egress capacity must be positive");
        this.ingressQueue = new ArrayBlockingQueue<>(this.ingressCapacity);
        this.egressQueue = new ArrayBlockingQueue<>(this.egressCapacity);

        this.sweepInterval = requireNonNullElse(sweepInterval, Duration.ofSeconds(SWEEP_INTERVAL));
        this.neighborStaleTime = requireNonNullElse(neighborStaleTime, Duration.ofSeconds(NEIGHBOR_STALE_TIME));
        isTrue(!this.sweepInterval.isNegative() && !this.sweepInterval.isZero(), "sweep interval must be positive");

        this.maxHopCount = requireNonNullElse(maxHopCount, MAX_HOP_COUNT);
        inclusiveBetween(0, MAX_HOP_COUNT, this.maxHopCount, "max hop count must be in [0, " + MAX_HOP_COUNT + "]");
        this.defaultLifetime = requireNonNullElse(defaultLifetime, DEFAULT_LIFETIME);
    }

    public NodeState getState() {
        return state;
    }

    /**
     * Launches the ingress, egress and maintenance workers and returns immediately.
     *
     * @throws IllegalStateException when the node was already started or stopped
     */
    public void start() {
        lifecycleLock.lock();
        try {
            if (state != NodeState.CREATED) {
                throw new IllegalStateException(String.format("node %s cannot be started, it is %s", nodeId, state.getValue()));
            }
            state = NodeState.STARTED;

            executor = newScheduledThreadPool(WORKER_THREADS, namedDaemonFactory("satnet-" + nodeId + "-%d"));
            executor.execute(this::ingressWorker);
            executor.execute(this::egressWorker);
            scheduleWithFixedDelaySafe(
                    executor, this::maintenance, sweepInterval.toMillis(), sweepInterval.toMillis(), MILLISECONDS
            );

            state = NodeState.RUNNING;
            log.info("Node {} ({}) started, {} bundles in custody", nodeId, endpoint, store.count());
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Cancels all workers and waits for them to exit, then clears both queues. Bundles that
     * reached the store stay there. Stopping twice is harmless.
     */
    public void stop() {
        lifecycleLock.lock();
        try {
            if (state == NodeState.STOPPING || state == NodeState.STOPPED) {
                return;
            }
            var wasStarted = state != NodeState.CREATED;
            state = NodeState.STOPPING;
            cancelled = true;

            if (wasStarted) {
                executor.shutdown();
                try {
                    if (!executor.awaitTermination(SHUTDOWN_TIMEOUT, SECONDS)) {
                        log.warn("Node {} workers did not exit within {}s, interrupting", nodeId, SHUTDOWN_TIMEOUT);
                        executor.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    log.warn("Node {} interrupted while waiting for workers", nodeId);
                    executor.shutdownNow();
                    Thread.currentThread().interrupt();
                }
            }

            ingressQueue.clear();
            egressQueue.clear();
            egressQueued.clear();
            state = NodeState.STOPPED;
            log.info("Node {} stopped", nodeId);
        } finally {
            lifecycleLock.unlock();
        }
    }

    /**
     * Takes custody of a locally produced bundle: stamps this node as source, stores it as
     * pending and queues it for egress. Never blocks.
     *
     * @throws ValidationException when the bundle is malformed, expired or a duplicate of a finished one
     * @throws CapacityException   when the egress queue is full; a new bundle is not kept, a copy
     *                             already in custody keeps its status
     */
    public void sendBundle(@NonNull Bundle bundle) throws ValidationException, CapacityException {
        checkAcceptingBundles();

        var stamped = bundle.withSourceEid(endpoint);
        var previous = findStatus(stamped.getId());
        store.store(stamped);

        if (!offerEgress(stamped)) {
            rollbackSend(stamped, previous);
            throw new CapacityException(String.format(
                    "egress queue of node %s is full (%d), bundle %s rejected", nodeId, egressCapacity, stamped.shortId()
            ));
        }
        log.debug("Node {} accepted {} for sending", nodeId, stamped);
    }

    /**
     * Queues a bundle that arrived over a link. Never blocks.
     *
     * @throws CapacityException when the ingress queue is full
     */
    public void receiveBundle(@NonNull Bundle bundle) throws CapacityException {
        checkAcceptingBundles();

        if (!ingressQueue.offer(bundle.copy())) {
            throw new CapacityException(String.format(
                    "ingress queue of node %s is full (%d), bundle %s rejected", nodeId, ingressCapacity, bundle.shortId()
            ));
        }
        metrics.received(bundle.size());
    }

    /**
     * A bundle from this node's endpoint with the configured default lifetime.
     */
    public Bundle createBundle(String destination, byte[] payload, @NonNull BundlePriority priority) {
        return Bundle.builder()
                .sourceEid(endpoint)
                .destinationEid(destination)
                .payload(payload)
                .priority(priority)
                .lifetime(defaultLifetime)
                .creationTimestamp(clock.instant())
                .build();
    }

    public void addNeighbor(String id, String neighborEndpoint, double linkQuality) {
        addNeighbor(
                Neighbor.builder()
                        .id(id)
                        .endpoint(neighborEndpoint)
                        .linkQuality(linkQuality)
                        .lastContact(clock.instant())
                        .active(true)
                        .build()
        );
    }

    /**
     * Inserts or replaces a neighbor. An active neighbor may open a route for waiting bundles.
     */
    public void addNeighbor(@NonNull Neighbor neighbor) {
        neighborsLock.writeLock().lock();
        try {
            neighbors.put(neighbor.getId(), neighbor);
        } finally {
            neighborsLock.writeLock().unlock();
        }
        log.debug("Node {} neighbor {} ({}) quality {} active {}",
                nodeId, neighbor.getId(), neighbor.getEndpoint(), neighbor.getLinkQuality(), neighbor.isActive());

        if (neighbor.isActive()) {
            scheduleRedrive();
        }
    }

    public boolean removeNeighbor(String id) {
        Neighbor removed;
        neighborsLock.writeLock().lock();
        try {
            removed = neighbors.remove(id);
        } finally {
            neighborsLock.writeLock().unlock();
        }
        if (removed != null) {
            log.debug("Node {} lost neighbor {}", nodeId, id);
        }

        return removed != null;
    }

    /**
     * Records a fresh contact with a known neighbor: new link quality, active again.
     *
     * @return false when the neighbor is unknown
     */
    public boolean updateNeighborQuality(String id, double linkQuality) {
        Neighbor updated;
        neighborsLock.writeLock().lock();
        try {
            var current = neighbors.get(id);
            if (current == null) {
                return false;
            }
            updated = current.toBuilder()
                    .linkQuality(linkQuality)
                    .lastContact(clock.instant())
                    .active(true)
                    .build();
            neighbors.put(id, updated);
        } finally {
            neighborsLock.writeLock().unlock();
        }

        scheduleRedrive();
        return true;
    }

    /**
     * Immutable copy of the neighbor table in insertion order.
     */
    public Map<String, Neighbor> neighborSnapshot() {
        neighborsLock.readLock().lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(neighbors));
        } finally {
            neighborsLock.readLock().unlock();
        }
    }

    /**
     * Refreshes the neighbor table from the topology: every satellite in range becomes an
     * active neighbor with a distance based link quality, neighbors the topology tracks but
     * no longer sees are removed. Neighbors unknown to the topology are left alone.
     *
     * @return amount of visible satellites
     */
    public int syncNeighbors(@NonNull TopologyManager topology) {
        var self = topology.getSatellite(nodeId);
        if (self.isEmpty()) {
            log.debug("Node {} is not tracked by the topology, nothing to sync", nodeId);
            return 0;
        }

        var now = clock.instant();
        var visible = topology.getVisibleNeighbors(nodeId);
        var visibleIds = new HashSet<String>();
        neighborsLock.writeLock().lock();
        try {
            for (var satellite : visible) {
                visibleIds.add(satellite.getId());
                var current = neighbors.get(satellite.getId());
                var builder = current == null ? Neighbor.builder().id(satellite.getId()) : current.toBuilder();
                neighbors.put(satellite.getId(), builder
                        .endpoint(defaultIfBlank(satellite.getEndpoint(), current == null ? null : current.getEndpoint()))
                        .linkQuality(topology.estimateLinkQuality(self.get(), satellite))
                        .batteryPercent(satellite.getBatteryPercent())
                        .inEclipse(satellite.isInEclipse())
                        .lastContact(now)
                        .active(true)
                        .build());
            }

            neighbors.keySet().removeIf(id -> !visibleIds.contains(id) && topology.getSatellite(id).isPresent());
        } finally {
            neighborsLock.writeLock().unlock();
        }
        log.debug("Node {} synced {} visible neighbors from topology", nodeId, visible.size());

        if (!visible.isEmpty()) {
            scheduleRedrive();
        }
        return visible.size();
    }

    public NodeStatistics getStatistics() {
        int neighborCount;
        neighborsLock.readLock().lock();
        try {
            neighborCount = neighbors.size();
        } finally {
            neighborsLock.readLock().unlock();
        }

        return metrics.fill(NodeStatistics.builder())
                .nodeId(nodeId)
                .endpoint(endpoint)
                .state(state)
                .neighborCount(neighborCount)
                .ingressQueueDepth(ingressQueue.size())
                .egressQueueDepth(egressQueue.size())
                .storedBundles(store.count())
                .build();
    }

    void processIngress(Bundle bundle) throws DtnException {
        try {
            bundle.validate(clock);
        } catch (ValidationException e) {
            metrics.dropped();
            log.warn("Node {} dropped invalid inbound {}: {}", nodeId, bundle, e.getMessage());
            return;
        }

        if (endpoint.equals(bundle.getDestinationEid())) {
            deliver(bundle);
            return;
        }

        try {
            store.store(bundle);
        } catch (ValidationException e) {
            metrics.dropped();
            log.warn("Node {} dropped inbound {}: {}", nodeId, bundle, e.getMessage());
            return;
        }

        if (offerEgress(bundle)) {
            log.debug("Node {} queued {} for forwarding", nodeId, bundle);
        } else {
            log.warn("Node {} egress queue full, {} stays pending in store", nodeId, bundle.shortId());
        }
    }

    void processEgress(UUID id) throws DtnException {
        Bundle bundle;
        try {
            if (store.getStatus(id) != BundleStatus.PENDING) {
                log.debug("Node {} skipped {}, no longer pending", nodeId, id);
                return;
            }
            bundle = store.retrieve(id);
        } catch (NotFoundException e) {
            log.debug("Node {} skipped {}, no longer in store", nodeId, id);
            return;
        }

        if (bundle.isExpired(clock)) {
            log.debug("Node {} holds back expired {} for the sweep", nodeId, bundle.shortId());
            return;
        }

        var snapshot = neighborSnapshot();
        String nextHop;
        try {
            nextHop = router.selectNextHop(bundle.copy(), snapshot);
        } catch (NoRouteException e) {
            log.debug("Node {} has no route for {}, kept pending: {}", nodeId, bundle.shortId(), e.getMessage());
            return;
        }

        var neighbor = snapshot.get(nextHop);
        if (neighbor == null) {
            log.warn("Node {} router {} chose unknown neighbor {} for {}", nodeId, router.getName(), nextHop, bundle.shortId());
            return;
        }

        var outbound = bundle.copy();
        try {
            outbound.incrementHop(nodeId);
        } catch (ValidationException e) {
            fail(id, e.getMessage());
            return;
        }
        if (outbound.getHopCount() > maxHopCount) {
            fail(id, String.format("hop count %d exceeds limit %d", outbound.getHopCount(), maxHopCount));
            return;
        }

        store.updateStatus(id, BundleStatus.IN_TRANSIT);
        try {
            transmitter.transmit(neighbor, outbound);
        } catch (Exception e) {
            log.warn("Node {} failed to transmit {} to {}", nodeId, outbound.shortId(), nextHop, e);
            fail(id, "transmission failed");
            return;
        }

        metrics.forwarded(outbound.size());
        log.debug("Node {} forwarded {} to {}", nodeId, outbound, nextHop);
    }

    /**
     * Retires every bundle whose lifetime has elapsed: marks it expired, then deletes it.
     *
     * @return amount of bundles retired
     */
    int sweepExpired() {
        var retired = 0;
        for (var bundle : store.list(BundleFilter.ALL)) {
            if (!bundle.isExpired(clock)) {
                continue;
            }

            var id = bundle.getId();
            try {
                if (!store.getStatus(id).isTerminal()) {
                    store.updateStatus(id, BundleStatus.EXPIRED);
                }
                store.delete(id);
                metrics.expired();
                retired++;
            } catch (DtnException e) {
                log.debug("Node {} could not retire {} [{}]: {}", nodeId, bundle.shortId(), e.getType().getCode(), e.getMessage());
            }
        }

        if (retired > 0) {
            log.info("Node {} retired {} expired bundles", nodeId, retired);
        }
        return retired;
    }

    /**
     * Marks neighbors without contact for longer than the stale time inactive.
     *
     * @return amount of neighbors deactivated
     */
    int deactivateStaleNeighbors() {
        var now = clock.instant();
        var deactivated = 0;
        neighborsLock.writeLock().lock();
        try {
            for (var entry : neighbors.entrySet()) {
                var neighbor = entry.getValue();
                if (neighbor.isActive() && neighbor.isStale(now, neighborStaleTime)) {
                    entry.setValue(neighbor.toBuilder().active(false).build());
                    deactivated++;
                    log.info("Node {} neighbor {} silent since {}, marked inactive", nodeId, neighbor.getId(), neighbor.getLastContact());
                }
            }
        } finally {
            neighborsLock.writeLock().unlock();
        }

        return deactivated;
    }

    /**
     * Offers pending bundles to egress again, highest priority first, until the queue is full.
     *
     * @return amount of bundles queued
     */
    int redrivePending() {
        var pending = store.list(BundleFilter.builder()
                .status(BundleStatus.PENDING)
                .order(BundleOrder.PRIORITY)
                .build());

        var queued = 0;
        for (var bundle : pending) {
            if (egressQueued.contains(bundle.getId()) || bundle.isExpired(clock)) {
                continue;
            }
            if (!offerEgress(bundle)) {
                log.debug("Node {} egress queue full, re-drive stopped after {} bundles", nodeId, queued);
                break;
            }
            queued++;
        }

        if (queued > 0) {
            log.debug("Node {} re-drove {} pending bundles", nodeId, queued);
        }
        return queued;
    }

    void maintenance() {
        sweepExpired();
        deactivateStaleNeighbors();
        redrivePending();
    }

    private boolean offerEgress(Bundle bundle) {
        if (!egressQueued.add(bundle.getId())) {
            return true;
        }
        if (!egressQueue.offer(bundle)) {
            egressQueued.remove(bundle.getId());
            return false;
        }

        return true;
    }

    private void deliver(Bundle bundle) throws DtnException {
        try {
            store.store(bundle);
        } catch (ValidationException e) {
            log.debug("Node {} ignored duplicate delivery of {}: {}", nodeId, bundle.shortId(), e.getMessage());
            return;
        }
        store.updateStatus(bundle.getId(), BundleStatus.DELIVERED);
        metrics.delivered();
        log.debug("Node {} delivered {}", nodeId, bundle);

        deliveryHandler.delivered(bundle.copy());
    }

    private void fail(UUID id, String reason) {
        metrics.dropped();
        try {
            store.updateStatus(id, BundleStatus.FAILED);
        } catch (DtnException e) {
            log.debug("Node {} could not mark {} failed [{}]: {}", nodeId, id, e.getType().getCode(), e.getMessage());
        }
        log.warn("Node {} gave up on bundle {}: {}", nodeId, id, reason);
    }

    private BundleStatus findStatus(UUID id) {
        try {
            return store.getStatus(id);
        } catch (NotFoundException e) {
            return null;
        }
    }

    private void rollbackSend(Bundle stamped, BundleStatus previous) {
        var id = stamped.getId();
        try {
            if (previous == null) {
                store.delete(id);
            } else if (previous != BundleStatus.PENDING) {
                store.updateStatus(id, previous);
            }
        } catch (DtnException e) {
            log.debug("Node {} could not roll back {} [{}]: {}", nodeId, stamped.shortId(), e.getType().getCode(), e.getMessage());
        }
    }

    private void scheduleRedrive() {
        if (state != NodeState.RUNNING || !redriveScheduled.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(() -> {
                redriveScheduled.set(false);
                try {
                    redrivePending();
                } catch (Exception e) {
                    log.error("Node {} re-drive failed", nodeId, e);
                }
            });
        } catch (RuntimeException e) {
            redriveScheduled.set(false);
            log.debug("Node {} is shutting down, re-drive skipped", nodeId);
        }
    }

    private void checkAcceptingBundles() {
        if (!state.acceptsBundles()) {
            throw new IllegalStateException(String.format("node %s is %s", nodeId, state.getValue()));
        }
    }

    private void ingressWorker() {
        while (!cancelled) {
            Bundle bundle;
            try {
                bundle = ingressQueue.poll(QUEUE_POLL_TIMEOUT, MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (bundle == null) {
                continue;
            }

            try {
                processIngress(bundle);
            } catch (Exception e) {
                log.error("Node {} failed to process inbound {}", nodeId, bundle, e);
            }
        }
        log.debug("Node {} ingress worker exited", nodeId);
    }

    private void egressWorker() {
        while (!cancelled) {
            Bundle bundle;
            try {
                bundle = egressQueue.poll(QUEUE_POLL_TIMEOUT, MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (bundle == null) {
                continue;
            }

            egressQueued.remove(bundle.getId());
            try {
                processEgress(bundle.getId());
            } catch (Exception e) {
                log.error("Node {} failed to forward {}", nodeId, bundle, e);
            }
        }
        log.debug("Node {} egress worker exited", nodeId);
    }
}
