package io.satnet;

import io.satnet.bundle.Bundle;
import io.satnet.bundle.BundleFilter;
import io.satnet.bundle.BundlePriority;
import io.satnet.bundle.BundleStatus;
import io.satnet.exception.CapacityException;
import io.satnet.exception.DtnErrorType;
import io.satnet.exception.NotFoundException;
import io.satnet.routing.LinkQualityEnergyRouter;
import io.satnet.storage.BundleStore;
import io.satnet.storage.InMemoryBundleStore;
import io.satnet.topology.SatelliteState;
import io.satnet.topology.TopologyManager;
import io.satnet.topology.Vector3;
import io.satnet.transport.BundleTransmitter;
import io.satnet.transport.DeliveryHandler;
import io.satnet.transport.Neighbor;
import io.satnet.transport.NodeState;
import io.satnet.utils.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.util.concurrent.TimeUnit.SECONDS;
import static java.util.stream.Collectors.toList;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.junit.jupiter.api.Assertions.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class DtnNodeTest {

    private static final String A = "dtn://earth/a";
    private static final String B = "dtn://earth/b";
    private static final String C = "dtn://earth/c";

    @Mock
    DeliveryHandler deliveryHandler;

    private MutableClock clock;
    private final List<Bundle> transmitted = new CopyOnWriteArrayList<>();
    private final BundleTransmitter recordingTransmitter = (neighbor, bundle) -> transmitted.add(bundle);
    private final List<DtnNode> started = new ArrayList<>();

    @BeforeEach
    void init() {
        clock = new MutableClock();
    }

    @AfterEach
    void stopNodes() {
        started.forEach(DtnNode::stop);
    }

    private DtnNode.DtnNodeBuilder nodeBuilder(String id, String endpoint) {
        return DtnNode.builder()
                .nodeId(id)
                .endpoint(endpoint)
                .store(new InMemoryBundleStore(clock, 100))
                .router(new LinkQualityEnergyRouter())
                .clock(clock)
                .transmitter(recordingTransmitter)
                .deliveryHandler(deliveryHandler);
    }

    private DtnNode start(DtnNode node) {
        node.start();
        started.add(node);
        return node;
    }

    private Bundle bundle(String source, String destination, String payload) {
        return Bundle.builder()
                .sourceEid(source)
                .destinationEid(destination)
                .payload(payload.getBytes(UTF_8))
                .creationTimestamp(clock.instant())
                .build();
    }

    private static void await(BooleanSupplier condition) throws InterruptedException {
        var deadline = System.nanoTime() + SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    private static BundleStatus status(DtnNode node, Bundle bundle) {
        try {
            return node.getStore().getStatus(bundle.getId());
        } catch (NotFoundException e) {
            return null;
        }
    }

    @Test
    void basicDelivery() throws Exception {
        var nodes = new ConcurrentHashMap<String, DtnNode>();
        BundleTransmitter loopback = (neighbor, bundle) -> nodes.get(neighbor.getId()).receiveBundle(bundle);
        BlockingQueue<Bundle> delivered = new LinkedBlockingQueue<>();

        var nodeA = nodeBuilder("A", A).transmitter(loopback).build();
        var nodeB = nodeBuilder("B", B).transmitter(loopback).deliveryHandler(delivered::add).build();
        nodes.put("A", nodeA);
        nodes.put("B", nodeB);
        nodeA.addNeighbor("B", B, 0.9);
        start(nodeA);
        start(nodeB);

        var ping = bundle(A, B, "ping");
        nodeA.sendBundle(ping);

        var received = delivered.poll(5, SECONDS);
        assertNotNull(received);
        assertEquals(ping.getId(), received.getId());
        assertEquals("ping", new String(received.getPayload(), UTF_8));
        assertEquals(1, received.getHopCount());
        assertEquals("A", received.getPreviousNode());
        assertEquals(BundleStatus.DELIVERED, status(nodeB, ping));
        assertEquals(BundleStatus.IN_TRANSIT, status(nodeA, ping));

        await(() -> nodeB.getStatistics().getBundlesDelivered() == 1);
        await(() -> nodeA.getStatistics().getBundlesForwarded() == 1);
    }

    @Test
    void multiHopForward() throws Exception {
        var node = nodeBuilder("A", A).build();
        node.addNeighbor("C", C, 0.7);

        var bundle = bundle(A, B, "relay me");
        node.sendBundle(bundle);
        node.processEgress(bundle.getId());

        assertEquals(1, transmitted.size());
        assertEquals(1, transmitted.get(0).getHopCount());
        assertEquals("A", transmitted.get(0).getPreviousNode());
        assertEquals(BundleStatus.IN_TRANSIT, status(node, bundle));
        // custody copy keeps the hop count it was stored with
        assertEquals(0, node.getStore().retrieve(bundle.getId()).getHopCount());
    }

    @Test
    void forwardsThroughRunningRelay() throws Exception {
        var nodes = new ConcurrentHashMap<String, DtnNode>();
        BundleTransmitter loopback = (neighbor, bundle) -> nodes.get(neighbor.getId()).receiveBundle(bundle);
        BlockingQueue<Bundle> delivered = new LinkedBlockingQueue<>();

        var nodeA = nodeBuilder("A", A).transmitter(loopback).build();
        var nodeC = nodeBuilder("C", C).transmitter(loopback).build();
        var nodeB = nodeBuilder("B", B).transmitter(loopback).deliveryHandler(delivered::add).build();
        nodes.put("A", nodeA);
        nodes.put("B", nodeB);
        nodes.put("C", nodeC);
        nodeA.addNeighbor("C", C, 0.8);
        nodeC.addNeighbor("B", B, 0.8);
        start(nodeA);
        start(nodeB);
        start(nodeC);

        var bundle = bundle(A, B, "two hops");
        nodeA.sendBundle(bundle);

        var received = delivered.poll(5, SECONDS);
        assertNotNull(received);
        assertEquals(2, received.getHopCount());
        assertEquals("C", received.getPreviousNode());
        assertEquals(BundleStatus.IN_TRANSIT, status(nodeC, bundle));
    }

    @Test
    void sendStampsSourceEndpoint() throws Exception {
        var node = nodeBuilder("A", A).build();
        var bundle = bundle("dtn://earth/someone-else", B, "x");

        node.sendBundle(bundle);

        assertEquals(A, node.getStore().retrieve(bundle.getId()).getSourceEid());
        assertEquals("dtn://earth/someone-else", bundle.getSourceEid());
    }

    @Test
    void egressBackpressure() throws Exception {
        var node = nodeBuilder("A", A).egressCapacity(2).build();
        var first = bundle(A, B, "1");
        var second = bundle(A, B, "2");
        var third = bundle(A, B, "3");

        node.sendBundle(first);
        node.sendBundle(second);
        var e = assertThrows(CapacityException.class, () -> node.sendBundle(third));

        assertEquals(DtnErrorType.CAPACITY, e.getType());
        assertEquals(BundleStatus.PENDING, status(node, second));
        assertEquals(BundleStatus.PENDING, status(node, first));
        assertNull(status(node, third));
        assertEquals(2, node.getStore().count());
        assertEquals(2, node.getStatistics().getEgressQueueDepth());
    }

    @Test
    void rejectedResendKeepsCopyInCustody() throws Exception {
        var node = nodeBuilder("A", A).egressCapacity(1).build();
        var waiting = bundle(A, B, "no route yet");
        var queued = bundle(A, B, "fills the queue");

        node.sendBundle(queued);
        node.processIngress(waiting);
        assertEquals(BundleStatus.PENDING, status(node, waiting));
        assertEquals(2, node.getStore().count());

        assertThrows(CapacityException.class, () -> node.sendBundle(waiting));

        assertEquals(BundleStatus.PENDING, status(node, waiting));
        assertEquals(2, node.getStore().count());
    }

    @Test
    void ingressBackpressure() throws Exception {
        var node = nodeBuilder("B", B).ingressCapacity(1).build();

        node.receiveBundle(bundle(A, B, "1"));

        assertThrows(CapacityException.class, () -> node.receiveBundle(bundle(A, B, "2")));
        assertEquals(1, node.getStatistics().getIngressQueueDepth());
    }

    @Test
    void expirySweepMarksThenDeletes() throws Exception {
        BundleStore store = spy(new InMemoryBundleStore(clock, 100));
        var node = nodeBuilder("A", A).store(store).build();
        var shortLived = Bundle.builder()
                .sourceEid(A)
                .destinationEid(B)
                .creationTimestamp(clock.instant())
                .lifetime(Duration.ofSeconds(1))
                .build();
        var longLived = bundle(A, B, "stays");
        node.sendBundle(shortLived);
        node.sendBundle(longLived);

        clock.advanceSeconds(2);

        assertEquals(1, node.sweepExpired());

        var order = inOrder(store);
        order.verify(store).updateStatus(shortLived.getId(), BundleStatus.EXPIRED);
        order.verify(store).delete(shortLived.getId());
        verify(store, never()).delete(longLived.getId());

        assertEquals(List.of(longLived.getId()), node.getStore().list(BundleFilter.ALL).stream().map(Bundle::getId).collect(toList()));
        assertEquals(1, node.getStatistics().getBundlesExpired());
    }

    @Test
    void sweepRetiresExpiredDeliveredBundles() throws Exception {
        var node = nodeBuilder("B", B).build();
        var bundle = Bundle.builder()
                .sourceEid(A)
                .destinationEid(B)
                .creationTimestamp(clock.instant())
                .lifetime(Duration.ofSeconds(10))
                .build();
        node.processIngress(bundle);
        assertEquals(BundleStatus.DELIVERED, status(node, bundle));

        clock.advanceSeconds(11);

        assertEquals(1, node.sweepExpired());
        assertEquals(0, node.getStore().count());
    }

    @Test
    void localDestinationIsDeliveredOnce() throws Exception {
        var node = nodeBuilder("B", B).build();
        var bundle = bundle(A, B, "ping");

        node.processIngress(bundle);
        node.processIngress(bundle.copy());

        var captor = ArgumentCaptor.forClass(Bundle.class);
        verify(deliveryHandler, times(1)).delivered(captor.capture());
        assertEquals(bundle.getId(), captor.getValue().getId());
        assertEquals(BundleStatus.DELIVERED, status(node, bundle));
        assertEquals(0, node.getStatistics().getEgressQueueDepth());
    }

    @Test
    void invalidInboundIsDropped() throws Exception {
        var node = nodeBuilder("B", B).build();
        var noSource = Bundle.builder()
                .destinationEid(C)
                .creationTimestamp(clock.instant())
                .build();
        var expired = Bundle.builder()
                .sourceEid(A)
                .destinationEid(C)
                .creationTimestamp(clock.instant().minusSeconds(60))
                .lifetime(Duration.ofSeconds(30))
                .build();

        node.processIngress(noSource);
        node.processIngress(expired);

        assertEquals(0, node.getStore().count());
        assertEquals(2, node.getStatistics().getBundlesDropped());
        verify(deliveryHandler, never()).delivered(any());
    }

    @Test
    void foreignDestinationIsStoredAndQueued() throws Exception {
        var node = nodeBuilder("C", C).build();
        var bundle = bundle(A, B, "pass through");

        node.processIngress(bundle);

        assertEquals(BundleStatus.PENDING, status(node, bundle));
        assertEquals(1, node.getStatistics().getEgressQueueDepth());
    }

    @Test
    void fullEgressKeepsForwardedBundlePending() throws Exception {
        var node = nodeBuilder("C", C).egressCapacity(1).build();
        var first = bundle(A, B, "1");
        var second = bundle(A, B, "2");

        node.processIngress(first);
        node.processIngress(second);

        assertEquals(BundleStatus.PENDING, status(node, second));
        assertEquals(1, node.getStatistics().getEgressQueueDepth());
        assertEquals(0, node.redrivePending());
    }

    @Test
    void noRouteLeavesBundlePending() throws Exception {
        var node = nodeBuilder("A", A).build();
        var bundle = bundle(A, B, "waiting");
        node.sendBundle(bundle);

        node.processEgress(bundle.getId());

        assertEquals(BundleStatus.PENDING, status(node, bundle));
        assertTrue(transmitted.isEmpty());
    }

    @Test
    void pendingBundleIsRedrivenWhenNeighborAppears() throws Exception {
        var node = start(nodeBuilder("A", A).build());
        var bundle = bundle(A, B, "waiting");
        node.sendBundle(bundle);
        await(() -> node.getStatistics().getEgressQueueDepth() == 0);

        node.addNeighbor("B", B, 0.9);

        await(() -> !transmitted.isEmpty());
        assertEquals(bundle.getId(), transmitted.get(0).getId());
        assertEquals(BundleStatus.IN_TRANSIT, status(node, bundle));
    }

    @Test
    void neighborUpdatesShareOneQueuedRedrive() throws Exception {
        var release = new CountDownLatch(1);
        var pendingScans = new AtomicInteger();
        var store = new InMemoryBundleStore(clock, 100) {
            @Override
            public List<Bundle> list(BundleFilter filter) {
                if (filter.getStatus() == BundleStatus.PENDING) {
                    pendingScans.incrementAndGet();
                    try {
                        release.await(5, SECONDS);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    }
                }
                return super.list(filter);
            }
        };
        var node = start(nodeBuilder("A", A).store(store).sweepInterval(Duration.ofHours(1)).build());

        node.addNeighbor("B", B, 0.9);
        await(() -> pendingScans.get() == 1);
        for (int i = 0; i < 10; i++) {
            node.updateNeighborQuality("B", 0.5 + i * 0.01);
        }
        release.countDown();

        await(() -> pendingScans.get() == 2);
        Thread.sleep(200);
        assertEquals(2, pendingScans.get());
    }

    @Test
    void redriveTakesPriorityFirstAndSkipsQueued() throws Exception {
        var node = nodeBuilder("C", C).egressCapacity(3).build();
        var bulk = Bundle.builder().sourceEid(A).destinationEid(B).priority(BundlePriority.BULK)
                .creationTimestamp(clock.instant()).build();
        var expedited = Bundle.builder().sourceEid(A).destinationEid(B).priority(BundlePriority.EXPEDITED)
                .creationTimestamp(clock.instant()).build();
        node.getStore().store(bulk);
        node.getStore().store(expedited);
        node.sendBundle(bundle(A, B, "already queued"));

        assertEquals(2, node.redrivePending());
        assertEquals(0, node.redrivePending());
        assertEquals(3, node.getStatistics().getEgressQueueDepth());
    }

    @Test
    void transmissionFailureMarksBundleFailed() throws Exception {
        var transmitter = mock(BundleTransmitter.class);
        doThrow(new IllegalStateException("link down")).when(transmitter).transmit(any(), any());
        var node = nodeBuilder("A", A).transmitter(transmitter).build();
        node.addNeighbor("B", B, 0.9);
        var bundle = bundle(A, B, "lost");
        node.sendBundle(bundle);

        node.processEgress(bundle.getId());

        assertEquals(BundleStatus.FAILED, status(node, bundle));
        assertEquals(1, node.getStatistics().getBundlesDropped());
    }

    @Test
    void hopLimitStopsForwarding() throws Exception {
        var node = nodeBuilder("C", C).maxHopCount(1).build();
        node.addNeighbor("B", B, 0.9);
        var relayed = Bundle.builder()
                .sourceEid(A)
                .destinationEid(B)
                .creationTimestamp(clock.instant())
                .hopCount(1)
                .previousNode("A")
                .build();

        node.processIngress(relayed);
        node.processEgress(relayed.getId());

        assertEquals(BundleStatus.FAILED, status(node, relayed));
        assertTrue(transmitted.isEmpty());
    }

    @Test
    void lifecycle() throws Exception {
        var node = nodeBuilder("A", A).build();
        assertEquals(NodeState.CREATED, node.getState());

        node.start();
        assertEquals(NodeState.RUNNING, node.getState());
        assertThrows(IllegalStateException.class, node::start);

        node.stop();
        assertEquals(NodeState.STOPPED, node.getState());
        assertDoesNotThrow(node::stop);
        assertThrows(IllegalStateException.class, node::start);
        assertThrows(IllegalStateException.class, () -> node.sendBundle(bundle(A, B, "late")));
        assertThrows(IllegalStateException.class, () -> node.receiveBundle(bundle(B, A, "late")));
    }

    @Test
    void stopKeepsStoredBundles() throws Exception {
        var node = nodeBuilder("A", A).build();
        var bundle = bundle(A, B, "kept");
        node.sendBundle(bundle);

        node.stop();

        assertEquals(BundleStatus.PENDING, status(node, bundle));
        assertEquals(0, node.getStatistics().getEgressQueueDepth());
    }

    @Test
    void neighborTable() {
        var node = nodeBuilder("A", A).build();
        node.addNeighbor("B", B, 0.9);
        node.addNeighbor("C", C, 0.4);

        var snapshot = node.neighborSnapshot();
        assertEquals(List.of("B", "C"), new ArrayList<>(snapshot.keySet()));
        assertThrows(UnsupportedOperationException.class, () -> snapshot.remove("B"));

        assertTrue(node.updateNeighborQuality("C", 0.6));
        assertFalse(node.updateNeighborQuality("X", 0.6));
        assertTrue(node.removeNeighbor("B"));
        assertFalse(node.removeNeighbor("B"));

        assertEquals(0.4, snapshot.get("C").getLinkQuality());
        assertEquals(0.6, node.neighborSnapshot().get("C").getLinkQuality());
        assertEquals(1, node.getStatistics().getNeighborCount());
        assertThrows(IllegalArgumentException.class, () -> node.addNeighbor("D", "dtn://earth/d", 1.5));
    }

    @Test
    void staleNeighborsBecomeInactive() {
        var node = nodeBuilder("A", A).neighborStaleTime(Duration.ofSeconds(600)).build();
        node.addNeighbor("B", B, 0.9);
        clock.advanceSeconds(300);
        node.addNeighbor("C", C, 0.9);
        clock.advanceSeconds(301);

        assertEquals(1, node.deactivateStaleNeighbors());
        assertFalse(node.neighborSnapshot().get("B").isActive());
        assertTrue(node.neighborSnapshot().get("C").isActive());

        node.updateNeighborQuality("B", 0.5);
        assertTrue(node.neighborSnapshot().get("B").isActive());
    }

    @Test
    void syncNeighborsFromTopology() {
        var topology = new TopologyManager(clock, 1_000, 20);
        topology.updateSatellite(SatelliteState.builder().id("A").endpoint(A).position(new Vector3(0, 0, 0)).batteryPercent(90).build());
        topology.updateSatellite(SatelliteState.builder().id("B").endpoint(B).position(new Vector3(500, 0, 0)).batteryPercent(10).build());
        topology.updateSatellite(SatelliteState.builder().id("C").endpoint(C).position(new Vector3(3_000, 0, 0)).batteryPercent(90).build());

        var node = nodeBuilder("A", A).build();
        node.addNeighbor("C", C, 0.9);
        node.addNeighbor("ground", "dtn://earth/ground", 0.9);

        assertEquals(1, node.syncNeighbors(topology));

        Map<String, Neighbor> neighbors = node.neighborSnapshot();
        assertEquals(0.5, neighbors.get("B").getLinkQuality(), 1e-9);
        assertEquals(10.0, neighbors.get("B").getBatteryPercent());
        assertFalse(neighbors.containsKey("C"));
        assertTrue(neighbors.containsKey("ground"));
    }

    @Test
    void createBundleUsesNodeDefaults() {
        var node = nodeBuilder("A", A).defaultLifetime(Duration.ofMinutes(5)).build();

        var bundle = node.createBundle(B, new byte[]{1}, BundlePriority.EXPEDITED);

        assertEquals(A, bundle.getSourceEid());
        assertEquals(Duration.ofMinutes(5), bundle.getLifetime());
        assertEquals(clock.instant(), bundle.getCreationTimestamp());
        assertEquals(BundlePriority.EXPEDITED, bundle.getPriority());
    }
}
