package io.satnet.transport;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Running counters of one node.
 */
public class NodeMetrics {
    final AtomicLong received = new AtomicLong();
    final AtomicLong forwarded = new AtomicLong();
    final AtomicLong delivered = new AtomicLong();
    final AtomicLong dropped = new AtomicLong();
    final AtomicLong expired = new AtomicLong();
    final AtomicLong bytesReceived = new AtomicLong();
    final AtomicLong bytesSent = new AtomicLong();

    public void received(int bytes) {
        received.incrementAndGet();
        bytesReceived.addAndGet(bytes);
    }

    public void forwarded(int bytes) {
        forwarded.incrementAndGet();
        bytesSent.addAndGet(bytes);
    }

    public void delivered() {
        delivered.incrementAndGet();
    }

    public void dropped() {
        dropped.incrementAndGet();
    }

    public void expired() {
        expired.incrementAndGet();
    }

    public NodeStatistics.NodeStatisticsBuilder fill(NodeStatistics.NodeStatisticsBuilder builder) {
        return builder
                .bundlesReceived(received.get())
                .bundlesForwarded(forwarded.get())
                .bundlesDelivered(delivered.get())
                .bundlesDropped(dropped.get())
                .bundlesExpired(expired.get())
                .bytesReceived(bytesReceived.get())
                .bytesSent(bytesSent.get());
    }
}
