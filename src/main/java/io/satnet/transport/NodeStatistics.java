package io.satnet.transport;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class NodeStatistics {
    String nodeId;
    String endpoint;
    NodeState state;
    int neighborCount;
    int ingressQueueDepth;
    int egressQueueDepth;
    int storedBundles;

    long bundlesReceived;
    long bundlesForwarded;
    long bundlesDelivered;
    long bundlesDropped;
    long bundlesExpired;
    long bytesReceived;
    long bytesSent;
}
