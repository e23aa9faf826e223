package io.satnet.constant;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class NodeConstant {

    public static final int DEFAULT_QUEUE_CAPACITY = 1000;
    public static final long SWEEP_INTERVAL = 5 * 60;          // seconds
    public static final long NEIGHBOR_STALE_TIME = 10 * 60;    // seconds
    public static final long STATISTICS_INTERVAL = 30;         // seconds
    public static final long SHUTDOWN_TIMEOUT = 10;            // seconds
    public static final long QUEUE_POLL_TIMEOUT = 250;         // milliseconds
    public static final int WORKER_THREADS = 3;

    public static final int DEFAULT_MAX_BUNDLES = 10_000;
}
