package io.satnet.constant;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class RoutingConstant {

    public static final double QUALITY_WEIGHT = 0.7;
    public static final double ENERGY_WEIGHT = 0.3;

    /**
     * Link quality below which a neighbor is presumed to be power starved when its
     * battery level is not known.
     */
    public static final double LOW_QUALITY_THRESHOLD = 0.3;
    public static final double LOW_ENERGY_PENALTY = 0.3;
    public static final double LOW_BATTERY_PERCENT = 20.0;

    // contact graph scoring
    public static final double CGR_QUALITY_WEIGHT = 0.4;
    public static final double CGR_LATENCY_WEIGHT = 0.3;
    public static final double CGR_BANDWIDTH_WEIGHT = 0.2;
    public static final double CGR_PRIORITY_WEIGHT = 0.1;
    public static final double CGR_PATH_BONUS = 0.5;
    public static final long CGR_LATENCY_CEILING = 10_000;        // ms
    public static final long CGR_BANDWIDTH_REFERENCE = 1_000_000; // bytes per second

    public static final double WEIGHT_SUM_TOLERANCE = 1e-6;
}
