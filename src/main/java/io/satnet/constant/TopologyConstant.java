package io.satnet.constant;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
public class TopologyConstant {

    public static final double MAX_RANGE_KM = 5_000;
    public static final double LOW_BATTERY_PERCENT = 20.0;
}
