package io.satnet.topology;

import lombok.Value;

@Value
public class NetworkStatistics {
    int total;
    int lowBatteryCount;
    int eclipseCount;
}
