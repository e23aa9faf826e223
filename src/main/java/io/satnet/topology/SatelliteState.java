package io.satnet.topology;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * Last known kinematic and power state of a tracked node.
 */
@Value
@Builder(toBuilder = true)
public class SatelliteState {
    String id;
    String endpoint;
    @Builder.Default
    Vector3 position = Vector3.ZERO;
    @Builder.Default
    Vector3 velocity = Vector3.ZERO;
    double batteryPercent;
    boolean inEclipse;
    @With
    Instant lastUpdate;
}
