package io.satnet.transport;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

import static java.util.Objects.requireNonNullElse;
import static org.apache.commons.lang3.Validate.inclusiveBetween;
import static org.apache.commons.lang3.Validate.notBlank;

/**
 * Node-local view of a reachable peer. Instances are immutable, the neighbor table replaces
 * an entry on every change so that snapshots handed to a router never move underneath it.
 */
@Value
public class Neighbor {

    String id;
    String endpoint;
    double linkQuality;
    Instant lastContact;
    boolean active;

    //optional telemetry
    Duration latency;
    long bandwidth;
    Double batteryPercent;
    boolean inEclipse;

    @Builder(toBuilder = true)
    private Neighbor(
            @NonNull String id,
            String endpoint,
            double linkQuality,
            Instant lastContact,
            boolean active,
            Duration latency,
            long bandwidth,
            Double batteryPercent,
            boolean inEclipse
    ) {
        notBlank(id, "neighbor id cannot be blank");
        inclusiveBetween(0.0, 1.0, linkQuality, "link quality outside of [0, 1]: " + linkQuality);

        this.id = id;
        this.endpoint = endpoint;
        this.linkQuality = linkQuality;
        this.lastContact = requireNonNullElse(lastContact, Instant.EPOCH);
        this.active = active;
        this.latency = requireNonNullElse(latency, Duration.ZERO);
        this.bandwidth = bandwidth;
        this.batteryPercent = batteryPercent;
        this.inEclipse = inEclipse;
    }

    public boolean hasBatteryReport() {
        return batteryPercent != null;
    }

    public boolean isStale(Instant now, Duration staleAfter) {
        return Duration.between(lastContact, now).compareTo(staleAfter) > 0;
    }
}
