package io.satnet.topology;

import lombok.Getter;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static io.satnet.constant.TopologyConstant.LOW_BATTERY_PERCENT;
import static io.satnet.constant.TopologyConstant.MAX_RANGE_KM;
import static java.util.stream.Collectors.toList;
import static org.apache.commons.lang3.Validate.isTrue;
import static org.apache.commons.lang3.Validate.notBlank;

/**
 * Tracks the kinematic state of every known node and answers which nodes are in
 * communication range of each other. Visibility is purely geometric and symmetric,
 * energy is left to the router.
 */
@Slf4j
public class TopologyManager {

    private final Map<String, SatelliteState> satellites = new ConcurrentHashMap<>();
    private final Clock clock;
    @Getter
    private final double maxRangeKm;
    @Getter
    private final double lowBatteryPercent;

    public TopologyManager() {
        this(Clock.systemUTC(), MAX_RANGE_KM, LOW_BATTERY_PERCENT);
    }

    public TopologyManager(@NonNull Clock clock, double maxRangeKm, double lowBatteryPercent) {
        isTrue(maxRangeKm > 0, "max range must be positive, got %s", maxRangeKm);
        this.clock = clock;
        this.maxRangeKm = maxRangeKm;
        this.lowBatteryPercent = lowBatteryPercent;
    }

    /**
     * Inserts or replaces the state for {@code state.getId()} and stamps it with the current time.
     */
    public void updateSatellite(@NonNull SatelliteState state) {
        notBlank(state.getId(), "satellite id cannot be blank");
        satellites.put(state.getId(), state.withLastUpdate(clock.instant()));
        log.trace("Satellite {} updated: {}", state.getId(), state.getPosition());
    }

    public boolean removeSatellite(String id) {
        return satellites.remove(id) != null;
    }

    public Optional<SatelliteState> getSatellite(String id) {
        return Optional.ofNullable(satellites.get(id));
    }

    /**
     * Every other tracked node within range of {@code nodeId}, nearest first. An unknown
     * node sees nothing.
     */
    public List<SatelliteState> getVisibleNeighbors(String nodeId) {
        var self = satellites.get(nodeId);
        if (self == null) {
            return List.of();
        }

        return satellites.values().stream()
                .filter(other -> !other.getId().equals(nodeId))
                .filter(other -> self.getPosition().distance(other.getPosition()) <= maxRangeKm)
                .sorted(Comparator.comparingDouble(other -> self.getPosition().distance(other.getPosition())))
                .collect(toList());
    }

    /**
     * Linear extrapolation from the last known velocity. Good enough for look-ahead routing,
     * not an orbit propagator.
     */
    public Vector3 predictPosition(@NonNull SatelliteState state, @NonNull Duration delta) {
        var seconds = delta.getSeconds() + delta.getNano() / 1_000_000_000.0;

        return state.getPosition().add(state.getVelocity().scale(seconds));
    }

    /**
     * Link quality guess from distance: 1 at zero distance, 0 at the edge of range.
     */
    public double estimateLinkQuality(@NonNull SatelliteState a, @NonNull SatelliteState b) {
        var quality = 1.0 - a.getPosition().distance(b.getPosition()) / maxRangeKm;

        return Math.max(0.0, Math.min(1.0, quality));
    }

    public NetworkStatistics getNetworkStatistics() {
        var snapshot = List.copyOf(satellites.values());
        var lowBattery = (int) snapshot.stream()
                .filter(state -> state.getBatteryPercent() < lowBatteryPercent)
                .count();
        var eclipse = (int) snapshot.stream()
                .filter(SatelliteState::isInEclipse)
                .count();

        return new NetworkStatistics(snapshot.size(), lowBattery, eclipse);
    }
}
