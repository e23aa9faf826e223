package io.satnet.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.satnet.routing.RoutingPolicy;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class RoutingConf {

    @JsonProperty("policy")
    private RoutingPolicy policy;

    @JsonProperty("quality_weight")
    private Double qualityWeight;

    @JsonProperty("energy_weight")
    private Double energyWeight;

    @JsonProperty("low_quality_threshold")
    private Double lowQualityThreshold;

    @JsonProperty("low_energy_penalty")
    private Double lowEnergyPenalty;

    @JsonProperty("low_battery_percent")
    private Double lowBatteryPercent;

    /**
     * Destination endpoint or endpoint prefix to next-hop neighbor id, used by the static policy.
     */
    @JsonProperty("static_routes")
    private Map<String, String> staticRoutes;
}
