package io.satnet.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class TopologyConf {

    @JsonProperty("max_range_km")
    private Double maxRangeKm;

    @JsonProperty("low_battery_percent")
    private Double lowBatteryPercent;
}
