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
public class NodeConf {

    @JsonProperty("id")
    private String id;

    @JsonProperty("endpoint")
    private String endpoint;

    @JsonProperty("ingress_capacity")
    private Integer ingressCapacity;

    @JsonProperty("egress_capacity")
    private Integer egressCapacity;

    @JsonProperty("sweep_interval_seconds")
    private Long sweepIntervalSeconds;

    @JsonProperty("neighbor_stale_seconds")
    private Long neighborStaleSeconds;

    @JsonProperty("max_hop_count")
    private Integer maxHopCount;
}
