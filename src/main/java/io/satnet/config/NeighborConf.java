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
public class NeighborConf {

    @JsonProperty("id")
    private String id;

    @JsonProperty("endpoint")
    private String endpoint;

    @JsonProperty("link_quality")
    private Double linkQuality;
}
