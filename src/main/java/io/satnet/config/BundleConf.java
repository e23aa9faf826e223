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
public class BundleConf {

    @JsonProperty("default_lifetime_seconds")
    private Long defaultLifetimeSeconds;
}
