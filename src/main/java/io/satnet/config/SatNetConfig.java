package io.satnet.config;

import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static com.fasterxml.jackson.databind.DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES;
import static java.util.Objects.requireNonNullElseGet;

/**
 * Root of the YAML configuration. Every section is optional, absent values fall back to
 * the defaults in the {@code io.satnet.constant} classes.
 */
@ToString
@Setter
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class SatNetConfig {

    private static final YAMLMapper mapper = YAMLMapper.builder()
            .configure(FAIL_ON_UNKNOWN_PROPERTIES, false)
            .build();

    public static SatNetConfig initConfig(Path configPath) throws IOException {
        return normalize(mapper.readValue(configPath.toFile(), SatNetConfig.class));
    }

    public static SatNetConfig initConfig(InputStream configStream) throws IOException {
        return normalize(mapper.readValue(configStream, SatNetConfig.class));
    }

    private static SatNetConfig normalize(SatNetConfig config) {
        if (config == null) {
            config = new SatNetConfig();
        }
        config.node = requireNonNullElseGet(config.node, NodeConf::new);
        config.bundle = requireNonNullElseGet(config.bundle, BundleConf::new);
        config.routing = requireNonNullElseGet(config.routing, RoutingConf::new);
        config.topology = requireNonNullElseGet(config.topology, TopologyConf::new);
        config.storage = requireNonNullElseGet(config.storage, StorageConf::new);
        config.neighbors = requireNonNullElseGet(config.neighbors, ArrayList::new);

        return config;
    }

    private NodeConf node;
    private BundleConf bundle;
    private RoutingConf routing;
    private TopologyConf topology;
    private StorageConf storage;
    private List<NeighborConf> neighbors;
}
