package io.satnet.config;

import io.satnet.routing.RoutingPolicy;
import io.satnet.storage.StorageBackend;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SatNetConfigTest {

    @Test
    void readsBundledDefaults() throws IOException {
        try (var defaults = getClass().getClassLoader().getResourceAsStream("satnet.default.yml")) {
            var config = SatNetConfig.initConfig(defaults);

            assertEquals("node-1", config.getNode().getId());
            assertEquals(1000, config.getNode().getEgressCapacity());
            assertEquals(86400L, config.getBundle().getDefaultLifetimeSeconds());
            assertEquals(RoutingPolicy.LINK_QUALITY_ENERGY, config.getRouting().getPolicy());
            assertEquals(0.7, config.getRouting().getQualityWeight());
            assertEquals(5000.0, config.getTopology().getMaxRangeKm());
            assertEquals(StorageBackend.NITRITE, config.getStorage().getBackend());
            assertTrue(config.getNeighbors().isEmpty());
        }
    }

    @Test
    void readsNeighborsAndStaticRoutes(@TempDir Path tempDir) throws IOException {
        var file = tempDir.resolve("config.yml");
        Files.writeString(file, String.join("\n",
                "node:",
                "  id: relay",
                "  endpoint: dtn://mars/relay",
                "routing:",
                "  policy: static",
                "  static_routes:",
                "    dtn://mars/base: base",
                "neighbors:",
                "  - id: base",
                "    endpoint: dtn://mars/base",
                "    link_quality: 0.8",
                "unknown_section:",
                "  ignored: true",
                ""
        ));

        var config = SatNetConfig.initConfig(file);

        assertEquals("relay", config.getNode().getId());
        assertEquals(RoutingPolicy.STATIC, config.getRouting().getPolicy());
        assertEquals("base", config.getRouting().getStaticRoutes().get("dtn://mars/base"));
        assertEquals(1, config.getNeighbors().size());
        assertEquals(0.8, config.getNeighbors().get(0).getLinkQuality());
        assertNull(config.getNode().getIngressCapacity());
        assertNotNull(config.getStorage());
        assertNotNull(config.getTopology());
    }

    @Test
    void rejectsUnknownPolicy() {
        var yaml = "routing:\n  policy: teleport\n";

        assertThrows(IOException.class, () -> SatNetConfig.initConfig(new ByteArrayInputStream(yaml.getBytes(UTF_8))));
    }
}
