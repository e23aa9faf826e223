package io.satnet.routing;

import io.satnet.bundle.Bundle;
import io.satnet.exception.NoRouteException;
import io.satnet.transport.Neighbor;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LinkQualityEnergyRouterTest {

    private final LinkQualityEnergyRouter router = new LinkQualityEnergyRouter();
    private final Bundle bundle = Bundle.create("dtn://earth/a", "dtn://earth/b", new byte[]{1});

    static Neighbor neighbor(String id, double quality, boolean active) {
        return Neighbor.builder()
                .id(id)
                .endpoint("dtn://earth/" + id)
                .linkQuality(quality)
                .lastContact(Instant.EPOCH)
                .active(active)
                .build();
    }

    static Map<String, Neighbor> table(Neighbor... neighbors) {
        var table = new LinkedHashMap<String, Neighbor>();
        for (var neighbor : neighbors) {
            table.put(neighbor.getId(), neighbor);
        }
        return table;
    }

    @Test
    void noNeighborsNoRoute() {
        assertThrows(NoRouteException.class, () -> router.selectNextHop(bundle, Map.of()));
    }

    @Test
    void onlyInactiveNeighborsNoRoute() {
        var neighbors = table(neighbor("b", 0.9, false), neighbor("c", 0.5, false));

        assertThrows(NoRouteException.class, () -> router.selectNextHop(bundle, neighbors));
    }

    @Test
    void picksHighestQuality() throws NoRouteException {
        var neighbors = table(neighbor("b", 0.4, true), neighbor("c", 0.9, true), neighbor("d", 0.95, false));

        assertEquals("c", router.selectNextHop(bundle, neighbors));
    }

    @Test
    void prefersNeighborWithEnoughBattery() throws NoRouteException {
        var starving = neighbor("b", 0.8, true).toBuilder().batteryPercent(5.0).build();
        var healthy = neighbor("c", 0.8, true).toBuilder().batteryPercent(80.0).build();

        assertEquals("c", router.selectNextHop(bundle, table(starving, healthy)));
    }

    @Test
    void degradedLinkIsTreatedAsLowEnergy() {
        var degraded = neighbor("b", 0.2, true);
        var fine = neighbor("c", 0.2, true).toBuilder().batteryPercent(90.0).build();

        assertTrue(router.isLowEnergy(degraded));
        assertEquals(0.7 * 0.2 + 0.3 * 0.3, router.score(degraded), 1e-9);
        assertEquals(0.7 * 0.2 + 0.3 * 1.0, router.score(fine), 1e-9);
    }

    @Test
    void qualityProxyPenaltyCanFlipTheChoice() throws NoRouteException {
        // 0.7 * 0.29 + 0.3 * 0.3 = 0.293 versus 0.7 * 0.25 + 0.3 * 1.0 = 0.475
        var proxyPenalized = neighbor("b", 0.29, true);
        var reported = neighbor("c", 0.25, true).toBuilder().batteryPercent(60.0).build();

        assertEquals("c", router.selectNextHop(bundle, table(proxyPenalized, reported)));
    }

    @Test
    void tiesGoToFirstSeen() throws NoRouteException {
        assertEquals("b", router.selectNextHop(bundle, table(neighbor("b", 0.8, true), neighbor("c", 0.8, true))));
        assertEquals("c", router.selectNextHop(bundle, table(neighbor("c", 0.8, true), neighbor("b", 0.8, true))));
    }

    @Test
    void resultIsAlwaysAnActiveKey() throws NoRouteException {
        var neighbors = table(neighbor("b", 0.1, false), neighbor("c", 0.0, true), neighbor("d", 0.3, false));

        var chosen = router.selectNextHop(bundle, neighbors);

        assertTrue(neighbors.containsKey(chosen));
        assertTrue(neighbors.get(chosen).isActive());
    }

    @Test
    void weightsMustSumToOne() {
        assertThrows(IllegalArgumentException.class, () -> new LinkQualityEnergyRouter(0.7, 0.7, 0.3, 0.3, 20));
        assertThrows(IllegalArgumentException.class, () -> new LinkQualityEnergyRouter(1.2, -0.2, 0.3, 0.3, 20));
    }
}
