package io.satnet.routing;

import io.satnet.bundle.Bundle;
import io.satnet.exception.NoRouteException;
import io.satnet.transport.Neighbor;

import java.util.Map;

/**
 * Next-hop selection policy.
 * <p>
 * Implementations receive a snapshot of the neighbor table keyed by neighbor id, in the
 * table's insertion order, and must neither modify it nor keep a reference to it. Ranking
 * must be deterministic: on equal scores the neighbor seen first wins.
 */
public interface Router {

    /**
     * @return id of the chosen neighbor, always a key of {@code neighbors}
     * @throws NoRouteException when the snapshot holds no active, eligible neighbor
     */
    String selectNextHop(Bundle bundle, Map<String, Neighbor> neighbors) throws NoRouteException;

    default String getName() {
        return getClass().getSimpleName();
    }
}
