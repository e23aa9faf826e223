package io.satnet.routing;

import io.satnet.bundle.Bundle;
import io.satnet.exception.NoRouteException;
import io.satnet.transport.Neighbor;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import static org.apache.commons.collections4.MapUtils.isNotEmpty;

/**
 * Operator defined routes: destination endpoint (exact, then longest prefix) to next-hop
 * neighbor id. Falls back to the first active neighbor when no route applies.
 */
@Slf4j
public class StaticRouter implements Router {

    private final Map<String, String> routes = new ConcurrentHashMap<>();

    public StaticRouter() {
    }

    public StaticRouter(Map<String, String> routes) {
        if (isNotEmpty(routes)) {
            this.routes.putAll(routes);
        }
    }

    public void addRoute(@NonNull String destination, @NonNull String nextHopId) {
        routes.put(destination, nextHopId);
    }

    public void removeRoute(@NonNull String destination) {
        routes.remove(destination);
    }

    @Override
    public String selectNextHop(Bundle bundle, Map<String, Neighbor> neighbors) throws NoRouteException {
        var destination = bundle.getDestinationEid();

        var exact = Optional.ofNullable(routes.get(destination))
                .filter(nextHop -> isActive(neighbors, nextHop));
        if (exact.isPresent()) {
            return exact.get();
        }

        var byPrefix = routes.entrySet().stream()
                .filter(route -> destination.startsWith(route.getKey()))
                .filter(route -> isActive(neighbors, route.getValue()))
                .max((a, b) -> Integer.compare(a.getKey().length(), b.getKey().length()))
                .map(Map.Entry::getValue);
        if (byPrefix.isPresent()) {
            return byPrefix.get();
        }

        log.trace("No static route for {}, falling back to first active neighbor", destination);
        return neighbors.entrySet().stream()
                .filter(entry -> entry.getValue().isActive())
                .map(Map.Entry::getKey)
                .findFirst()
                .orElseThrow(() -> new NoRouteException("no route to destination: " + destination));
    }

    private static boolean isActive(Map<String, Neighbor> neighbors, String id) {
        var neighbor = neighbors.get(id);
        return neighbor != null && neighbor.isActive();
    }
}
