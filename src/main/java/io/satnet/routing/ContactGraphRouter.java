package io.satnet.routing;

import io.satnet.bundle.Bundle;
import io.satnet.exception.NoRouteException;
import io.satnet.transport.Neighbor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Objects;

import static io.satnet.constant.RoutingConstant.CGR_BANDWIDTH_REFERENCE;
import static io.satnet.constant.RoutingConstant.CGR_BANDWIDTH_WEIGHT;
import static io.satnet.constant.RoutingConstant.CGR_LATENCY_CEILING;
import static io.satnet.constant.RoutingConstant.CGR_LATENCY_WEIGHT;
import static io.satnet.constant.RoutingConstant.CGR_PATH_BONUS;
import static io.satnet.constant.RoutingConstant.CGR_PRIORITY_WEIGHT;
import static io.satnet.constant.RoutingConstant.CGR_QUALITY_WEIGHT;
import static org.apache.commons.lang3.StringUtils.isNotBlank;
import static org.apache.commons.lang3.StringUtils.split;

/**
 * Contact based policy for constellations with predictable links. A neighbor whose endpoint
 * is the destination is chosen directly, otherwise neighbors are ranked by link quality,
 * latency, bandwidth and bundle priority, with a bonus for neighbors in the destination's
 * endpoint authority ({@code dtn://mars/sat001} is on the way to {@code dtn://mars/base}).
 */
@Slf4j
public class ContactGraphRouter implements Router {

    @Override
    public String selectNextHop(Bundle bundle, Map<String, Neighbor> neighbors) throws NoRouteException {
        var destination = bundle.getDestinationEid();
        for (var entry : neighbors.entrySet()) {
            if (entry.getValue().isActive() && Objects.equals(entry.getValue().getEndpoint(), destination)) {
                return entry.getKey();
            }
        }

        String bestId = null;
        var bestScore = Double.NEGATIVE_INFINITY;
        for (var entry : neighbors.entrySet()) {
            if (!entry.getValue().isActive()) {
                continue;
            }

            var score = score(entry.getValue(), bundle);
            if (score > bestScore) {
                bestScore = score;
                bestId = entry.getKey();
            }
        }

        if (bestId == null) {
            throw new NoRouteException("no route to destination: " + destination);
        }
        log.trace("Contact route for {} via {} (score {})", bundle.shortId(), bestId, bestScore);

        return bestId;
    }

    double score(Neighbor neighbor, Bundle bundle) {
        var latencyScore = 1.0 - Math.min((double) neighbor.getLatency().toMillis() / CGR_LATENCY_CEILING, 1.0);
        var bandwidthScore = Math.min((double) neighbor.getBandwidth() / CGR_BANDWIDTH_REFERENCE, 1.0);
        var priorityScore = bundle.getPriority().getValue() / 2.0;

        var score = CGR_QUALITY_WEIGHT * neighbor.getLinkQuality()
                + CGR_LATENCY_WEIGHT * latencyScore
                + CGR_BANDWIDTH_WEIGHT * bandwidthScore
                + CGR_PRIORITY_WEIGHT * priorityScore;

        if (isOnPathTo(neighbor.getEndpoint(), bundle.getDestinationEid())) {
            score += CGR_PATH_BONUS;
        }

        return score;
    }

    static boolean isOnPathTo(String endpoint, String destination) {
        if (Objects.equals(endpoint, destination)) {
            return true;
        }

        var authority = authority(endpoint);
        return isNotBlank(authority) && authority.equals(authority(destination));
    }

    /**
     * {@code scheme://authority/path} gives {@code authority}, anything else gives null.
     */
    static String authority(String eid) {
        if (eid == null || !eid.contains("://")) {
            return null;
        }
        var parts = split(eid.substring(eid.indexOf("://") + 3), '/');

        return parts.length > 0 ? parts[0] : null;
    }
}
