package io.satnet.routing;

import io.satnet.bundle.Bundle;
import io.satnet.exception.NoRouteException;
import io.satnet.transport.Neighbor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

import static io.satnet.constant.RoutingConstant.ENERGY_WEIGHT;
import static io.satnet.constant.RoutingConstant.LOW_BATTERY_PERCENT;
import static io.satnet.constant.RoutingConstant.LOW_ENERGY_PENALTY;
import static io.satnet.constant.RoutingConstant.LOW_QUALITY_THRESHOLD;
import static io.satnet.constant.RoutingConstant.QUALITY_WEIGHT;
import static io.satnet.constant.RoutingConstant.WEIGHT_SUM_TOLERANCE;
import static org.apache.commons.lang3.Validate.inclusiveBetween;
import static org.apache.commons.lang3.Validate.isTrue;

/**
 * Scores every active neighbor as
 * {@code qualityWeight * linkQuality + energyWeight * energyScore}.
 * <p>
 * The energy score is 1 unless the neighbor looks power starved, then it drops to the
 * configured penalty. A neighbor looks power starved when it reported a battery level below
 * {@code lowBatteryPercent}, or, without a battery report, when its link quality is below
 * {@code lowQualityThreshold}: a degrading link is the usual sign of a satellite running
 * out of power.
 */
@Slf4j
@Getter
public class LinkQualityEnergyRouter implements Router {

    private final double qualityWeight;
    private final double energyWeight;
    private final double lowQualityThreshold;
    private final double lowEnergyPenalty;
    private final double lowBatteryPercent;

    public LinkQualityEnergyRouter() {
        this(QUALITY_WEIGHT, ENERGY_WEIGHT, LOW_QUALITY_THRESHOLD, LOW_ENERGY_PENALTY, LOW_BATTERY_PERCENT);
    }

    public LinkQualityEnergyRouter(
            double qualityWeight,
            double energyWeight,
            double lowQualityThreshold,
            double lowEnergyPenalty,
            double lowBatteryPercent
    ) {
        inclusiveBetween(0.0, 1.0, qualityWeight, "quality weight must be in [0, 1]");
        inclusiveBetween(0.0, 1.0, energyWeight, "energy weight must be in [0, 1]");
        isTrue(
                Math.abs(qualityWeight + energyWeight - 1.0) <= WEIGHT_SUM_TOLERANCE,
                "quality and energy weights must sum to 1, got %s + %s", qualityWeight, energyWeight
        );
        inclusiveBetween(0.0, 1.0, lowQualityThreshold, "low quality threshold must be in [0, 1]");
        inclusiveBetween(0.0, 1.0, lowEnergyPenalty, "low energy penalty must be in [0, 1]");
        inclusiveBetween(0.0, 100.0, lowBatteryPercent, "low battery percent must be in [0, 100]");

        this.qualityWeight = qualityWeight;
        this.energyWeight = energyWeight;
        this.lowQualityThreshold = lowQualityThreshold;
        this.lowEnergyPenalty = lowEnergyPenalty;
        this.lowBatteryPercent = lowBatteryPercent;
    }

    @Override
    public String selectNextHop(Bundle bundle, Map<String, Neighbor> neighbors) throws NoRouteException {
        String bestId = null;
        var bestScore = Double.NEGATIVE_INFINITY;
        for (var entry : neighbors.entrySet()) {
            var neighbor = entry.getValue();
            if (!neighbor.isActive()) {
                continue;
            }

            var score = score(neighbor);
            log.trace("{} scored {} for {}", entry.getKey(), score, bundle.shortId());
            if (score > bestScore) {
                bestScore = score;
                bestId = entry.getKey();
            }
        }

        if (bestId == null) {
            throw new NoRouteException("no active neighbor for " + bundle.getDestinationEid());
        }

        return bestId;
    }

    double score(Neighbor neighbor) {
        return qualityWeight * neighbor.getLinkQuality() + energyWeight * energyScore(neighbor);
    }

    double energyScore(Neighbor neighbor) {
        return isLowEnergy(neighbor) ? lowEnergyPenalty : 1.0;
    }

    boolean isLowEnergy(Neighbor neighbor) {
        if (neighbor.hasBatteryReport()) {
            return neighbor.getBatteryPercent() < lowBatteryPercent;
        }

        return neighbor.getLinkQuality() < lowQualityThreshold;
    }
}
