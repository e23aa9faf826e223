package io.satnet.routing;

import io.satnet.config.RoutingConf;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

import static io.satnet.constant.RoutingConstant.LOW_BATTERY_PERCENT;
import static io.satnet.constant.RoutingConstant.LOW_ENERGY_PENALTY;
import static io.satnet.constant.RoutingConstant.LOW_QUALITY_THRESHOLD;
import static io.satnet.constant.RoutingConstant.QUALITY_WEIGHT;

@UtilityClass
@Slf4j
public class RouterFactory {

    public static Router create(RoutingConf conf) {
        var routing = Optional.ofNullable(conf).orElseGet(RoutingConf::new);
        var policy = Optional.ofNullable(routing.getPolicy()).orElse(RoutingPolicy.LINK_QUALITY_ENERGY);

        Router router;
        switch (policy) {
            case CONTACT_GRAPH:
                router = new ContactGraphRouter();
                break;
            case STATIC:
                router = new StaticRouter(routing.getStaticRoutes());
                break;
            default:
                var qualityWeight = Optional.ofNullable(routing.getQualityWeight()).orElse(QUALITY_WEIGHT);
                router = new LinkQualityEnergyRouter(
                        qualityWeight,
                        Optional.ofNullable(routing.getEnergyWeight()).orElse(1.0 - qualityWeight),
                        Optional.ofNullable(routing.getLowQualityThreshold()).orElse(LOW_QUALITY_THRESHOLD),
                        Optional.ofNullable(routing.getLowEnergyPenalty()).orElse(LOW_ENERGY_PENALTY),
                        Optional.ofNullable(routing.getLowBatteryPercent()).orElse(LOW_BATTERY_PERCENT)
                );
        }
        log.info("Routing policy {} ({})", policy, router.getName());

        return router;
    }
}
