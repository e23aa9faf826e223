package io.satnet.routing;

import com.fasterxml.jackson.annotation.JsonCreator;
import lombok.Getter;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.List;

@Getter
@RequiredArgsConstructor
public enum RoutingPolicy {

    LINK_QUALITY_ENERGY(List.of("link-quality-energy", "energy", "default")),
    CONTACT_GRAPH(List.of("contact-graph", "cgr")),
    STATIC(List.of("static")),
    ;

    private final List<String> aliases;

    @JsonCreator
    public static RoutingPolicy parseName(@NonNull String policyName) {
        return Arrays.stream(RoutingPolicy.values())
                .filter(policy -> policy.getAliases().contains(policyName.strip().toLowerCase()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("unknown routing policy: " + policyName));
    }
}
