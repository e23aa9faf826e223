package io.satnet.transport;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Node lifecycle, in order. A stopped node is never restarted.
 */
@Getter
@RequiredArgsConstructor
public enum NodeState {

    CREATED("created"),
    STARTED("started"),
    RUNNING("running"),
    STOPPING("stopping"),
    STOPPED("stopped"),
    ;

    private final String value;

    public boolean acceptsBundles() {
        return this == CREATED || this == STARTED || this == RUNNING;
    }
}
