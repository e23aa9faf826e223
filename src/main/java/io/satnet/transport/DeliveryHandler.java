package io.satnet.transport;

import io.satnet.bundle.Bundle;

/**
 * Local consumer of bundles addressed to this node.
 */
@FunctionalInterface
public interface DeliveryHandler {

    DeliveryHandler NONE = bundle -> { };

    void delivered(Bundle bundle);
}
