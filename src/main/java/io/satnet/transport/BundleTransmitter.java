package io.satnet.transport;

import io.satnet.bundle.Bundle;

/**
 * Hand-off point to the link layer. Called by the egress worker once a next hop is chosen
 * and the stored copy is marked in transit.
 */
@FunctionalInterface
public interface BundleTransmitter {

    BundleTransmitter NONE = (neighbor, bundle) -> { };

    /**
     * @throws Exception any failure, the node marks the bundle failed
     */
    void transmit(Neighbor neighbor, Bundle bundle) throws Exception;
}
