package io.satnet.exception;

/**
 * No active, eligible neighbor for a routing decision. Expected in a disconnected network;
 * the node keeps the bundle pending instead of surfacing this to producers.
 */
public class NoRouteException extends DtnException {

    public NoRouteException(String message) {
        super(DtnErrorType.NO_ROUTE, message);
    }
}
