package com.navcaddy.core.engine;

import com.navcaddy.core.model.ParsedIntent;
import com.navcaddy.core.model.RoutingTarget;
import com.navcaddy.core.model.SessionContext;

/**
 * Produces the assistant's reply once a turn has been routed to a destination.
 * <p>
 * The returned text is raw; it still passes through the response formatter.
 */
@FunctionalInterface
public interface RouteActionHandler {

    String respond(ParsedIntent intent, RoutingTarget target, SessionContext context);
}
