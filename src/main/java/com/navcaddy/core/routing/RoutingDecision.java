package com.navcaddy.core.routing;

import com.navcaddy.core.error.ErrorKind;
import com.navcaddy.core.error.RecoveryAction;
import com.navcaddy.core.model.RoutingTarget;

import java.util.List;

/**
 * Result of checking a routed intent against session state.
 *
 * @param target  where to navigate; {@code null} when blocked
 * @param missing prerequisites that blocked navigation, empty when navigating
 * @param message user-facing explanation when blocked
 */
public record RoutingDecision(RoutingTarget target, List<Prerequisite> missing, String message) {

    public RoutingDecision {
        missing = missing == null ? List.of() : List.copyOf(missing);
    }

    public static RoutingDecision navigate(RoutingTarget target) {
        return new RoutingDecision(target, List.of(), null);
    }

    public static RoutingDecision blocked(List<Prerequisite> missing) {
        return new RoutingDecision(null, missing, missing.get(0).message());
    }

    public boolean shouldNavigate() {
        return missing.isEmpty();
    }

    public ErrorKind errorKind() {
        return shouldNavigate() ? null : ErrorKind.NO_ACTIVE_SESSION;
    }

    public RecoveryAction recovery() {
        return shouldNavigate() ? RecoveryAction.NONE : RecoveryAction.START_ROUND;
    }
}
