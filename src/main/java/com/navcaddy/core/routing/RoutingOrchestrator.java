package com.navcaddy.core.routing;

import com.navcaddy.core.model.ClassificationResult;
import com.navcaddy.core.model.SessionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Decides whether a {@link ClassificationResult.Route} can be followed given the current session.
 */
@Service
public class RoutingOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RoutingOrchestrator.class);

    private final PrerequisiteChecker checker;

    public RoutingOrchestrator(PrerequisiteChecker checker) {
        this.checker = checker;
    }

    public RoutingDecision decide(ClassificationResult.Route route, SessionContext context) {
        List<Prerequisite> missing = checker.missing(route.intent().intentType(), context);
        if (!missing.isEmpty()) {
            log.info("Route to {} blocked, missing {}", route.target().screen(), missing);
            return RoutingDecision.blocked(missing);
        }
        return RoutingDecision.navigate(route.target());
    }
}
