package com.navcaddy.core.routing;

import com.navcaddy.core.model.IntentType;
import com.navcaddy.core.model.SessionContext;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps intents to the prerequisites they need and checks them against a session snapshot.
 */
@Component
public class PrerequisiteChecker {

    private static final Map<IntentType, Set<Prerequisite>> REQUIRED = new EnumMap<>(IntentType.class);

    static {
        REQUIRED.put(IntentType.SCORE_ENTRY, Set.of(Prerequisite.ROUND_ACTIVE));
        REQUIRED.put(IntentType.ROUND_END, Set.of(Prerequisite.ROUND_ACTIVE));
        REQUIRED.put(IntentType.COURSE_INFO, Set.of(Prerequisite.COURSE_SELECTED));
    }

    public Set<Prerequisite> requiredFor(IntentType intentType) {
        return REQUIRED.getOrDefault(intentType, Set.of());
    }

    /**
     * @return missing prerequisites in declaration order; empty when the intent may proceed
     */
    public List<Prerequisite> missing(IntentType intentType, SessionContext context) {
        Set<Prerequisite> required = requiredFor(intentType);
        var missing = new ArrayList<Prerequisite>();
        for (Prerequisite prerequisite : Prerequisite.values()) {
            if (required.contains(prerequisite) && !isSatisfied(prerequisite, context)) {
                missing.add(prerequisite);
            }
        }
        return missing;
    }

    boolean isSatisfied(Prerequisite prerequisite, SessionContext context) {
        if (context == null) {
            return false;
        }
        return switch (prerequisite) {
            case ROUND_ACTIVE -> context.hasActiveRound();
            case COURSE_SELECTED -> context.currentRound() != null
                    && context.currentRound().courseName() != null
                    && !context.currentRound().courseName().isBlank();
        };
    }
}
