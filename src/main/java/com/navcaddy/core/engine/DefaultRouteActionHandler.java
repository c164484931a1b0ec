package com.navcaddy.core.engine;

import com.navcaddy.core.intent.IntentRegistry;
import com.navcaddy.core.model.ExtractedEntities;
import com.navcaddy.core.model.ParsedIntent;
import com.navcaddy.core.model.RoutingTarget;
import com.navcaddy.core.model.SessionContext;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Short spoken replies announcing where the user is being taken.
 */
@Component
public class DefaultRouteActionHandler implements RouteActionHandler {

    @Override
    public String respond(ParsedIntent intent, RoutingTarget target, SessionContext context) {
        ExtractedEntities e = intent.entities();
        String club = e.club() != null ? e.club().name() : null;
        return switch (intent.intentType()) {
            case CLUB_ADJUSTMENT -> club != null
                    ? "Let's dial in your " + club + ". Update its carry and I'll use it from here on."
                    : "Let's check your club distances and adjust what's off.";
            case RECOVERY_CHECK -> e.hasPain()
                    ? "Sorry to hear about the " + e.pain() + ". Here's your recovery overview, so take it easy."
                    : "Here's your recovery overview for today.";
            case SHOT_RECOMMENDATION -> shotAdvice(e, context);
            case SCORE_ENTRY -> "Ready to log your score for " + hole(e, context) + ".";
            case DRILL_REQUEST -> club != null
                    ? "Here are a few drills to build consistency with your " + club + "."
                    : "Here are a few drills for your next practice session.";
            case WEATHER_CHECK -> e.wind() != null
                    ? "Here's the weather. You mentioned " + e.wind() + " wind, so factor that in."
                    : "Here's the current weather and how it plays today.";
            case STATS_LOOKUP -> "Here are your stats.";
            case ROUND_START -> "Let's get your round set up.";
            case ROUND_END -> "Nice work out there. Here's your round summary.";
            case EQUIPMENT_INFO -> "Here's what's in your bag.";
            case COURSE_INFO -> context != null && context.currentRound() != null
                    ? "Here's the layout for " + context.currentRound().courseName() + "."
                    : "Here's the course information.";
            case SETTINGS_CHANGE -> "Opening your settings.";
            case FEEDBACK -> "Thanks, I'm listening. Tell me what worked and what didn't.";
            default -> "Opening " + IntentRegistry.getSchema(intent.intentType()).displayName()
                    .toLowerCase(Locale.ROOT) + ".";
        };
    }

    private static String shotAdvice(ExtractedEntities e, SessionContext context) {
        var sb = new StringBuilder("Here's my read");
        if (e.yardage() != null) {
            sb.append(" for ").append(e.yardage()).append(" yards");
        }
        if (e.lie() != null) {
            sb.append(" from the ").append(e.lie().name().toLowerCase(Locale.ROOT));
        }
        sb.append('.');
        if (e.club() != null) {
            sb.append(" The ").append(e.club().name()).append(" is a good fit");
            if (e.yardage() != null && e.club().estimatedCarry() < e.yardage()) {
                sb.append(" if you take a full swing");
            }
            sb.append('.');
        }
        sb.append(" Pick a target and commit to it.");
        return sb.toString();
    }

    private static String hole(ExtractedEntities e, SessionContext context) {
        if (e.holeNumber() != null) {
            return "hole " + e.holeNumber();
        }
        if (context != null && context.currentHole() != null) {
            return "hole " + context.currentHole();
        }
        return "this hole";
    }
}
