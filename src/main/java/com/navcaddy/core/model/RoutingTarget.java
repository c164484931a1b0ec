package com.navcaddy.core.model;

import java.io.Serializable;
import java.util.Map;
import java.util.Objects;

/**
 * Destination for a high-confidence intent, consumed by the navigation layer.
 *
 * @param module     app area that owns the screen
 * @param screen     screen identifier within the module
 * @param parameters screen arguments (never null)
 */
public record RoutingTarget(
    Module module,
    String screen,
    Map<String, String> parameters
) implements Serializable {

    public RoutingTarget {
        Objects.requireNonNull(module, "module");
        if (screen == null || screen.isBlank()) {
            throw new IllegalArgumentException("screen must not be blank");
        }
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
    }

    public RoutingTarget(Module module, String screen) {
        this(module, screen, Map.of());
    }
}
