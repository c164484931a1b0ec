package com.navcaddy.core.model;

/**
 * Top-level app areas a routing target can point into.
 */
public enum Module {
    CADDY,
    COACH,
    RECOVERY,
    SETTINGS
}
