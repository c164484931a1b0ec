package com.navcaddy.core.model;

import java.io.Serializable;

/**
 * A club reference resolved from free text.
 *
 * @param name           canonical display name, e.g. "7-Iron"
 * @param type           club family
 * @param loft           loft in degrees
 * @param estimatedCarry typical carry distance in yards
 */
public record Club(
    String name,
    ClubType type,
    double loft,
    int estimatedCarry
) implements Serializable {}
