package com.navcaddy.core.model;

import java.io.Serializable;

/**
 * @param weather       short description, e.g. "overcast"
 * @param windSpeed     mph
 * @param windDirection e.g. "left-to-right"
 * @param temperature   degrees Fahrenheit
 */
public record CourseConditions(
    String weather,
    Integer windSpeed,
    String windDirection,
    Integer temperature
) implements Serializable {}
