package com.navcaddy.core.model;

public enum ClubType {
    DRIVER,
    WOOD,
    HYBRID,
    IRON,
    WEDGE,
    PUTTER
}
