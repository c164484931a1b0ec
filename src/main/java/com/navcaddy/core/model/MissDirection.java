package com.navcaddy.core.model;

public enum MissDirection {
    PUSH,
    PULL,
    SLICE,
    HOOK,
    FAT,
    THIN,
    STRAIGHT
}
