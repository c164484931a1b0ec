package com.navcaddy.core.normalizer;

public enum ModificationType {
    SLANG,
    NUMBER,
    PROFANITY
}
