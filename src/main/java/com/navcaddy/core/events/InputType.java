package com.navcaddy.core.events;

/** How the user produced an utterance. */
public enum InputType {
    TEXT,
    VOICE
}
