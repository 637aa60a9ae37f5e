package com.ivamare.topicbus.model;

/**
 * Kind of a topic handler. Determines which backend operation binds it.
 */
public enum HandlerKind {
    /** Raw listener, bound through {@code Backend.addListener}. */
    LISTENER("listener"),
    /** Fire-and-forget handler, bound through {@code Backend.slot}. */
    SLOT("slot"),
    /** Request/reply handler, bound through {@code Backend.replyTo}. */
    REPLY("reply");

    private final String value;

    HandlerKind(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public static HandlerKind fromValue(String value) {
        for (HandlerKind kind : values()) {
            if (kind.value.equals(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown HandlerKind: " + value);
    }
}
