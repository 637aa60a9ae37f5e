package com.ivamare.topicbus.model;

/**
 * Structured result of a request/reply exchange.
 *
 * @param code Status code, HTTP-like (200 ok, 404 no handler, 409 timeout, 500 handler error)
 * @param data Result payload (nullable)
 */
public record Reply(int code, Object data) {

    public static final int OK = 200;
    public static final int NOT_FOUND = 404;
    public static final int TIMEOUT = 409;
    public static final int ERROR = 500;

    public static Reply ok(Object data) {
        return new Reply(OK, data);
    }

    /**
     * Standardized failure answered when a reply handler exceeds its timeout.
     */
    public static Reply timeout() {
        return new Reply(TIMEOUT, null);
    }

    public static Reply notFound() {
        return new Reply(NOT_FOUND, null);
    }

    public static Reply error(Object data) {
        return new Reply(ERROR, data);
    }

    public boolean isSuccess() {
        return code == OK;
    }

    public boolean isTimeout() {
        return code == TIMEOUT;
    }
}
