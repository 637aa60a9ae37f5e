package com.ivamare.topicbus.backend.redis;

import com.ivamare.topicbus.backend.BackendOptions;

import java.time.Duration;
import java.util.Map;

/**
 * Options for the Redis backend.
 *
 * @param host Redis host (default localhost)
 * @param port Redis port (default 6379)
 * @param broadcastErrors Publish handler failures on the error topic (default false)
 * @param healthCheck Register this process in the health hash (default false)
 * @param requestTimeout How long a requester waits for a reply (default 600s)
 */
public record RedisBackendOptions(
    String host,
    int port,
    boolean broadcastErrors,
    boolean healthCheck,
    Duration requestTimeout
) {

    public static final String HOST = "host";
    public static final String PORT = "port";
    public static final String BROADCAST_ERRORS = "broadcast_errors";
    public static final String HEALTH_CHECK = "health_check";
    public static final String REQUEST_TIMEOUT = "request_timeout";

    public static RedisBackendOptions defaults() {
        return new RedisBackendOptions("localhost", 6379, false, false, Duration.ofSeconds(600));
    }

    public static RedisBackendOptions fromMap(Map<String, Object> options) {
        RedisBackendOptions defaults = defaults();
        return new RedisBackendOptions(
            BackendOptions.string(options, HOST, defaults.host()),
            (int) BackendOptions.number(options, PORT, defaults.port()),
            BackendOptions.flag(options, BROADCAST_ERRORS),
            BackendOptions.flag(options, HEALTH_CHECK),
            Duration.ofSeconds(BackendOptions.number(options, REQUEST_TIMEOUT, defaults.requestTimeout().toSeconds()))
        );
    }
}
