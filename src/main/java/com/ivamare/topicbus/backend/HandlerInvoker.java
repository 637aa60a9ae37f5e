package com.ivamare.topicbus.backend;

import com.ivamare.topicbus.model.HandlerSpec;
import com.ivamare.topicbus.model.MessageContext;
import com.ivamare.topicbus.model.Reply;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs handlers under their execution policy on behalf of a backend.
 *
 * <p>Inline handlers run on the backend's dispatch pool. Forked handlers run on
 * a separate pool, so a blocking or crashing handler never stalls dispatch, and
 * are interrupted when they exceed their timeout. Every invocation resolves to
 * a {@link Reply}:
 * <ul>
 *   <li>a returned Reply is passed through, any other value becomes {@link Reply#ok(Object)}</li>
 *   <li>a timeout becomes {@link Reply#timeout()}</li>
 *   <li>a handler exception becomes {@link Reply#error(Object)} and is reported</li>
 * </ul>
 * Backends only forward the reply for reply-kind handlers.
 */
public class HandlerInvoker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HandlerInvoker.class);

    private final String backendName;
    private final ExecutorService dispatchExecutor;
    private final ExecutorService forkExecutor;
    private final ErrorReporter errorReporter;

    public HandlerInvoker(String backendName) {
        this(backendName, ErrorReporter.NONE);
    }

    public HandlerInvoker(String backendName, ErrorReporter errorReporter) {
        this.backendName = backendName;
        this.errorReporter = errorReporter != null ? errorReporter : ErrorReporter.NONE;
        this.dispatchExecutor = Executors.newCachedThreadPool(daemonThreads("topicbus-" + backendName + "-dispatch-"));
        this.forkExecutor = Executors.newCachedThreadPool(daemonThreads("topicbus-" + backendName + "-fork-"));
    }

    /**
     * Invoke a handler.
     *
     * @param spec Handler descriptor
     * @param payload Message payload
     * @param context Delivery context
     * @return Future that always completes normally with the resulting reply
     */
    public CompletableFuture<Reply> invoke(HandlerSpec spec, Object payload, MessageContext context) {
        CompletableFuture<Object> result = new CompletableFuture<>();
        ExecutorService executor = spec.fork() ? forkExecutor : dispatchExecutor;

        Future<?> task;
        try {
            task = executor.submit(() -> {
                try {
                    result.complete(spec.handler().handle(payload, context));
                } catch (Throwable e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RuntimeException e) {
            log.error("Cannot schedule handler for {} on backend {}", spec.topic(), backendName, e);
            return CompletableFuture.completedFuture(Reply.error(e.getMessage()));
        }

        Duration timeout = spec.timeout();
        return result
            .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
            .handle((value, error) -> {
                if (error == null) {
                    return value instanceof Reply reply ? reply : Reply.ok(value);
                }
                Throwable cause = unwrap(error);
                if (cause instanceof TimeoutException) {
                    if (spec.fork()) {
                        task.cancel(true);
                    }
                    log.warn("Handler for {} (owner={}) exceeded timeout of {}s on backend {}",
                        spec.topic(), spec.owner().getSimpleName(), timeout.toSeconds(), backendName);
                    return Reply.timeout();
                }
                log.error("Handler for {} (owner={}) failed on backend {}",
                    spec.topic(), spec.owner().getSimpleName(), backendName, cause);
                reportError(spec, context, cause);
                return Reply.error(cause.getMessage());
            });
    }

    @Override
    public void close() {
        shutdown(dispatchExecutor);
        shutdown(forkExecutor);
    }

    private void reportError(HandlerSpec spec, MessageContext context, Throwable cause) {
        try {
            errorReporter.report(spec, context, cause);
        } catch (RuntimeException e) {
            log.warn("Error reporter failed for {}: {}", spec.topic(), e.getMessage());
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    private static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static CustomizableThreadFactory daemonThreads(String prefix) {
        CustomizableThreadFactory factory = new CustomizableThreadFactory(prefix);
        factory.setDaemon(true);
        return factory;
    }

    /**
     * Receives handler failures, e.g. to broadcast them on an error topic.
     */
    @FunctionalInterface
    public interface ErrorReporter {

        ErrorReporter NONE = (spec, context, error) -> { };

        void report(HandlerSpec spec, MessageContext context, Throwable error);
    }
}
