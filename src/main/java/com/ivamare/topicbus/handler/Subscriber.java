package com.ivamare.topicbus.handler;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as a subscriber that declares topic handlers.
 *
 * <p>Classes carrying this annotation are picked up by
 * {@link com.ivamare.topicbus.registry.SubscriberLoader} and may declare
 * handlers with {@link ListenTo}, {@link ReplyTo} and {@link Slot}, or by
 * implementing {@link TopicSubscriber}.
 *
 * <p>Example:
 * <pre>
 * {@literal @}Subscriber(backend = "redis")
 * public class OrderSubscriber {
 *
 *     {@literal @}Slot(value = "orders.created", exclusive = true, timeout = 30)
 *     public void onCreated(Object payload, MessageContext context) {
 *         // ...
 *     }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface Subscriber {

    /**
     * Name of the backend this class binds its handlers to. Empty means the
     * configured default backend.
     *
     * @return backend name
     */
    String backend() default "";
}
