package com.ivamare.topicbus.handler;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a method as a request/reply handler. The return value is sent back to the requester.
 *
 * <p>Handler methods must have the signature:
 * <pre>
 * Object handleXxx(Object payload, MessageContext context)
 * </pre>
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface ReplyTo {

    /**
     * The topic to subscribe to, may contain wildcards.
     *
     * @return topic
     */
    String value();

    /**
     * Join the competing-consumer group named after the declaring class.
     *
     * @return true for exclusive delivery
     */
    boolean exclusive() default false;

    /**
     * Maximum execution time in seconds.
     *
     * @return timeout in seconds
     */
    long timeout() default 600;

    /**
     * Run the handler isolated from the dispatch loop.
     *
     * @return true to fork
     */
    boolean fork() default false;
}
