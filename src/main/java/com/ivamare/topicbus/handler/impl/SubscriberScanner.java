package com.ivamare.topicbus.handler.impl;

import com.ivamare.topicbus.backend.BackendManager;
import com.ivamare.topicbus.handler.ListenTo;
import com.ivamare.topicbus.handler.ReplyTo;
import com.ivamare.topicbus.handler.Slot;
import com.ivamare.topicbus.handler.Subscriber;
import com.ivamare.topicbus.handler.TopicHandler;
import com.ivamare.topicbus.handler.TopicSubscriber;
import com.ivamare.topicbus.model.HandlerKind;
import com.ivamare.topicbus.model.HandlerOptions;
import com.ivamare.topicbus.model.MessageContext;
import com.ivamare.topicbus.registry.Registrar;
import com.ivamare.topicbus.registry.TopicRegistry;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.aop.support.AopUtils;
import org.springframework.beans.factory.config.BeanPostProcessor;
import org.springframework.util.ClassUtils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.function.Supplier;

/**
 * Registers the handlers an object declares.
 *
 * <p>Implements BeanPostProcessor to automatically discover subscribers among
 * Spring beans: beans annotated with {@link Subscriber}, carrying
 * {@link ListenTo}/{@link ReplyTo}/{@link Slot} methods, or implementing
 * {@link TopicSubscriber}.
 *
 * <p>A handler method may take any payload type: payloads that are not
 * already instances of it (e.g. maps decoded from JSON) are converted with
 * the ObjectMapper.
 */
public class SubscriberScanner implements BeanPostProcessor {

    private static final Logger log = LoggerFactory.getLogger(SubscriberScanner.class);

    private final Supplier<TopicRegistry> registry;
    private final Supplier<BackendManager> backendManager;
    private final Supplier<ObjectMapper> objectMapper;

    public SubscriberScanner(TopicRegistry registry, BackendManager backendManager) {
        this(registry, backendManager, new ObjectMapper().findAndRegisterModules());
    }

    public SubscriberScanner(TopicRegistry registry, BackendManager backendManager, ObjectMapper objectMapper) {
        this(() -> registry, () -> backendManager, () -> objectMapper);
    }

    /**
     * Create a scanner resolving its collaborators on first use.
     *
     * @param registry Registry supplier
     * @param backendManager Backend manager supplier
     * @param objectMapper Mapper used to convert payloads to handler parameter types
     */
    public SubscriberScanner(
            Supplier<TopicRegistry> registry,
            Supplier<BackendManager> backendManager,
            Supplier<ObjectMapper> objectMapper) {
        this.registry = registry;
        this.backendManager = backendManager;
        this.objectMapper = objectMapper;
    }

    /**
     * Whether a class declares handlers in any supported way.
     *
     * @param type Candidate class
     * @return true for subscriber classes
     */
    public static boolean isSubscriber(Class<?> type) {
        return type.isAnnotationPresent(Subscriber.class)
            || TopicSubscriber.class.isAssignableFrom(type)
            || Arrays.stream(type.getMethods()).anyMatch(SubscriberScanner::isHandlerMethod);
    }

    /**
     * Register everything a subscriber object declares.
     *
     * <p>Annotated methods are registered in method-name order, then
     * {@link TopicSubscriber#declare(Registrar)} is called.
     *
     * @param subscriber The subscriber instance
     * @return Registrar bound to the subscriber's class
     */
    public Registrar registerSubscriber(Object subscriber) {
        Class<?> owner = AopUtils.getTargetClass(subscriber);
        Registrar registrar = Registrar.forOwner(registry.get(), backendManager.get(), owner);

        Subscriber annotation = owner.getAnnotation(Subscriber.class);
        if (annotation != null && !annotation.backend().isEmpty()) {
            registrar.useBackend(annotation.backend());
        }

        List<Method> methods = new ArrayList<>(Arrays.asList(owner.getMethods()));
        methods.sort(Comparator.comparing(Method::getName));
        for (Method method : methods) {
            registerMethod(registrar, subscriber, method);
        }

        if (subscriber instanceof TopicSubscriber topicSubscriber) {
            topicSubscriber.declare(registrar);
        }
        return registrar;
    }

    /**
     * BeanPostProcessor callback - scans beans for subscriber declarations.
     */
    @Override
    public Object postProcessAfterInitialization(Object bean, String beanName) {
        if (isSubscriber(AopUtils.getTargetClass(bean))) {
            registerSubscriber(bean);
        }
        return bean;
    }

    private void registerMethod(Registrar registrar, Object subscriber, Method method) {
        ListenTo listenTo = method.getAnnotation(ListenTo.class);
        ReplyTo replyTo = method.getAnnotation(ReplyTo.class);
        Slot slot = method.getAnnotation(Slot.class);
        if (listenTo == null && replyTo == null && slot == null) {
            return;
        }

        validateHandlerMethod(method);
        TopicHandler handler = invoking(subscriber, method);

        if (listenTo != null) {
            registrar.listenTo(listenTo.value(),
                options(listenTo.exclusive(), listenTo.timeout(), listenTo.fork()), handler);
            logDiscovered(registrar, method, HandlerKind.LISTENER, listenTo.value());
        }
        if (replyTo != null) {
            registrar.replyTo(replyTo.value(),
                options(replyTo.exclusive(), replyTo.timeout(), replyTo.fork()), handler);
            logDiscovered(registrar, method, HandlerKind.REPLY, replyTo.value());
        }
        if (slot != null) {
            registrar.slot(slot.value(), options(slot.exclusive(), slot.timeout(), slot.fork()), handler);
            logDiscovered(registrar, method, HandlerKind.SLOT, slot.value());
        }
    }

    private TopicHandler invoking(Object subscriber, Method method) {
        Class<?> payloadClass = method.getParameterTypes()[0];
        return (payload, context) -> {
            Object argument = payload;
            if (payload != null && !ClassUtils.isAssignableValue(payloadClass, payload)) {
                ObjectMapper mapper = objectMapper.get();
                JavaType payloadType = mapper.getTypeFactory().constructType(method.getGenericParameterTypes()[0]);
                argument = mapper.convertValue(payload, payloadType);
            }
            try {
                return method.invoke(subscriber, argument, context);
            } catch (InvocationTargetException e) {
                if (e.getCause() instanceof Exception cause) {
                    throw cause;
                }
                throw e;
            }
        };
    }

    private static HandlerOptions options(boolean exclusive, long timeoutSeconds, boolean fork) {
        return new HandlerOptions(exclusive, Duration.ofSeconds(timeoutSeconds), fork);
    }

    private static boolean isHandlerMethod(Method method) {
        return method.isAnnotationPresent(ListenTo.class)
            || method.isAnnotationPresent(ReplyTo.class)
            || method.isAnnotationPresent(Slot.class);
    }

    private void logDiscovered(Registrar registrar, Method method, HandlerKind kind, String topic) {
        log.info("Discovered {} handler {}.{}() for {}",
            kind.getValue(), registrar.owner().getSimpleName(), method.getName(), topic);
    }

    private void validateHandlerMethod(Method method) {
        Class<?>[] params = method.getParameterTypes();
        if (params.length != 2 || !params[1].equals(MessageContext.class)) {
            throw new IllegalArgumentException(
                "Handler method " + method.getName() + " must have signature: " +
                "Object methodName(Object payload, MessageContext context)"
            );
        }
    }
}
