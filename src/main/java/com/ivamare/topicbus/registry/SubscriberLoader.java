package com.ivamare.topicbus.registry;

import com.ivamare.topicbus.exception.SubscriberLoadException;
import com.ivamare.topicbus.handler.Subscriber;
import com.ivamare.topicbus.handler.TopicSubscriber;
import com.ivamare.topicbus.handler.impl.SubscriberScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeanInstantiationException;
import org.springframework.beans.BeanUtils;
import org.springframework.beans.factory.config.BeanDefinition;
import org.springframework.context.annotation.ClassPathScanningCandidateComponentProvider;
import org.springframework.core.type.filter.AnnotationTypeFilter;
import org.springframework.core.type.filter.AssignableTypeFilter;
import org.springframework.util.ClassUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Discovers subscriber classes on the classpath and runs their declarations.
 *
 * <p>Classes under the base package that are annotated with {@link Subscriber}
 * or implement {@link TopicSubscriber} are loaded in lexical order of their
 * fully qualified names, instantiated through their no-arg constructor and
 * handed to the {@link SubscriberScanner}.
 *
 * <p>Loading the same class twice registers its handlers twice.
 */
public class SubscriberLoader {

    private static final Logger log = LoggerFactory.getLogger(SubscriberLoader.class);

    public static final String DEFAULT_SUBSCRIBERS_PACKAGE = "subscribers";

    private final SubscriberScanner scanner;
    private final String defaultPackage;
    private final ClassLoader classLoader;

    public SubscriberLoader(SubscriberScanner scanner) {
        this(scanner, DEFAULT_SUBSCRIBERS_PACKAGE);
    }

    public SubscriberLoader(SubscriberScanner scanner, String defaultPackage) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.defaultPackage = defaultPackage != null ? defaultPackage : DEFAULT_SUBSCRIBERS_PACKAGE;
        this.classLoader = ClassUtils.getDefaultClassLoader();
    }

    /**
     * Load every subscriber under the configured package.
     *
     * @return names of the loaded classes, in load order
     */
    public List<String> loadAll() {
        return loadAll(defaultPackage);
    }

    /**
     * Load every subscriber under a base package.
     *
     * @param basePackage Package to scan, including sub-packages
     * @return names of the loaded classes, in load order
     * @throws SubscriberLoadException if a discovered class cannot be loaded
     */
    public List<String> loadAll(String basePackage) {
        ClassPathScanningCandidateComponentProvider provider = new ClassPathScanningCandidateComponentProvider(false);
        provider.addIncludeFilter(new AnnotationTypeFilter(Subscriber.class));
        provider.addIncludeFilter(new AssignableTypeFilter(TopicSubscriber.class));

        List<String> classNames = new ArrayList<>();
        for (BeanDefinition candidate : provider.findCandidateComponents(basePackage)) {
            classNames.add(candidate.getBeanClassName());
        }
        classNames.sort(null);

        log.info("Loading {} subscribers from {}", classNames.size(), basePackage);
        for (String className : classNames) {
            loadSubscriber(className);
        }
        return classNames;
    }

    /**
     * Load one subscriber class and register its declarations.
     *
     * @param className Fully qualified class name
     * @return Registrar bound to the loaded class
     * @throws SubscriberLoadException if the class is missing, declares nothing or cannot be instantiated
     */
    public Registrar loadSubscriber(String className) {
        Class<?> type;
        try {
            type = ClassUtils.forName(className, classLoader);
        } catch (ClassNotFoundException | LinkageError e) {
            throw new SubscriberLoadException(className, e);
        }
        return loadSubscriber(type);
    }

    /**
     * Instantiate a subscriber class and register its declarations.
     *
     * @param type Subscriber class
     * @return Registrar bound to the class
     */
    public Registrar loadSubscriber(Class<?> type) {
        if (!SubscriberScanner.isSubscriber(type)) {
            throw new SubscriberLoadException(type.getName(), "class declares no topic handlers");
        }
        Object subscriber;
        try {
            subscriber = BeanUtils.instantiateClass(type);
        } catch (BeanInstantiationException e) {
            throw new SubscriberLoadException(type.getName(), e);
        }
        log.debug("Loaded subscriber {}", type.getName());
        return scanner.registerSubscriber(subscriber);
    }
}
