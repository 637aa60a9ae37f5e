package com.ivamare.topicbus.handler;

import com.ivamare.topicbus.registry.Registrar;

/**
 * Programmatic alternative to the handler annotations.
 *
 * <p>{@link #declare(Registrar)} is called once per load with a registrar
 * bound to the implementing class.
 */
public interface TopicSubscriber {

    void declare(Registrar registrar);
}
