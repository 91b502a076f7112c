package de.bsommerfeld.traderelay.core.event;

import com.google.common.eventbus.EventBus;
import com.google.common.eventbus.SubscriberExceptionContext;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thin wrapper around Guava's {@link EventBus} that decouples the inbound
 * Discord poller from the components answering messages. Delivery is
 * synchronous on the posting thread; subscribers that do slow work hand it
 * off to their own executor.
 */
@Singleton
public class ApplicationEventBus {

    private static final Logger LOG = LoggerFactory.getLogger(ApplicationEventBus.class);
    private final EventBus eventBus;

    public ApplicationEventBus() {
        this.eventBus = new EventBus(ApplicationEventBus::logSubscriberFailure);
    }

    public void post(Object event) {
        LOG.debug("Posting event: {}", event);
        eventBus.post(event);
    }

    public void register(Object listener) {
        LOG.trace("Registering listener: {}", listener.getClass().getName());
        eventBus.register(listener);
    }

    public void unregister(Object listener) {
        LOG.trace("Unregistering listener: {}", listener.getClass().getName());
        eventBus.unregister(listener);
    }

    private static void logSubscriberFailure(Throwable exception, SubscriberExceptionContext context) {
        LOG.error("Subscriber {}#{} failed on {}",
                context.getSubscriber().getClass().getSimpleName(),
                context.getSubscriberMethod().getName(),
                context.getEvent().getClass().getSimpleName(), exception);
    }
}
