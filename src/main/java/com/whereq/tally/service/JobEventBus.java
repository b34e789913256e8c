package com.whereq.tally.service;

import com.whereq.tally.model.JobEvent;
import com.whereq.tally.model.JobEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous typed pub/sub for job lifecycle events.
 *
 * Events are delivered in publish order on the publishing thread, to the
 * subscribers present when publishing starts. A failing subscriber does not stop
 * delivery to the others.
 */
@Slf4j
@Component
public class JobEventBus {

    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    /**
     * Handle to detach a subscriber
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    public Subscription subscribe(JobEventType type, Consumer<JobEvent> listener) {
        Registration registration = new Registration(type, listener);
        registrations.add(registration);
        return () -> registrations.remove(registration);
    }

    /**
     * Receive every event type
     */
    public Subscription subscribeAll(Consumer<JobEvent> listener) {
        return subscribe(null, listener);
    }

    public void publish(JobEvent event) {
        for (Registration registration : registrations) {
            if (registration.type != null && registration.type != event.getType()) {
                continue;
            }
            try {
                registration.listener.accept(event);
            } catch (RuntimeException e) {
                log.error("Subscriber failed on {} for job {}", event.getType().getWireName(), event.getJobId(), e);
            }
        }
    }

    public int getSubscriberCount() {
        return registrations.size();
    }

    /**
     * Detach every subscriber
     */
    public void clear() {
        registrations.clear();
    }

    private static final class Registration {
        private final JobEventType type;
        private final Consumer<JobEvent> listener;

        private Registration(JobEventType type, Consumer<JobEvent> listener) {
            this.type = type;
            this.listener = listener;
        }
    }
}
