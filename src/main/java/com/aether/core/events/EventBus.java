package com.aether.core.events;

import com.aether.core.entity.UnknownAgentException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Routes agent events to the mailbox of the entity actor that owns the agent.
 * <p>
 * Events for one agent reach its mailbox in the order {@link #publish} was called;
 * no ordering is promised across agents. Global subscribers see every routed event
 * after it has been handed to the mailbox.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Owning mailbox per agent. */
    private final ConcurrentHashMap<String, Mailbox> mailboxes = new ConcurrentHashMap<>();

    /** Observers of all routed events. */
    private final CopyOnWriteArrayList<Consumer<AgentEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Deliver an event without waiting for it to be processed.
     *
     * @return false if no actor owns the event's agent (the event is dropped)
     */
    public boolean publish(AgentEvent event) {
        Mailbox mailbox = mailboxes.get(event.agentId());
        if (mailbox == null) {
            log.warn("Dropping {} for unknown agent {}", event.eventName(), event.agentId());
            return false;
        }
        log.debug("Routing {} to agent {}", event.eventName(), event.agentId());
        mailbox.offer(event);
        notifyGlobal(event);
        return true;
    }

    /**
     * Deliver an event and obtain the actor's reply once it has been processed.
     * Fails with {@link UnknownAgentException} when no actor owns the agent.
     */
    public CompletableFuture<Object> request(AgentEvent event) {
        Mailbox mailbox = mailboxes.get(event.agentId());
        if (mailbox == null) {
            return CompletableFuture.failedFuture(new UnknownAgentException(event.agentId()));
        }
        log.debug("Routing request {} to agent {}", event.eventName(), event.agentId());
        CompletableFuture<Object> reply = mailbox.offer(event);
        notifyGlobal(event);
        return reply;
    }

    /**
     * Register the mailbox that owns an agent's events. Only one owner per agent.
     *
     * @return a {@link Subscription} handle that removes the registration
     * @throws IllegalStateException if the agent already has an owner
     */
    public Subscription register(String agentId, Mailbox mailbox) {
        Mailbox existing = mailboxes.putIfAbsent(agentId, mailbox);
        if (existing != null) {
            throw new IllegalStateException("Agent " + agentId + " already has a mailbox");
        }
        log.debug("Registered mailbox for agent {}", agentId);
        return () -> mailboxes.remove(agentId, mailbox);
    }

    /**
     * Observe every event routed through the bus, regardless of agent.
     */
    public Subscription subscribeAll(Consumer<AgentEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    public boolean isRegistered(String agentId) {
        return mailboxes.containsKey(agentId);
    }

    /**
     * Destination of one agent's events.
     */
    @FunctionalInterface
    public interface Mailbox {
        /** Enqueue the event; the future completes with the actor's reply. */
        CompletableFuture<Object> offer(AgentEvent event);
    }

    /**
     * Handle for cancelling a registration or subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void notifyGlobal(AgentEvent event) {
        List<Consumer<AgentEvent>> subscribers = globalSubscribers;
        for (Consumer<AgentEvent> subscriber : subscribers) {
            try {
                subscriber.accept(event);
            } catch (Exception e) {
                log.warn("Subscriber threw exception processing event {}: {}",
                        event.eventName(), e.getMessage(), e);
            }
        }
    }
}
