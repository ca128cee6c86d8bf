package com.rms.authsync.replication;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.rms.authsync.core.error.UnroutableEventException;
import com.rms.authsync.core.subject.EventSubjects;

/**
 * Fixed subject to handler table.
 *
 * <p>Built once from the handler beans. Construction fails if two handlers claim the same subject,
 * if a handler claims a subject outside {@link EventSubjects#ALL}, or if a known subject has no
 * handler.</p>
 */
@Component
public class EventRouter {

    private static final Logger log = LoggerFactory.getLogger(EventRouter.class);

    private final Map<String, ReplicationHandler> handlers;

    public EventRouter(List<ReplicationHandler> handlers) {
        Map<String, ReplicationHandler> table = new HashMap<>();
        for (ReplicationHandler h : handlers) {
            if (!EventSubjects.ALL.contains(h.subject())) {
                throw new IllegalStateException("Handler " + h.getClass().getSimpleName()
                        + " registered for unknown subject " + h.subject());
            }
            ReplicationHandler previous = table.putIfAbsent(h.subject(), h);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handlers for subject " + h.subject() + ": "
                        + previous.getClass().getSimpleName() + ", " + h.getClass().getSimpleName());
            }
        }

        Set<String> missing = new TreeSet<>(EventSubjects.ALL);
        missing.removeAll(table.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No handler registered for subjects " + missing);
        }

        this.handlers = Collections.unmodifiableMap(table);
        log.info("Event router ready subjects={}", this.handlers.size());
    }

    public ReplicationHandler resolve(String subject) {
        ReplicationHandler handler = subject == null ? null : handlers.get(subject);
        if (handler == null) {
            throw new UnroutableEventException(subject);
        }
        return handler;
    }

    public Set<String> subjects() {
        return handlers.keySet();
    }
}
