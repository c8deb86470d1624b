package com.openforge.memgraph.consistency;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import java.util.function.Supplier;

/**
 * Serializes checked writes per namespace so two copies of the same new fact
 * cannot both pass the duplicate check. Different namespaces never block each other.
 *
 * A namespace holds an entry only while some writer is running or waiting in it.
 */
@Component
public class NamespaceWriteGate {

    private final Map<String, Lane> lanes = new ConcurrentHashMap<>();

    /** {@code users} is only read or written inside {@code lanes.compute*}. */
    private static final class Lane {
        final Semaphore semaphore = new Semaphore(1, true);
        int users;
    }

    public <T> T run(String namespace, Supplier<T> task) {
        Lane lane = lanes.compute(namespace, (ns, l) -> {
            Lane entered = l == null ? new Lane() : l;
            entered.users++;
            return entered;
        });
        try {
            try {
                lane.semaphore.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CancellationException("Interrupted waiting for write gate (namespace=" + namespace + ")");
            }
            try {
                return task.get();
            } finally {
                lane.semaphore.release();
            }
        } finally {
            lanes.computeIfPresent(namespace, (ns, l) -> --l.users == 0 ? null : l);
        }
    }

    /** Namespaces with a writer running or waiting. */
    int activeNamespaces() {
        return lanes.size();
    }
}
