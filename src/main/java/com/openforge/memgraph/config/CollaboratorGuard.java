package com.openforge.memgraph.config;

import com.openforge.memgraph.error.CollaboratorUnavailableException;
import com.openforge.memgraph.error.MemoryCoreException;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Runs a collaborator call under an explicit timeout.
 *
 * Timeouts and transport failures become {@link CollaboratorUnavailableException};
 * the core's own typed errors (not-found, invariant violation) pass through unchanged.
 * An interrupted caller gets a {@link CancellationException} with the interrupt flag restored.
 */
@Slf4j
@Component
public class CollaboratorGuard {

    private final TimeLimiter     timeLimiter;
    private final ExecutorService executor;

    public CollaboratorGuard(TimeLimiter storeTimeLimiter,
                             @Qualifier("collaboratorExecutor") ExecutorService executor) {
        this.timeLimiter = storeTimeLimiter;
        this.executor    = executor;
    }

    public <T> T call(String collaborator, String namespace, String operation, Supplier<T> call) {
        try {
            return timeLimiter.executeFutureSupplier(
                    () -> CompletableFuture.supplyAsync(call, executor));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("%s cancelled (namespace=%s)".formatted(operation, namespace));
        } catch (Exception e) {
            Throwable cause = unwrap(e);
            if (cause instanceof MemoryCoreException core) throw core;
            if (cause instanceof CancellationException cancelled) throw cancelled;
            log.warn("[Guard] {} {} failed (namespace={}): {}",
                    collaborator, operation, namespace, cause.toString());
            throw new CollaboratorUnavailableException(collaborator, namespace, operation, cause);
        }
    }

    public void run(String collaborator, String namespace, String operation, Runnable call) {
        call(collaborator, namespace, operation, () -> {
            call.run();
            return Boolean.TRUE;
        });
    }

    private static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof ExecutionException || current instanceof CompletionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
