package com.openforge.memgraph.consistency;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NamespaceWriteGateTest {

    private final NamespaceWriteGate gate    = new NamespaceWriteGate();
    private final ExecutorService    writers = Executors.newFixedThreadPool(4);

    @AfterEach
    void tearDown() {
        writers.shutdownNow();
    }

    @Test
    void idleNamespacesAreForgotten() {
        for (int i = 0; i < 100; i++) {
            String ns = "tenant-" + i;
            assertThat(gate.run(ns, () -> ns)).isEqualTo(ns);
        }

        assertThat(gate.activeNamespaces()).isZero();
    }

    @Test
    void failingTaskStillLeavesTheGate() {
        assertThatThrownBy(() -> gate.run("tenant-a", () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(gate.activeNamespaces()).isZero();
        assertThat(gate.run("tenant-a", () -> "again")).isEqualTo("again");
    }

    @Test
    void sameNamespaceRunsOneAtATime() throws Exception {
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        Runnable body = () -> gate.run("tenant-a", () -> {
            maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
            try {
                Thread.sleep(20);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return inside.decrementAndGet();
        });

        Future<?> a = writers.submit(body);
        Future<?> b = writers.submit(body);
        Future<?> c = writers.submit(body);
        a.get(5, TimeUnit.SECONDS);
        b.get(5, TimeUnit.SECONDS);
        c.get(5, TimeUnit.SECONDS);

        assertThat(maxInside.get()).isEqualTo(1);
        assertThat(gate.activeNamespaces()).isZero();
    }

    @Test
    void otherNamespaceIsNotBlocked() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        Future<String> holder = writers.submit(() -> gate.run("tenant-a", () -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "a";
        }));
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();

        assertThat(gate.run("tenant-b", () -> "b")).isEqualTo("b");
        assertThat(gate.activeNamespaces()).isEqualTo(1);

        release.countDown();
        assertThat(holder.get(5, TimeUnit.SECONDS)).isEqualTo("a");
        assertThat(gate.activeNamespaces()).isZero();
    }
}
