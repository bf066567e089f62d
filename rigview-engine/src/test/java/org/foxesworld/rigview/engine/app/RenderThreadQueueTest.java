package org.foxesworld.rigview.engine.app;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RenderThreadQueueTest {

    @Test
    void jobsRunInPostOrderOnlyWhenDrained() {
        RenderThreadQueue queue = new RenderThreadQueue();
        List<Integer> ran = new ArrayList<>();

        queue.post(() -> ran.add(1));
        queue.execute(() -> ran.add(2));
        assertTrue(ran.isEmpty());

        assertEquals(2, queue.drain(10));
        assertEquals(List.of(1, 2), ran);
        assertTrue(queue.isEmpty());
    }

    @Test
    void drainStopsAtTheJobLimit() {
        RenderThreadQueue queue = new RenderThreadQueue();
        for (int i = 0; i < 5; i++) queue.post(() -> { });

        assertEquals(3, queue.drain(3));
        assertEquals(2, queue.size());
    }

    @Test
    void failingJobIsReportedAndTheRestStillRun() {
        List<Throwable> errors = new ArrayList<>();
        RenderThreadQueue queue = new RenderThreadQueue().setOnError(errors::add);
        List<String> ran = new ArrayList<>();

        queue.post(() -> { throw new IllegalStateException("boom"); });
        queue.post(() -> ran.add("after"));
        queue.drain(10);

        assertEquals(1, errors.size());
        assertEquals("boom", errors.get(0).getMessage());
        assertEquals(List.of("after"), ran);
    }

    @Test
    void asyncCompletionsWaitForTheDrain() {
        RenderThreadQueue queue = new RenderThreadQueue();
        CompletableFuture<String> source = new CompletableFuture<>();

        CompletableFuture<String> hopped = source.handleAsync((v, e) -> v + "!", queue);
        source.complete("done");
        assertFalse(hopped.isDone(), "completion runs only on drain");
        queue.drain(10);

        assertEquals("done!", hopped.join());
    }

    @Test
    void clearDropsPendingJobs() {
        RenderThreadQueue queue = new RenderThreadQueue();
        queue.post(() -> { throw new AssertionError("must not run"); });

        queue.clear();

        assertEquals(0, queue.drain(10));
    }
}
