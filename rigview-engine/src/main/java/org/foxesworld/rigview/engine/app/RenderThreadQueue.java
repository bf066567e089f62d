package org.foxesworld.rigview.engine.app;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Bridge "any thread -> render thread".
 *
 * <ul>
 *   <li>{@link #post(Runnable)} / {@link #execute(Runnable)}: fire-and-forget</li>
 *   <li>{@link #drainBudgeted(int, long)}: render thread only, once per frame</li>
 * </ul>
 */
public final class RenderThreadQueue implements Executor {

    private static final Logger log = LogManager.getLogger(RenderThreadQueue.class);

    private final Queue<Runnable> q = new ConcurrentLinkedQueue<>();
    private volatile Consumer<Throwable> onError;

    public void post(Runnable run) {
        q.add(Objects.requireNonNull(run, "run"));
    }

    @Override
    public void execute(Runnable command) {
        post(command);
    }

    /** Hook for exceptions thrown by jobs; runs on the render thread. */
    public RenderThreadQueue setOnError(Consumer<Throwable> onError) {
        this.onError = onError;
        return this;
    }

    public int drain(int maxJobs) {
        return drainBudgeted(maxJobs, 0L);
    }

    /**
     * @param timeBudgetNanos 0 disables the budget; otherwise stops once it is spent
     * @return executed jobs count
     */
    public int drainBudgeted(int maxJobs, long timeBudgetNanos) {
        int limit = Math.max(0, maxJobs);
        long deadline = (timeBudgetNanos > 0L) ? (System.nanoTime() + timeBudgetNanos) : Long.MAX_VALUE;

        int n = 0;
        while (n < limit) {
            Runnable job = q.poll();
            if (job == null) break;
            try {
                job.run();
            } catch (RuntimeException e) {
                report(e);
            }
            n++;
            if ((n & 0x3F) == 0 && System.nanoTime() >= deadline) break;
        }
        return n;
    }

    private void report(RuntimeException e) {
        Consumer<Throwable> h = this.onError;
        if (h == null) {
            log.error("Render-thread job failed", e);
            return;
        }
        try {
            h.accept(e);
        } catch (RuntimeException hookError) {
            hookError.addSuppressed(e);
            log.error("Render-thread error hook failed", hookError);
        }
    }

    public void clear() {
        q.clear();
    }

    public boolean isEmpty() {
        return q.isEmpty();
    }

    public int size() {
        return q.size();
    }
}
