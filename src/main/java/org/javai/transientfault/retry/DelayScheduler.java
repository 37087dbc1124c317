package org.javai.transientfault.retry;

import java.time.Duration;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Runs an asynchronous attempt after a delay without blocking a thread. Replaced in tests.
 */
@FunctionalInterface
interface DelayScheduler {

    DelayScheduler SYSTEM = new DelayScheduler() {
        private final ScheduledThreadPoolExecutor timer = newTimer();

        @Override
        public Future<?> schedule(Runnable task, Duration delay) {
            // the timer thread only hands the attempt over; attempts run in the common pool
            return timer.schedule(() -> ForkJoinPool.commonPool().execute(task),
                    delay.toMillis(), TimeUnit.MILLISECONDS);
        }
    };

    /**
     * Schedules the task.
     *
     * @return a handle whose cancellation drops the task if it has not started
     */
    Future<?> schedule(Runnable task, Duration delay);

    private static ScheduledThreadPoolExecutor newTimer() {
        ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(1, runnable -> {
            Thread thread = new Thread(runnable, "transientfault-retry-timer");
            thread.setDaemon(true);
            return thread;
        });
        timer.setRemoveOnCancelPolicy(true);
        return timer;
    }
}
