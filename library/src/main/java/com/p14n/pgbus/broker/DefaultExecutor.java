package com.p14n.pgbus.broker;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default implementation of {@link AsyncExecutor} backed by a named
 * scheduled pool. Threads are daemon threads so a forgotten bus does not
 * keep the JVM alive.
 */
public class DefaultExecutor implements AsyncExecutor {

        private static final Logger logger = LoggerFactory.getLogger(DefaultExecutor.class);

        private final ScheduledExecutorService se;

        /**
         * @param scheduledSize the size of the scheduled thread pool
         */
        public DefaultExecutor(int scheduledSize) {
                this.se = createScheduledExecutorService(scheduledSize);
        }

        protected ScheduledExecutorService createScheduledExecutorService(int size) {
                return Executors.newScheduledThreadPool(size,
                                new ThreadFactoryBuilder().setNameFormat("pgbus-scheduled-%d").setDaemon(true).build());
        }

        @Override
        public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay, long period, TimeUnit unit) {
                return se.scheduleAtFixedRate(command, initialDelay, period, unit);
        }

        @Override
        public List<Runnable> shutdownNow() {
                return se.shutdownNow();
        }

        /**
         * Stops scheduling, lets a running tick finish for up to five seconds,
         * then interrupts whatever is left.
         */
        @Override
        public void close() throws Exception {
                se.shutdown();
                if (!se.awaitTermination(5, TimeUnit.SECONDS)) {
                        logger.atWarn().log("Executor did not terminate in time, interrupting");
                        shutdownNow();
                }
        }
}
