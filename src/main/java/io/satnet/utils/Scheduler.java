package io.satnet.utils;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static java.util.concurrent.Executors.newScheduledThreadPool;

@UtilityClass
@Slf4j
public class Scheduler {
    public static final ScheduledExecutorService scheduler = newScheduledThreadPool(
            2,
            namedDaemonFactory("satnet-scheduler-%d")
    );

    public static BasicThreadFactory namedDaemonFactory(String namingPattern) {
        return new BasicThreadFactory.Builder()
                .namingPattern(namingPattern)
                .daemon(true)
                .build();
    }

    public static ScheduledFuture<?> scheduleWithFixedDelaySafe(Runnable command, long delay, TimeUnit unit) {
        return scheduleWithFixedDelaySafe(scheduler, command, delay, delay, unit);
    }

    /**
     * Like {@link ScheduledExecutorService#scheduleWithFixedDelay} but a failing run is logged
     * and the job stays scheduled, instead of being silently cancelled by the executor.
     */
    public static ScheduledFuture<?> scheduleWithFixedDelaySafe(
            ScheduledExecutorService executor,
            Runnable command,
            long initialDelay,
            long delay,
            TimeUnit unit
    ) {
        return executor.scheduleWithFixedDelay(
                () -> {
                    try {
                        command.run();
                    } catch (Exception e) {
                        log.error("Error while execute task", e);
                    }
                }, initialDelay, delay, unit);
    }
}
