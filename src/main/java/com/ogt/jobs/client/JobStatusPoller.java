package com.ogt.jobs.client;

import com.ogt.jobs.dto.JobStatusResponse;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Polling de un job hasta un estado terminal. No conoce HTTP: recibe la
 * función que consulta el estado y un {@link Sleeper}, así se prueba sin esperas.
 */
@Slf4j
public class JobStatusPoller {

    private final Function<UUID, JobStatusResponse> statusFetcher;
    private final BackoffPolicy backoff;
    private final Sleeper sleeper;

    public JobStatusPoller(Function<UUID, JobStatusResponse> statusFetcher) {
        this(statusFetcher, BackoffPolicy.defaults(), Sleeper.THREAD);
    }

    public JobStatusPoller(Function<UUID, JobStatusResponse> statusFetcher, BackoffPolicy backoff, Sleeper sleeper) {
        this.statusFetcher = statusFetcher;
        this.backoff = backoff;
        this.sleeper = sleeper;
    }

    public PollOutcome await(UUID jobId, Duration maxWait) throws InterruptedException {
        return await(jobId, maxWait, status -> { });
    }

    /**
     * @param maxWait tiempo máximo acumulado de espera; {@code null} espera sin límite
     * @param onUpdate recibe cada snapshot que trae un cambio
     */
    public PollOutcome await(UUID jobId, Duration maxWait, Consumer<JobStatusResponse> onUpdate)
            throws InterruptedException {
        JobStatusResponse last = statusFetcher.apply(jobId);
        onUpdate.accept(last);
        int polls = 1;
        Duration interval = backoff.getBase();
        Duration waited = Duration.ZERO;

        while (!last.isTerminal()) {
            if (maxWait != null) {
                Duration remaining = maxWait.minus(waited);
                if (remaining.isNegative() || remaining.isZero()) {
                    log.debug("Espera agotada para job {} tras {} consultas", jobId, polls);
                    return new PollOutcome(last, polls, true);
                }
                if (interval.compareTo(remaining) > 0) interval = remaining;
            }

            sleeper.sleep(interval);
            waited = waited.plus(interval);

            JobStatusResponse current = statusFetcher.apply(jobId);
            polls++;
            boolean changed = hasChanged(last, current);
            if (changed) onUpdate.accept(current);
            interval = backoff.next(interval, changed);
            last = current;
        }
        return new PollOutcome(last, polls, false);
    }

    static boolean hasChanged(JobStatusResponse previous, JobStatusResponse current) {
        return previous.getStatus() != current.getStatus()
                || previous.getProcessedCount() != current.getProcessedCount()
                || previous.getRetryCount() != current.getRetryCount();
    }
}
