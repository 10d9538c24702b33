package com.instaclustr.bulkrestore.impl.task;

import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import com.google.common.base.Ticker;
import com.instaclustr.bulkrestore.impl.TaskFailedException;
import com.instaclustr.bulkrestore.impl.backend.TaskEndpoint;
import com.instaclustr.bulkrestore.impl.retry.Sleeper;
import com.instaclustr.bulkrestore.impl.retry.Sleeper.LinearSleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the status of a restore task at a fixed interval until it is done or the polling budget is spent.
 * <p>
 * A task which failed or was aborted surfaces as {@link TaskFailedException}, a task read the caller is not
 * authorized for surfaces as {@link com.instaclustr.bulkrestore.impl.AuthException} without any further read.
 * Running out of budget is not a failure, the result is {@link TaskState#TIMED_OUT} and the task may be polled
 * again later.
 */
public class TaskPoller {

    private static final Logger logger = LoggerFactory.getLogger(TaskPoller.class);

    private final TaskEndpoint taskEndpoint;
    private final PollingSpec pollingSpec;
    private final Ticker ticker;
    private final Sleeper sleeper;

    public TaskPoller(final TaskEndpoint taskEndpoint, final PollingSpec pollingSpec) {
        this(taskEndpoint, pollingSpec, Ticker.systemTicker(), new LinearSleeper(pollingSpec.interval.toMilliseconds()));
    }

    public TaskPoller(final TaskEndpoint taskEndpoint,
                      final PollingSpec pollingSpec,
                      final Ticker ticker,
                      final Sleeper sleeper) {
        this.taskEndpoint = taskEndpoint;
        this.pollingSpec = pollingSpec;
        this.ticker = ticker;
        this.sleeper = sleeper;
    }

    /**
     * Single read of a task, never loops.
     */
    public TaskState readState(final String taskId) {
        final String status = taskEndpoint.readTask(taskId);

        logger.info("[{}] Task status {}.", taskId, status);

        final TaskState state = TaskState.fromStatus(status);

        if (state.isFailure()) {
            throw new TaskFailedException(taskId, status);
        }

        return state;
    }

    public TaskPollResult poll(final String taskId) {
        return poll(taskId, () -> false);
    }

    /**
     * @param cancelled checked before every read, a cancelled poll returns {@link TaskState#PENDING}
     */
    public TaskPollResult poll(final String taskId, final BooleanSupplier cancelled) {
        final long budget = TimeUnit.MILLISECONDS.toNanos(pollingSpec.timeout.toMilliseconds());
        final long start = ticker.read();

        String lastStatus = null;

        while (true) {
            if (cancelled.getAsBoolean()) {
                logger.info("[{}] Polling was cancelled. Last known status: {}.", taskId, lastStatus);
                return new TaskPollResult(taskId, TaskState.PENDING, lastStatus);
            }

            lastStatus = taskEndpoint.readTask(taskId);

            logger.info("[{}] Task status {}.", taskId, lastStatus);

            final TaskState state = TaskState.fromStatus(lastStatus);

            if (state == TaskState.COMPLETED) {
                return new TaskPollResult(taskId, state, lastStatus);
            }

            if (state.isFailure()) {
                throw new TaskFailedException(taskId, lastStatus);
            }

            if (ticker.read() - start >= budget) {
                logger.warn("[{}] Task timed out after polling. Last known status: {}.", taskId, lastStatus);
                return new TaskPollResult(taskId, TaskState.TIMED_OUT, lastStatus);
            }

            sleeper.sleep();
        }
    }
}
