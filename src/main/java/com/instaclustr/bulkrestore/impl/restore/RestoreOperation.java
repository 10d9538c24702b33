package com.instaclustr.bulkrestore.impl.restore;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import javax.inject.Inject;

import com.google.common.base.Ticker;
import com.google.inject.assistedinject.Assisted;
import com.instaclustr.bulkrestore.impl.ApiException;
import com.instaclustr.bulkrestore.impl.BulkRestoreException;
import com.instaclustr.bulkrestore.impl.ResourceType;
import com.instaclustr.bulkrestore.impl.backend.BackendApi;
import com.instaclustr.bulkrestore.impl.backend.SubmissionResponse;
import com.instaclustr.bulkrestore.impl.list.EnvironmentResolver;
import com.instaclustr.bulkrestore.impl.resolve.NameGenerator;
import com.instaclustr.bulkrestore.impl.retry.Sleeper.LinearSleeper;
import com.instaclustr.bulkrestore.impl.spec.RestoreGroup;
import com.instaclustr.bulkrestore.impl.spec.TargetSpec;
import com.instaclustr.bulkrestore.impl.task.TaskPollResult;
import com.instaclustr.bulkrestore.impl.task.TaskPoller;
import com.instaclustr.bulkrestore.impl.task.TaskState;
import com.instaclustr.bulkrestore.operations.Operation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_ACCOUNT;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_REGION;
import static java.lang.String.format;

/**
 * Restores every group of the request: resolves the target environment, builds and submits the restore
 * request and polls the returned task. A group which fails does not stop the others, its error is recorded
 * and the operation ends as failed.
 */
public class RestoreOperation extends Operation<RestoreOperationRequest> {

    private static final Logger logger = LoggerFactory.getLogger(RestoreOperation.class);

    private final BackendApi backendApi;
    private final Map<ResourceType, RestoreRequestBuilder> builders;
    private final EnvironmentResolver environmentResolver;
    private final NameGenerator nameGenerator;
    private final Ticker ticker;

    @Inject
    public RestoreOperation(@Assisted final RestoreOperationRequest request,
                            final BackendApi backendApi,
                            final Map<ResourceType, RestoreRequestBuilder> builders,
                            final EnvironmentResolver environmentResolver,
                            final NameGenerator nameGenerator,
                            final Ticker ticker) {
        super(request);
        this.backendApi = backendApi;
        this.builders = builders;
        this.environmentResolver = environmentResolver;
        this.nameGenerator = nameGenerator;
        this.ticker = ticker;
    }

    @Override
    protected void run0() throws Exception {
        final List<RestoreOutcome> outcomes = new CopyOnWriteArrayList<>();
        request.outcomes = outcomes;

        final TaskPoller poller = new TaskPoller(backendApi.tasks(),
                                                 request.polling,
                                                 ticker,
                                                 new LinearSleeper(request.polling.interval.toMilliseconds()));

        if (request.restoreGroups.isEmpty()) {
            logger.info("There is nothing to restore.");
            return;
        }

        int done = 0;

        for (final RestoreGroup group : request.restoreGroups) {
            if (getShouldCancel().get()) {
                logger.info("Restore was cancelled, {} of {} groups were processed", done, request.restoreGroups.size());
                break;
            }

            outcomes.add(restore(group, poller));

            progress = (float) ++done / request.restoreGroups.size();
        }
    }

    RestoreOutcome restore(final RestoreGroup group, final TaskPoller poller) {
        final String runToken = nameGenerator.runToken();
        String taskId = null;

        try {
            final RestoreRequestBuilder builder = builders.get(group.getResourceType());

            if (builder == null) {
                throw new IllegalStateException(format("There is no restore request builder for resource type %s", group.getResourceType()));
            }

            final TargetSpec target = group.getTarget();

            final String environmentId = builder.requiresEnvironment()
                ? environmentResolver.resolveEnvironmentId(target.getString(TARGET_ACCOUNT), target.getString(TARGET_REGION))
                : null;

            final RestoreRequest restoreRequest = builder.build(group.getRecord(), target, environmentId);

            final SubmissionResponse response = backendApi.restores().submit(restoreRequest);

            if (!response.isOk()) {
                throw new ApiException(response.getStatusCode(), "restore request was not accepted", response.getContent());
            }

            taskId = response.getTaskId();

            logger.info("Submitted restore of {} backup {} as task {}, run token {}",
                        group.getResourceType(), group.getRecord().getSourceBackupId(), taskId, runToken);

            final TaskPollResult result = poller.poll(taskId, () -> getShouldCancel().get());

            if (result.getState() == TaskState.COMPLETED) {
                return RestoreOutcome.of(group, runToken, taskId, RestoreOutcome.COMPLETED, "task completed");
            }

            return RestoreOutcome.of(group, runToken, taskId, RestoreOutcome.NOT_DONE, format("task not done - %s", result.getLastStatus()));
        } catch (final BulkRestoreException ex) {
            addError(Error.from(format("%s %s", group.getResourceType(), group.getRecord().getSourceBackupId()), ex));
            return RestoreOutcome.of(group, runToken, taskId, ex.getStatusCode(), ex.getMessage());
        } catch (final RuntimeException ex) {
            // exhausted lookup retries and wiring errors
            addError(Error.from(format("%s %s", group.getResourceType(), group.getRecord().getSourceBackupId()), ex));
            return RestoreOutcome.of(group, runToken, taskId, RestoreOutcome.ERROR, ex.getMessage());
        }
    }
}
