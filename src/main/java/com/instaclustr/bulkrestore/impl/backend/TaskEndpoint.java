package com.instaclustr.bulkrestore.impl.backend;

import com.instaclustr.bulkrestore.impl.AuthException;

@FunctionalInterface
public interface TaskEndpoint {

    /**
     * Reads the current status of an asynchronous backend task, e.g. {@code queued}, {@code in_progress},
     * {@code completed}, {@code failed} or {@code aborted}.
     *
     * @throws AuthException when the caller is not allowed to read the task
     */
    String readTask(final String taskId) throws AuthException;
}
