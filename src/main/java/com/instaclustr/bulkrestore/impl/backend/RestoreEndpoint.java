package com.instaclustr.bulkrestore.impl.backend;

import com.instaclustr.bulkrestore.impl.restore.RestoreRequest;

@FunctionalInterface
public interface RestoreEndpoint {

    SubmissionResponse submit(final RestoreRequest request);
}
