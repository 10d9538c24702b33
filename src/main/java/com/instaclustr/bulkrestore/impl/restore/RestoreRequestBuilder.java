package com.instaclustr.bulkrestore.impl.restore;

import com.instaclustr.bulkrestore.impl.record.BackupRecord;
import com.instaclustr.bulkrestore.impl.spec.TargetSpec;

/**
 * Builds the restore request of one backup from its resolved and validated target spec.
 */
public interface RestoreRequestBuilder {

    /**
     * @param record        backup to restore
     * @param spec          resolved target spec, no field may still follow the default input
     * @param environmentId target environment, null for resource types addressing their target otherwise
     */
    RestoreRequest build(final BackupRecord record, final TargetSpec spec, final String environmentId);

    /**
     * @return true when the target environment has to be resolved before {@link #build} is called
     */
    default boolean requiresEnvironment() {
        return true;
    }
}
