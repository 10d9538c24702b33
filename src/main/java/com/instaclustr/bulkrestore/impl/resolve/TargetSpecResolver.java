package com.instaclustr.bulkrestore.impl.resolve;

import com.instaclustr.bulkrestore.impl.ValidationException;
import com.instaclustr.bulkrestore.impl.record.BackupRecord;
import com.instaclustr.bulkrestore.impl.spec.TargetSpec;

/**
 * Completes an operator supplied target spec of one backup. Explicit values always win. In the account the
 * backup was taken in, missing values are inherited from the backup. Across accounts nothing is inherited:
 * fields the target account can not share with the source have to be explicit, the others are marked to
 * follow the default input.
 */
public interface TargetSpecResolver {

    /**
     * @param spec         partial spec, never modified
     * @param record       backup to restore
     * @param crossAccount true when restoring into another account than the one of the backup
     * @return new, resolved spec
     * @throws ValidationException when a required field can not be resolved
     */
    TargetSpec resolve(final TargetSpec spec, final BackupRecord record, final boolean crossAccount);
}
