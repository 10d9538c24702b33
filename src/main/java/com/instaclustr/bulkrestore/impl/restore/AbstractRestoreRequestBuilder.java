package com.instaclustr.bulkrestore.impl.restore;

import com.instaclustr.bulkrestore.impl.ValidationException;
import com.instaclustr.bulkrestore.impl.record.BackupRecord;
import com.instaclustr.bulkrestore.impl.spec.TargetSpec;

import static java.lang.String.format;

public abstract class AbstractRestoreRequestBuilder<R extends BackupRecord, Q extends RestoreRequest> implements RestoreRequestBuilder {

    private final Class<R> recordClass;

    protected AbstractRestoreRequestBuilder(final Class<R> recordClass) {
        this.recordClass = recordClass;
    }

    @Override
    public final Q build(final BackupRecord record, final TargetSpec spec, final String environmentId) {
        if (!recordClass.isInstance(record)) {
            throw new ValidationException("backup_record", format("%s can not build a request for %s",
                                                                  getClass().getSimpleName(),
                                                                  record == null ? null : record.getClass().getSimpleName()));
        }

        for (final String field : spec.fields()) {
            if (spec.isFollowDefault(field)) {
                throw new ValidationException(field, format("%s still follows the default input, restore groups have to be validated first", field));
            }
        }

        return build0(recordClass.cast(record), spec, environmentId);
    }

    protected abstract Q build0(final R record, final TargetSpec spec, final String environmentId);
}
