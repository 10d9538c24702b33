package com.instaclustr.bulkrestore.impl.resolve;

import com.instaclustr.bulkrestore.impl.ValidationException;
import com.instaclustr.bulkrestore.impl.record.BackupRecord;
import com.instaclustr.bulkrestore.impl.spec.TargetField;
import com.instaclustr.bulkrestore.impl.spec.TargetSpec;

import static java.lang.String.format;

public abstract class AbstractTargetSpecResolver<R extends BackupRecord> implements TargetSpecResolver {

    private final Class<R> recordClass;

    protected AbstractTargetSpecResolver(final Class<R> recordClass) {
        this.recordClass = recordClass;
    }

    @Override
    public final TargetSpec resolve(final TargetSpec spec, final BackupRecord record, final boolean crossAccount) {
        if (!recordClass.isInstance(record)) {
            throw new ValidationException("backup_record", format("%s can not resolve a target of %s",
                                                                  getClass().getSimpleName(),
                                                                  record == null ? null : record.getClass().getSimpleName()));
        }

        final R typedRecord = recordClass.cast(record);

        TargetSpec resolved = spec == null ? TargetSpec.empty() : spec;

        if (resolved.isBlank(TargetField.TARGET_ACCOUNT) && record.getSourceAccount() != null) {
            resolved = resolved.with(TargetField.TARGET_ACCOUNT, record.getSourceAccount());
        }
        if (resolved.isBlank(TargetField.TARGET_REGION) && record.getSourceRegion() != null) {
            resolved = resolved.with(TargetField.TARGET_REGION, record.getSourceRegion());
        }

        resolved = resolveFields(resolved, typedRecord, crossAccount);

        return TagMerger.mergeInto(resolved, record.getSourceTags());
    }

    protected abstract TargetSpec resolveFields(final TargetSpec spec, final R record, final boolean crossAccount);

    /**
     * Fills one field: the explicit value, else the source value in the same account, else either a failure
     * or the follow-default marker across accounts. A missing source value leaves the field absent.
     */
    protected static TargetSpec inherit(final TargetSpec spec,
                                        final TargetField field,
                                        final Object sourceValue,
                                        final boolean crossAccount,
                                        final boolean requiredCrossAccount) {
        if (!spec.isBlank(field)) {
            return spec;
        }

        if (!crossAccount) {
            return TargetSpec.isBlankValue(sourceValue) ? spec.without(field) : spec.with(field, sourceValue);
        }

        if (requiredCrossAccount) {
            throw crossAccountFailure(field);
        }

        return spec.with(field, TargetSpec.FOLLOW_DEFAULT_INPUT);
    }

    protected static ValidationException crossAccountFailure(final TargetField field) {
        return new ValidationException(field.getJsonName(), format("%s must be filled for cross-account restore", field.getJsonName()));
    }
}
