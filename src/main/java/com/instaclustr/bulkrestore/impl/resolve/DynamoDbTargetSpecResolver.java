package com.instaclustr.bulkrestore.impl.resolve;

import com.instaclustr.bulkrestore.impl.ValidationException;
import com.instaclustr.bulkrestore.impl.record.DynamoDbBackupRecord;
import com.instaclustr.bulkrestore.impl.spec.TargetSpec;

import static com.google.common.base.Strings.isNullOrEmpty;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.CHANGE_SET_NAME;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_TABLE_NAME;

public class DynamoDbTargetSpecResolver extends AbstractTargetSpecResolver<DynamoDbBackupRecord> {

    public DynamoDbTargetSpecResolver() {
        super(DynamoDbBackupRecord.class);
    }

    @Override
    protected TargetSpec resolveFields(final TargetSpec spec, final DynamoDbBackupRecord record, final boolean crossAccount) {
        if (!spec.isBlank(TARGET_TABLE_NAME)) {
            return spec;
        }

        if (spec.isEmpty(CHANGE_SET_NAME) || isNullOrEmpty(record.getSourceTableName())) {
            throw new ValidationException(CHANGE_SET_NAME.getJsonName(), "change_set_name has to be set when target_table_name is not");
        }

        return spec.with(TARGET_TABLE_NAME, record.getSourceTableName() + "-" + spec.getString(CHANGE_SET_NAME));
    }
}
