package com.instaclustr.bulkrestore.impl.resolve;

import com.instaclustr.bulkrestore.impl.ValidationException;
import com.instaclustr.bulkrestore.impl.spec.TargetSpec;
import org.junit.jupiter.api.Test;

import static com.instaclustr.bulkrestore.impl.record.BackupRecords.dynamoDb;
import static com.instaclustr.bulkrestore.impl.record.BackupRecords.protectionGroup;
import static com.instaclustr.bulkrestore.impl.spec.Specs.spec;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_BUCKET;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_TABLE_NAME;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class DynamoDbTargetSpecResolverTest {

    private final DynamoDbTargetSpecResolver resolver = new DynamoDbTargetSpecResolver();

    @Test
    public void tableNameFromChangeSet() {
        final TargetSpec resolved = resolver.resolve(spec("change_set_name", "cs1"), dynamoDb("b-1"), false);

        assertEquals("orders-cs1", resolved.getString(TARGET_TABLE_NAME));
    }

    @Test
    public void explicitTableName() {
        final TargetSpec resolved = resolver.resolve(spec("target_table_name", "orders-copy"), dynamoDb("b-1"), false);

        assertEquals("orders-copy", resolved.getString(TARGET_TABLE_NAME));
    }

    @Test
    public void tableNameOrChangeSetIsRequired() {
        final ValidationException ex = assertThrows(ValidationException.class, () -> resolver.resolve(TargetSpec.empty(), dynamoDb("b-1"), false));

        assertEquals("change_set_name", ex.getField());
    }

    @Test
    public void protectionGroupRequiresBucket() {
        final ProtectionGroupTargetSpecResolver pgResolver = new ProtectionGroupTargetSpecResolver();

        assertThrows(ValidationException.class, () -> pgResolver.resolve(TargetSpec.empty(), protectionGroup("b-1"), false));
        assertEquals("restore-bucket", pgResolver.resolve(spec("target_bucket", "restore-bucket"), protectionGroup("b-1"), false).getString(TARGET_BUCKET));
    }
}
