package com.instaclustr.bulkrestore.impl.resolve;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.instaclustr.bulkrestore.impl.Tag;
import com.instaclustr.bulkrestore.impl.ValidationException;
import com.instaclustr.bulkrestore.impl.record.EbsBackupRecord;
import com.instaclustr.bulkrestore.impl.spec.TargetSpec;
import org.junit.jupiter.api.Test;

import static com.instaclustr.bulkrestore.impl.record.BackupRecords.ACCOUNT;
import static com.instaclustr.bulkrestore.impl.record.BackupRecords.OTHER_ACCOUNT;
import static com.instaclustr.bulkrestore.impl.record.BackupRecords.REGION;
import static com.instaclustr.bulkrestore.impl.record.BackupRecords.ebs;
import static com.instaclustr.bulkrestore.impl.record.BackupRecords.rds;
import static com.instaclustr.bulkrestore.impl.spec.Specs.spec;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TAGS;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_ACCOUNT;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_AZ;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_IOPS;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_KMS_KEY_NATIVE_ID;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_REGION;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_VOLUME_TYPE;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class EbsTargetSpecResolverTest {

    private final EbsTargetSpecResolver resolver = new EbsTargetSpecResolver();

    @Test
    public void inheritsFromSourceInSameAccount() {
        final EbsBackupRecord record = ebs("b-1", "vol-1", "gp2", null);

        final TargetSpec resolved = resolver.resolve(spec("target_az", "us-east-1a"), record, false);

        assertEquals(ACCOUNT, resolved.getString(TARGET_ACCOUNT));
        assertEquals(REGION, resolved.getString(TARGET_REGION));
        assertEquals("us-east-1a", resolved.getString(TARGET_AZ));
        assertEquals("gp2", resolved.getString(TARGET_VOLUME_TYPE));
        assertEquals("kms-source", resolved.getString(TARGET_KMS_KEY_NATIVE_ID));
        assertEquals(0, resolved.getInteger(TARGET_IOPS));
        assertFalse(resolved.contains(TAGS));
    }

    @Test
    public void inheritsIopsOfProvisionedVolume() {
        final TargetSpec resolved = resolver.resolve(TargetSpec.empty(), ebs("b-1", "vol-1", "gp3", 3000), false);

        assertEquals("gp3", resolved.getString(TARGET_VOLUME_TYPE));
        assertEquals(3000, resolved.getInteger(TARGET_IOPS));
        assertEquals("us-east-1b", resolved.getString(TARGET_AZ));
    }

    @Test
    public void explicitValuesWin() {
        final TargetSpec resolved = resolver.resolve(spec("target_volume_type", "io1", "target_iops", "4000", "target_kms_key_native_id", "kms-mine"),
                                                     ebs("b-1", "vol-1", "gp3", 3000),
                                                     false);

        assertEquals("io1", resolved.getString(TARGET_VOLUME_TYPE));
        assertEquals(4000, resolved.getInteger(TARGET_IOPS));
        assertEquals("kms-mine", resolved.getString(TARGET_KMS_KEY_NATIVE_ID));
    }

    @Test
    public void crossAccountFollowsDefaultInput() {
        final TargetSpec resolved = resolver.resolve(spec("target_account", OTHER_ACCOUNT, "target_kms_key_native_id", "kms-target"),
                                                     ebs("b-1", "vol-1", "gp3", 3000),
                                                     true);

        assertEquals(OTHER_ACCOUNT, resolved.getString(TARGET_ACCOUNT));
        assertTrue(resolved.isFollowDefault(TARGET_AZ));
        assertTrue(resolved.isFollowDefault(TARGET_VOLUME_TYPE));
        assertEquals(0, resolved.getInteger(TARGET_IOPS));
    }

    @Test
    public void crossAccountRequiresKmsKey() {
        final ValidationException ex = assertThrows(ValidationException.class,
                                                    () -> resolver.resolve(spec("target_account", OTHER_ACCOUNT), ebs("b-1", "vol-1", "gp2", null), true));

        assertEquals("target_kms_key_native_id", ex.getField());
        assertEquals("target_kms_key_native_id must be filled for cross-account restore", ex.getMessage());
    }

    @Test
    public void iopsOnlyForProvisionedVolumeTypes() {
        final ValidationException ex = assertThrows(ValidationException.class,
                                                    () -> resolver.resolve(spec("target_iops", 500), ebs("b-1", "vol-1", "gp2", null), false));

        assertEquals("target_iops", ex.getField());
    }

    @Test
    public void appendsTagsToSourceTags() {
        final TargetSpec resolved = resolver.resolve(spec("append_tags", ImmutableMap.of("restored", "yes", "a", "1")),
                                                     ebs("b-1", "vol-1", "gp2", null, Tag.of("a", "1"), Tag.of("a", "2")),
                                                     false);

        assertEquals(ImmutableList.of(Tag.of("a", "1"), Tag.of("a", "2"), Tag.of("restored", "yes")), resolved.getTags());
        assertFalse(resolved.contains("append_tags"));
    }

    @Test
    public void rejectsRecordOfOtherType() {
        assertThrows(ValidationException.class, () -> resolver.resolve(TargetSpec.empty(), rds("b-1"), false));
    }
}
