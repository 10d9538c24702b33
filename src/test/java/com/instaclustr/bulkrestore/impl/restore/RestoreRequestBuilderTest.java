package com.instaclustr.bulkrestore.impl.restore;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.instaclustr.bulkrestore.impl.NotFoundException;
import com.instaclustr.bulkrestore.impl.Tag;
import com.instaclustr.bulkrestore.impl.ValidationException;
import com.instaclustr.bulkrestore.impl.backend.FakeBackendApi;
import com.instaclustr.bulkrestore.impl.backend.S3Bucket;
import com.instaclustr.bulkrestore.impl.record.RdsBackupRecord.Instance;
import com.instaclustr.bulkrestore.impl.resolve.Ec2TargetSpecResolver;
import com.instaclustr.bulkrestore.impl.retry.RetrySpec;
import com.instaclustr.bulkrestore.impl.spec.TargetSpec;
import org.junit.jupiter.api.Test;

import static com.instaclustr.bulkrestore.impl.record.BackupRecords.ACCOUNT;
import static com.instaclustr.bulkrestore.impl.record.BackupRecords.OTHER_ACCOUNT;
import static com.instaclustr.bulkrestore.impl.record.BackupRecords.REGION;
import static com.instaclustr.bulkrestore.impl.record.BackupRecords.dynamoDb;
import static com.instaclustr.bulkrestore.impl.record.BackupRecords.ebs;
import static com.instaclustr.bulkrestore.impl.record.BackupRecords.ec2;
import static com.instaclustr.bulkrestore.impl.record.BackupRecords.protectionGroup;
import static com.instaclustr.bulkrestore.impl.record.BackupRecords.rds;
import static com.instaclustr.bulkrestore.impl.spec.Specs.spec;
import static com.instaclustr.bulkrestore.impl.spec.TargetSpec.FOLLOW_DEFAULT_INPUT;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RestoreRequestBuilderTest {

    @Test
    public void ebsRequest() {
        final EbsRestoreRequest request = new EbsRestoreRequestBuilder().build(ebs("b-1", "vol-1", "gp2", null),
                                                                               spec("target_az", "us-east-1a",
                                                                                    "target_volume_type", "gp2",
                                                                                    "target_iops", 0,
                                                                                    "target_kms_key_native_id", "kms-1",
                                                                                    "tags", ImmutableList.of(Tag.of("a", "1"))),
                                                                               "env-1");

        assertEquals("b-1", request.getSourceBackupId());
        assertEquals("env-1", request.getEnvironmentId());
        assertEquals("us-east-1a", request.getAz());
        assertNull(request.getIops());
        assertEquals("kms-1", request.getKmsKeyNativeId());
        assertEquals("gp2", request.getVolumeType());
        assertEquals(ImmutableList.of(Tag.of("a", "1")), request.getTags());
    }

    @Test
    public void ebsRequestWithProvisionedIops() {
        final EbsRestoreRequest request = new EbsRestoreRequestBuilder().build(ebs("b-1", "vol-1", "gp3", 3000),
                                                                               spec("target_volume_type", "io2", "target_iops", 6000),
                                                                               "env-1");

        assertEquals(6000, request.getIops());
    }

    @Test
    public void ebsRequestRejectsIopsOfGeneralPurposeVolume() {
        assertThrows(ValidationException.class, () -> new EbsRestoreRequestBuilder().build(ebs("b-1", "vol-1", "gp2", null),
                                                                                           spec("target_volume_type", "gp2", "target_iops", 100),
                                                                                           "env-1"));
    }

    @Test
    public void unvalidatedSpecIsRejected() {
        final ValidationException ex = assertThrows(ValidationException.class,
                                                    () -> new EbsRestoreRequestBuilder().build(ebs("b-1", "vol-1", "gp2", null),
                                                                                               spec("target_az", FOLLOW_DEFAULT_INPUT),
                                                                                               "env-1"));

        assertEquals("target_az", ex.getField());
    }

    @Test
    public void recordOfOtherTypeIsRejected() {
        assertThrows(ValidationException.class, () -> new EbsRestoreRequestBuilder().build(rds("b-1"), TargetSpec.empty(), "env-1"));
    }

    @Test
    public void ec2RequestKeepsPerDeviceSettingsInSourceAccount() {
        final TargetSpec resolved = new Ec2TargetSpecResolver().resolve(TargetSpec.empty(), ec2("b-1"), false);

        final Ec2RestoreRequest request = new Ec2RestoreRequestBuilder().build(ec2("b-1"), resolved, "env-1");

        assertEquals("vpc-1", request.getVpcNativeId());
        assertEquals("subnet-1", request.getSubnetNativeId());
        assertEquals("key-1", request.getKeyPairName());
        assertEquals("profile-1", request.getIamInstanceProfileName());
        assertTrue(request.isShouldPowerOn());

        assertEquals(2, request.getEbsBlockDeviceMappings().size());
        assertEquals("kms-root", request.getEbsBlockDeviceMappings().get(0).getKmsKeyNativeId());
        assertNull(request.getEbsBlockDeviceMappings().get(1).getKmsKeyNativeId());

        assertEquals(2, request.getNetworkInterfaces().size());
        assertEquals(ImmutableList.of("sg-1"), request.getNetworkInterfaces().get(0).getSecurityGroupNativeIds());
        assertEquals(ImmutableList.of("sg-2", "sg-3"), request.getNetworkInterfaces().get(1).getSecurityGroupNativeIds());
        assertEquals("subnet-1", request.getNetworkInterfaces().get(1).getSubnetNativeId());
    }

    @Test
    public void ec2RequestAppliesTargetNetworkAndKmsEverywhere() {
        final Ec2RestoreRequest request = new Ec2RestoreRequestBuilder().build(ec2("b-1"),
                                                                               spec("target_account", OTHER_ACCOUNT,
                                                                                    "target_vpc_native_id", "vpc-9",
                                                                                    "target_subnet_native_id", "subnet-9",
                                                                                    "target_security_group_native_ids", ImmutableList.of("sg-9"),
                                                                                    "target_kms_key_native_id", "kms-9"),
                                                                               "env-2");

        assertEquals("vpc-9", request.getVpcNativeId());
        assertEquals("subnet-9", request.getSubnetNativeId());
        assertEquals("key-1", request.getKeyPairName());
        assertNull(request.getIamInstanceProfileName());
        request.getEbsBlockDeviceMappings().forEach(mapping -> assertEquals("kms-9", mapping.getKmsKeyNativeId()));
        request.getNetworkInterfaces().forEach(ni -> {
            assertEquals("subnet-9", ni.getSubnetNativeId());
            assertEquals(ImmutableList.of("sg-9"), ni.getSecurityGroupNativeIds());
        });
    }

    @Test
    public void rdsRequest() {
        final RdsRestoreRequest request = new RdsRestoreRequestBuilder().build(rds("b-1", new Instance("db-1", "db.t3.medium", true)),
                                                                               spec("target_rds_name", "restored",
                                                                                    "target_instance_class", "db.t3.large",
                                                                                    "target_subnet_group_name", "sng",
                                                                                    "target_security_group_native_ids", ImmutableList.of("sg-1"),
                                                                                    "target_kms_key_native_id", "kms-1"),
                                                                               "env-1");

        assertEquals("restored", request.getName());
        assertEquals("db.t3.large", request.getInstanceClass());
        assertEquals("sng", request.getSubnetGroupName());
        assertEquals(ImmutableList.of("sg-1"), request.getSecurityGroupNativeIds());
        assertTrue(request.isPubliclyAccessible());
    }

    @Test
    public void rdsIsPubliclyAccessibleOnlyWhenEveryInstanceIs() {
        assertTrue(RdsRestoreRequestBuilder.publiclyAccessible(rds("b-1", new Instance("a", "c", true), new Instance("b", "c", true))));
        assertFalse(RdsRestoreRequestBuilder.publiclyAccessible(rds("b-1", new Instance("a", "c", true), new Instance("b", "c", false))));
        assertFalse(RdsRestoreRequestBuilder.publiclyAccessible(rds("b-1")));
    }

    @Test
    public void dynamoDbRequestCopiesTableSettings() {
        final DynamoDbRestoreRequest request = new DynamoDbRestoreRequestBuilder().build(dynamoDb("b-1"),
                                                                                         spec("target_table_name", "orders-copy"),
                                                                                         "env-1");

        assertEquals("orders-copy", request.getTableName());
        assertEquals("PROVISIONED", request.getBillingMode());
        assertEquals("STANDARD", request.getTableClass());
        assertEquals(5, request.getProvisionedThroughput().get("read_capacity_units").asInt());
        assertEquals("KMS", request.getSseSpecification().get("sse_type").asText());
    }

    @Test
    public void protectionGroupRequestUsesTargetBucket() {
        final FakeBackendApi backend = new FakeBackendApi();
        backend.s3Buckets.add(ImmutableList.of(new S3Bucket("bucket-id-1", "restore-bucket-old", "env-9", ACCOUNT, REGION),
                                               new S3Bucket("bucket-id-2", "restore-bucket", "env-7", ACCOUNT, REGION),
                                               new S3Bucket("bucket-id-3", "restore-bucket", "env-8", OTHER_ACCOUNT, REGION)));

        final ProtectionGroupRestoreRequestBuilder builder = new ProtectionGroupRestoreRequestBuilder(backend, new RetrySpec());

        assertFalse(builder.requiresEnvironment());

        final ProtectionGroupRestoreRequest request = builder.build(protectionGroup("b-1"),
                                                                    spec("target_account", ACCOUNT,
                                                                         "target_region", REGION,
                                                                         "target_bucket", "restore-bucket",
                                                                         "target_prefix", "restored/"),
                                                                    null);

        assertEquals("bucket-id-2", request.getBucketId());
        assertEquals("env-7", request.getEnvironmentId());
        assertEquals("restored/", request.getPrefix());
        assertEquals(ImmutableList.of("asset-1", "asset-2"), request.getProtectionGroupS3AssetIds());
        assertEquals(ImmutableMap.of("prefix", "invoices/", "latest_version_only", true), request.getObjectFilters());
    }

    @Test
    public void protectionGroupRequestFailsWithoutBucket() {
        final ProtectionGroupRestoreRequestBuilder builder = new ProtectionGroupRestoreRequestBuilder(new FakeBackendApi(), new RetrySpec());

        assertThrows(NotFoundException.class, () -> builder.build(protectionGroup("b-1"),
                                                                  spec("target_account", ACCOUNT, "target_region", REGION, "target_bucket", "missing"),
                                                                  null));
    }
}
