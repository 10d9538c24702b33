package com.instaclustr.bulkrestore.impl.backend;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.instaclustr.bulkrestore.impl.AuthException;
import com.instaclustr.bulkrestore.impl.record.DynamoDbBackupRecord;
import com.instaclustr.bulkrestore.impl.record.EbsBackupRecord;
import com.instaclustr.bulkrestore.impl.record.Ec2BackupRecord;
import com.instaclustr.bulkrestore.impl.record.RdsBackupRecord;
import com.instaclustr.bulkrestore.impl.restore.RestoreRequest;

public class FakeBackendApi implements BackendApi {

    public final FakeEndpoint<EbsBackupRecord> ebsBackups = new FakeEndpoint<>(2);
    public final FakeEndpoint<Ec2BackupRecord> ec2Backups = new FakeEndpoint<>(2);
    public final FakeEndpoint<RdsBackupRecord> rdsBackups = new FakeEndpoint<>(2);
    public final FakeEndpoint<DynamoDbBackupRecord> dynamoDbBackups = new FakeEndpoint<>(2);

    public final FakeEndpoint<Environment> environments = new FakeEndpoint<Environment>(10)
        .field("account_native_id", Environment::getAccountNativeId)
        .field("aws_region", Environment::getRegion);

    public final FakeEndpoint<S3Bucket> s3Buckets = new FakeEndpoint<S3Bucket>(10)
        .field("account_native_id", S3Bucket::getAccountNativeId)
        .field("aws_region", S3Bucket::getRegion)
        .field("name", S3Bucket::getName);

    public final FakeEndpoint<ProtectionGroup> protectionGroups = new FakeEndpoint<ProtectionGroup>(10)
        .field("name", ProtectionGroup::getName);

    public final FakeEndpoint<ProtectionGroupS3Asset> protectionGroupS3Assets = new FakeEndpoint<ProtectionGroupS3Asset>(10)
        .field("protection_group_id", ProtectionGroupS3Asset::getProtectionGroupId);

    public final FakeEndpoint<ProtectionGroupBackup> protectionGroupBackups = new FakeEndpoint<ProtectionGroupBackup>(10)
        .field("protection_group_id", ProtectionGroupBackup::getProtectionGroupId);

    public final FakeRestoreEndpoint restores = new FakeRestoreEndpoint();
    public final FakeTaskEndpoint tasks = new FakeTaskEndpoint();

    @Override
    public ListingEndpoint<EbsBackupRecord> ebsBackups() {
        return ebsBackups;
    }

    @Override
    public ListingEndpoint<Ec2BackupRecord> ec2Backups() {
        return ec2Backups;
    }

    @Override
    public ListingEndpoint<RdsBackupRecord> rdsBackups() {
        return rdsBackups;
    }

    @Override
    public ListingEndpoint<DynamoDbBackupRecord> dynamoDbBackups() {
        return dynamoDbBackups;
    }

    @Override
    public ListingEndpoint<Environment> environments() {
        return environments;
    }

    @Override
    public ListingEndpoint<S3Bucket> s3Buckets() {
        return s3Buckets;
    }

    @Override
    public ListingEndpoint<ProtectionGroup> protectionGroups() {
        return protectionGroups;
    }

    @Override
    public ListingEndpoint<ProtectionGroupS3Asset> protectionGroupS3Assets() {
        return protectionGroupS3Assets;
    }

    @Override
    public ListingEndpoint<ProtectionGroupBackup> protectionGroupBackups() {
        return protectionGroupBackups;
    }

    @Override
    public RestoreEndpoint restores() {
        return restores;
    }

    @Override
    public TaskEndpoint tasks() {
        return tasks;
    }

    /**
     * Accepts every request as task {@code task-<n>} unless a rejection is set.
     */
    public static class FakeRestoreEndpoint implements RestoreEndpoint {

        public final List<RestoreRequest> submitted = new ArrayList<>();
        public SubmissionResponse rejection;

        @Override
        public synchronized SubmissionResponse submit(final RestoreRequest request) {
            submitted.add(request);
            if (rejection != null) {
                return rejection;
            }
            return SubmissionResponse.accepted("task-" + submitted.size());
        }
    }

    /**
     * Replays scripted statuses per task, the last one is repeated. Unscripted tasks are completed.
     */
    public static class FakeTaskEndpoint implements TaskEndpoint {

        public final Map<String, Deque<String>> statuses = new HashMap<>();
        public final List<String> reads = new ArrayList<>();
        public boolean unauthorized;

        public FakeTaskEndpoint script(final String taskId, final String... statuses) {
            final Deque<String> queue = new ArrayDeque<>();
            for (final String status : statuses) {
                queue.add(status);
            }
            this.statuses.put(taskId, queue);
            return this;
        }

        @Override
        public synchronized String readTask(final String taskId) throws AuthException {
            reads.add(taskId);

            if (unauthorized) {
                throw new AuthException("user not authorized to access task.");
            }

            final Deque<String> queue = statuses.get(taskId);

            if (queue == null || queue.isEmpty()) {
                return "completed";
            }

            return queue.size() > 1 ? queue.poll() : queue.peek();
        }
    }
}
