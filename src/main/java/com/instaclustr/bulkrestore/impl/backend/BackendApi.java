package com.instaclustr.bulkrestore.impl.backend;

import com.instaclustr.bulkrestore.impl.record.DynamoDbBackupRecord;
import com.instaclustr.bulkrestore.impl.record.EbsBackupRecord;
import com.instaclustr.bulkrestore.impl.record.Ec2BackupRecord;
import com.instaclustr.bulkrestore.impl.record.RdsBackupRecord;

/**
 * Entry point to the backup backend. Transport, authentication and credential retrieval live behind this
 * interface, an implementation is bound in the injector by the embedding application.
 * <p>
 * Backup listings return records already mapped from the backend's wire representation, each carrying
 * the account and region it was taken in.
 */
public interface BackendApi {

    ListingEndpoint<EbsBackupRecord> ebsBackups();

    ListingEndpoint<Ec2BackupRecord> ec2Backups();

    ListingEndpoint<RdsBackupRecord> rdsBackups();

    ListingEndpoint<DynamoDbBackupRecord> dynamoDbBackups();

    ListingEndpoint<Environment> environments();

    ListingEndpoint<S3Bucket> s3Buckets();

    ListingEndpoint<ProtectionGroup> protectionGroups();

    ListingEndpoint<ProtectionGroupS3Asset> protectionGroupS3Assets();

    ListingEndpoint<ProtectionGroupBackup> protectionGroupBackups();

    RestoreEndpoint restores();

    TaskEndpoint tasks();
}
