package com.instaclustr.bulkrestore.impl.list;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.instaclustr.bulkrestore.impl.NotFoundException;
import com.instaclustr.bulkrestore.impl.Tag;
import com.instaclustr.bulkrestore.impl.TooManyResultsException;
import com.instaclustr.bulkrestore.impl.ValidationException;
import com.instaclustr.bulkrestore.impl.backend.FakeBackendApi;
import com.instaclustr.bulkrestore.impl.backend.ProtectionGroup;
import com.instaclustr.bulkrestore.impl.backend.ProtectionGroupBackup;
import com.instaclustr.bulkrestore.impl.backend.ProtectionGroupS3Asset;
import com.instaclustr.bulkrestore.impl.filter.FilterOperator;
import com.instaclustr.bulkrestore.impl.filter.TimeWindowFilterBuilder;
import com.instaclustr.bulkrestore.impl.record.EbsBackupRecord;
import com.instaclustr.bulkrestore.impl.record.ProtectionGroupBackupRecord;
import org.junit.jupiter.api.Test;

import static com.instaclustr.bulkrestore.impl.record.BackupRecords.ACCOUNT;
import static com.instaclustr.bulkrestore.impl.record.BackupRecords.OTHER_ACCOUNT;
import static com.instaclustr.bulkrestore.impl.record.BackupRecords.REGION;
import static com.instaclustr.bulkrestore.impl.record.BackupRecords.ebs;
import static com.instaclustr.bulkrestore.impl.record.BackupRecords.ebsIn;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class BackupListerTest {

    private final FakeBackendApi backend = new FakeBackendApi();

    private final TimeWindowFilterBuilder timeWindowFilterBuilder =
        new TimeWindowFilterBuilder(Clock.fixed(Instant.parse("2024-03-10T15:30:00Z"), ZoneOffset.UTC));

    private static DiscoverySpec discovery() {
        final DiscoverySpec spec = new DiscoverySpec();
        spec.sourceAccount = ACCOUNT;
        spec.sourceRegion = REGION;
        spec.searchDirection = "before";
        spec.endDayOffset = 0;
        return spec;
    }

    @Test
    public void keepsBackupsOfSourceAccountAndRegion() {
        backend.ebsBackups.add(ImmutableList.of(ebs("b-1", "vol-1", "gp2", null),
                                                ebsIn("b-2", "vol-2", OTHER_ACCOUNT, REGION),
                                                ebsIn("b-3", "vol-3", ACCOUNT, "eu-west-1"),
                                                ebs("b-4", "vol-4", "gp2", null)));

        final List<EbsBackupRecord> records = new EbsBackupLister(backend, timeWindowFilterBuilder).list(discovery());

        assertEquals(2, records.size());
        assertEquals("b-1", records.get(0).getSourceBackupId());
        assertEquals("b-4", records.get(1).getSourceBackupId());

        // four records over pages of two
        assertEquals(2, backend.ebsBackups.calls.size());
        assertEquals("2024-03-10T23:59:59Z", backend.ebsBackups.calls.get(0).filter.get("start_timestamp", FilterOperator.LTE));
    }

    @Test
    public void assetIdIsSentToBackend() {
        final DiscoverySpec spec = discovery();
        spec.searchAssetId = "vol-1";

        new EbsBackupLister(backend, timeWindowFilterBuilder).list(spec);

        assertEquals("vol-1", backend.ebsBackups.calls.get(0).filter.get("volume_id", FilterOperator.EQ));
    }

    @Test
    public void filtersByTagAndKeepsLatest() {
        backend.ebsBackups.add(ImmutableList.of(ebs("b-1", "vol-1", "gp2", null, Tag.of("team", "a")),
                                                ebs("b-2", "vol-1", "gp2", null, Tag.of("team", "a")),
                                                ebs("b-3", "vol-2", "gp2", null, Tag.of("team", "b")),
                                                ebs("b-4", "vol-3", "gp2", null, Tag.of("team", "a"))));

        final DiscoverySpec spec = discovery();
        spec.searchTagKey = "team";
        spec.searchTagValue = "a";
        spec.latestOnly = true;

        final List<EbsBackupRecord> records = new EbsBackupLister(backend, timeWindowFilterBuilder).list(spec);

        assertEquals(2, records.size());
        assertEquals("b-1", records.get(0).getSourceBackupId());
        assertEquals("b-4", records.get(1).getSourceBackupId());
    }

    @Test
    public void tooManyResults() {
        backend.ebsBackups.add(ImmutableList.of(ebs("b-1", "vol-1", "gp2", null),
                                                ebs("b-2", "vol-2", "gp2", null),
                                                ebs("b-3", "vol-3", "gp2", null)));

        final DiscoverySpec spec = discovery();
        spec.maxResults = 2;

        assertThrows(TooManyResultsException.class, () -> new EbsBackupLister(backend, timeWindowFilterBuilder).list(spec));
    }

    @Test
    public void sourceRegionIsRequired() {
        final DiscoverySpec spec = discovery();
        spec.sourceRegion = null;

        assertThrows(ValidationException.class, () -> new EbsBackupLister(backend, timeWindowFilterBuilder).list(spec));
    }

    @Test
    public void protectionGroupBackups() {
        backend.protectionGroups.add(ImmutableList.of(new ProtectionGroup("pg-1", "documents")));
        backend.protectionGroupS3Assets.add(ImmutableList.of(new ProtectionGroupS3Asset("asset-1", "pg-1", "bucket-a"),
                                                             new ProtectionGroupS3Asset("asset-2", "pg-1", "bucket-b")));
        backend.protectionGroupBackups.add(ImmutableList.of(new ProtectionGroupBackup("pgb-2", "pg-1", "2024-03-10T01:00:00Z", "2024-04-10T01:00:00Z"),
                                                            new ProtectionGroupBackup("pgb-1", "pg-1", "2024-03-09T01:00:00Z", "2024-04-09T01:00:00Z")));

        final DiscoverySpec spec = discovery();
        spec.protectionGroupName = "documents";
        spec.bucketNames = ImmutableList.of("bucket-b");

        final List<ProtectionGroupBackupRecord> records = new ProtectionGroupBackupLister(backend, timeWindowFilterBuilder).list(spec);

        assertEquals(1, records.size());
        assertEquals("pgb-2", records.get(0).getSourceBackupId());
        assertEquals(ImmutableList.of("asset-2"), records.get(0).getProtectionGroupS3AssetIds());
        assertEquals("documents", records.get(0).getProtectionGroupName());
    }

    @Test
    public void unknownBucketOfProtectionGroup() {
        backend.protectionGroups.add(ImmutableList.of(new ProtectionGroup("pg-1", "documents")));
        backend.protectionGroupS3Assets.add(ImmutableList.of(new ProtectionGroupS3Asset("asset-1", "pg-1", "bucket-a")));

        final DiscoverySpec spec = discovery();
        spec.protectionGroupName = "documents";
        spec.bucketNames = ImmutableList.of("bucket-a", "bucket-z");

        final NotFoundException ex = assertThrows(NotFoundException.class,
                                                  () -> new ProtectionGroupBackupLister(backend, timeWindowFilterBuilder).list(spec));

        assertTrue(ex.getMessage().contains("bucket-z"));
    }

    @Test
    public void unknownProtectionGroupListsNothing() {
        final DiscoverySpec spec = discovery();
        spec.protectionGroupName = "missing";

        assertTrue(new ProtectionGroupBackupLister(backend, timeWindowFilterBuilder).list(spec).isEmpty());
    }
}
