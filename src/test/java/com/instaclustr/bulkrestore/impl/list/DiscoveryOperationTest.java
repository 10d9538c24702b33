package com.instaclustr.bulkrestore.impl.list;

import java.time.Clock;
import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.instaclustr.bulkrestore.impl.NotFoundException;
import com.instaclustr.bulkrestore.impl.ResourceType;
import com.instaclustr.bulkrestore.impl.ValidationException;
import com.instaclustr.bulkrestore.impl.backend.Environment;
import com.instaclustr.bulkrestore.impl.backend.FakeBackendApi;
import com.instaclustr.bulkrestore.impl.filter.TimeWindowFilterBuilder;
import com.instaclustr.bulkrestore.impl.retry.Retrier;
import com.instaclustr.bulkrestore.impl.retry.RetrierFactory;
import com.instaclustr.bulkrestore.operations.Operation;
import org.junit.jupiter.api.Test;

import static com.instaclustr.bulkrestore.impl.record.BackupRecords.ACCOUNT;
import static com.instaclustr.bulkrestore.impl.record.BackupRecords.REGION;
import static com.instaclustr.bulkrestore.impl.record.BackupRecords.dynamoDb;
import static com.instaclustr.bulkrestore.impl.record.BackupRecords.ebs;
import static com.instaclustr.bulkrestore.impl.record.BackupRecords.ebsIn;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class DiscoveryOperationTest {

    private final FakeBackendApi backend = new FakeBackendApi();

    private final Retrier noRetries = RetrierFactory.getRetrier(null);

    private final EnvironmentResolver environmentResolver = new EnvironmentResolver(backend, noRetries);

    private DiscoveryOperation operation(final DiscoveryOperationRequest request) {
        final TimeWindowFilterBuilder timeWindowFilterBuilder = new TimeWindowFilterBuilder(Clock.systemUTC());

        final Map<ResourceType, BackupLister> listers = ImmutableMap.<ResourceType, BackupLister>builder()
            .put(ResourceType.BLOCK_VOLUME, new EbsBackupLister(backend, timeWindowFilterBuilder))
            .put(ResourceType.COMPUTE_INSTANCE, new Ec2BackupLister(backend, timeWindowFilterBuilder))
            .put(ResourceType.MANAGED_DATABASE, new RdsBackupLister(backend, timeWindowFilterBuilder))
            .put(ResourceType.KEY_VALUE_TABLE, new DynamoDbBackupLister(backend, timeWindowFilterBuilder))
            .put(ResourceType.OBJECT_PROTECTION_GROUP, new ProtectionGroupBackupLister(backend, timeWindowFilterBuilder))
            .build();

        return new DiscoveryOperation(request, listers, new RegionLister(environmentResolver));
    }

    private static DiscoverySpec discovery() {
        final DiscoverySpec spec = new DiscoverySpec();
        spec.sourceAccount = ACCOUNT;
        spec.sourceRegion = REGION;
        return spec;
    }

    @Test
    public void discoversEveryTypeOfRegion() {
        backend.ebsBackups.add(ImmutableList.of(ebs("b-1", "vol-1", "gp2", null)));
        backend.dynamoDbBackups.add(ImmutableList.of(dynamoDb("b-2")));

        final DiscoveryOperation operation = operation(new DiscoveryOperationRequest("discover", discovery(), null, false));

        operation.run();

        assertEquals(Operation.State.COMPLETED, operation.state);

        final DiscoveryResult result = operation.request.response;

        assertEquals(ACCOUNT, result.getSourceAccount());
        assertEquals(1, result.getRegions().size());
        assertEquals(2, result.size());
        assertEquals(ImmutableList.of(ResourceType.BLOCK_VOLUME, ResourceType.KEY_VALUE_TABLE),
                     ImmutableList.copyOf(result.getRegions().get(0).getBackups().keySet()));
        // protection groups are listed only when a group name is given
        assertTrue(backend.protectionGroups.calls.isEmpty());
    }

    @Test
    public void discoversAllRegionsOfAccount() {
        backend.environments.add(ImmutableList.of(new Environment("env-1", ACCOUNT, REGION),
                                                  new Environment("env-2", ACCOUNT, "eu-west-1"),
                                                  new Environment("env-3", "999999999999", "ap-south-1")));
        backend.ebsBackups.add(ImmutableList.of(ebs("b-1", "vol-1", "gp2", null), ebsIn("b-2", "vol-2", ACCOUNT, "eu-west-1")));

        final DiscoverySpec spec = discovery();
        spec.sourceRegion = null;

        final DiscoveryOperation operation = operation(new DiscoveryOperationRequest("discover", spec, ImmutableList.of(ResourceType.BLOCK_VOLUME), true));

        operation.run();

        final DiscoveryResult result = operation.request.response;

        assertEquals(2, result.getRegions().size());
        assertEquals(REGION, result.getRegions().get(0).getRegion());
        assertEquals("eu-west-1", result.getRegions().get(1).getRegion());
        assertEquals("b-2", result.getRegions().get(1).getBackups().get(ResourceType.BLOCK_VOLUME).get(0).getSourceBackupId());
    }

    @Test
    public void emptyRegionsAreKept() {
        final DiscoveryOperation operation = operation(new DiscoveryOperationRequest("discover", discovery(), ImmutableList.of(ResourceType.MANAGED_DATABASE), false));

        operation.run();

        assertEquals(Operation.State.COMPLETED, operation.state);
        assertEquals(0, operation.request.response.size());
        assertTrue(operation.request.response.getRegions().get(0).getBackups().isEmpty());
    }

    @Test
    public void requestValidation() {
        final DiscoverySpec spec = discovery();
        spec.sourceRegion = null;

        assertThrows(ValidationException.class, () -> new DiscoveryOperationRequest("discover", spec, null, false).validate());

        new DiscoveryOperationRequest("discover", spec, null, true).validate();
    }

    @Test
    public void environmentLookup() {
        backend.environments.add(ImmutableList.of(new Environment("env-1", ACCOUNT, REGION)));

        assertEquals("env-1", environmentResolver.resolveEnvironmentId(ACCOUNT, REGION));
        assertThrows(NotFoundException.class, () -> environmentResolver.resolveEnvironmentId(ACCOUNT, "eu-west-1"));
        assertThrows(ValidationException.class, () -> environmentResolver.resolveEnvironmentId(null, REGION));
        assertFalse(new RegionLister(environmentResolver).listRegions(ACCOUNT).isEmpty());
    }
}
