package com.instaclustr.bulkrestore.impl.resolve;

import java.util.Set;

import com.google.common.collect.ImmutableSet;
import com.instaclustr.bulkrestore.impl.ValidationException;
import com.instaclustr.bulkrestore.impl.record.EbsBackupRecord;
import com.instaclustr.bulkrestore.impl.spec.TargetSpec;

import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_AZ;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_IOPS;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_KMS_KEY_NATIVE_ID;
import static com.instaclustr.bulkrestore.impl.spec.TargetField.TARGET_VOLUME_TYPE;
import static java.lang.String.format;

public class EbsTargetSpecResolver extends AbstractTargetSpecResolver<EbsBackupRecord> {

    /**
     * Volume types accepting provisioned IOPS.
     */
    public static final Set<String> IOPS_VOLUME_TYPES = ImmutableSet.of("gp3", "io1", "io2");

    public EbsTargetSpecResolver() {
        super(EbsBackupRecord.class);
    }

    @Override
    protected TargetSpec resolveFields(final TargetSpec spec, final EbsBackupRecord record, final boolean crossAccount) {
        TargetSpec resolved = inherit(spec, TARGET_AZ, record.getSourceAz(), crossAccount, false);
        resolved = inherit(resolved, TARGET_VOLUME_TYPE, record.getSourceVolumeType(), crossAccount, false);
        resolved = inherit(resolved, TARGET_KMS_KEY_NATIVE_ID, record.getSourceKms(), crossAccount, true);

        if (resolved.isBlank(TARGET_IOPS)) {
            final String volumeType = resolved.getString(TARGET_VOLUME_TYPE);
            final Integer sourceIops = record.getSourceIops();
            final boolean inheritIops = !crossAccount && IOPS_VOLUME_TYPES.contains(volumeType) && sourceIops != null;
            resolved = resolved.with(TARGET_IOPS, inheritIops ? sourceIops : 0);
        }

        checkIops(resolved);

        return resolved;
    }

    /**
     * @throws ValidationException when non-zero IOPS are requested for a volume type not accepting them
     */
    public static void checkIops(final TargetSpec spec) {
        final Integer iops = spec.getInteger(TARGET_IOPS);

        if (iops == null || iops == 0 || spec.isFollowDefault(TARGET_VOLUME_TYPE)) {
            return;
        }

        final String volumeType = spec.getString(TARGET_VOLUME_TYPE);

        if (!IOPS_VOLUME_TYPES.contains(volumeType)) {
            throw new ValidationException(TARGET_IOPS.getJsonName(),
                                          format("target_iops %s can not be set for volume type %s, only for %s", iops, volumeType, IOPS_VOLUME_TYPES));
        }
    }
}
