package com.instaclustr.bulkrestore.impl.list;

import java.util.List;

import com.instaclustr.bulkrestore.impl.record.BackupRecord;

/**
 * Discovers backups of one resource type. An empty list is a valid outcome.
 */
public interface BackupLister {

    List<? extends BackupRecord> list(final DiscoverySpec spec);
}
