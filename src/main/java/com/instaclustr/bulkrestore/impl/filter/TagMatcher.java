package com.instaclustr.bulkrestore.impl.filter;

import java.util.List;

import com.instaclustr.bulkrestore.impl.Tag;
import com.instaclustr.bulkrestore.impl.record.BackupRecord;

import static com.google.common.base.Strings.isNullOrEmpty;
import static java.util.stream.Collectors.toList;

/**
 * Keeps records carrying a tag with exactly the searched key and value. A record with several tags of the
 * same key matches when any of them has the searched value.
 */
public final class TagMatcher {

    private TagMatcher() {
    }

    public static <T extends BackupRecord> List<T> filter(final List<T> records, final String key, final String value) {
        if (isNullOrEmpty(key) || isNullOrEmpty(value)) {
            return records;
        }

        final Tag searched = Tag.of(key, value);

        return records.stream().filter(record -> record.getSourceTags().contains(searched)).collect(toList());
    }
}
