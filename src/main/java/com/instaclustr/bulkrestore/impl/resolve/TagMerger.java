package com.instaclustr.bulkrestore.impl.resolve;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.instaclustr.bulkrestore.impl.Tag;
import com.instaclustr.bulkrestore.impl.spec.TargetField;
import com.instaclustr.bulkrestore.impl.spec.TargetSpec;

/**
 * Appends operator tags to the tags a restored resource gets. A tag equal to an existing one is not
 * repeated, a new value of an existing key is added as another tag.
 */
public final class TagMerger {

    private TagMerger() {
    }

    public static List<Tag> merge(final List<Tag> tags, final Map<String, String> appendTags) {
        final List<Tag> merged = new ArrayList<>(tags == null ? new ArrayList<>() : tags);

        if (appendTags != null) {
            for (final Map.Entry<String, String> entry : appendTags.entrySet()) {
                final Tag tag = Tag.of(entry.getKey(), entry.getValue());
                if (!merged.contains(tag)) {
                    merged.add(tag);
                }
            }
        }

        return merged;
    }

    /**
     * Stores the merge of the spec's own tags, or the source tags when it has none, and its
     * {@code append_tags} as the spec's {@code tags}.
     */
    public static TargetSpec mergeInto(final TargetSpec spec, final List<Tag> sourceTags) {
        final List<Tag> base = spec.isBlank(TargetField.TAGS) ? sourceTags : spec.getTags();
        final List<Tag> merged = merge(base, spec.getAppendTags());

        final TargetSpec withoutAppendTags = spec.without(TargetField.APPEND_TAGS);

        return merged.isEmpty() ? withoutAppendTags.without(TargetField.TAGS) : withoutAppendTags.with(TargetField.TAGS, merged);
    }
}
