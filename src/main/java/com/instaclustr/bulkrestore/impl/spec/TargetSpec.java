package com.instaclustr.bulkrestore.impl.spec;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.instaclustr.bulkrestore.impl.Tag;
import com.instaclustr.bulkrestore.impl.ValidationException;

import static java.lang.String.format;

/**
 * Immutable field-to-value mapping describing where and how one backup is restored. The same shape is used
 * for operator supplied per resource type defaults.
 * <p>
 * A field is empty when it is absent, a blank string or an empty collection. A field holding
 * {@link #FOLLOW_DEFAULT_INPUT} is not empty but still has to be filled from the defaults before a restore
 * request can be built from the spec.
 */
public final class TargetSpec {

    public static final String FOLLOW_DEFAULT_INPUT = "FOLLOW_DEFAULT_INPUT";

    private static final String SINGLE_SECURITY_GROUP_ALIAS = "target_security_group_native_id";

    private static final TargetSpec EMPTY = new TargetSpec(ImmutableMap.of());

    private final ImmutableMap<String, Object> values;

    private TargetSpec(final ImmutableMap<String, Object> values) {
        this.values = values;
    }

    public static TargetSpec empty() {
        return EMPTY;
    }

    /**
     * Builds a spec from a parsed JSON object. Tags become {@link Tag} lists, {@code append_tags} a string map,
     * {@code target_iops} an integer and security groups a list, {@code target_security_group_native_id}
     * being accepted for a single group. Null values are dropped.
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static TargetSpec of(final Map<String, Object> values) {
        if (values == null || values.isEmpty()) {
            return EMPTY;
        }

        final Map<String, Object> normalized = new LinkedHashMap<>();

        for (final Map.Entry<String, Object> entry : values.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            if (SINGLE_SECURITY_GROUP_ALIAS.equals(entry.getKey())) {
                normalized.putIfAbsent(TargetField.TARGET_SECURITY_GROUP_NATIVE_IDS.getJsonName(),
                                       normalize(TargetField.TARGET_SECURITY_GROUP_NATIVE_IDS.getJsonName(), entry.getValue()));
                continue;
            }
            normalized.put(entry.getKey(), normalize(entry.getKey(), entry.getValue()));
        }

        return new TargetSpec(ImmutableMap.copyOf(normalized));
    }

    @SuppressWarnings("unchecked")
    private static Object normalize(final String field, final Object value) {
        if (FOLLOW_DEFAULT_INPUT.equals(value)) {
            return value;
        }
        if (TargetField.TAGS.getJsonName().equals(field)) {
            return toTags(field, value);
        }
        if (TargetField.APPEND_TAGS.getJsonName().equals(field)) {
            if (!(value instanceof Map)) {
                throw new ValidationException(field, format("%s has to be an object of tag keys and values", field));
            }
            final ImmutableMap.Builder<String, String> appendTags = ImmutableMap.builder();
            ((Map<Object, Object>) value).forEach((k, v) -> appendTags.put(String.valueOf(k), v == null ? "" : String.valueOf(v)));
            return appendTags.build();
        }
        if (TargetField.TARGET_IOPS.getJsonName().equals(field)) {
            return toInteger(field, value);
        }
        if (TargetField.TARGET_SECURITY_GROUP_NATIVE_IDS.getJsonName().equals(field)) {
            if (value instanceof Collection) {
                return toStringList((Collection<Object>) value);
            }
            return value.toString().trim().isEmpty() ? ImmutableList.of() : ImmutableList.of(value.toString());
        }
        if (value instanceof Collection) {
            return ImmutableList.copyOf((Collection<Object>) value);
        }
        if (value instanceof Map) {
            return ImmutableMap.copyOf((Map<Object, Object>) value);
        }
        return value;
    }

    @SuppressWarnings("unchecked")
    private static List<Tag> toTags(final String field, final Object value) {
        if (!(value instanceof Collection)) {
            throw new ValidationException(field, format("%s has to be a list of key and value pairs", field));
        }
        final ImmutableList.Builder<Tag> tags = ImmutableList.builder();
        for (final Object tag : (Collection<Object>) value) {
            if (tag instanceof Tag) {
                tags.add((Tag) tag);
            } else if (tag instanceof Map) {
                final Map<String, Object> map = (Map<String, Object>) tag;
                tags.add(Tag.of(stringOrNull(map.get("key")), stringOrNull(map.get("value"))));
            } else {
                throw new ValidationException(field, format("%s contains an invalid tag %s", field, tag));
            }
        }
        return tags.build();
    }

    private static String stringOrNull(final Object value) {
        return value == null ? null : value.toString();
    }

    private static List<String> toStringList(final Collection<Object> values) {
        final ImmutableList.Builder<String> list = ImmutableList.builder();
        values.stream().filter(v -> v != null).map(Object::toString).forEach(list::add);
        return list.build();
    }

    private static Integer toInteger(final String field, final Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        final String text = value.toString().trim();
        if (text.isEmpty()) {
            return 0;
        }
        try {
            return Integer.parseInt(text);
        } catch (final NumberFormatException ex) {
            throw new ValidationException(field, format("%s has to be an integer, it is '%s'", field, value), ex);
        }
    }

    public boolean contains(final String field) {
        return values.containsKey(field);
    }

    public boolean contains(final TargetField field) {
        return contains(field.getJsonName());
    }

    public Object get(final String field) {
        return values.get(field);
    }

    public Object get(final TargetField field) {
        return get(field.getJsonName());
    }

    public String getString(final TargetField field) {
        final Object value = get(field);
        return value == null ? null : value.toString();
    }

    public Integer getInteger(final TargetField field) {
        final Object value = get(field);
        if (value == null || isFollowDefault(field)) {
            return null;
        }
        return toInteger(field.getJsonName(), value);
    }

    @SuppressWarnings("unchecked")
    public List<String> getStringList(final TargetField field) {
        final Object value = get(field);
        if (value == null || isFollowDefault(field)) {
            return ImmutableList.of();
        }
        if (value instanceof Collection) {
            return toStringList((Collection<Object>) value);
        }
        return ImmutableList.of(value.toString());
    }

    @SuppressWarnings("unchecked")
    public List<Tag> getTags() {
        final Object value = get(TargetField.TAGS);
        return value instanceof List ? (List<Tag>) value : ImmutableList.of();
    }

    @SuppressWarnings("unchecked")
    public Map<String, String> getAppendTags() {
        final Object value = get(TargetField.APPEND_TAGS);
        return value instanceof Map ? (Map<String, String>) value : ImmutableMap.of();
    }

    public boolean isFollowDefault(final String field) {
        return FOLLOW_DEFAULT_INPUT.equals(values.get(field));
    }

    public boolean isFollowDefault(final TargetField field) {
        return isFollowDefault(field.getJsonName());
    }

    /**
     * @return true when the field is absent, blank or an empty collection, the sentinel is not blank
     */
    public boolean isBlank(final String field) {
        return isBlankValue(values.get(field));
    }

    public boolean isBlank(final TargetField field) {
        return isBlank(field.getJsonName());
    }

    /**
     * @return true when the field is blank or follows the default input
     */
    public boolean isEmpty(final String field) {
        return isBlank(field) || isFollowDefault(field);
    }

    public boolean isEmpty(final TargetField field) {
        return isEmpty(field.getJsonName());
    }

    public static boolean isBlankValue(final Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String) {
            return ((String) value).trim().isEmpty();
        }
        if (value instanceof Collection) {
            return ((Collection<?>) value).isEmpty();
        }
        if (value instanceof Map) {
            return ((Map<?, ?>) value).isEmpty();
        }
        return false;
    }

    public TargetSpec with(final String field, final Object value) {
        if (value == null) {
            return without(field);
        }
        final Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.put(field, normalize(field, value));
        return new TargetSpec(ImmutableMap.copyOf(copy));
    }

    public TargetSpec with(final TargetField field, final Object value) {
        return with(field.getJsonName(), value);
    }

    public TargetSpec without(final String field) {
        if (!values.containsKey(field)) {
            return this;
        }
        final Map<String, Object> copy = new LinkedHashMap<>(values);
        copy.remove(field);
        return new TargetSpec(ImmutableMap.copyOf(copy));
    }

    public TargetSpec without(final TargetField field) {
        return without(field.getJsonName());
    }

    public Set<String> fields() {
        return values.keySet();
    }

    @JsonValue
    public Map<String, Object> toMap() {
        return values;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return values.equals(((TargetSpec) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("values", values).toString();
    }
}
