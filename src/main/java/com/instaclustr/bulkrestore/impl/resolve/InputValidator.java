package com.instaclustr.bulkrestore.impl.resolve;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.instaclustr.bulkrestore.impl.ResourceType;
import com.instaclustr.bulkrestore.impl.ValidationException;
import com.instaclustr.bulkrestore.impl.spec.RestoreGroup;
import com.instaclustr.bulkrestore.impl.spec.TargetSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.lang.String.format;

/**
 * Completes restore groups with the operator's default input of their resource type. Explicit values of a
 * group are kept, missing and blank ones and those following the default input are replaced by the default.
 */
public class InputValidator {

    private static final Logger logger = LoggerFactory.getLogger(InputValidator.class);

    /**
     * @return new restore groups, the given ones are not modified
     * @throws ValidationException when a declared default is empty or an empty field of a group has no default
     */
    public List<RestoreGroup> validate(final Map<ResourceType, TargetSpec> defaultInput, final List<RestoreGroup> restoreGroups) {
        final List<RestoreGroup> validated = new ArrayList<>();

        for (final RestoreGroup group : restoreGroups) {
            final TargetSpec defaults = defaultInput == null ? null : defaultInput.get(group.getResourceType());

            TargetSpec target = group.getTarget();

            if (defaults != null) {
                for (final String field : defaults.fields()) {
                    if (defaults.isEmpty(field)) {
                        throw new ValidationException(field, format("The required input %s for resource type %s should be filled.",
                                                                    field, group.getResourceType()));
                    }
                    if (!target.contains(field)) {
                        target = target.with(field, defaults.get(field));
                    }
                }
            }

            for (final String field : target.fields()) {
                if (!target.isEmpty(field)) {
                    continue;
                }
                if (defaults == null || defaults.isEmpty(field)) {
                    throw new ValidationException(field, format("The input %s of resource type %s is empty and there is no default for it.",
                                                                field, group.getResourceType()));
                }
                target = target.with(field, defaults.get(field));
            }

            validated.add(group.withTarget(target));
        }

        logger.info("Validated {} restore groups", validated.size());

        return validated;
    }
}
