package com.instaclustr.bulkrestore.impl.list;

import java.util.List;

import com.google.inject.Inject;
import com.instaclustr.bulkrestore.impl.NotFoundException;
import com.instaclustr.bulkrestore.impl.ValidationException;
import com.instaclustr.bulkrestore.impl.backend.BackendApi;
import com.instaclustr.bulkrestore.impl.backend.Environment;
import com.instaclustr.bulkrestore.impl.filter.FilterExpression;
import com.instaclustr.bulkrestore.impl.retry.Retrier;
import com.instaclustr.bulkrestore.impl.retry.RetrierFactory;
import com.instaclustr.bulkrestore.impl.retry.RetrySpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Strings.isNullOrEmpty;
import static java.lang.String.format;
import static java.util.stream.Collectors.toList;

/**
 * Finds backend environments of an account. Lookups are retried according to the bound {@link RetrySpec}.
 */
public class EnvironmentResolver {

    private static final Logger logger = LoggerFactory.getLogger(EnvironmentResolver.class);

    static final String ACCOUNT_NATIVE_ID = "account_native_id";
    static final String AWS_REGION = "aws_region";

    private final BackendApi backendApi;
    private final Retrier retrier;

    @Inject
    public EnvironmentResolver(final BackendApi backendApi, final RetrySpec retrySpec) {
        this(backendApi, RetrierFactory.getRetrier(retrySpec));
    }

    public EnvironmentResolver(final BackendApi backendApi, final Retrier retrier) {
        this.backendApi = backendApi;
        this.retrier = retrier;
    }

    /**
     * @return id of the environment of the given account and region
     * @throws ValidationException when account or region is missing
     * @throws NotFoundException   when the backend knows no such environment
     */
    public String resolveEnvironmentId(final String account, final String region) {
        if (isNullOrEmpty(account)) {
            throw new ValidationException("target_account", "target_account is required");
        }
        if (isNullOrEmpty(region)) {
            throw new ValidationException("target_region", "target_region is required");
        }

        final FilterExpression filter = FilterExpression.builder()
            .eq(ACCOUNT_NATIVE_ID, account)
            .eq(AWS_REGION, region)
            .build();

        final List<Environment> environments = lookup(filter);

        if (environments.isEmpty()) {
            throw new NotFoundException(format("No authorized environment found for account %s in region %s", account, region));
        }

        logger.debug("Resolved environment {} for {}/{}", environments.get(0).getId(), account, region);

        return environments.get(0).getId();
    }

    /**
     * @return environments of the account, one per connected region
     */
    public List<Environment> environmentsOf(final String account) {
        if (isNullOrEmpty(account)) {
            throw new ValidationException("source_account", "source_account is required");
        }
        return lookup(FilterExpression.eq(ACCOUNT_NATIVE_ID, account)).stream()
            .filter(environment -> !isNullOrEmpty(environment.getRegion()))
            .collect(toList());
    }

    private List<Environment> lookup(final FilterExpression filter) {
        try {
            return retrier.submit(() -> PaginatedFilterFetcher.fetchAll(backendApi.environments(), filter));
        } catch (final RuntimeException ex) {
            throw ex;
        } catch (final Exception ex) {
            throw new IllegalStateException(format("Unable to list environments with filter %s", filter), ex);
        }
    }
}
