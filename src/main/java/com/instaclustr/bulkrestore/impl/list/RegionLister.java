package com.instaclustr.bulkrestore.impl.list;

import java.util.LinkedHashMap;
import java.util.Map;

import com.google.inject.Inject;
import com.instaclustr.bulkrestore.impl.backend.Environment;

/**
 * Regions in which an account is connected to the backend.
 */
public class RegionLister {

    private final EnvironmentResolver environmentResolver;

    @Inject
    public RegionLister(final EnvironmentResolver environmentResolver) {
        this.environmentResolver = environmentResolver;
    }

    /**
     * @return environment id by region, in the order the backend listed the environments
     */
    public Map<String, String> listRegions(final String account) {
        final Map<String, String> regions = new LinkedHashMap<>();
        for (final Environment environment : environmentResolver.environmentsOf(account)) {
            regions.putIfAbsent(environment.getRegion(), environment.getId());
        }
        return regions;
    }
}
