package com.pagewright.core.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Registry that discovers filters via Java Service Provider Interface (SPI).
 *
 * <p>Filters are listed in {@code META-INF/services/com.pagewright.core.filter.Filter}
 * and loaded once, when the registry is created.
 */
public class ServiceLoaderFilterRegistry implements FilterRegistry {

    private static final Logger log = LoggerFactory.getLogger(ServiceLoaderFilterRegistry.class);

    private final SimpleFilterRegistry delegate;

    public ServiceLoaderFilterRegistry() {
        this(Thread.currentThread().getContextClassLoader());
    }

    /**
     * Discovers filters visible to the given class loader.
     *
     * @param classLoader class loader used for discovery
     */
    public ServiceLoaderFilterRegistry(ClassLoader classLoader) {
        log.debug("Discovering filters via ServiceLoader");
        List<Filter> filters = ServiceLoader.load(Filter.class, classLoader).stream()
            .map(ServiceLoader.Provider::get)
            .toList();
        filters.forEach(filter -> log.debug("Found filter: {} ({} -> {})",
            filter.getId(), filter.getInputKind(), filter.getOutputKind()));
        log.info("Discovered {} filters", filters.size());
        this.delegate = new SimpleFilterRegistry(filters);
    }

    @Override
    public Optional<Filter> resolve(String name) {
        return delegate.resolve(name);
    }
}
