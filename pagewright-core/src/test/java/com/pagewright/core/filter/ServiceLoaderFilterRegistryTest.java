package com.pagewright.core.filter;

import org.junit.jupiter.api.Test;

import java.util.ServiceLoader;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Validates SPI registration of filters.
 *
 * <p>Every filter listed in {@code META-INF/services} must be instantiable and carry a
 * unique identifier.
 */
class ServiceLoaderFilterRegistryTest {

    @Test
    void serviceLoader_discoversAllRegisteredFilters() {
        Set<String> ids = ServiceLoader.load(Filter.class).stream()
            .map(ServiceLoader.Provider::get)
            .map(Filter::getId)
            .collect(Collectors.toSet());

        Set<String> expected = TestFilters.all().stream().map(Filter::getId).collect(Collectors.toSet());
        assertThat(ids).isEqualTo(expected);
    }

    @Test
    void resolve_discoveredFilter_hasDeclaredKinds() {
        FilterRegistry registry = new ServiceLoaderFilterRegistry();

        assertThat(registry.resolve("text_to_binary")).hasValueSatisfying(filter -> {
            assertThat(filter.getInputKind().isBinary()).isFalse();
            assertThat(filter.getOutputKind().isBinary()).isTrue();
        });
        assertThat(registry.resolve("does_not_exist")).isEmpty();
    }
}
