package com.pagewright.core.filter;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class SimpleFilterRegistryTest {

    @Test
    void resolve_registeredFilter_returnsIt() {
        UpcaseFilter upcase = new UpcaseFilter();
        FilterRegistry registry = SimpleFilterRegistry.of(upcase, new ExpandFilter());

        assertThat(registry.resolve("upcase")).containsSame(upcase);
        assertThat(registry.resolve("markdown")).isEmpty();
    }

    @Test
    void new_withDuplicateIds_throws() {
        assertThatThrownBy(() -> SimpleFilterRegistry.of(new UpcaseFilter(), new UpcaseFilter()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("upcase");
    }
}
