package com.pagewright.core.writer;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class FileActionTest {

    @Test
    void of_mapsCreatedAndModifiedFlags() {
        assertThat(FileAction.of(true, true)).isEqualTo(FileAction.CREATE);
        assertThat(FileAction.of(false, true)).isEqualTo(FileAction.UPDATE);
        assertThat(FileAction.of(false, false)).isEqualTo(FileAction.IDENTICAL);
    }

    @Test
    void label_isLowerCaseName() {
        assertThat(FileAction.CREATE.label()).isEqualTo("create");
        assertThat(FileAction.SKIP.label()).isEqualTo("skip");
    }
}
