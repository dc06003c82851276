package com.wcoptimizer.repository;

import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqlTemplateLoaderTest {

    private final SqlTemplateLoader loader = new SqlTemplateLoader(new DefaultResourceLoader());

    @Test
    void load_returnsNamedBlockWithoutComments() {
        String sql = loader.load("tableExists");

        assertThat(sql).startsWith("SELECT COUNT(*)");
        assertThat(sql).contains(":table");
        assertThat(sql).doesNotContain("-- name:");
    }

    @Test
    void load_unknownNameFails() {
        assertThatThrownBy(() -> loader.load("noSuchQuery"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("noSuchQuery");
    }
}
