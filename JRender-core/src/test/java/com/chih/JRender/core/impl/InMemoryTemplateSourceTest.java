package com.chih.JRender.core.impl;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryTemplateSourceTest {

    @Test
    void testPutReadRemove() {
        InMemoryTemplateSource source = new InMemoryTemplateSource()
                .put("b.page.tmpl", "B")
                .put("a.page.tmpl", "A");

        assertThat(source.read("a.page.tmpl")).isEqualTo("A");
        assertThat(source.names()).containsExactly("a.page.tmpl", "b.page.tmpl");

        source.remove("a.page.tmpl");

        assertThat(source.read("a.page.tmpl")).isNull();
        assertThat(source.names()).containsExactly("b.page.tmpl");
    }

    @Test
    void testInitialContentsAndReadOnlyNames() {
        InMemoryTemplateSource source = new InMemoryTemplateSource(Map.of("home.page.tmpl", "home"));

        assertThat(source.read("home.page.tmpl")).isEqualTo("home");
        assertThatThrownBy(() -> source.names().add("x")).isInstanceOf(UnsupportedOperationException.class);
    }
}
