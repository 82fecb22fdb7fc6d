package com.chih.JRender.core.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateObjectMapperFactoryTest {

    @Test
    void testForFilenameSelectsFormat() {
        assertThat(TemplateObjectMapperFactory.forFilename("site.yaml").getFactory()).isInstanceOf(YAMLFactory.class);
        assertThat(TemplateObjectMapperFactory.forFilename("SITE.YML").getFactory()).isInstanceOf(YAMLFactory.class);
        assertThat(TemplateObjectMapperFactory.forFilename("site.json").getFactory()).isNotInstanceOf(YAMLFactory.class);
        assertThat(TemplateObjectMapperFactory.forFilename(null).getFactory()).isNotInstanceOf(YAMLFactory.class);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testEmptyStringKeptAsEmptyTemplate() throws Exception {
        ObjectMapper mapper = TemplateObjectMapperFactory.createJsonMapper();

        Map<String, String> parsed = mapper.readValue("{\"empty.page.tmpl\": \"\"}", Map.class);

        assertThat(parsed).containsEntry("empty.page.tmpl", "");
    }
}
