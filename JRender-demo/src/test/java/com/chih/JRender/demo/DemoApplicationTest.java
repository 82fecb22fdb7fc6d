package com.chih.JRender.demo;

import com.chih.JRender.core.engine.CachePolicy;
import com.chih.JRender.core.engine.TemplateRenderer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.not;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * JRender Demo 应用集成测试
 * 通过 HTTP 接口验证页面渲染和错误映射
 */
@SpringBootTest(classes = DemoApplication.class)
@AutoConfigureMockMvc
public class DemoApplicationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TemplateRenderer renderer;

    @Test
    public void testTemplatesPreloaded() {
        assertThat(renderer.getPolicy()).isEqualTo(CachePolicy.REUSE);
        assertThat(renderer.getStore().names()).contains("home.page.tmpl", "about.page.tmpl");
    }

    @Test
    public void testHomePage() throws Exception {
        mockMvc.perform(get("/home"))
                .andExpect(status().isOk())
                .andExpect(content().contentTypeCompatibleWith(MediaType.TEXT_HTML))
                .andExpect(content().string(containsString("<title>Home</title>")))
                .andExpect(content().string(containsString("This is the home page")));
    }

    @Test
    public void testAboutPage() throws Exception {
        mockMvc.perform(get("/about"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("This is the about page")))
                .andExpect(content().string(containsString("This came from the template: Hello, again")));
    }

    @Test
    public void testGenericPageRoute() throws Exception {
        mockMvc.perform(get("/pages/about"))
                .andExpect(status().isOk())
                .andExpect(content().string(containsString("This is the about page")));
    }

    @Test
    public void testUnknownPageIsNotFound() throws Exception {
        mockMvc.perform(get("/pages/contact"))
                .andExpect(status().isNotFound())
                .andExpect(content().string("Page not found"));
    }

    @Test
    public void testExecutionErrorIsServerErrorWithoutPartialPage() throws Exception {
        mockMvc.perform(get("/pages/strict"))
                .andExpect(status().isInternalServerError())
                .andExpect(content().string(not(containsString("before"))));
    }

    @Test
    public void testHealthEndpoint() throws Exception {
        mockMvc.perform(get("/actuator/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.jRender.details.policy").value("REUSE"));
    }
}
