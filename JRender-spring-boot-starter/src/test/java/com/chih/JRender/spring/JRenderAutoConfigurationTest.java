package com.chih.JRender.spring;

import com.chih.JRender.core.engine.CachePolicy;
import com.chih.JRender.core.engine.TemplateRenderer;
import com.chih.JRender.core.exception.TemplateSyntaxException;
import com.chih.JRender.core.impl.InMemoryTemplateSource;
import com.chih.JRender.core.impl.MustacheTemplateEngine;
import com.chih.JRender.core.impl.NoOpRenderMetrics;
import com.chih.JRender.core.spi.RenderMetrics;
import com.chih.JRender.core.spi.TemplateEngine;
import com.chih.JRender.core.spi.TemplateSource;
import com.chih.JRender.spring.health.JRenderHealthIndicator;
import com.chih.JRender.spring.metrics.MicrometerRenderMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * JRenderAutoConfiguration 单元测试
 *
 * 测试 Spring Boot 自动配置功能，包括：
 * - 默认 Bean 装配
 * - 配置属性生效
 * - 用户自定义 Bean 覆盖
 */
@DisplayName("JRenderAutoConfiguration 测试")
class JRenderAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JRenderAutoConfiguration.class));

    @Test
    @DisplayName("JRenderProperties 默认配置应该正确")
    void testPropertiesDefaults() {
        JRenderProperties properties = new JRenderProperties();

        assertThat(properties.isUseCache()).isTrue();
        assertThat(properties.isPreload()).isTrue();
        assertThat(properties.isStrictVariables()).isTrue();
        assertThat(properties.getPageSuffix()).isEqualTo(".page.tmpl");
        assertThat(properties.getLayoutSuffix()).isEqualTo(".layout.tmpl");
        assertThat(properties.getLocations()).containsExactly(
                "file:./templates/**/*.tmpl",
                "classpath*:templates/**/*.tmpl");
    }

    @Test
    @DisplayName("默认装配：启动时预热所有页面")
    void testDefaultWiring() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(TemplateRenderer.class);
            assertThat(context).hasSingleBean(JRenderHealthIndicator.class);
            assertThat(context.getBean(TemplateSource.class)).isInstanceOf(SpringResourceTemplateSource.class);
            assertThat(context.getBean(RenderMetrics.class)).isInstanceOf(NoOpRenderMetrics.class);

            TemplateRenderer renderer = context.getBean(TemplateRenderer.class);
            assertThat(renderer.getPolicy()).isEqualTo(CachePolicy.REUSE);
            assertThat(renderer.getStore().names()).containsExactly("home.page.tmpl");
            assertThat(renderer.render("home.page.tmpl", Map.of("title", "T", "heading", "Home")))
                    .isEqualTo("<html><title>T</title><h1>Home</h1></html>");
        });
    }

    @Test
    @DisplayName("use-cache=false 时不写存储")
    void testReloadPolicy() {
        contextRunner.withPropertyValues("j-render.use-cache=false").run(context -> {
            TemplateRenderer renderer = context.getBean(TemplateRenderer.class);

            assertThat(renderer.getPolicy()).isEqualTo(CachePolicy.RELOAD);
            renderer.render("home.page.tmpl", Map.of("title", "T", "heading", "Home"));
            assertThat(renderer.getStore().size()).isZero();
        });
    }

    @Test
    @DisplayName("preload=false 时按需构建")
    void testLazyBuild() {
        contextRunner.withPropertyValues("j-render.preload=false").run(context -> {
            TemplateRenderer renderer = context.getBean(TemplateRenderer.class);
            assertThat(renderer.getStore().size()).isZero();

            renderer.render("home.page.tmpl", Map.of("title", "T", "heading", "Home"));

            assertThat(renderer.getStore().size()).isEqualTo(1);
        });
    }

    @Test
    @DisplayName("strict-variables=false 时缺失字段输出空串")
    void testLenientVariables() {
        contextRunner.withPropertyValues("j-render.strict-variables=false").run(context -> {
            TemplateEngine engine = context.getBean(TemplateEngine.class);
            assertThat(((MustacheTemplateEngine) engine).isStrictVariables()).isFalse();

            TemplateRenderer renderer = context.getBean(TemplateRenderer.class);
            assertThat(renderer.render("home.page.tmpl", Map.of())).isEqualTo("<html><title></title><h1></h1></html>");
        });
    }

    @Test
    @DisplayName("预热遇到语法错误时启动失败")
    void testMalformedTemplateFailsStartup() {
        contextRunner.withPropertyValues("j-render.locations=classpath:broken/*.tmpl").run(context -> {
            assertThat(context).hasFailed();
            assertThat(context.getStartupFailure())
                    .hasStackTraceContaining(TemplateSyntaxException.class.getName())
                    .hasStackTraceContaining("bad.page.tmpl");
        });
    }

    @Test
    @DisplayName("存在 MeterRegistry 时使用 Micrometer 实现")
    void testMicrometerMetrics() {
        contextRunner.withBean(MeterRegistry.class, SimpleMeterRegistry::new).run(context -> {
            assertThat(context.getBean(RenderMetrics.class)).isInstanceOf(MicrometerRenderMetrics.class);

            context.getBean(TemplateRenderer.class).render("home.page.tmpl", Map.of("title", "T", "heading", "H"));

            MeterRegistry registry = context.getBean(MeterRegistry.class);
            assertThat(registry.get("jrender.render.count").tag("template", "home.page.tmpl").counter().count())
                    .isEqualTo(1.0);
        });
    }

    @Test
    @DisplayName("用户自定义的模板来源优先")
    void testCustomTemplateSource() {
        contextRunner
                .withBean(TemplateSource.class, () -> new InMemoryTemplateSource().put("hello.page.tmpl", "Hello {{name}}"))
                .run(context -> {
                    TemplateRenderer renderer = context.getBean(TemplateRenderer.class);

                    assertThat(renderer.getStore().names()).containsExactly("hello.page.tmpl");
                    assertThat(renderer.render("hello.page.tmpl", Map.of("name", "Spring"))).isEqualTo("Hello Spring");
                });
    }

    @Test
    @DisplayName("自定义命名约定")
    void testCustomSuffixes() {
        contextRunner
                .withPropertyValues("j-render.page-suffix=.view.tmpl", "j-render.preload=false")
                .run(context -> {
                    JRenderProperties properties = context.getBean(JRenderProperties.class);
                    assertThat(properties.getPageSuffix()).isEqualTo(".view.tmpl");
                    assertThat(properties.getLocations()).isEqualTo(List.of(
                            "file:./templates/**/*.tmpl", "classpath*:templates/**/*.tmpl"));
                    assertThat(context.getBean(TemplateRenderer.class).warmUp()).isZero();
                });
    }
}
