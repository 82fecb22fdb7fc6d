package com.chih.JRender.spring;

import com.chih.JRender.core.engine.CachePolicy;
import com.chih.JRender.core.engine.TemplateLoader;
import com.chih.JRender.core.engine.TemplateRenderer;
import com.chih.JRender.core.engine.TemplateStore;
import com.chih.JRender.core.impl.MustacheTemplateEngine;
import com.chih.JRender.core.impl.NoOpRenderMetrics;
import com.chih.JRender.core.spi.RenderMetrics;
import com.chih.JRender.core.spi.TemplateEngine;
import com.chih.JRender.core.spi.TemplateSource;
import com.chih.JRender.core.support.TemplateNaming;
import com.chih.JRender.spring.health.JRenderHealthIndicator;
import com.chih.JRender.spring.metrics.MicrometerRenderMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * JRender Spring Boot 自动配置类。
 * <p>
 * 负责创建模板来源、模板引擎、加载器、存储和渲染器，整个对象图在启动时构建一次。
 * 所有 Bean 都带有 {@code @ConditionalOnMissingBean}，用户可以逐个替换。
 * </p>
 *
 * <h3>使用示例：</h3>
 * <pre>{@code
 * # application.yml
 * j-render:
 *   use-cache: false        # 开发模式，每次渲染都重新加载
 *   locations:
 *     - classpath*:views/*.tmpl
 *
 * // 自定义模板来源（可选）
 * @Bean
 * public TemplateSource templateSource() {
 *     return BundleTemplateSource.fromClasspath("views/site.yaml");
 * }
 * }</pre>
 *
 * @author JRender Team
 * @since 2025/12/10
 * @see JRenderProperties
 * @see TemplateRenderer
 */
@Configuration
@EnableConfigurationProperties(JRenderProperties.class)
public class JRenderAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(JRenderAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean(TemplateSource.class)
    public TemplateSource templateSource(JRenderProperties properties) {
        return new SpringResourceTemplateSource(properties.getLocations());
    }

    @Bean
    @ConditionalOnMissingBean(TemplateEngine.class)
    public TemplateEngine templateEngine(JRenderProperties properties) {
        return new MustacheTemplateEngine(properties.isStrictVariables());
    }

    @Bean
    @ConditionalOnMissingBean(TemplateNaming.class)
    public TemplateNaming templateNaming(JRenderProperties properties) {
        return new TemplateNaming(properties.getPageSuffix(), properties.getLayoutSuffix());
    }

    @Bean
    @ConditionalOnMissingBean(TemplateLoader.class)
    public TemplateLoader templateLoader(TemplateSource source, TemplateEngine engine, TemplateNaming naming) {
        return new TemplateLoader(source, engine, naming);
    }

    @Bean
    @ConditionalOnMissingBean(TemplateStore.class)
    public TemplateStore templateStore() {
        return new TemplateStore();
    }

    /**
     * Micrometer 在类路径中时优先使用 Micrometer 实现；
     * 没有 MeterRegistry Bean 时同样退回空实现
     */
    @Configuration
    @ConditionalOnClass(MeterRegistry.class)
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnMissingBean(RenderMetrics.class)
        public RenderMetrics renderMetrics(ObjectProvider<MeterRegistry> registry) {
            MeterRegistry meterRegistry = registry.getIfAvailable();
            return meterRegistry != null ? new MicrometerRenderMetrics(meterRegistry) : new NoOpRenderMetrics();
        }
    }

    // 保底配置：如果没有 Metrics 环境，注入空实现
    @Bean
    @ConditionalOnMissingBean(RenderMetrics.class)
    public RenderMetrics defaultRenderMetrics() {
        return new NoOpRenderMetrics();
    }

    /**
     * 渲染器
     * <p>
     * use-cache 与 preload 同时开启时，启动阶段就构建全部页面，
     * 任何一个页面有语法错误或缺失片段都会让应用启动失败。
     * </p>
     */
    @Bean
    @ConditionalOnMissingBean(TemplateRenderer.class)
    public TemplateRenderer templateRenderer(TemplateStore store, TemplateLoader loader, TemplateEngine engine,
                                             RenderMetrics metrics, JRenderProperties properties) {
        CachePolicy policy = CachePolicy.fromUseCache(properties.isUseCache());
        TemplateRenderer renderer = new TemplateRenderer(store, loader, engine, policy, metrics);
        if (properties.isPreload() && policy.usesStore()) {
            renderer.warmUp();
        }
        log.info("JRender initialized with cache policy {}", policy);
        return renderer;
    }

    /**
     * 健康检查自动配置
     * 只有当引入了 Actuator (存在 HealthIndicator 类) 时才生效
     */
    @Configuration
    @ConditionalOnClass(HealthIndicator.class)
    static class HealthCheckConfiguration {

        @Bean
        @ConditionalOnMissingBean(name = "jRenderHealthIndicator")
        public JRenderHealthIndicator jRenderHealthIndicator(TemplateRenderer renderer) {
            return new JRenderHealthIndicator(renderer);
        }
    }
}
