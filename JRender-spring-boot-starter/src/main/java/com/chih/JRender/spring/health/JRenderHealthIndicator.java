package com.chih.JRender.spring.health;

import com.chih.JRender.core.engine.TemplateRenderer;
import com.chih.JRender.core.exception.JRenderException;
import org.springframework.boot.actuate.health.AbstractHealthIndicator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.Map;
import java.util.TreeMap;

/**
 * JRender 健康检查指示器
 * 存在构建失败的模板 (语法错误、片段缺失) 时，状态标记为 DOWN
 *
 * @author JRender Team
 * @since 2025/12/10
 */
public class JRenderHealthIndicator extends AbstractHealthIndicator {

    private final TemplateRenderer renderer;

    public JRenderHealthIndicator(TemplateRenderer renderer) {
        this.renderer = renderer;
    }

    @Override
    protected void doHealthCheck(Health.Builder builder) throws Exception {
        Map<String, JRenderException> errors = renderer.getBuildErrors();

        builder.withDetail("policy", renderer.getPolicy().name())
                .withDetail("cachedTemplates", renderer.getStore().size());

        if (errors.isEmpty()) {
            builder.up();
        } else {
            Map<String, String> messages = new TreeMap<>();
            errors.forEach((name, e) -> messages.put(name, e.getMessage()));
            // 列出具体失败的模板和错误信息
            builder.status(Status.DOWN)
                    .withDetail("errorCount", errors.size())
                    .withDetail("errors", messages);
        }
    }
}
