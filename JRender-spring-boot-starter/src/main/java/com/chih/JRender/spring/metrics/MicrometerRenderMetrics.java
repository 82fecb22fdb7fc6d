package com.chih.JRender.spring.metrics;

import com.chih.JRender.core.spi.RenderMetrics;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * 基于 Micrometer 的监控实现
 * <p>
 * 监控指标说明：
 * <ul>
 *   <li>jrender.render.timer: 模板渲染耗时，tags: template={name}, result={success|failure}</li>
 *   <li>jrender.render.count: 模板渲染次数，tags 同上</li>
 *   <li>jrender.build.timer: 模板构建 (读取 + 编译) 耗时，tags 同上</li>
 * </ul>
 * </p>
 * <p>
 * 模板名称来自调用方；渲染器只为来源中存在的模板记录指标，标签基数以模板数量为上限。
 * </p>
 */
public class MicrometerRenderMetrics implements RenderMetrics {

    private final MeterRegistry registry;

    public MicrometerRenderMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void recordRender(String templateName, long durationNs, boolean success) {
        Timer.builder("jrender.render.timer")
                .description("Timer for template rendering")
                .tag("template", templateName)
                .tag("result", result(success))
                .register(registry)
                .record(durationNs, TimeUnit.NANOSECONDS);

        Counter.builder("jrender.render.count")
                .description("Counter for template rendering")
                .tag("template", templateName)
                .tag("result", result(success))
                .register(registry)
                .increment();
    }

    @Override
    public void recordBuild(String templateName, long durationNs, boolean success) {
        Timer.builder("jrender.build.timer")
                .description("Timer for template loading and compilation")
                .tag("template", templateName)
                .tag("result", result(success))
                .register(registry)
                .record(durationNs, TimeUnit.NANOSECONDS);
    }

    private static String result(boolean success) {
        return success ? "success" : "failure";
    }
}
