package com.chih.JRender.core.engine;

import com.chih.JRender.core.exception.JRenderException;
import com.chih.JRender.core.exception.TemplateExecutionException;
import com.chih.JRender.core.exception.TemplateNotFoundException;
import com.chih.JRender.core.exception.TemplateWriteException;
import com.chih.JRender.core.impl.NoOpRenderMetrics;
import com.chih.JRender.core.spi.CompiledTemplate;
import com.chih.JRender.core.spi.RenderMetrics;
import com.chih.JRender.core.spi.TemplateEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 渲染器：名称 + 数据 -> 输出
 * <p>
 * 渲染流程：
 * 1. REUSE 策略下通过 TemplateStore 取出或构建模板；RELOAD 策略下直接调用 TemplateLoader，绕过存储
 * 2. 构建失败立即抛出，输出目标保持不变
 * 3. 执行结果先写入内存缓冲区
 * 4. 执行成功后再一次性写入输出目标，执行失败时输出目标收不到任何字节
 * </p>
 * <p>
 * 渲染器不吞异常，也不在失败时打 error 日志，错误如何呈现由调用方决定。
 * </p>
 *
 * @author JRender Team
 * @since 2025/12/10
 */
public class TemplateRenderer {

    private static final Logger log = LoggerFactory.getLogger(TemplateRenderer.class);

    private final TemplateStore store;

    private final TemplateLoader loader;

    private final TemplateEngine engine;

    private final RenderMetrics metrics;

    private volatile CachePolicy policy;

    // 每个模板名称最近一次构建失败的原因，构建成功后清除
    private final Map<String, JRenderException> buildErrors = new ConcurrentHashMap<>();

    public TemplateRenderer(TemplateStore store, TemplateLoader loader, TemplateEngine engine,
                            CachePolicy policy, RenderMetrics metrics) {
        this.store = store;
        this.loader = loader;
        this.engine = engine;
        this.policy = policy != null ? policy : CachePolicy.REUSE;
        this.metrics = (metrics != null) ? metrics : new NoOpRenderMetrics();
    }

    public TemplateRenderer(TemplateStore store, TemplateLoader loader, TemplateEngine engine, CachePolicy policy) {
        this(store, loader, engine, policy, null);
    }

    public TemplateRenderer(TemplateLoader loader, TemplateEngine engine) {
        this(new TemplateStore(), loader, engine, CachePolicy.REUSE, null);
    }

    /**
     * 渲染模板并写入输出目标
     *
     * @param sink 输出目标，只在渲染完全成功后写入
     * @param name 模板名称
     * @param payload 渲染数据，原样交给模板引擎
     */
    public void render(Writer sink, String name, Object payload) {
        String output = render(name, payload);
        try {
            sink.write(output);
            sink.flush();
        } catch (IOException e) {
            throw new TemplateWriteException(name, e);
        }
    }

    /**
     * 渲染模板并返回结果
     */
    public String render(String name, Object payload) {
        CompiledTemplate template = obtain(name);

        long startTime = System.nanoTime();
        boolean success = false;
        try {
            StringWriter buffer = new StringWriter();
            engine.execute(template, payload, buffer);
            success = true;
            return buffer.toString();
        } catch (JRenderException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new TemplateExecutionException(name, e);
        } finally {
            metrics.recordRender(name, System.nanoTime() - startTime, success);
        }
    }

    /**
     * 预热：把来源中所有页面模板构建进存储，遇到第一个构建错误即抛出
     *
     * @return 本次预热后存储中的模板数量，RELOAD 策略下为 0
     */
    public int warmUp() {
        if (!policy.usesStore()) {
            log.debug("Cache policy is {}, skipping warm-up", policy);
            return 0;
        }
        Set<String> pages = loader.pageNames();
        for (String page : pages) {
            obtain(page);
        }
        log.info("Initialized {} templates.", pages.size());
        return store.size();
    }

    /**
     * 切换缓存策略，同时清空存储，避免新策略下使用旧的编译结果
     * <p>
     * 切换前已开始的构建不会把结果写回存储，见 {@link TemplateStore#reset()}。
     * </p>
     */
    public void switchPolicy(CachePolicy newPolicy) {
        if (newPolicy == null) {
            throw new IllegalArgumentException("Cache policy must not be null");
        }
        CachePolicy old = this.policy;
        this.policy = newPolicy;
        store.reset();
        log.info("Cache policy switched: {} -> {}", old, newPolicy);
    }

    public CachePolicy getPolicy() {
        return policy;
    }

    public TemplateStore getStore() {
        return store;
    }

    /**
     * @return 模板名称 -> 最近一次构建失败的原因 (语法错误、片段缺失)
     */
    public Map<String, JRenderException> getBuildErrors() {
        return Collections.unmodifiableMap(new TreeMap<>(buildErrors));
    }

    private CompiledTemplate obtain(String name) {
        if (policy.usesStore()) {
            return store.populate(name, this::build);
        }
        return build(name);
    }

    private CompiledTemplate build(String name) {
        long startTime = System.nanoTime();
        boolean success = false;
        boolean found = true;
        try {
            CompiledTemplate template = loader.load(name);
            buildErrors.remove(name);
            success = true;
            return template;
        } catch (TemplateNotFoundException e) {
            // 请求了不存在的模板，不算模板本身的问题；模板被删除后旧的构建错误也随之失效
            found = false;
            buildErrors.remove(name);
            throw e;
        } catch (JRenderException e) {
            buildErrors.put(name, e);
            log.debug("Failed to build template: {}", name, e);
            throw e;
        } finally {
            // 名称可能来自外部请求，不存在的模板不产生指标
            if (found) {
                metrics.recordBuild(name, System.nanoTime() - startTime, success);
            }
        }
    }
}
