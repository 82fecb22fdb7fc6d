package com.chih.JRender.core.impl;

import com.chih.JRender.core.exception.TemplateSourceNotFoundException;
import com.chih.JRender.core.spi.TemplateSource;
import com.chih.JRender.core.support.TemplateObjectMapperFactory;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 内嵌 bundle 模板源：一个 YAML 或 JSON 文档中定义多个模板片段
 * <p>
 * 文档顶层是 "片段名称 -> 模板文本" 的映射，构造时一次性解析，之后只读：
 * <pre>{@code
 * base.layout.tmpl: |
 *   <html><body>{{$content}}{{/content}}</body></html>
 * home.page.tmpl: |
 *   {{<base.layout}}{{$content}}Hello {{name}}{{/content}}{{/base.layout}}
 * }</pre>
 * </p>
 *
 * @author JRender Team
 * @since 2025/12/10
 */
public class BundleTemplateSource implements TemplateSource {

    private static final Logger log = LoggerFactory.getLogger(BundleTemplateSource.class);

    private static final TypeReference<LinkedHashMap<String, String>> BUNDLE_TYPE = new TypeReference<>() {
    };

    private final String bundleName;

    private final Map<String, String> templates;

    /**
     * @param is bundle 内容，由调用方负责关闭
     * @param bundleName bundle 文件名，用于选择 YAML / JSON 解析器和错误信息
     */
    public BundleTemplateSource(InputStream is, String bundleName) {
        this.bundleName = bundleName;
        this.templates = parse(is, bundleName);
        log.debug("Loaded template bundle {} with {} fragments", bundleName, templates.size());
    }

    public static BundleTemplateSource fromFile(Path bundleFile) {
        try (InputStream is = Files.newInputStream(bundleFile)) {
            return new BundleTemplateSource(is, bundleFile.getFileName().toString());
        } catch (IOException e) {
            throw new TemplateSourceNotFoundException(bundleFile.toString(), e);
        }
    }

    public static BundleTemplateSource fromClasspath(String resourcePath) {
        String cleanPath = resourcePath.startsWith("/") ? resourcePath.substring(1) : resourcePath;
        InputStream is = BundleTemplateSource.class.getClassLoader().getResourceAsStream(cleanPath);
        if (is == null) {
            throw new TemplateSourceNotFoundException("classpath:" + cleanPath);
        }
        try (is) {
            return new BundleTemplateSource(is, cleanPath);
        } catch (IOException e) {
            throw new TemplateSourceNotFoundException("classpath:" + cleanPath, e);
        }
    }

    private static Map<String, String> parse(InputStream is, String bundleName) {
        ObjectMapper mapper = TemplateObjectMapperFactory.forFilename(bundleName);
        try {
            byte[] content = is.readAllBytes();
            // 空文件直接交给 Jackson 会报 "No content to map"
            if (new String(content, StandardCharsets.UTF_8).isBlank()) {
                return Collections.emptyMap();
            }
            Map<String, String> parsed = mapper.readValue(content, BUNDLE_TYPE);
            // 只有 "---" 的 YAML 文档解析结果为 null
            return parsed != null ? Collections.unmodifiableMap(parsed) : Collections.emptyMap();
        } catch (IOException e) {
            throw new TemplateSourceNotFoundException(bundleName, e);
        }
    }

    @Override
    public String read(String name) {
        return templates.get(name);
    }

    @Override
    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(templates.keySet()));
    }

    public String getBundleName() {
        return bundleName;
    }
}
