package com.chih.JRender.core.spi;

import com.chih.JRender.core.exception.TemplateSourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于索引的 TemplateSource 泛型基类
 * <p>
 * 实现了"Index-Only"模式的通用逻辑：
 * 1. 正向索引：模板名称 -> 资源对象，只存引用不存内容
 * 2. Cache Miss 回源：索引未命中或资源已消失时重新扫描一次
 * 3. 每次 read 都重新读取内容，开发模式 (RELOAD) 下修改立即可见
 * </p>
 *
 * @param <T> 资源类型（TemplateResource 或 Spring Resource）
 * @author JRender Team
 * @since 2025/12/10
 */
public abstract class AbstractIndexBasedTemplateSource<T> implements TemplateSource {

    private static final Logger log = LoggerFactory.getLogger(AbstractIndexBasedTemplateSource.class);

    /**
     * 正向索引：模板名称 -> 资源对象
     */
    protected final Map<String, T> nameToResource = new ConcurrentHashMap<>();

    // === 抽象方法：子类实现资源操作差异化逻辑 ===

    /**
     * 扫描所有配置位置，返回找到的模板资源
     */
    protected abstract Collection<T> scan();

    /**
     * 打开资源流，调用者负责关闭
     */
    protected abstract InputStream openStream(T resource) throws IOException;

    /**
     * 资源对应的模板名称 (文件名)
     */
    protected abstract String getResourceName(T resource);

    protected abstract boolean exists(T resource);

    /**
     * 资源描述，用于日志
     */
    protected abstract String getResourceDescription(T resource);

    // === 核心通用逻辑 ===

    /**
     * 重新扫描并整体替换索引
     * <p>
     * 同名资源以扫描顺序中的第一个为准，后续的同名资源记录警告后忽略。
     * </p>
     */
    protected synchronized void rebuildIndex() {
        Map<String, T> fresh = new LinkedHashMap<>();
        for (T resource : scan()) {
            String name = getResourceName(resource);
            T previous = fresh.putIfAbsent(name, resource);
            if (previous != null && !previous.equals(resource)) {
                log.warn("Duplicate template name '{}': keeping {}, ignoring {}", name,
                        getResourceDescription(previous), getResourceDescription(resource));
            }
        }

        nameToResource.keySet().retainAll(fresh.keySet());
        nameToResource.putAll(fresh);
        log.debug("Template index rebuilt: {} templates", fresh.size());
    }

    @Override
    public String read(String name) {
        T resource = nameToResource.get(name);

        // 索引未命中或资源已被删除：回源重新扫描一次
        if (resource == null || !exists(resource)) {
            rebuildIndex();
            resource = nameToResource.get(name);
            if (resource == null) {
                return null;
            }
        }

        try (InputStream is = openStream(resource)) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TemplateSourceNotFoundException(name, e);
        }
    }

    @Override
    public Set<String> names() {
        rebuildIndex();
        return Collections.unmodifiableSet(new TreeSet<>(nameToResource.keySet()));
    }
}
