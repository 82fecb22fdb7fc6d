package com.chih.JRender.core.engine;

import com.chih.JRender.core.exception.TemplateNotFoundException;
import com.chih.JRender.core.spi.CompiledTemplate;
import com.chih.JRender.core.spi.TemplateEngine;
import com.chih.JRender.core.spi.TemplateSource;
import com.chih.JRender.core.support.TemplateNaming;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Function;

/**
 * 模板加载器：页面片段 + 共享布局片段 -> 一个 CompiledTemplate
 * <p>
 * 加载器无状态、不缓存，同样的片段内容总是得到同样的编译结果；
 * 它只读 TemplateSource，从不写 TemplateStore。
 * </p>
 *
 * @author JRender Team
 * @since 2025/12/10
 */
public class TemplateLoader {

    private static final Logger log = LoggerFactory.getLogger(TemplateLoader.class);

    private final TemplateSource source;

    private final TemplateEngine engine;

    private final TemplateNaming naming;

    public TemplateLoader(TemplateSource source, TemplateEngine engine, TemplateNaming naming) {
        this.source = source;
        this.engine = engine;
        this.naming = naming != null ? naming : TemplateNaming.defaults();
    }

    public TemplateLoader(TemplateSource source, TemplateEngine engine) {
        this(source, engine, TemplateNaming.defaults());
    }

    /**
     * 构建单个页面模板
     * <p>
     * 1. 读取页面片段，不存在则抛出 TemplateNotFoundException
     * 2. 按命名约定发现所有布局片段，逐个解析一遍：任何一个布局有语法错误都会让本次构建失败
     * 3. 编译页面，布局和其他子片段通过 fragmentLoader 在编译期解析
     * </p>
     *
     * @param name 页面名称
     * @return 编译后的模板
     */
    public CompiledTemplate load(String name) {
        String page = source.read(name);
        if (page == null) {
            throw new TemplateNotFoundException(name);
        }

        Map<String, String> layouts = readLayouts(name);
        Function<String, String> fragmentLoader = createFragmentLoader(layouts);

        for (Map.Entry<String, String> layout : layouts.entrySet()) {
            engine.compile(layout.getKey(), layout.getValue(), fragmentLoader);
        }

        CompiledTemplate compiled = engine.compile(name, page, fragmentLoader);
        log.debug("Loaded template {} with {} layout fragments", name, layouts.size());
        return compiled;
    }

    /**
     * @return 来源中所有符合页面命名约定的模板名称
     */
    public Set<String> pageNames() {
        Set<String> pages = new TreeSet<>();
        for (String candidate : source.names()) {
            if (naming.isPage(candidate)) {
                pages.add(candidate);
            }
        }
        return pages;
    }

    public TemplateNaming getNaming() {
        return naming;
    }

    private Map<String, String> readLayouts(String pageName) {
        Map<String, String> layouts = new TreeMap<>();
        for (String candidate : source.names()) {
            if (!naming.isLayout(candidate) || candidate.equals(pageName)) {
                continue;
            }
            String content = source.read(candidate);
            // 扫描与读取之间被删除的布局直接跳过
            if (content != null) {
                layouts.put(candidate, content);
            }
        }
        return layouts;
    }

    /**
     * 片段加载器：优先使用本次构建已读到的布局，其余片段回源读取
     */
    private Function<String, String> createFragmentLoader(Map<String, String> layouts) {
        return fragmentName -> {
            String layout = layouts.get(fragmentName);
            return layout != null ? layout : source.read(fragmentName);
        };
    }
}
