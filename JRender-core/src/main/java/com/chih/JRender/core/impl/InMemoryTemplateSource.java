package com.chih.JRender.core.impl;

import com.chih.JRender.core.spi.TemplateSource;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 基于内存字符串的模板源，线程安全
 * 适合测试和把模板直接写在代码里的小应用
 *
 * @author JRender Team
 */
public class InMemoryTemplateSource implements TemplateSource {

    private final Map<String, String> templates = new ConcurrentHashMap<>();

    public InMemoryTemplateSource() {
    }

    public InMemoryTemplateSource(Map<String, String> templates) {
        this.templates.putAll(templates);
    }

    public InMemoryTemplateSource put(String name, String template) {
        templates.put(name, template);
        return this;
    }

    public InMemoryTemplateSource remove(String name) {
        templates.remove(name);
        return this;
    }

    @Override
    public String read(String name) {
        return templates.get(name);
    }

    @Override
    public Set<String> names() {
        return Collections.unmodifiableSet(new TreeSet<>(templates.keySet()));
    }
}
