package com.chih.JRender.core.spi;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 编译后的模板，编译完成后不可变
 * <p>
 * 布局、页眉页脚等子片段在编译期就已解析并链接进 engineObject，执行期不再回源。
 * </p>
 *
 * @author JRender Team
 * @since 2025/12/10
 */
public final class CompiledTemplate {

    private final String name;

    // 具体的模板引擎对象 (如 Mustache)
    private final Object engineObject;

    // 编译过程中引入的片段名称 (布局、partial)
    private final Set<String> fragments;

    public CompiledTemplate(String name, Object engineObject, Set<String> fragments) {
        if (name == null || engineObject == null) {
            throw new IllegalArgumentException("Template name and engine object cannot be null");
        }
        this.name = name;
        this.engineObject = engineObject;
        this.fragments = fragments != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(fragments))
                : Collections.emptySet();
    }

    public String getName() {
        return name;
    }

    public Object getEngineObject() {
        return engineObject;
    }

    public Set<String> getFragments() {
        return fragments;
    }

    @Override
    public String toString() {
        return "CompiledTemplate{name='" + name + "', fragments=" + fragments + '}';
    }
}
