package com.chih.JRender.spring;

import com.chih.JRender.core.spi.AbstractIndexBasedTemplateSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 基于 Spring Resource 的模板源
 * <p>
 * 通过继承 AbstractIndexBasedTemplateSource，获得了 Index-Only 模式：
 * 索引只存 Resource 引用，内容每次读取时打开。
 * </p>
 *
 * <h3>支持的位置模式：</h3>
 * <ul>
 *   <li>Classpath 资源（包括所有 jar 包）：<code>classpath*:templates/**&#47;*.tmpl</code></li>
 *   <li>文件系统资源：<code>file:./templates/*.tmpl</code></li>
 *   <li>单个资源：<code>classpath:views/base.layout.tmpl</code></li>
 * </ul>
 *
 * @author JRender Team
 * @see org.springframework.core.io.Resource
 * @see AbstractIndexBasedTemplateSource
 */
public class SpringResourceTemplateSource extends AbstractIndexBasedTemplateSource<Resource> {

    private static final Logger log = LoggerFactory.getLogger(SpringResourceTemplateSource.class);

    private final ResourcePatternResolver resolver;

    /**
     * 资源位置配置列表，构造时确定，运行时不可变
     */
    private final List<String> locations;

    public SpringResourceTemplateSource(List<String> locations) {
        this(locations, new PathMatchingResourcePatternResolver());
    }

    public SpringResourceTemplateSource(List<String> locations, ResourcePatternResolver resolver) {
        this.locations = new ArrayList<>(locations);
        this.resolver = resolver;

        // 首次扫描建立索引
        rebuildIndex();
    }

    @Override
    protected Collection<Resource> scan() {
        List<Resource> found = new ArrayList<>();
        for (String location : locations) {
            if (!StringUtils.hasText(location)) {
                continue;
            }
            try {
                for (Resource resource : resolver.getResources(location)) {
                    if (isTemplateResource(resource)) {
                        found.add(resource);
                    }
                }
            } catch (IOException e) {
                log.warn("Failed to scan template location: {}", location, e);
            }
        }
        return found;
    }

    private boolean isTemplateResource(Resource resource) {
        String filename = resource.getFilename();
        if (filename == null || filename.isEmpty()) {
            return false;
        }
        // 忽略编辑器临时文件和隐藏文件
        return !filename.startsWith(".") && !filename.endsWith("~") && resource.isReadable();
    }

    // === 实现抽象方法 ===

    @Override
    protected InputStream openStream(Resource resource) throws IOException {
        return resource.getInputStream();
    }

    @Override
    protected String getResourceName(Resource resource) {
        return resource.getFilename();
    }

    @Override
    protected boolean exists(Resource resource) {
        return resource.exists();
    }

    @Override
    protected String getResourceDescription(Resource resource) {
        return resource.getDescription();
    }

    public List<String> getLocations() {
        return locations;
    }

    @Override
    public String toString() {
        return "SpringResourceTemplateSource" + locations;
    }
}
