package com.chih.JRender.spring;

import com.chih.JRender.core.support.TemplateNaming;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 模板渲染配置
 *
 * @author JRender Team
 * @since 2025/12/10
 */
@ConfigurationProperties(prefix = "j-render")
public class JRenderProperties {

    /**
     * 是否复用已编译模板
     * true: 生产模式，首次构建后常驻内存；false: 开发模式，每次渲染都从来源重新加载
     */
    private boolean useCache = true;

    /**
     * 模板扫描路径列表，支持 Spring Resource 路径模式
     */
    private List<String> locations = new ArrayList<>();

    private String pageSuffix = TemplateNaming.DEFAULT_PAGE_SUFFIX;

    private String layoutSuffix = TemplateNaming.DEFAULT_LAYOUT_SUFFIX;

    /**
     * 启动时是否预先构建所有页面 (只在 use-cache 为 true 时生效)
     */
    private boolean preload = true;

    /**
     * 模板引用的名称在数据中不存在时是否报错
     */
    private boolean strictVariables = true;

    public JRenderProperties() {
        // 1. 默认约定：项目根目录下的 templates 目录 (方便本地调试)
        locations.add("file:./templates/**/*.tmpl");

        // 2. 默认约定：扫描 classpath 下 templates 目录
        locations.add("classpath*:templates/**/*.tmpl");
    }

    public boolean isUseCache() {
        return useCache;
    }

    public void setUseCache(boolean useCache) {
        this.useCache = useCache;
    }

    public List<String> getLocations() {
        return locations;
    }

    public void setLocations(List<String> locations) {
        this.locations = locations;
    }

    public String getPageSuffix() {
        return pageSuffix;
    }

    public void setPageSuffix(String pageSuffix) {
        this.pageSuffix = pageSuffix;
    }

    public String getLayoutSuffix() {
        return layoutSuffix;
    }

    public void setLayoutSuffix(String layoutSuffix) {
        this.layoutSuffix = layoutSuffix;
    }

    public boolean isPreload() {
        return preload;
    }

    public void setPreload(boolean preload) {
        this.preload = preload;
    }

    public boolean isStrictVariables() {
        return strictVariables;
    }

    public void setStrictVariables(boolean strictVariables) {
        this.strictVariables = strictVariables;
    }
}
