package com.chih.JRender.core.support;

/**
 * 模板命名约定
 * <p>
 * 页面模板以 {@code .page.tmpl} 结尾，共享布局片段以 {@code .layout.tmpl} 结尾。
 * 加载器依靠该约定发现布局片段，预热时依靠该约定枚举页面。
 * </p>
 *
 * @author JRender Team
 * @since 2025/12/10
 */
public final class TemplateNaming {

    public static final String DEFAULT_PAGE_SUFFIX = ".page.tmpl";

    public static final String DEFAULT_LAYOUT_SUFFIX = ".layout.tmpl";

    private final String pageSuffix;

    private final String layoutSuffix;

    public TemplateNaming(String pageSuffix, String layoutSuffix) {
        if (pageSuffix == null || pageSuffix.isEmpty() || layoutSuffix == null || layoutSuffix.isEmpty()) {
            throw new IllegalArgumentException("Page and layout suffixes cannot be empty");
        }
        if (pageSuffix.equals(layoutSuffix)) {
            throw new IllegalArgumentException("Page and layout suffixes must differ: " + pageSuffix);
        }
        this.pageSuffix = pageSuffix;
        this.layoutSuffix = layoutSuffix;
    }

    public static TemplateNaming defaults() {
        return new TemplateNaming(DEFAULT_PAGE_SUFFIX, DEFAULT_LAYOUT_SUFFIX);
    }

    public boolean isPage(String name) {
        return name != null && name.endsWith(pageSuffix);
    }

    public boolean isLayout(String name) {
        return name != null && name.endsWith(layoutSuffix);
    }

    public String getPageSuffix() {
        return pageSuffix;
    }

    public String getLayoutSuffix() {
        return layoutSuffix;
    }

    @Override
    public String toString() {
        return "TemplateNaming{page='" + pageSuffix + "', layout='" + layoutSuffix + "'}";
    }
}
