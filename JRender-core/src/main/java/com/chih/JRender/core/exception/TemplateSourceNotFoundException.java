package com.chih.JRender.core.exception;

/**
 * 模板片段缺失或无法读取
 */
public class TemplateSourceNotFoundException extends JRenderException {

    private final String fragment;

    public TemplateSourceNotFoundException(String fragment) {
        this(fragment, "Template source not found: " + fragment, null);
    }

    public TemplateSourceNotFoundException(String fragment, String referencedBy) {
        this(fragment, "Template source not found: " + fragment + " (referenced by " + referencedBy + ")", null);
    }

    public TemplateSourceNotFoundException(String fragment, Throwable cause) {
        this(fragment, "Template source could not be read: " + fragment, cause);
    }

    protected TemplateSourceNotFoundException(String fragment, String message, Throwable cause) {
        super(message, cause);
        this.fragment = fragment;
    }

    public String getFragment() {
        return fragment;
    }
}
