package com.chih.JRender.core.exception;

/**
 * 模板语法错误，携带出错的片段名称和解析器给出的原始信息
 */
public class TemplateSyntaxException extends JRenderException {

    private final String fragment;

    private final String parserMessage;

    public TemplateSyntaxException(String fragment, String parserMessage, Throwable cause) {
        super("Failed to parse template fragment: " + fragment + " (" + parserMessage + ")", cause);
        this.fragment = fragment;
        this.parserMessage = parserMessage;
    }

    public String getFragment() {
        return fragment;
    }

    public String getParserMessage() {
        return parserMessage;
    }
}
