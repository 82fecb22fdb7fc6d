package com.chih.JRender.core.exception;

public class TemplateExecutionException extends JRenderException {
    public TemplateExecutionException(String name, Throwable cause) {
        super("Failed to execute template: " + name, cause);
    }
}
