package com.chih.JRender.core.exception;

public class TemplateNotFoundException extends TemplateSourceNotFoundException {
    public TemplateNotFoundException(String name) {
        super(name, "Template not found for name: " + name, null);
    }
}
