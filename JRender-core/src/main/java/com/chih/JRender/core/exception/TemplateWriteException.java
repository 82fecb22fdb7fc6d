package com.chih.JRender.core.exception;

import java.io.IOException;

public class TemplateWriteException extends JRenderException {
    public TemplateWriteException(String name, IOException cause) {
        super("Failed to write rendered output for template: " + name, cause);
    }
}
