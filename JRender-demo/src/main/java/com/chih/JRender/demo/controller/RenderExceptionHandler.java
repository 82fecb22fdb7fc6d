package com.chih.JRender.demo.controller;

import com.chih.JRender.core.exception.JRenderException;
import com.chih.JRender.core.exception.TemplateNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

/**
 * 渲染错误到 HTTP 状态码的映射：页面不存在 404，其余 500
 */
@ControllerAdvice
@Slf4j
public class RenderExceptionHandler {

    @ExceptionHandler(TemplateNotFoundException.class)
    public ResponseEntity<String> notFound(TemplateNotFoundException e) {
        log.info("Page not found: {}", e.getFragment());
        return plainText(HttpStatus.NOT_FOUND, "Page not found");
    }

    @ExceptionHandler(JRenderException.class)
    public ResponseEntity<String> renderFailed(JRenderException e) {
        log.error("Failed to render page", e);
        return plainText(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error");
    }

    private static ResponseEntity<String> plainText(HttpStatus status, String body) {
        return ResponseEntity.status(status).contentType(MediaType.TEXT_PLAIN).body(body);
    }
}
