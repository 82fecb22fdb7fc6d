package com.chih.JRender.core.exception;

/**
 * JRender 框架根异常
 * <p>
 * 所有渲染链路上的错误都以非受检异常的形式同步抛给调用方，框架内部不吞异常、不终止进程。
 * </p>
 */
public class JRenderException extends RuntimeException {
    public JRenderException(String message) {
        super(message);
    }

    public JRenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
