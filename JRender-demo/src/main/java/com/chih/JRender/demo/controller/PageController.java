package com.chih.JRender.demo.controller;

import com.chih.JRender.core.engine.TemplateRenderer;
import com.chih.JRender.demo.model.TemplateData;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * 页面控制器
 * <p>
 * 每个 handler 组装 TemplateData，交给 TemplateRenderer 写入响应。
 * 渲染失败时响应尚未写入任何内容，错误由 {@link RenderExceptionHandler} 转换为 HTTP 状态码。
 * </p>
 *
 * @author JRender Team
 * @since 2025/12/10
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class PageController {

    private final TemplateRenderer renderer;

    @GetMapping("/home")
    public void home(HttpServletResponse response) {
        render(response, "home.page.tmpl", new TemplateData());
    }

    @GetMapping("/about")
    public void about(HttpServletResponse response) {
        TemplateData data = TemplateData.builder()
                .stringMap(Map.of("test", "Hello, again"))
                .build();
        render(response, "about.page.tmpl", data);
    }

    /**
     * 按名称渲染任意页面，名称不含后缀
     */
    @GetMapping("/pages/{name}")
    public void page(@PathVariable("name") String name, HttpServletResponse response) {
        render(response, name + ".page.tmpl", new TemplateData());
    }

    private void render(HttpServletResponse response, String template, TemplateData data) {
        log.debug("Rendering {}", template);
        response.setContentType(MediaType.TEXT_HTML_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        renderer.render(new ResponseWriter(response), template, data);
    }

    /**
     * 首次写入时才获取响应的 Writer
     * <p>
     * 渲染失败时响应的 Writer 从未被获取，异常处理器仍然可以正常输出错误响应。
     * </p>
     */
    private static class ResponseWriter extends Writer {

        private final HttpServletResponse response;

        ResponseWriter(HttpServletResponse response) {
            this.response = response;
        }

        @Override
        public void write(char[] cbuf, int off, int len) throws IOException {
            response.getWriter().write(cbuf, off, len);
        }

        @Override
        public void write(String str) throws IOException {
            response.getWriter().write(str);
        }

        @Override
        public void flush() throws IOException {
            response.getWriter().flush();
        }

        @Override
        public void close() {
            // 由 Servlet 容器关闭
        }
    }
}
