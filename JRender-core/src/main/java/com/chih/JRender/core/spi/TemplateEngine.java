package com.chih.JRender.core.spi;

import java.io.IOException;
import java.io.Writer;
import java.util.function.Function;

/**
 * 模板引擎 SPI 接口
 * 模板语法本身交给引擎实现，JRender 只负责编译结果的缓存与输出
 *
 * @author JRender Team
 * @since 2025/12/10
 */
public interface TemplateEngine {

    /**
     * 1. 编译阶段：将模板文本编译为可执行对象
     *
     * @param name 模板名称，同时作为错误信息中的片段标识
     * @param source 模板文本
     * @param fragmentLoader 子片段加载器 (输入片段名称，返回片段内容，找不到时返回 null)
     * @return 编译后的模板
     * @throws com.chih.JRender.core.exception.TemplateSyntaxException 任一片段语法错误
     * @throws com.chih.JRender.core.exception.TemplateSourceNotFoundException 引用的片段不存在
     */
    CompiledTemplate compile(String name, String source, Function<String, String> fragmentLoader);

    /**
     * 2. 执行阶段：使用编译好的对象渲染到 out
     *
     * @param template 编译后的模板
     * @param payload 调用方提供的数据，引擎不关心其具体结构
     * @param out 输出目标
     * @throws IOException 写入 out 失败
     */
    void execute(CompiledTemplate template, Object payload, Writer out) throws IOException;
}
