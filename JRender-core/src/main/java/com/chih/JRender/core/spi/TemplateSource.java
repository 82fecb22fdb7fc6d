package com.chih.JRender.core.spi;

import java.util.Set;

/**
 * 模板来源接口 (SPI)
 * <p>
 * 支持扩展不同的存储源（文件系统、Classpath、内嵌 bundle、内存字符串）。
 * 来源只负责"读"，不缓存编译结果。
 * </p>
 *
 * @author JRender Team
 * @since 2025/12/10
 */
public interface TemplateSource extends AutoCloseable {

    /**
     * 读取单个模板片段
     *
     * @param name 片段名称 (如 home.page.tmpl)
     * @return 片段内容，来源中不存在该片段时返回 null
     * @throws com.chih.JRender.core.exception.TemplateSourceNotFoundException 片段存在但读取失败
     */
    String read(String name);

    /**
     * @return 来源当前已知的所有片段名称
     */
    Set<String> names();

    @Override
    default void close() throws Exception {
        // Default no-op
    }
}
