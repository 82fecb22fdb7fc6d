package com.chih.JRender.core.spi;

/**
 * 监控指标 SPI 接口
 *
 * @author JRender Team
 */
public interface RenderMetrics {

    /**
     * 记录一次模板渲染
     *
     * @param templateName 模板名称
     * @param durationNs 耗时 (纳秒)
     * @param success 是否成功
     */
    void recordRender(String templateName, long durationNs, boolean success);

    /**
     * 记录一次模板构建 (读取 + 编译)
     */
    void recordBuild(String templateName, long durationNs, boolean success);
}
