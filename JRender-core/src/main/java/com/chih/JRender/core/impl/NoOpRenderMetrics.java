package com.chih.JRender.core.impl;

import com.chih.JRender.core.spi.RenderMetrics;

public class NoOpRenderMetrics implements RenderMetrics {
    @Override
    public void recordRender(String templateName, long durationNs, boolean success) {
        // Do nothing
    }

    @Override
    public void recordBuild(String templateName, long durationNs, boolean success) {
        // Do nothing
    }
}
