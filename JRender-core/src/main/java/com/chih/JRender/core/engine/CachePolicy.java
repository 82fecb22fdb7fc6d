package com.chih.JRender.core.engine;

/**
 * 缓存策略
 *
 * @author JRender Team
 * @since 2025/12/10
 */
public enum CachePolicy {

    /**
     * 复用存储中的已编译模板 (生产环境)
     */
    REUSE,

    /**
     * 每次渲染都从来源重新加载，不写存储 (开发环境)
     */
    RELOAD;

    public static CachePolicy fromUseCache(boolean useCache) {
        return useCache ? REUSE : RELOAD;
    }

    public boolean usesStore() {
        return this == REUSE;
    }
}
