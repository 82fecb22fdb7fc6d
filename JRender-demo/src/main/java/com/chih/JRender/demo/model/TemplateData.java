package com.chih.JRender.demo.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * 页面渲染数据，由 handler 传给模板
 * <p>
 * 集合字段默认是空 Map；字段为 null 时按假值处理，模板可以用 {{^flash}}...{{/flash}} 判断。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TemplateData {

    @Builder.Default
    private Map<String, String> stringMap = new HashMap<>();

    @Builder.Default
    private Map<String, Integer> intMap = new HashMap<>();

    @Builder.Default
    private Map<String, Double> floatMap = new HashMap<>();

    @Builder.Default
    private Map<String, Object> data = new HashMap<>();

    // 防 CSRF 攻击的令牌
    @Builder.Default
    private String csrfToken = "";

    @Builder.Default
    private String flash = "";

    @Builder.Default
    private String warning = "";

    @Builder.Default
    private String error = "";
}
