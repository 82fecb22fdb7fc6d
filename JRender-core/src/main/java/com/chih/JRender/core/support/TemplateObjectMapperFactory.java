package com.chih.JRender.core.support;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

/**
 * 模板 bundle 解析用的 ObjectMapper 工厂类。
 * <p>
 * 集中管理 Jackson 配置，YAML 和 JSON 两种 bundle 格式使用一致的策略：
 * 容忍未知字段，空字符串不转为 null（空模板也是合法模板）。
 * </p>
 *
 * @author JRender Team
 * @since 2025/12/10
 */
public final class TemplateObjectMapperFactory {

    private TemplateObjectMapperFactory() {
    }

    /**
     * 根据文件名选择映射器：.yaml / .yml 使用 YAML，其余按 JSON 处理
     */
    public static ObjectMapper forFilename(String filename) {
        String lower = filename != null ? filename.toLowerCase() : "";
        return (lower.endsWith(".yaml") || lower.endsWith(".yml")) ? createYamlMapper() : createJsonMapper();
    }

    public static ObjectMapper createYamlMapper() {
        return configure(new ObjectMapper(new YAMLFactory()));
    }

    public static ObjectMapper createJsonMapper() {
        return configure(new ObjectMapper());
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        mapper.configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, false);
        return mapper;
    }
}
