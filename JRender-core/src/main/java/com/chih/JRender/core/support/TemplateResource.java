package com.chih.JRender.core.support;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * 模板资源包装类
 * <p>
 * 统一文件系统和 Classpath（含 JAR 内条目）两类模板文件的访问方式，
 * 供 {@link com.chih.JRender.core.impl.FileTemplateSource} 建立索引使用。
 * 所有字段为 final，实例不可变。
 * </p>
 *
 * @author JRender Team
 * @since 2025/12/10
 */
public final class TemplateResource {

    /**
     * 文件系统路径，Classpath 资源时为 null
     */
    private final Path filePath;

    /**
     * Classpath 资源 URL，文件系统资源时为 null
     */
    private final URL classpathUrl;

    /**
     * 资源描述 (日志、错误信息用)，同时作为相等性判断依据
     */
    private final String resourcePath;

    private TemplateResource(Path filePath, URL classpathUrl, String resourcePath) {
        this.filePath = filePath;
        this.classpathUrl = classpathUrl;
        this.resourcePath = resourcePath;
    }

    /**
     * 创建文件系统资源
     *
     * @param filePath 模板文件路径，不能为 null
     */
    public static TemplateResource fromFile(Path filePath) {
        if (filePath == null) {
            throw new IllegalArgumentException("File path cannot be null");
        }
        return new TemplateResource(filePath, null, filePath.toAbsolutePath().toString());
    }

    /**
     * 创建 Classpath 资源
     *
     * <pre>{@code
     * URL url = classLoader.getResource("templates/home.page.tmpl");
     * TemplateResource resource = TemplateResource.fromClasspath(url, "classpath:templates/home.page.tmpl");
     * }</pre>
     *
     * @param classpathUrl 资源 URL (file: 或 jar: 协议)
     * @param resourcePath 资源描述，不能为空
     */
    public static TemplateResource fromClasspath(URL classpathUrl, String resourcePath) {
        if (classpathUrl == null) {
            throw new IllegalArgumentException("Classpath URL cannot be null");
        }
        if (resourcePath == null || resourcePath.trim().isEmpty()) {
            throw new IllegalArgumentException("Resource path cannot be null or empty");
        }
        return new TemplateResource(null, classpathUrl, resourcePath);
    }

    /**
     * 打开输入流，调用者负责关闭
     */
    public InputStream getInputStream() throws IOException {
        if (filePath != null) {
            return Files.newInputStream(filePath);
        }
        return classpathUrl.openStream();
    }

    public boolean exists() {
        if (filePath != null) {
            return Files.isRegularFile(filePath);
        }
        // classpath URL 不一定支持存在性检查，只能尝试打开
        try (InputStream ignored = classpathUrl.openStream()) {
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    /**
     * 模板名称即文件名 (不含目录)
     */
    public String getFilename() {
        if (filePath != null) {
            return filePath.getFileName().toString();
        }
        String path = classpathUrl.getPath();
        int lastSlash = path.lastIndexOf('/');
        return lastSlash >= 0 ? path.substring(lastSlash + 1) : path;
    }

    public String getResourcePath() {
        return resourcePath;
    }

    public boolean isFileSystemResource() {
        return filePath != null;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof TemplateResource other)) {
            return false;
        }
        return Objects.equals(resourcePath, other.resourcePath);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(resourcePath);
    }

    @Override
    public String toString() {
        return "TemplateResource{path='" + resourcePath + "'}";
    }
}
