package com.chih.JRender.core.impl;

import com.chih.JRender.core.spi.AbstractIndexBasedTemplateSource;
import com.chih.JRender.core.support.TemplateResource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.net.JarURLConnection;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Enumeration;
import java.util.List;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;
import java.util.stream.Stream;

/**
 * 基于文件的模板源
 * <p>
 * 特性：
 * 1. 继承 AbstractIndexBasedTemplateSource，获得 Index-Only 模式能力
 * 2. 支持文件系统和 Classpath 资源混合加载，文件系统中不存在的路径按 Classpath 处理
 * 3. Classpath 既支持开发环境的 target/classes 目录，也支持打包后的 JAR 条目
 * 4. 目录递归扫描，模板名称取文件名
 * </p>
 * <p>
 * <strong>使用示例：</strong>
 * <pre>{@code
 * // 文件系统目录
 * FileTemplateSource source1 = new FileTemplateSource("./templates");
 *
 * // Classpath 目录 (打包进 JAR 的模板)
 * FileTemplateSource source2 = new FileTemplateSource("templates/");
 *
 * // 自定义模板文件后缀
 * FileTemplateSource source3 = new FileTemplateSource(List.of("./views"), ".html");
 * }</pre>
 * </p>
 *
 * @author JRender Team
 * @since 2025/12/10
 */
public class FileTemplateSource extends AbstractIndexBasedTemplateSource<TemplateResource> {

    private static final Logger log = LoggerFactory.getLogger(FileTemplateSource.class);

    public static final String DEFAULT_EXTENSION = ".tmpl";

    // 支持多个路径（可能是文件，也可能是目录）
    private final List<String> configPaths;

    // 只有以该后缀结尾的文件才会被视为模板
    private final String extension;

    public FileTemplateSource(String... paths) {
        this(Arrays.asList(paths), DEFAULT_EXTENSION);
    }

    /**
     * @param paths 文件或目录路径列表，支持文件系统路径和 Classpath 路径
     * @param extension 模板文件后缀，如 ".tmpl"
     */
    public FileTemplateSource(List<String> paths, String extension) {
        this.configPaths = new ArrayList<>(paths);
        this.extension = extension != null ? extension : DEFAULT_EXTENSION;

        // 首次扫描建立索引
        rebuildIndex();
    }

    @Override
    protected Collection<TemplateResource> scan() {
        List<TemplateResource> found = new ArrayList<>();
        for (String pathStr : configPaths) {
            File file = new File(pathStr);
            if (file.exists()) {
                collectFromFileSystem(file.toPath(), found);
            } else {
                scanClasspath(pathStr, found);
            }
        }
        return found;
    }

    /**
     * 文件系统：单个文件直接加入，目录递归扫描
     */
    private void collectFromFileSystem(Path root, List<TemplateResource> found) {
        if (Files.isRegularFile(root)) {
            if (isTemplateFile(root.getFileName().toString())) {
                found.add(TemplateResource.fromFile(root));
            }
            return;
        }

        try (Stream<Path> stream = Files.walk(root)) {
            stream.filter(Files::isRegularFile)
                    .filter(p -> isTemplateFile(p.getFileName().toString()))
                    .sorted()
                    .forEach(p -> found.add(TemplateResource.fromFile(p)));
        } catch (IOException e) {
            log.warn("Failed to scan template directory: {}", root, e);
        }
    }

    /**
     * 扫描 Classpath 资源（支持目录和 JAR）
     */
    private void scanClasspath(String path, List<TemplateResource> found) {
        // ClassLoader 资源路径不应以 / 开头
        String cleanPath = path.startsWith("/") ? path.substring(1) : path;

        // 空路径会导致全量扫描 Classpath
        if (cleanPath.isEmpty()) {
            log.warn("Empty classpath location ignored. Specify a concrete directory like 'templates/'.");
            return;
        }

        try {
            Enumeration<URL> resources = classLoader().getResources(cleanPath);
            while (resources.hasMoreElements()) {
                URL url = resources.nextElement();
                String protocol = url.getProtocol();

                if ("file".equals(protocol)) {
                    // 场景 A: 开发环境（资源在 target/classes 目录下）
                    collectFromFileSystem(Paths.get(url.toURI()), found);
                } else if ("jar".equals(protocol)) {
                    // 场景 B: 生产环境（资源在 JAR 包内）
                    scanJar(url, cleanPath, found);
                }
            }
        } catch (Exception e) {
            log.warn("Failed to scan classpath location: {}", path, e);
        }
    }

    /**
     * 扫描 JAR 包内的资源
     * <p>
     * 使用 JarURLConnection 获取 JAR 文件的基础 URL，再拼接条目名称构造条目 URL。
     * </p>
     */
    private void scanJar(URL url, String rootPath, List<TemplateResource> found) throws IOException {
        // URL 格式通常为: jar:file:/path/to/app.jar!/templates
        JarURLConnection jarConn = (JarURLConnection) url.openConnection();
        jarConn.setUseCaches(false);
        URL jarBaseUrl = jarConn.getJarFileURL();

        try (JarFile jarFile = jarConn.getJarFile()) {
            Enumeration<JarEntry> entries = jarFile.entries();
            while (entries.hasMoreElements()) {
                JarEntry entry = entries.nextElement();
                String name = entry.getName();

                if (name.startsWith(rootPath) && !entry.isDirectory() && isTemplateFile(name)) {
                    URL entryUrl = new URL("jar:" + jarBaseUrl + "!/" + name);
                    found.add(TemplateResource.fromClasspath(entryUrl, "classpath:" + name));
                }
            }
        }
    }

    private boolean isTemplateFile(String fileName) {
        int lastSlash = fileName.lastIndexOf('/');
        String baseName = lastSlash >= 0 ? fileName.substring(lastSlash + 1) : fileName;
        // 忽略编辑器临时文件和隐藏文件
        return !baseName.startsWith(".") && !baseName.endsWith("~") && baseName.endsWith(extension);
    }

    private ClassLoader classLoader() {
        ClassLoader contextLoader = Thread.currentThread().getContextClassLoader();
        return contextLoader != null ? contextLoader : FileTemplateSource.class.getClassLoader();
    }

    // === 实现抽象方法 ===

    @Override
    protected InputStream openStream(TemplateResource resource) throws IOException {
        return resource.getInputStream();
    }

    @Override
    protected String getResourceName(TemplateResource resource) {
        return resource.getFilename();
    }

    @Override
    protected boolean exists(TemplateResource resource) {
        return resource.exists();
    }

    @Override
    protected String getResourceDescription(TemplateResource resource) {
        return resource.getResourcePath();
    }

    @Override
    public String toString() {
        return "FileTemplateSource" + configPaths;
    }
}
