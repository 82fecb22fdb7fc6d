package com.chih.JRender.core.impl;

import com.chih.JRender.core.exception.JRenderException;
import com.chih.JRender.core.exception.TemplateSourceNotFoundException;
import com.chih.JRender.core.exception.TemplateSyntaxException;
import com.chih.JRender.core.spi.CompiledTemplate;
import com.chih.JRender.core.spi.TemplateEngine;
import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheException;
import com.github.mustachejava.util.GuardException;
import com.github.mustachejava.reflect.MissingWrapper;
import com.github.mustachejava.reflect.ReflectionObjectHandler;
import com.github.mustachejava.util.Wrapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.Writer;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * 基于 Mustache 的模板引擎实现
 * <p>
 * 支持 {{user.name}}、{{#list}} 循环、{{> partial}} 子模板，
 * 以及 {{&lt; base.layout}} {{$content}}...{{/content}} 形式的布局继承。
 * 布局和子模板在编译期通过 fragmentLoader 加载并链接，执行期不再回源。
 * </p>
 * <p>
 * 严格变量模式 (默认开启)：模板引用的名称在数据中不存在时，执行失败而不是输出空串；
 * 名称存在但值为 null 时视为假值。
 * </p>
 *
 * @author JRender Team
 * @since 2025/12/10
 */
public class MustacheTemplateEngine implements TemplateEngine {

    private static final Logger log = LoggerFactory.getLogger(MustacheTemplateEngine.class);

    private final boolean strictVariables;

    public MustacheTemplateEngine() {
        this(true);
    }

    public MustacheTemplateEngine(boolean strictVariables) {
        this.strictVariables = strictVariables;
    }

    @Override
    public CompiledTemplate compile(String name, String source, Function<String, String> fragmentLoader) {
        if (source == null) {
            throw new TemplateSourceNotFoundException(name);
        }
        // 每次编译创建一个临时的 Factory，绑定当前的 fragmentLoader
        // Factory 内部会缓存子模板，同一次编译中同名片段只读取一次
        JRenderMustacheFactory mf = new JRenderMustacheFactory(name, fragmentLoader, strictVariables);
        try {
            Mustache mustache = mf.compile(new StringReader(source), name);
            log.debug("Compiled mustache template: {} (fragments: {})", name, mf.getRecordedFragments());
            return new CompiledTemplate(name, mustache, mf.getRecordedFragments());
        } catch (RuntimeException e) {
            throw translateCompileFailure(name, e);
        }
    }

    @Override
    public void execute(CompiledTemplate template, Object payload, Writer out) throws IOException {
        Mustache mustache = (Mustache) template.getEngineObject();
        mustache.execute(out, payload);
        out.flush();
    }

    public boolean isStrictVariables() {
        return strictVariables;
    }

    /**
     * 子片段抛出的 JRender 异常可能被 Mustache 包装，这里还原出最内层的那个；
     * 其余 Mustache 异常都归为根模板的语法错误
     */
    private static JRenderException translateCompileFailure(String name, RuntimeException e) {
        Throwable current = e;
        while (current != null) {
            if (current instanceof TemplateSyntaxException || current instanceof TemplateSourceNotFoundException) {
                return (JRenderException) current;
            }
            current = current.getCause();
        }
        return new TemplateSyntaxException(name, e.getMessage(), e);
    }

    /**
     * 自定义 Mustache 工厂，用于从 TemplateSource 加载布局和子模板
     */
    private static class JRenderMustacheFactory extends DefaultMustacheFactory {

        private final String rootName;

        private final Function<String, String> fragmentLoader;

        // 用于检测循环引用：当前编译链路上尚未完成的片段
        private final Set<String> visiting = new HashSet<>();

        // 记录编译期引入的所有片段
        private final Set<String> recordedFragments = new LinkedHashSet<>();

        JRenderMustacheFactory(String rootName, Function<String, String> fragmentLoader, boolean strictVariables) {
            this.rootName = rootName;
            this.fragmentLoader = fragmentLoader;
            if (rootName != null) {
                visiting.add(rootName);
            }
            if (strictVariables) {
                setObjectHandler(new StrictObjectHandler());
            }
        }

        @Override
        public Reader getReader(String resourceName) {
            String name = normalize(resourceName);

            // 1. 循环引用检测：片段在自己的编译链路上再次出现，即 A -> B -> A
            if (visiting.contains(name)) {
                throw new TemplateSyntaxException(name,
                        String.format("Circular reference detected! Fragment '%s' is referenced recursively.", name), null);
            }

            recordedFragments.add(name);

            String content = fragmentLoader != null ? fragmentLoader.apply(name) : null;
            if (content == null) {
                throw new TemplateSourceNotFoundException(name, rootName);
            }
            visiting.add(name);
            return new StringReader(content);
        }

        /**
         * 子片段的语法错误归属到该片段本身，而不是引用它的页面
         */
        @Override
        public Mustache compilePartial(String s) {
            String name = normalize(s);
            boolean onPath = visiting.contains(name);
            try {
                return super.compilePartial(s);
            } catch (TemplateSyntaxException | TemplateSourceNotFoundException e) {
                throw e;
            } catch (MustacheException e) {
                throw new TemplateSyntaxException(name, e.getMessage(), e);
            } finally {
                // 片段编译完成后出栈，同一片段在别处再次引用是合法的
                if (!onPath) {
                    visiting.remove(name);
                }
            }
        }

        Set<String> getRecordedFragments() {
            return recordedFragments;
        }

        private static String normalize(String resourceName) {
            String name = resourceName;
            while (name.startsWith("/") || name.startsWith("./")) {
                name = name.startsWith("/") ? name.substring(1) : name.substring(2);
            }
            return name;
        }
    }

    /**
     * 严格模式的对象处理器：名称在数据中不存在 (没有对应的 getter、字段或 Map 键) 时抛出异常。
     * 名称存在但值为 null 时按普通的假值处理，{{^flash}} 之类的反向区块照常工作。
     */
    private static class StrictObjectHandler extends ReflectionObjectHandler {

        @Override
        public Wrapper find(String name, List<Object> scopes) {
            Wrapper delegate = super.find(name, scopes);
            if (!(delegate instanceof MissingWrapper)) {
                return delegate;
            }
            return new Wrapper() {
                @Override
                public Object call(List<Object> callScopes) throws GuardException {
                    // 先校验 guard，数据结构变化时由 mustache.java 重新查找
                    delegate.call(callScopes);
                    throw new MustacheException("No value found for '" + name + "' in template data");
                }
            };
        }
    }
}
