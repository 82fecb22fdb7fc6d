package com.chih.JRender.core.engine;

import com.chih.JRender.core.spi.CompiledTemplate;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * 模板存储：名称 -> 编译后模板，"当前有哪些已编译模板"的唯一来源
 *
 * 锁设计说明：
 * - 读写锁 (ReentrantReadWriteLock) 保护底层 HashMap，读操作并发，写操作独占
 * - 构建锁按名称划分：同名模板的首次构建串行化，后到的调用者等待并复用结果
 * - 构建 (读文件 + 编译) 在读写锁之外执行，写锁只覆盖最后一步插入
 * - 构建失败时异常原样抛出，存储内容保持不变
 * - reset 递增代数 (generation)，reset 之前开始的构建结果只返回给调用者，不写入存储
 *
 * @author JRender Team
 * @since 2025/12/10
 */
public class TemplateStore {

    private static final Logger log = LoggerFactory.getLogger(TemplateStore.class);

    private final Map<String, CompiledTemplate> templates = new HashMap<>();

    // 每次 reset 递增，读写受读写锁保护
    private long generation;

    // 读写锁：读操作并发，写操作独占
    private final ReentrantReadWriteLock rwLock = new ReentrantReadWriteLock();
    private final ReentrantReadWriteLock.ReadLock readLock = rwLock.readLock();
    private final ReentrantReadWriteLock.WriteLock writeLock = rwLock.writeLock();

    // 构建锁：防止同一个名称被并发重复构建
    // 使用 Caffeine 缓存管理锁对象，长期不访问的锁自动清理
    private final Cache<String, ReentrantLock> buildLocks = Caffeine.newBuilder()
            .maximumSize(10_000)
            .expireAfterAccess(30, TimeUnit.MINUTES)
            .build();

    /**
     * 取出或构建模板 (get-or-populate)
     * <p>
     * 已存在则直接返回，不调用 builder；否则在该名称的构建锁内 Double-Check 后调用 builder，
     * 成功则写入并返回。构建锁若在构建期间被淘汰，可能出现第二次并发构建，
     * 此时以先写入的结果为准，所有调用者拿到的仍是同一个对象。
     * </p>
     *
     * @param name 模板名称
     * @param builder 构建函数，输入模板名称
     * @return 存储中的权威模板
     */
    public CompiledTemplate populate(String name, Function<String, CompiledTemplate> builder) {
        // 1. 读锁下快速查找
        Optional<CompiledTemplate> existing = get(name);
        if (existing.isPresent()) {
            return existing.get();
        }

        // 2. 未命中，进入该名称的构建锁
        ReentrantLock buildLock = buildLocks.get(name, k -> new ReentrantLock());
        buildLock.lock();
        try {
            // Double-check：等待构建锁期间可能已被其他线程写入
            existing = get(name);
            if (existing.isPresent()) {
                return existing.get();
            }

            long startGeneration = currentGeneration();

            // 在读写锁之外构建
            CompiledTemplate built = builder.apply(name);
            if (built == null) {
                throw new IllegalStateException("Template builder returned null for: " + name);
            }

            return insert(name, built, startGeneration);
        } finally {
            buildLock.unlock();
        }
    }

    /**
     * 纯查找，无副作用
     */
    public Optional<CompiledTemplate> get(String name) {
        readLock.lock();
        try {
            return Optional.ofNullable(templates.get(name));
        } finally {
            readLock.unlock();
        }
    }

    /**
     * 清空所有模板，用于缓存策略切换或测试
     * <p>
     * 此时仍在进行中的构建完成后不会写入存储。
     * </p>
     */
    public void reset() {
        writeLock.lock();
        try {
            int size = templates.size();
            templates.clear();
            generation++;
            log.debug("Template store reset, {} templates dropped", size);
        } finally {
            writeLock.unlock();
        }
    }

    public int size() {
        readLock.lock();
        try {
            return templates.size();
        } finally {
            readLock.unlock();
        }
    }

    public Set<String> names() {
        readLock.lock();
        try {
            return Collections.unmodifiableSet(new TreeSet<>(templates.keySet()));
        } finally {
            readLock.unlock();
        }
    }

    private long currentGeneration() {
        readLock.lock();
        try {
            return generation;
        } finally {
            readLock.unlock();
        }
    }

    private CompiledTemplate insert(String name, CompiledTemplate built, long startGeneration) {
        writeLock.lock();
        try {
            if (generation != startGeneration) {
                log.debug("Store was reset while building {}, result not stored", name);
                return built;
            }
            CompiledTemplate winner = templates.putIfAbsent(name, built);
            return winner != null ? winner : built;
        } finally {
            writeLock.unlock();
        }
    }
}
