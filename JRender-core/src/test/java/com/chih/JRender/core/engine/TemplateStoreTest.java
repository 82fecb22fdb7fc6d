package com.chih.JRender.core.engine;

import com.chih.JRender.core.exception.TemplateSourceNotFoundException;
import com.chih.JRender.core.spi.CompiledTemplate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * TemplateStore 测试
 *
 * 测试覆盖：
 * - get-or-populate 语义
 * - 并发首次构建只执行一次
 * - 构建失败不污染存储
 */
@DisplayName("模板存储测试")
class TemplateStoreTest {

    private final TemplateStore store = new TemplateStore();

    @Test
    @DisplayName("已存在的模板不再调用构建函数")
    void testPopulateReturnsExistingEntry() {
        AtomicInteger builds = new AtomicInteger();
        CompiledTemplate first = store.populate("home", name -> {
            builds.incrementAndGet();
            return template(name);
        });
        CompiledTemplate second = store.populate("home", name -> {
            builds.incrementAndGet();
            return template(name);
        });

        assertThat(second).isSameAs(first);
        assertThat(builds.get()).isEqualTo(1);
        assertThat(store.size()).isEqualTo(1);
        assertThat(store.get("home")).containsSame(first);
    }

    @Test
    @DisplayName("并发首次请求同一名称时只构建一次")
    void testConcurrentPopulateBuildsOnce() throws Exception {
        int threadCount = 16;
        AtomicInteger builds = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(threadCount);

        List<Future<CompiledTemplate>> futures = new ArrayList<>();
        for (int i = 0; i < threadCount; i++) {
            futures.add(executor.submit(() -> {
                start.await();
                return store.populate("home", name -> {
                    builds.incrementAndGet();
                    sleepQuietly(50);
                    return template(name);
                });
            }));
        }
        start.countDown();

        CompiledTemplate winner = futures.get(0).get(5, TimeUnit.SECONDS);
        for (Future<CompiledTemplate> future : futures) {
            assertThat(future.get(5, TimeUnit.SECONDS)).isSameAs(winner);
        }
        executor.shutdown();

        assertThat(builds.get()).isEqualTo(1);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("不同名称的构建互不阻塞")
    void testDifferentNamesBuildIndependently() throws Exception {
        CountDownLatch insideFirstBuild = new CountDownLatch(1);
        CountDownLatch releaseFirstBuild = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        Future<CompiledTemplate> slow = executor.submit(() -> store.populate("slow", name -> {
            insideFirstBuild.countDown();
            awaitQuietly(releaseFirstBuild);
            return template(name);
        }));

        assertThat(insideFirstBuild.await(5, TimeUnit.SECONDS)).isTrue();
        // slow 仍在构建中，fast 不应被阻塞
        CompiledTemplate fast = store.populate("fast", this::template);
        assertThat(fast.getName()).isEqualTo("fast");

        releaseFirstBuild.countDown();
        assertThat(slow.get(5, TimeUnit.SECONDS).getName()).isEqualTo("slow");
        executor.shutdown();

        assertThat(store.names()).containsExactly("fast", "slow");
    }

    @Test
    @DisplayName("构建失败不修改存储，之后可以重新构建")
    void testFailedPopulateIsNotPoisoning() {
        assertThatThrownBy(() -> store.populate("home", name -> {
            throw new TemplateSourceNotFoundException(name);
        })).isInstanceOf(TemplateSourceNotFoundException.class);

        assertThat(store.get("home")).isEmpty();
        assertThat(store.size()).isZero();

        CompiledTemplate fixed = store.populate("home", this::template);

        assertThat(store.get("home")).containsSame(fixed);
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("构建函数返回 null 视为错误")
    void testNullBuildResultRejected() {
        assertThatThrownBy(() -> store.populate("home", name -> null))
                .isInstanceOf(IllegalStateException.class);
        assertThat(store.size()).isZero();
    }

    @Test
    @DisplayName("reset 清空全部模板")
    void testReset() {
        store.populate("home", this::template);
        store.populate("about", this::template);
        assertThat(store.names()).containsExactly("about", "home");

        store.reset();

        assertThat(store.size()).isZero();
        assertThat(store.get("home")).isEmpty();
        Set<String> names = store.names();
        assertThat(names).isEmpty();
    }

    @Test
    @DisplayName("构建期间发生 reset：结果返回给调用者，但不写入存储")
    void testResetDuringBuildDropsResult() {
        CompiledTemplate built = store.populate("home", name -> {
            store.reset();
            return template(name);
        });

        assertThat(built.getName()).isEqualTo("home");
        assertThat(store.get("home")).isEmpty();

        // 之后的构建照常写入
        CompiledTemplate rebuilt = store.populate("home", this::template);
        assertThat(store.get("home")).containsSame(rebuilt);
    }

    private CompiledTemplate template(String name) {
        return new CompiledTemplate(name, new Object(), Set.of());
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void awaitQuietly(CountDownLatch latch) {
        try {
            latch.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
