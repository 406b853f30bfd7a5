package com.voicetutor.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 线程池配置类。
 * <p>
 * 外部模型调用（委托导演、话术生成）在独立线程池中执行，调用线程只按软超时等待结果：
 * <ul>
 *   <li>核心线程数：默认4</li>
 *   <li>最大线程数：默认16</li>
 *   <li>队列大小：默认200，为 0 时使用直接移交队列</li>
 *   <li>拒绝策略：支持AbortPolicy、DiscardPolicy、DiscardOldestPolicy，默认AbortPolicy</li>
 * </ul>
 * 不支持 CallerRunsPolicy：被拒绝的任务会在提交线程上同步执行，软超时失效，配置后按 AbortPolicy 处理。
 * 拒绝由调用方转换为 EXTERNAL_SERVICE_ERROR 并走兜底。
 * </p>
 *
 * @author voicetutor
 * @since 2026-03-02
 */
@Slf4j
@Configuration
public class ThreadPoolConfig {

    @Bean(name = "tutorDelegateExecutor", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "tutorDelegateExecutor")
    public ThreadPoolExecutor tutorDelegateExecutor(
            @Value("${tutor.executor.core-size:4}") int coreSize,
            @Value("${tutor.executor.max-size:16}") int maxSize,
            @Value("${tutor.executor.keep-alive-seconds:60}") long keepAliveSeconds,
            @Value("${tutor.executor.queue-capacity:200}") int queueCapacity,
            @Value("${tutor.executor.rejection-policy:AbortPolicy}") String rejectionPolicy,
            @Value("${tutor.executor.thread-name-prefix:tutor-delegate-}") String threadNamePrefix) {
        int normalizedCoreSize = Math.max(coreSize, 1);
        int normalizedMaxSize = Math.max(maxSize, normalizedCoreSize);
        long normalizedKeepAliveSeconds = Math.max(keepAliveSeconds, 0L);
        int normalizedQueueCapacity = Math.max(queueCapacity, 0);
        BlockingQueue<Runnable> queue = normalizedQueueCapacity == 0
                ? new SynchronousQueue<>()
                : new LinkedBlockingQueue<>(normalizedQueueCapacity);
        AtomicInteger threadIndex = new AtomicInteger(0);
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(threadNamePrefix + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return new ThreadPoolExecutor(
                normalizedCoreSize,
                normalizedMaxSize,
                normalizedKeepAliveSeconds,
                TimeUnit.SECONDS,
                queue,
                threadFactory,
                buildRejectedExecutionHandler(rejectionPolicy));
    }

    private RejectedExecutionHandler buildRejectedExecutionHandler(String policy) {
        if ("DiscardPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardPolicy();
        }
        if ("DiscardOldestPolicy".equals(policy)) {
            return new ThreadPoolExecutor.DiscardOldestPolicy();
        }
        if ("CallerRunsPolicy".equals(policy)) {
            log.warn("CallerRunsPolicy bypasses the soft timeout of delegate calls, fallback to AbortPolicy");
            return new ThreadPoolExecutor.AbortPolicy();
        }
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        log.warn("Unknown rejection policy '{}', fallback to AbortPolicy", policy);
        return new ThreadPoolExecutor.AbortPolicy();
    }

}
