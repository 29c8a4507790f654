package com.callflow.config;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * 线程池配置类。
 * <p>
 * 支持两种拒绝策略：
 * <ul>
 *   <li>AbortPolicy：拒绝任务并抛出异常（默认）</li>
 *   <li>CallerRunsPolicy：由调用线程执行该任务</li>
 * </ul>
 * DiscardPolicy、DiscardOldestPolicy 会静默丢弃任务，配置时启动失败。
 * </p>
 *
 * @author callflow
 * @since 2026-10-01
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ThreadPoolConfigProperties.class)
public class ThreadPoolConfig {

    /**
     * 流水线任务线程池：每条通话记录一个任务
     */
    @Bean(name = "pipelineWorker", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(name = "pipelineWorker")
    public ThreadPoolExecutor pipelineWorker(ThreadPoolConfigProperties properties) {
        return buildExecutor("pipelineWorker", properties.getPipeline());
    }

    /**
     * 阶段调用线程池：分析、计划、抽取与执行器调用在此线程池上以超时方式等待
     */
    @Bean(name = "stageCallWorker", destroyMethod = "shutdownNow")
    @ConditionalOnMissingBean(name = "stageCallWorker")
    public ThreadPoolExecutor stageCallWorker(ThreadPoolConfigProperties properties) {
        return buildExecutor("stageCallWorker", properties.getStageCall());
    }

    private ThreadPoolExecutor buildExecutor(String name, ThreadPoolConfigProperties.Pool pool) {
        int coreSize = Math.max(pool.getCorePoolSize() == null ? 1 : pool.getCorePoolSize(), 1);
        int maxSize = Math.max(pool.getMaxPoolSize() == null ? coreSize : pool.getMaxPoolSize(), coreSize);
        long keepAliveSeconds = Math.max(pool.getKeepAliveTime() == null ? 0L : pool.getKeepAliveTime(), 0L);
        int queueCapacity = Math.max(pool.getBlockQueueSize() == null ? 0 : pool.getBlockQueueSize(), 0);
        BlockingQueue<Runnable> queue = queueCapacity == 0
                ? new SynchronousQueue<>()
                : new LinkedBlockingQueue<>(queueCapacity);
        ThreadPoolExecutor executor = new ThreadPoolExecutor(
                coreSize,
                maxSize,
                keepAliveSeconds,
                TimeUnit.SECONDS,
                queue,
                new ThreadFactoryBuilder()
                        .setNameFormat(pool.getThreadNamePrefix() + "%d")
                        .setDaemon(false)
                        .build(),
                buildRejectedExecutionHandler(name, pool.getPolicy()));
        log.info("Thread pool created. name={}, coreSize={}, maxSize={}, queueCapacity={}, policy={}",
                name, coreSize, maxSize, queueCapacity, pool.getPolicy());
        return executor;
    }

    private RejectedExecutionHandler buildRejectedExecutionHandler(String name, String policy) {
        if ("DiscardPolicy".equals(policy) || "DiscardOldestPolicy".equals(policy)) {
            log.error("Rejection policy '{}' drops tasks silently and is not allowed. pool={}", policy, name);
            throw new IllegalStateException("Unsupported rejection policy for " + name + ": " + policy);
        }
        if ("CallerRunsPolicy".equals(policy)) {
            return new ThreadPoolExecutor.CallerRunsPolicy();
        }
        if ("AbortPolicy".equals(policy)) {
            return new ThreadPoolExecutor.AbortPolicy();
        }
        log.warn("Unknown rejection policy '{}', fallback to AbortPolicy", policy);
        return new ThreadPoolExecutor.AbortPolicy();
    }

}
