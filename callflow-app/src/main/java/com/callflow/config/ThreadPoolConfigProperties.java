package com.callflow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 线程池配置属性类，配置前缀为 callflow.thread-pool。
 * <p>
 * pipeline 线程池承载每条通话记录的处理任务，stage-call 线程池承载带超时的阶段调用与执行器调用。
 * 两者分开，避免阶段调用阻塞时占满流水线任务线程。
 * </p>
 *
 * @author callflow
 * @since 2026-10-01
 */
@Data
@ConfigurationProperties(prefix = "callflow.thread-pool", ignoreInvalidFields = true)
public class ThreadPoolConfigProperties {

    private Pool pipeline = new Pool(8, 16, 60L, 1000, "AbortPolicy", "pipeline-worker-");

    private Pool stageCall = new Pool(16, 32, 60L, 0, "AbortPolicy", "stage-call-");

    @Data
    public static class Pool {

        /** 核心线程数 */
        private Integer corePoolSize;

        /** 最大线程数 */
        private Integer maxPoolSize;

        /** 空闲线程最大存活时间（秒） */
        private Long keepAliveTime;

        /** 阻塞队列容量，0 表示直接移交 */
        private Integer blockQueueSize;

        /**
         * 拒绝策略：AbortPolicy 或 CallerRunsPolicy
         */
        private String policy;

        /** 线程名前缀 */
        private String threadNamePrefix;

        public Pool() {
        }

        public Pool(Integer corePoolSize, Integer maxPoolSize, Long keepAliveTime,
                    Integer blockQueueSize, String policy, String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.keepAliveTime = keepAliveTime;
            this.blockQueueSize = blockQueueSize;
            this.policy = policy;
            this.threadNamePrefix = threadNamePrefix;
        }
    }

}
