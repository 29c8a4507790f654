/**
 * Run 领域 - 批次运行域
 *
 * <p>职责：一次编排批次的进度、逐条结果、错误与汇总统计</p>
 *
 * <p>{@link com.callflow.domain.run.model.entity.PipelineRunEntity} 的所有写操作在实体上同步，
 * 对外只暴露不可变快照 {@link com.callflow.domain.run.model.valobj.RunSnapshot}。</p>
 *
 * @author callflow
 * @since 2026-10-01
 */
package com.callflow.domain.run;
