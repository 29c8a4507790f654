/**
 * Workflow 领域 - 审批与执行域
 *
 * <p>职责：工作流风险路由、人工审批、分步执行追踪</p>
 *
 * <h3>状态机</h3>
 * <ul>
 *   <li>PENDING_ASSESSMENT → AWAITING_APPROVAL | AUTO_APPROVED</li>
 *   <li>AWAITING_APPROVAL → APPROVED | REJECTED</li>
 *   <li>APPROVED | AUTO_APPROVED → EXECUTED | FAILED</li>
 * </ul>
 *
 * <h3>核心实体</h3>
 * <ul>
 *   <li>{@link com.callflow.domain.workflow.model.entity.WorkflowEntity}</li>
 *   <li>{@link com.callflow.domain.workflow.model.entity.ExecutionStepEntity}</li>
 * </ul>
 *
 * <h3>领域服务</h3>
 * <ul>
 *   <li>ApprovalGateDomainService - 审批路由与人工审批</li>
 *   <li>ExecutionTrackerDomainService - 步骤构建与顺序执行</li>
 * </ul>
 *
 * @author callflow
 * @since 2026-10-01
 */
package com.callflow.domain.workflow;
