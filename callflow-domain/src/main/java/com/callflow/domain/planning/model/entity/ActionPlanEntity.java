package com.callflow.domain.planning.model.entity;

import com.callflow.domain.planning.model.valobj.RolePlan;
import com.callflow.types.enums.RiskLevelEnum;
import com.callflow.types.enums.WorkflowTypeEnum;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 行动计划领域实体。
 * 包含面向借款人、顾问、主管、管理层四个角色的子计划，以及计划级风险与审批路由。
 *
 * @author callflow
 * @since 2026-10-01
 */
@Data
public class ActionPlanEntity {

    /**
     * 主键 ID
     */
    private String id;

    /**
     * 分析结果 ID
     */
    private String analysisId;

    /**
     * 通话记录 ID
     */
    private String transcriptId;

    /**
     * 运行 ID
     */
    private String runId;

    private RolePlan borrowerPlan;

    private RolePlan advisorPlan;

    private RolePlan supervisorPlan;

    private RolePlan leadershipPlan;

    /**
     * 计划级风险等级
     */
    private RiskLevelEnum riskLevel;

    /**
     * 审批路由
     */
    private String approvalRoute;

    /**
     * 计划是否允许自动执行，null 表示未声明
     */
    private Boolean autoExecutable;

    /**
     * 队列状态
     */
    private String queueStatus;

    /**
     * 审批人
     */
    private String approvedBy;

    /**
     * 审批时间
     */
    private LocalDateTime approvedAt;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 更新时间
     */
    private LocalDateTime updatedAt;

    /**
     * 按角色取子计划
     */
    public RolePlan rolePlan(WorkflowTypeEnum role) {
        if (role == null) {
            return null;
        }
        return switch (role) {
            case BORROWER -> borrowerPlan;
            case ADVISOR -> advisorPlan;
            case SUPERVISOR -> supervisorPlan;
            case LEADERSHIP -> leadershipPlan;
        };
    }

    /**
     * 记录计划级审批
     */
    public void recordApproval(String approver) {
        if (approver == null || approver.trim().isEmpty()) {
            throw new IllegalStateException("Approver cannot be empty");
        }
        if (this.approvedBy != null) {
            throw new IllegalStateException("Plan already approved by " + this.approvedBy);
        }
        this.approvedBy = approver;
        this.approvedAt = LocalDateTime.now();
        this.queueStatus = "approved";
        this.updatedAt = this.approvedAt;
    }

    /**
     * 验证计划是否有效
     */
    public void validate() {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalStateException("Plan ID cannot be empty");
        }
        if (analysisId == null || analysisId.trim().isEmpty()) {
            throw new IllegalStateException("Plan analysis ID cannot be empty");
        }
    }
}
