package com.callflow.infrastructure.dao.po;

import com.callflow.types.enums.StepStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 执行步骤 PO，主键为 workflowId + stepNumber
 *
 * @author callflow
 * @since 2026-10-01
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionStepPO {

    private String workflowId;

    private Integer stepNumber;

    private String action;

    private String details;

    private String toolNeeded;

    private String validationCriteria;

    private StepStatusEnum status;

    /**
     * 执行结果 (JSON)
     */
    private String result;

    private String errorMessage;

    private Integer attemptCount;

    private LocalDateTime startedAt;

    private LocalDateTime executedAt;

    /**
     * 版本号 (乐观锁)
     */
    private Integer version;

    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;
}
