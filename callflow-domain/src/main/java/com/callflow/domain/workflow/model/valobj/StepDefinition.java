package com.callflow.domain.workflow.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 工作流步骤定义，由工作流抽取阶段给出，执行前展开为执行步骤。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StepDefinition {

    /**
     * 动作描述
     */
    private String action;

    /**
     * 执行细节
     */
    private String details;

    /**
     * 所需工具类型，如 email / crm / task
     */
    private String toolNeeded;

    /**
     * 验证标准
     */
    private String validationCriteria;
}
