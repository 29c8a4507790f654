package com.callflow.domain.planning.model.valobj;

import com.callflow.domain.workflow.model.valobj.StepDefinition;
import com.callflow.types.enums.RiskLevelEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 角色计划中的单个行动项。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActionItem {

    /**
     * 行动描述
     */
    private String action;

    /**
     * 优先级
     */
    private String priority;

    /**
     * 行动项自身的风险等级，未给出时为 null
     */
    private RiskLevelEnum riskLevel;

    /**
     * 步骤定义
     */
    @Builder.Default
    private List<StepDefinition> steps = new ArrayList<>();
}
