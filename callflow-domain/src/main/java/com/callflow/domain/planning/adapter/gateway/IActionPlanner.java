package com.callflow.domain.planning.adapter.gateway;

import com.callflow.domain.analysis.model.entity.AnalysisEntity;
import com.callflow.domain.analysis.model.valobj.RiskAssessment;
import com.callflow.domain.planning.model.entity.ActionPlanEntity;

/**
 * 行动计划生成器（外部协作方，视为黑盒）。
 */
public interface IActionPlanner {

    /**
     * 基于分析结果与风险评估生成四角色行动计划。
     */
    ActionPlanEntity plan(AnalysisEntity analysis, RiskAssessment assessment);
}
