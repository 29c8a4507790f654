package com.callflow.domain.analysis.adapter.gateway;

import com.callflow.domain.analysis.model.entity.AnalysisEntity;
import com.callflow.domain.analysis.model.valobj.RiskAssessment;

/**
 * 风险分类器（外部协作方，视为黑盒）。
 */
public interface IRiskClassifier {

    /**
     * 根据分析结果给出风险等级与审批路由建议。
     */
    RiskAssessment classify(AnalysisEntity analysis);
}
