package com.callflow.domain.analysis.model.valobj;

import com.callflow.types.enums.RiskLevelEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 风险分类器输出：风险等级与审批路由建议。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskAssessment {

    /**
     * 风险等级，分类器无法判断时为 null
     */
    private RiskLevelEnum riskLevel;

    /**
     * 审批路由建议，如 supervisor_approval / advisor_approval / auto_approve
     */
    private String approvalRoute;

    /**
     * 判定依据
     */
    private String reasoning;
}
