package com.callflow.infrastructure.analysis;

import com.callflow.domain.analysis.adapter.gateway.IRiskClassifier;
import com.callflow.domain.analysis.model.entity.AnalysisEntity;
import com.callflow.domain.analysis.model.valobj.RiskAssessment;
import com.callflow.domain.analysis.model.valobj.RiskScores;
import com.callflow.types.enums.RiskLevelEnum;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * 阈值风险分类器：取风险评分最大值与阈值比较。
 * 高风险路由到主管审批，中风险路由到顾问审批，低风险可自动审批。
 *
 * @author callflow
 * @since 2026-10-01
 */
@Component
public class ThresholdRiskClassifier implements IRiskClassifier {

    public static final String ROUTE_SUPERVISOR = "supervisor_approval";
    public static final String ROUTE_ADVISOR = "advisor_approval";
    public static final String ROUTE_AUTO = "auto_approve";

    private final double highThreshold;
    private final double mediumThreshold;

    public ThresholdRiskClassifier(@Value("${callflow.risk.high-threshold:0.7}") double highThreshold,
                                   @Value("${callflow.risk.medium-threshold:0.4}") double mediumThreshold) {
        if (mediumThreshold > highThreshold) {
            throw new IllegalArgumentException("Medium risk threshold must not exceed high threshold");
        }
        this.highThreshold = highThreshold;
        this.mediumThreshold = mediumThreshold;
    }

    @Override
    public RiskAssessment classify(AnalysisEntity analysis) {
        RiskScores scores = analysis.getRiskScores();
        if (scores == null) {
            return RiskAssessment.builder()
                    .riskLevel(null)
                    .approvalRoute(ROUTE_SUPERVISOR)
                    .reasoning("No risk scores available")
                    .build();
        }
        double maxRisk = scores.maxRisk();
        if (maxRisk >= highThreshold) {
            return assessment(RiskLevelEnum.HIGH, ROUTE_SUPERVISOR, maxRisk);
        }
        if (maxRisk >= mediumThreshold) {
            return assessment(RiskLevelEnum.MEDIUM, ROUTE_ADVISOR, maxRisk);
        }
        return assessment(RiskLevelEnum.LOW, ROUTE_AUTO, maxRisk);
    }

    private RiskAssessment assessment(RiskLevelEnum level, String route, double maxRisk) {
        return RiskAssessment.builder()
                .riskLevel(level)
                .approvalRoute(route)
                .reasoning(String.format(Locale.ROOT, "max risk score %.2f", maxRisk))
                .build();
    }
}
