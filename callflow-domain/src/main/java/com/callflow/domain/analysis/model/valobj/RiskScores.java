package com.callflow.domain.analysis.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 借款人风险评分（0.0 ~ 1.0）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskScores {

    /**
     * 逾期风险
     */
    private Double delinquencyRisk;

    /**
     * 流失风险
     */
    private Double churnRisk;

    /**
     * 投诉风险
     */
    private Double complaintRisk;

    /**
     * 再融资可能性
     */
    private Double refinanceLikelihood;

    /**
     * 取风险类评分中的最大值（再融资可能性不计入风险）。
     */
    public double maxRisk() {
        return Math.max(valueOf(delinquencyRisk), Math.max(valueOf(churnRisk), valueOf(complaintRisk)));
    }

    private double valueOf(Double value) {
        return value == null ? 0D : value;
    }
}
