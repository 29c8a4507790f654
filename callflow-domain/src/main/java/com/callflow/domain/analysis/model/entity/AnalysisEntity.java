package com.callflow.domain.analysis.model.entity;

import com.callflow.domain.analysis.model.valobj.RiskScores;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 通话分析领域实体，每次运行每条通话记录一份，创建后不可变。
 *
 * @author callflow
 * @since 2026-10-01
 */
@Data
public class AnalysisEntity {

    /**
     * 主键 ID
     */
    private String id;

    /**
     * 通话记录 ID
     */
    private String transcriptId;

    /**
     * 运行 ID
     */
    private String runId;

    /**
     * 客户意图
     */
    private String intent;

    /**
     * 情绪
     */
    private String sentiment;

    /**
     * 紧急程度
     */
    private String urgency;

    /**
     * 分析摘要
     */
    private String summary;

    /**
     * 风险评分
     */
    private RiskScores riskScores;

    /**
     * 创建时间
     */
    private LocalDateTime createdAt;

    /**
     * 验证分析结果是否有效
     */
    public void validate() {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalStateException("Analysis ID cannot be empty");
        }
        if (transcriptId == null || transcriptId.trim().isEmpty()) {
            throw new IllegalStateException("Analysis transcript ID cannot be empty");
        }
    }
}
