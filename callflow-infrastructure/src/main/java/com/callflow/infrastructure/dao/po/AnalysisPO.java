package com.callflow.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 分析结果 PO
 *
 * @author callflow
 * @since 2026-10-01
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisPO {

    private String id;

    private String transcriptId;

    private String runId;

    private String intent;

    private String sentiment;

    private String urgency;

    private String summary;

    /**
     * 风险评分 (JSON)
     */
    private String riskScores;

    private Integer version;

    private LocalDateTime createdAt;
}
