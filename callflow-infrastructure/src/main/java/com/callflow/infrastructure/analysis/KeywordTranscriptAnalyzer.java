package com.callflow.infrastructure.analysis;

import com.callflow.domain.analysis.adapter.gateway.ITranscriptAnalyzer;
import com.callflow.domain.analysis.model.entity.AnalysisEntity;
import com.callflow.domain.analysis.model.valobj.RiskScores;
import com.callflow.domain.transcript.model.entity.TranscriptEntity;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * 基于关键词的确定性通话分析器，作为默认分析引擎。
 * 每命中一个信号词，对应风险分值增加固定步长，上限 1.0。
 *
 * @author callflow
 * @since 2026-10-01
 */
@Component
public class KeywordTranscriptAnalyzer implements ITranscriptAnalyzer {

    private static final double BASE_SCORE = 0.1D;
    private static final double SIGNAL_STEP = 0.25D;
    private static final int SUMMARY_LIMIT = 160;

    private static final List<String> DELINQUENCY_SIGNALS = List.of("late", "missed", "behind", "hardship", "can't pay", "lost my job");
    private static final List<String> CHURN_SIGNALS = List.of("cancel", "leave", "switch", "competitor", "close my account");
    private static final List<String> COMPLAINT_SIGNALS = List.of("complaint", "angry", "frustrated", "unacceptable", "supervisor");
    private static final List<String> REFINANCE_SIGNALS = List.of("refinance", "rate", "lower payment", "cash out");

    @Override
    public AnalysisEntity analyze(TranscriptEntity transcript) {
        String content = StringUtils.defaultString(transcript.getContent()).toLowerCase(Locale.ROOT);
        RiskScores scores = RiskScores.builder()
                .delinquencyRisk(score(content, DELINQUENCY_SIGNALS))
                .churnRisk(score(content, CHURN_SIGNALS))
                .complaintRisk(score(content, COMPLAINT_SIGNALS))
                .refinanceLikelihood(score(content, REFINANCE_SIGNALS))
                .build();

        AnalysisEntity analysis = new AnalysisEntity();
        analysis.setId("ANALYSIS_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12).toUpperCase(Locale.ROOT));
        analysis.setTranscriptId(transcript.getId());
        analysis.setIntent(resolveIntent(content));
        analysis.setSentiment(scores.getComplaintRisk() >= 0.5D ? "negative" : "neutral");
        analysis.setUrgency(scores.maxRisk() >= 0.6D ? "high" : scores.maxRisk() >= 0.35D ? "medium" : "low");
        analysis.setSummary(StringUtils.abbreviate(StringUtils.normalizeSpace(transcript.getContent()), SUMMARY_LIMIT));
        analysis.setRiskScores(scores);
        analysis.setCreatedAt(LocalDateTime.now());
        return analysis;
    }

    private String resolveIntent(String content) {
        if (containsAny(content, DELINQUENCY_SIGNALS)) {
            return "hardship_assistance";
        }
        if (containsAny(content, COMPLAINT_SIGNALS)) {
            return "complaint";
        }
        if (containsAny(content, REFINANCE_SIGNALS)) {
            return "refinance_inquiry";
        }
        if (containsAny(content, CHURN_SIGNALS)) {
            return "account_closure";
        }
        return "general_inquiry";
    }

    private double score(String content, List<String> signals) {
        long hits = signals.stream().filter(content::contains).count();
        return Math.min(1D, BASE_SCORE + hits * SIGNAL_STEP);
    }

    private boolean containsAny(String content, List<String> signals) {
        return signals.stream().anyMatch(content::contains);
    }
}
