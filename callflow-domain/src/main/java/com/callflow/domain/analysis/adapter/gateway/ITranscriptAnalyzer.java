package com.callflow.domain.analysis.adapter.gateway;

import com.callflow.domain.analysis.model.entity.AnalysisEntity;
import com.callflow.domain.transcript.model.entity.TranscriptEntity;

/**
 * 通话分析引擎（外部协作方，视为黑盒）。
 */
public interface ITranscriptAnalyzer {

    /**
     * 分析通话记录，返回结构化分析结果。
     */
    AnalysisEntity analyze(TranscriptEntity transcript);
}
