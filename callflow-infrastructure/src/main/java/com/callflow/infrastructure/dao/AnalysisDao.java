package com.callflow.infrastructure.dao;

import com.callflow.infrastructure.dao.po.AnalysisPO;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 分析结果 DAO
 *
 * @author callflow
 * @since 2026-10-01
 */
@Component
public class AnalysisDao extends AbstractInMemoryDao<AnalysisPO> {

    /**
     * 根据通话记录 ID 查询，按创建时间升序
     */
    public List<AnalysisPO> selectByTranscriptId(String transcriptId) {
        List<AnalysisPO> rows = selectWhere(po -> Objects.equals(transcriptId, po.getTranscriptId()));
        rows.sort(Comparator.comparing(AnalysisPO::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder())));
        return rows;
    }

    @Override
    protected String keyOf(AnalysisPO po) {
        return po.getId();
    }

    @Override
    protected Integer versionOf(AnalysisPO po) {
        return po.getVersion();
    }

    @Override
    protected AnalysisPO copy(AnalysisPO po, Integer version) {
        return po.toBuilder().version(version).build();
    }
}
