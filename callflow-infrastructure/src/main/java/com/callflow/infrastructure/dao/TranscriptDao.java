package com.callflow.infrastructure.dao;

import com.callflow.infrastructure.dao.po.TranscriptPO;
import org.springframework.stereotype.Component;

/**
 * 通话记录 DAO
 *
 * @author callflow
 * @since 2026-10-01
 */
@Component
public class TranscriptDao extends AbstractInMemoryDao<TranscriptPO> {

    @Override
    protected String keyOf(TranscriptPO po) {
        return po.getId();
    }

    @Override
    protected Integer versionOf(TranscriptPO po) {
        return po.getVersion();
    }

    @Override
    protected TranscriptPO copy(TranscriptPO po, Integer version) {
        return po.toBuilder().version(version).build();
    }
}
