package com.callflow.infrastructure.dao;

import com.callflow.infrastructure.dao.po.ActionPlanPO;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * 行动计划 DAO
 *
 * @author callflow
 * @since 2026-10-01
 */
@Component
public class ActionPlanDao extends AbstractInMemoryDao<ActionPlanPO> {

    /**
     * 根据分析结果 ID 查询
     */
    public ActionPlanPO selectByAnalysisId(String analysisId) {
        return selectWhere(po -> Objects.equals(analysisId, po.getAnalysisId())).stream()
                .findFirst()
                .orElse(null);
    }

    @Override
    protected String keyOf(ActionPlanPO po) {
        return po.getId();
    }

    @Override
    protected Integer versionOf(ActionPlanPO po) {
        return po.getVersion();
    }

    @Override
    protected ActionPlanPO copy(ActionPlanPO po, Integer version) {
        return po.toBuilder().version(version).build();
    }
}
