package com.callflow.infrastructure.dao;

import com.callflow.infrastructure.dao.po.WorkflowPO;
import com.callflow.types.enums.WorkflowStatusEnum;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * 工作流 DAO，查询结果按创建时间升序、ID 次序稳定排列
 *
 * @author callflow
 * @since 2026-10-01
 */
@Component
public class WorkflowDao extends AbstractInMemoryDao<WorkflowPO> {

    private static final Comparator<WorkflowPO> CREATION_ORDER = Comparator
            .comparing(WorkflowPO::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(WorkflowPO::getId);

    public List<WorkflowPO> selectByPlanId(String planId) {
        return selectSorted(po -> Objects.equals(planId, po.getPlanId()));
    }

    public List<WorkflowPO> selectByRunId(String runId) {
        return selectSorted(po -> Objects.equals(runId, po.getRunId()));
    }

    public List<WorkflowPO> selectByStatus(WorkflowStatusEnum status) {
        return selectSorted(po -> po.getStatus() == status);
    }

    @Override
    public List<WorkflowPO> selectAll() {
        return selectSorted(po -> true);
    }

    private List<WorkflowPO> selectSorted(Predicate<WorkflowPO> filter) {
        List<WorkflowPO> rows = selectWhere(filter);
        rows.sort(CREATION_ORDER);
        return rows;
    }

    @Override
    protected String keyOf(WorkflowPO po) {
        return po.getId();
    }

    @Override
    protected Integer versionOf(WorkflowPO po) {
        return po.getVersion();
    }

    @Override
    protected WorkflowPO copy(WorkflowPO po, Integer version) {
        return po.toBuilder().version(version).build();
    }
}
