package com.callflow.infrastructure.dao;

import com.callflow.infrastructure.dao.po.ExecutionStepPO;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 执行步骤 DAO
 *
 * @author callflow
 * @since 2026-10-01
 */
@Component
public class ExecutionStepDao extends AbstractInMemoryDao<ExecutionStepPO> {

    /**
     * 工作流尚无步骤时批量插入，返回插入行数；已有步骤时返回 0
     */
    public synchronized int insertBatchIfAbsent(String workflowId, List<ExecutionStepPO> steps) {
        if (table.values().stream().anyMatch(po -> Objects.equals(workflowId, po.getWorkflowId()))) {
            return 0;
        }
        int affected = 0;
        for (ExecutionStepPO step : steps) {
            affected += insert(step);
        }
        return affected;
    }

    /**
     * 按步骤序号升序查询
     */
    public List<ExecutionStepPO> selectByWorkflowId(String workflowId) {
        List<ExecutionStepPO> rows = selectWhere(po -> Objects.equals(workflowId, po.getWorkflowId()));
        rows.sort(Comparator.comparing(ExecutionStepPO::getStepNumber));
        return rows;
    }

    public ExecutionStepPO selectByWorkflowIdAndStepNumber(String workflowId, Integer stepNumber) {
        return selectByKey(key(workflowId, stepNumber));
    }

    public synchronized int deleteByWorkflowId(String workflowId) {
        int before = table.size();
        table.values().removeIf(po -> Objects.equals(workflowId, po.getWorkflowId()));
        return before - table.size();
    }

    public static String key(String workflowId, Integer stepNumber) {
        return workflowId + "#" + stepNumber;
    }

    @Override
    protected String keyOf(ExecutionStepPO po) {
        return key(po.getWorkflowId(), po.getStepNumber());
    }

    @Override
    protected Integer versionOf(ExecutionStepPO po) {
        return po.getVersion();
    }

    @Override
    protected ExecutionStepPO copy(ExecutionStepPO po, Integer version) {
        return po.toBuilder().version(version).build();
    }
}
