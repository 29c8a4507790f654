package com.callflow.infrastructure.repository.workflow;

import com.callflow.domain.workflow.adapter.repository.IExecutionStepRepository;
import com.callflow.domain.workflow.model.entity.ExecutionStepEntity;
import com.callflow.infrastructure.dao.ExecutionStepDao;
import com.callflow.infrastructure.dao.po.ExecutionStepPO;
import com.callflow.infrastructure.util.JsonCodec;
import com.callflow.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 执行步骤仓储实现类，结果载荷以 JSON 存储，更新带乐观锁。
 *
 * @author callflow
 * @since 2026-10-01
 */
@Slf4j
@Repository
public class ExecutionStepRepositoryImpl implements IExecutionStepRepository {

    private final ExecutionStepDao executionStepDao;
    private final JsonCodec jsonCodec;

    public ExecutionStepRepositoryImpl(ExecutionStepDao executionStepDao, JsonCodec jsonCodec) {
        this.executionStepDao = executionStepDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public List<ExecutionStepEntity> saveAllIfAbsent(String workflowId, List<ExecutionStepEntity> steps) {
        for (ExecutionStepEntity step : steps) {
            if (!Objects.equals(workflowId, step.getWorkflowId())) {
                throw AppException.invalidInput("Step belongs to workflow " + step.getWorkflowId() + ", expected " + workflowId);
            }
        }
        List<ExecutionStepPO> rows = steps.stream().map(this::toPO).collect(Collectors.toList());
        int inserted = executionStepDao.insertBatchIfAbsent(workflowId, rows);
        if (inserted > 0) {
            log.info("Execution steps built. workflowId={}, stepCount={}", workflowId, inserted);
        }
        return findByWorkflowId(workflowId);
    }

    @Override
    public ExecutionStepEntity update(ExecutionStepEntity step) {
        Integer oldVersion = step.getVersion();
        if (oldVersion == null) {
            throw new IllegalStateException("Version cannot be null for ExecutionStep update: "
                    + step.getWorkflowId() + "#" + step.getStepNumber());
        }
        int affected = executionStepDao.updateWithVersion(toPO(step));
        if (affected == 0) {
            log.warn("Execution step optimistic lock conflict. workflowId={}, stepNumber={}, expectedVersion={}",
                    step.getWorkflowId(), step.getStepNumber(), oldVersion);
            throw AppException.invalidTransition("Optimistic lock failed for step "
                    + step.getStepNumber() + " of workflow " + step.getWorkflowId());
        }
        step.setVersion(oldVersion + 1);
        return findByWorkflowIdAndStepNumber(step.getWorkflowId(), step.getStepNumber());
    }

    @Override
    public List<ExecutionStepEntity> findByWorkflowId(String workflowId) {
        return executionStepDao.selectByWorkflowId(workflowId).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public ExecutionStepEntity findByWorkflowIdAndStepNumber(String workflowId, Integer stepNumber) {
        return toEntity(executionStepDao.selectByWorkflowIdAndStepNumber(workflowId, stepNumber));
    }

    @Override
    public boolean deleteByWorkflowId(String workflowId) {
        return executionStepDao.deleteByWorkflowId(workflowId) > 0;
    }

    private ExecutionStepEntity toEntity(ExecutionStepPO po) {
        if (po == null) {
            return null;
        }
        ExecutionStepEntity entity = new ExecutionStepEntity();
        entity.setWorkflowId(po.getWorkflowId());
        entity.setStepNumber(po.getStepNumber());
        entity.setAction(po.getAction());
        entity.setDetails(po.getDetails());
        entity.setToolNeeded(po.getToolNeeded());
        entity.setValidationCriteria(po.getValidationCriteria());
        entity.setStatus(po.getStatus());
        entity.setResult(jsonCodec.readMap(po.getResult()));
        entity.setErrorMessage(po.getErrorMessage());
        entity.setAttemptCount(po.getAttemptCount());
        entity.setStartedAt(po.getStartedAt());
        entity.setExecutedAt(po.getExecutedAt());
        entity.setVersion(po.getVersion());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private ExecutionStepPO toPO(ExecutionStepEntity entity) {
        return ExecutionStepPO.builder()
                .workflowId(entity.getWorkflowId())
                .stepNumber(entity.getStepNumber())
                .action(entity.getAction())
                .details(entity.getDetails())
                .toolNeeded(entity.getToolNeeded())
                .validationCriteria(entity.getValidationCriteria())
                .status(entity.getStatus())
                .result(jsonCodec.writeValue(entity.getResult()))
                .errorMessage(entity.getErrorMessage())
                .attemptCount(entity.getAttemptCount())
                .startedAt(entity.getStartedAt())
                .executedAt(entity.getExecutedAt())
                .version(entity.getVersion())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
