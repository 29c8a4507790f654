package com.callflow.domain.workflow.service;

import com.callflow.domain.pipeline.service.StageCallInvoker;
import com.callflow.domain.workflow.adapter.gateway.IStepActuator;
import com.callflow.domain.workflow.adapter.repository.IExecutionStepRepository;
import com.callflow.domain.workflow.adapter.repository.IWorkflowRepository;
import com.callflow.domain.workflow.model.entity.ExecutionStepEntity;
import com.callflow.domain.workflow.model.entity.WorkflowEntity;
import com.callflow.domain.workflow.model.valobj.StepDefinition;
import com.callflow.domain.workflow.model.valobj.WorkflowExecutionResult;
import com.callflow.types.common.Constants;
import com.callflow.types.enums.ResponseCode;
import com.callflow.types.enums.StepStatusEnum;
import com.callflow.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 执行追踪领域服务：维护 Workflow → ExecutionStep 层级与步骤状态迁移。
 * <p>
 * 步骤严格按序号升序执行；步骤出错后只能由调用方显式重试，不做自动重试。
 * 步骤状态迁移依赖仓储乐观锁，并发抢占失败的一方得到 INVALID_TRANSITION。
 */
@Slf4j
@Service
public class ExecutionTrackerDomainService {

    private final IWorkflowRepository workflowRepository;
    private final IExecutionStepRepository executionStepRepository;
    private final IStepActuator stepActuator;
    private final StageCallInvoker stageCallInvoker;
    private final Counter stepExecutedCounter;
    private final Counter stepErrorCounter;

    public ExecutionTrackerDomainService(IWorkflowRepository workflowRepository,
                                         IExecutionStepRepository executionStepRepository,
                                         IStepActuator stepActuator,
                                         StageCallInvoker stageCallInvoker) {
        this.workflowRepository = workflowRepository;
        this.executionStepRepository = executionStepRepository;
        this.stepActuator = stepActuator;
        this.stageCallInvoker = stageCallInvoker;
        this.stepExecutedCounter = Counter.builder("callflow.step.execute.total")
                .tag("result", "EXECUTED")
                .register(Metrics.globalRegistry);
        this.stepErrorCounter = Counter.builder("callflow.step.execute.total")
                .tag("result", "ERROR")
                .register(Metrics.globalRegistry);
    }

    /**
     * 把工作流拆解为有序步骤；已有步骤时直接返回，不重复生成。
     */
    public List<ExecutionStepEntity> buildSteps(WorkflowEntity workflow) {
        if (workflow == null || StringUtils.isBlank(workflow.getId())) {
            throw AppException.invalidInput("Workflow is required to build steps");
        }
        List<ExecutionStepEntity> existing = executionStepRepository.findByWorkflowId(workflow.getId());
        if (!existing.isEmpty()) {
            return existing;
        }
        return executionStepRepository.saveAllIfAbsent(workflow.getId(), defineSteps(workflow));
    }

    /**
     * 执行单个步骤。仅当工作流已审批、目标步骤为 PENDING 或 ERROR 且前序步骤全部 EXECUTED 时合法。
     */
    public ExecutionStepEntity executeStep(String workflowId, Integer stepNumber, long actuatorTimeoutMs) {
        if (stepNumber == null || stepNumber < 1) {
            throw AppException.invalidInput("Step number must be a positive integer: " + stepNumber);
        }
        WorkflowEntity workflow = requireExecutableWorkflow(workflowId);
        List<ExecutionStepEntity> steps = buildSteps(workflow);
        ExecutionStepEntity target = null;
        for (ExecutionStepEntity step : steps) {
            if (step.getStepNumber().equals(stepNumber)) {
                target = step;
                break;
            }
        }
        if (target == null) {
            throw AppException.invalidInput("Step " + stepNumber + " not found in workflow " + workflowId);
        }
        for (ExecutionStepEntity step : steps) {
            if (step.getStepNumber() < stepNumber && !step.isExecuted()) {
                throw AppException.invalidTransition("Step " + stepNumber + " is blocked: step "
                        + step.getStepNumber() + " is " + step.getStatus());
            }
        }

        try {
            target.start();
        } catch (IllegalStateException ex) {
            throw AppException.invalidTransition(ex.getMessage());
        }
        ExecutionStepEntity running = executionStepRepository.update(target);
        log.info("Step started. workflowId={}, stepNumber={}, tool={}, attempt={}",
                workflowId, stepNumber, running.getToolNeeded(), running.getAttemptCount());

        ExecutionStepEntity finished = finishStep(running, actuatorTimeoutMs);
        if (finished.isExecuted() && allExecuted(executionStepRepository.findByWorkflowId(workflowId))) {
            completeWorkflow(workflowId);
        }
        return finished;
    }

    /**
     * 依序执行所有未完成步骤，遇到第一个 ERROR 即停止；已处于 ERROR 的步骤不会被自动重试。
     */
    public WorkflowExecutionResult executeWorkflow(String workflowId, long actuatorTimeoutMs) {
        WorkflowEntity workflow = requireExecutableWorkflow(workflowId);
        List<ExecutionStepEntity> steps = buildSteps(workflow);
        int executed = 0;
        Integer failedStep = null;
        String error = null;
        for (ExecutionStepEntity step : steps) {
            if (step.isExecuted()) {
                executed++;
                continue;
            }
            if (step.getStatus() != StepStatusEnum.PENDING) {
                failedStep = step.getStepNumber();
                error = step.getStatus() == StepStatusEnum.ERROR
                        ? step.getErrorMessage()
                        : "Step " + step.getStepNumber() + " is " + step.getStatus();
                break;
            }
            ExecutionStepEntity result = executeStep(workflowId, step.getStepNumber(), actuatorTimeoutMs);
            if (!result.isExecuted()) {
                failedStep = result.getStepNumber();
                error = result.getErrorMessage();
                break;
            }
            executed++;
        }
        WorkflowEntity latest = workflowRepository.findById(workflowId);
        return new WorkflowExecutionResult(workflowId, latest.getStatus(), steps.size(), executed, failedStep, error);
    }

    /**
     * 调用方显式把存在 ERROR 步骤的已审批工作流标记为 FAILED。
     */
    public WorkflowEntity markWorkflowFailed(String workflowId, String actorId, String reason) {
        if (StringUtils.isBlank(reason)) {
            throw AppException.missingReason("Failure reason is required");
        }
        if (StringUtils.isBlank(actorId)) {
            throw AppException.invalidInput("Actor is required");
        }
        WorkflowEntity workflow = requireExecutableWorkflow(workflowId);
        boolean hasError = executionStepRepository.findByWorkflowId(workflowId).stream()
                .anyMatch(step -> step.getStatus() == StepStatusEnum.ERROR);
        if (!hasError) {
            throw AppException.invalidTransition("Workflow " + workflowId + " has no step in ERROR");
        }
        try {
            workflow.markFailed(actorId.trim(), reason.trim());
        } catch (IllegalStateException ex) {
            throw AppException.invalidTransition(ex.getMessage());
        }
        WorkflowEntity failed = workflowRepository.update(workflow);
        log.info("Workflow marked failed. workflowId={}, failedBy={}, reason={}",
                failed.getId(), failed.getFailedBy(), failed.getFailureReason());
        return failed;
    }

    public List<ExecutionStepEntity> listSteps(String workflowId) {
        requireWorkflow(workflowId);
        return executionStepRepository.findByWorkflowId(workflowId);
    }

    /**
     * 调用执行器并落库终态。步骤进入 IN_PROGRESS 后的任何失败（超时、执行器异常、结果无法持久化）
     * 都记为 ERROR，保证步骤可被重试或被标记失败。
     */
    private ExecutionStepEntity finishStep(ExecutionStepEntity running, long actuatorTimeoutMs) {
        String workflowId = running.getWorkflowId();
        Integer stepNumber = running.getStepNumber();
        ExecutionStepEntity request = running.copy();
        String error;
        try {
            Map<String, Object> result = stageCallInvoker.invoke("actuator:" + running.getToolNeeded(),
                    actuatorTimeoutMs, () -> stepActuator.execute(request));
            ExecutionStepEntity completed = running.copy();
            completed.complete(result);
            ExecutionStepEntity finished = executionStepRepository.update(completed);
            stepExecutedCounter.increment();
            return finished;
        } catch (AppException ex) {
            if (ex.is(ResponseCode.INVALID_TRANSITION)) {
                throw ex;
            }
            error = ex.is(ResponseCode.STAGE_FAILURE) ? ex.getInfo() : "Malformed actuator result: " + ex.getInfo();
        } catch (RuntimeException ex) {
            error = "Malformed actuator result: " + ex.getMessage();
        }
        running.fail(error);
        stepErrorCounter.increment();
        log.warn("Step execution failed. workflowId={}, stepNumber={}, tool={}, error={}",
                workflowId, stepNumber, running.getToolNeeded(), error);
        return executionStepRepository.update(running);
    }

    private List<ExecutionStepEntity> defineSteps(WorkflowEntity workflow) {
        LocalDateTime now = LocalDateTime.now();
        List<ExecutionStepEntity> steps = new ArrayList<>();
        List<StepDefinition> definitions = workflow.getStepDefinitions();
        if (definitions != null && !definitions.isEmpty()) {
            int number = 1;
            for (StepDefinition definition : definitions) {
                String action = StringUtils.defaultIfBlank(definition.getAction(), workflow.getActionItem());
                steps.add(newStep(workflow.getId(), number++, action, definition.getDetails(),
                        definition.getToolNeeded(), definition.getValidationCriteria(), now));
            }
            return steps;
        }
        if (StringUtils.isBlank(workflow.getActionItem())) {
            throw AppException.invalidInput("Workflow " + workflow.getId() + " has no action to execute");
        }
        steps.add(newStep(workflow.getId(), 1, workflow.getActionItem(), workflow.getActionItem(),
                Constants.DEFAULT_TOOL, null, now));
        return steps;
    }

    private ExecutionStepEntity newStep(String workflowId,
                                        int stepNumber,
                                        String action,
                                        String details,
                                        String toolNeeded,
                                        String validationCriteria,
                                        LocalDateTime now) {
        ExecutionStepEntity step = new ExecutionStepEntity();
        step.setWorkflowId(workflowId);
        step.setStepNumber(stepNumber);
        step.setAction(action);
        step.setDetails(details);
        step.setToolNeeded(StringUtils.defaultIfBlank(toolNeeded, Constants.DEFAULT_TOOL).trim().toLowerCase(Locale.ROOT));
        step.setValidationCriteria(validationCriteria);
        step.setStatus(StepStatusEnum.PENDING);
        step.setAttemptCount(0);
        step.setCreatedAt(now);
        step.setUpdatedAt(now);
        return step;
    }

    private void completeWorkflow(String workflowId) {
        WorkflowEntity workflow = workflowRepository.findById(workflowId);
        try {
            workflow.markExecuted();
        } catch (IllegalStateException ex) {
            throw AppException.invalidTransition(ex.getMessage());
        }
        workflowRepository.update(workflow);
        log.info("Workflow executed. workflowId={}, transcriptId={}", workflowId, workflow.getTranscriptId());
    }

    private boolean allExecuted(List<ExecutionStepEntity> steps) {
        return !steps.isEmpty() && steps.stream().allMatch(ExecutionStepEntity::isExecuted);
    }

    private WorkflowEntity requireExecutableWorkflow(String workflowId) {
        WorkflowEntity workflow = requireWorkflow(workflowId);
        if (workflow.getStatus() == null || !workflow.getStatus().isExecutable()) {
            throw AppException.invalidTransition("Workflow " + workflowId
                    + " is not approved for execution, current: " + workflow.getStatus());
        }
        return workflow;
    }

    private WorkflowEntity requireWorkflow(String workflowId) {
        if (StringUtils.isBlank(workflowId)) {
            throw AppException.invalidInput("Workflow ID is required");
        }
        WorkflowEntity workflow = workflowRepository.findById(workflowId);
        if (workflow == null) {
            throw AppException.invalidInput("Workflow not found: " + workflowId);
        }
        return workflow;
    }
}
