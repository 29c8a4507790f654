package com.callflow.test;

import com.callflow.api.dto.WorkflowBulkApproveResponseDTO;
import com.callflow.api.dto.WorkflowDetailDTO;
import com.callflow.domain.workflow.adapter.repository.IExecutionStepRepository;
import com.callflow.domain.workflow.model.entity.WorkflowEntity;
import com.callflow.domain.workflow.model.valobj.BulkApprovalResult;
import com.callflow.domain.workflow.model.valobj.WorkflowExecutionResult;
import com.callflow.domain.workflow.service.ApprovalGateDomainService;
import com.callflow.domain.workflow.service.ExecutionTrackerDomainService;
import com.callflow.test.support.WorkflowFixtures;
import com.callflow.trigger.application.command.WorkflowActionCommandService;
import com.callflow.trigger.application.common.WorkflowDetailViewAssembler;
import com.callflow.types.enums.RiskLevelEnum;
import com.callflow.types.enums.WorkflowStatusEnum;
import com.callflow.types.exception.AppException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class WorkflowActionCommandServiceTest {

    private ApprovalGateDomainService approvalGateDomainService;
    private ExecutionTrackerDomainService executionTrackerDomainService;
    private WorkflowDetailViewAssembler assembler;
    private Executor pipelineWorker;

    @BeforeEach
    public void setUp() {
        approvalGateDomainService = mock(ApprovalGateDomainService.class);
        executionTrackerDomainService = mock(ExecutionTrackerDomainService.class);
        IExecutionStepRepository executionStepRepository = mock(IExecutionStepRepository.class);
        when(executionStepRepository.findByWorkflowId(anyString())).thenReturn(Collections.emptyList());
        assembler = new WorkflowDetailViewAssembler(executionStepRepository);
        pipelineWorker = mock(Executor.class);

        WorkflowEntity approved = WorkflowFixtures.pendingWorkflow("WF_1", RiskLevelEnum.MEDIUM);
        approved.setStatus(WorkflowStatusEnum.APPROVED);
        approved.setApprovedBy("sup_1");
        when(approvalGateDomainService.approve("WF_1", "sup_1", null)).thenReturn(approved);
    }

    @Test
    public void shouldOnlyApproveByDefault() {
        WorkflowActionCommandService service = newService(false);

        WorkflowDetailDTO dto = service.approve("WF_1", "sup_1", null);

        Assertions.assertEquals("approved", dto.getStatus());
        Assertions.assertEquals("sup_1", dto.getApprovedBy());
        verify(pipelineWorker, never()).execute(any(Runnable.class));
    }

    @Test
    public void shouldSubmitExecutionAfterApprovalWhenEnabled() {
        when(executionTrackerDomainService.executeWorkflow("WF_1", 5000L))
                .thenReturn(new WorkflowExecutionResult("WF_1", WorkflowStatusEnum.EXECUTED, 1, 1, null, null));
        WorkflowActionCommandService service = newService(true);

        service.approve("WF_1", "sup_1", null);

        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(pipelineWorker).execute(task.capture());
        task.getValue().run();
        verify(executionTrackerDomainService).executeWorkflow(eq("WF_1"), eq(5000L));
    }

    @Test
    public void shouldKeepApprovalWhenBackgroundExecutionFails() {
        when(executionTrackerDomainService.executeWorkflow("WF_1", 5000L))
                .thenThrow(AppException.invalidTransition("Workflow WF_1 is not approved for execution"));
        WorkflowActionCommandService service = newService(true);

        service.approve("WF_1", "sup_1", null);
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        verify(pipelineWorker).execute(task.capture());

        Assertions.assertDoesNotThrow(() -> task.getValue().run());
    }

    @Test
    public void shouldReturnApprovalWhenWorkerRejectsExecution() {
        doThrow(new RejectedExecutionException("queue full")).when(pipelineWorker).execute(any(Runnable.class));
        WorkflowActionCommandService service = newService(true);

        WorkflowDetailDTO dto = service.approve("WF_1", "sup_1", null);

        Assertions.assertEquals("approved", dto.getStatus());
        verify(executionTrackerDomainService, never()).executeWorkflow(anyString(), eq(5000L));
    }

    @Test
    public void shouldSubmitOnlyApprovedWorkflowsFromBulkApproval() {
        List<String> ids = List.of("WF_1", "WF_2", "WF_3");
        when(approvalGateDomainService.bulkApprove(ids, "sup_1", null)).thenReturn(new BulkApprovalResult("sup_1", 3,
                List.of("WF_1", "WF_3"), Map.of("WF_2", "Only workflows awaiting approval can be approved")));
        WorkflowActionCommandService service = newService(true);

        WorkflowBulkApproveResponseDTO dto = service.bulkApprove(ids, "sup_1", null);

        Assertions.assertEquals(2, dto.getApprovedCount());
        Assertions.assertEquals(1, dto.getFailedCount());
        Assertions.assertEquals(3, dto.getTotalRequested());
        verify(pipelineWorker, times(2)).execute(any(Runnable.class));
    }

    private WorkflowActionCommandService newService(boolean executeOnApprove) {
        return new WorkflowActionCommandService(approvalGateDomainService, executionTrackerDomainService,
                assembler, pipelineWorker, 5000L, executeOnApprove);
    }
}
