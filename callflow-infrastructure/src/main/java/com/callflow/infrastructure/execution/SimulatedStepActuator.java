package com.callflow.infrastructure.execution;

import com.callflow.domain.workflow.adapter.gateway.IStepActuator;
import com.callflow.domain.workflow.model.entity.ExecutionStepEntity;
import com.google.common.collect.ImmutableSet;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * 模拟步骤执行器：按工具类型生成执行回执，不触达真实外部系统。
 * 未知工具类型视为执行失败。
 *
 * @author callflow
 * @since 2026-10-01
 */
@Slf4j
@Component
public class SimulatedStepActuator implements IStepActuator {

    public static final Set<String> SUPPORTED_TOOLS = ImmutableSet.of(
            "email", "crm", "disclosure", "task", "training",
            "servicing_api", "income_api", "underwriting_api", "hardship_api",
            "pricing_api", "document_api", "compliance_api", "accounting_api");

    @Override
    public Map<String, Object> execute(ExecutionStepEntity step) {
        String tool = StringUtils.lowerCase(StringUtils.trimToEmpty(step.getToolNeeded()), Locale.ROOT);
        if (!SUPPORTED_TOOLS.contains(tool)) {
            throw new IllegalArgumentException("Unsupported tool type: " + step.getToolNeeded());
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", step.getAction());
        payload.put("details", step.getDetails());
        payload.put("step_number", step.getStepNumber());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("adapter", tool);
        result.put("payload", payload);
        result.put("mock", true);
        result.put("timestamp", Instant.now().toString());
        result.put("execution_id", tool + "_" + UUID.randomUUID().toString().replace("-", "").substring(0, 8));
        log.debug("Simulated step executed. workflowId={}, stepNumber={}, tool={}",
                step.getWorkflowId(), step.getStepNumber(), tool);
        return result;
    }
}
