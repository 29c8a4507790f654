package com.callflow.domain.workflow.model.valobj;

import java.util.List;
import java.util.Map;

/**
 * 批量审批结果，单个工作流失败不影响其余工作流。
 *
 * @param approvedBy     审批人
 * @param totalRequested 去重后的请求数量
 * @param approvedIds    审批成功的工作流 ID，按请求顺序
 * @param failures       审批失败的工作流 ID → 失败原因，按请求顺序
 */
public record BulkApprovalResult(String approvedBy,
                                 int totalRequested,
                                 List<String> approvedIds,
                                 Map<String, String> failures) {

    public int approvedCount() {
        return approvedIds.size();
    }

    public int failedCount() {
        return failures.size();
    }
}
