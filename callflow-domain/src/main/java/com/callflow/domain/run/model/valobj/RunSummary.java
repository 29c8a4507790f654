package com.callflow.domain.run.model.valobj;

import lombok.Value;

/**
 * 运行汇总统计。
 * successRate 仅在运行终态后给出，保留三位小数。
 */
@Value
public class RunSummary {

    int total;

    int successful;

    int failed;

    Double successRate;

    public static RunSummary of(int total, int successful, int failed, boolean terminal) {
        Double rate = null;
        if (terminal) {
            rate = total == 0 ? 0D : Math.round(successful * 1000D / total) / 1000D;
        }
        return new RunSummary(total, successful, failed, rate);
    }
}
