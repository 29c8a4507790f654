package com.callflow.domain.pipeline.service;

import com.callflow.types.exception.AppException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 外部协作方调用器：在独立线程池上执行阶段引擎或步骤执行器调用，并以超时为界。
 * 超时、异常与拒绝执行统一转换为 STAGE_FAILURE。
 */
@Slf4j
@Service
public class StageCallInvoker {

    private final ExecutorService stageCallWorker;

    public StageCallInvoker(@Qualifier("stageCallWorker") ExecutorService stageCallWorker) {
        this.stageCallWorker = stageCallWorker;
    }

    public <T> T invoke(String callName, long timeoutMs, Callable<T> call) {
        if (timeoutMs <= 0L) {
            throw AppException.invalidInput("Timeout must be positive for call " + callName + ": " + timeoutMs);
        }
        Future<T> future;
        try {
            future = stageCallWorker.submit(call);
        } catch (RejectedExecutionException ex) {
            throw AppException.stageFailure(callName + " rejected by stage call worker", ex);
        }
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("Stage call timed out. call={}, timeoutMs={}", callName, timeoutMs);
            throw AppException.stageFailure(callName + " timed out after " + timeoutMs + "ms", ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw AppException.stageFailure(callName + " interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause() == null ? ex : ex.getCause();
            throw AppException.stageFailure(callName + " failed: " + describe(cause), cause);
        }
    }

    private String describe(Throwable throwable) {
        if (throwable instanceof AppException appException) {
            return appException.getInfo();
        }
        String message = throwable.getMessage();
        return message == null || message.isBlank() ? throwable.getClass().getSimpleName() : message;
    }
}
