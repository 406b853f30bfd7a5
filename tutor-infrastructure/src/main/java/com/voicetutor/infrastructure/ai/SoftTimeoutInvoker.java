package com.voicetutor.infrastructure.ai;

import com.voicetutor.types.enums.ResponseCode;
import com.voicetutor.types.exception.AppException;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 外部模型调用的软超时包装：超时、中断与执行失败统一转换为 EXTERNAL_SERVICE_ERROR。
 */
public final class SoftTimeoutInvoker {

    private SoftTimeoutInvoker() {
    }

    public static <T> T invoke(ExecutorService executor, Callable<T> call, long timeoutMs, String operation) {
        if (timeoutMs <= 0L || executor == null) {
            return callDirectly(call, operation);
        }
        Future<T> future;
        try {
            future = executor.submit(call);
        } catch (RejectedExecutionException ex) {
            throw new AppException(ResponseCode.EXTERNAL_SERVICE_ERROR, operation + " rejected by executor", ex);
        }
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new AppException(ResponseCode.EXTERNAL_SERVICE_ERROR,
                    operation + " soft timeout exceeded " + timeoutMs + "ms", ex);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AppException(ResponseCode.EXTERNAL_SERVICE_ERROR, operation + " interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof AppException appException) {
                throw appException;
            }
            throw new AppException(ResponseCode.EXTERNAL_SERVICE_ERROR, operation + " failed: " + rootMessage(cause), cause);
        }
    }

    public static boolean isTimeout(Throwable throwable) {
        Throwable cursor = throwable;
        while (cursor != null) {
            if (cursor instanceof TimeoutException) {
                return true;
            }
            cursor = cursor.getCause();
        }
        return false;
    }

    private static <T> T callDirectly(Callable<T> call, String operation) {
        try {
            return call.call();
        } catch (AppException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new AppException(ResponseCode.EXTERNAL_SERVICE_ERROR, operation + " failed: " + rootMessage(ex), ex);
        }
    }

    private static String rootMessage(Throwable throwable) {
        Throwable cursor = throwable;
        while (cursor != null && cursor.getCause() != null && cursor.getCause() != cursor) {
            cursor = cursor.getCause();
        }
        if (cursor == null) {
            return "unknown";
        }
        return cursor.getMessage() == null ? cursor.getClass().getSimpleName() : cursor.getMessage();
    }
}
