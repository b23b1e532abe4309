package com.work.oracle.app.web;

import com.work.oracle.app.web.dto.ApiError;
import com.work.oracle.core.exception.SettlementException;
import com.work.oracle.core.exception.SubmissionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 运维接口的统一异常映射：
 * - 参数非法（如 id 无法解析）：400
 * - 来源不可用：503
 * - 链读取 / 交易提交失败：502（部分结算额外标记 partial=true）
 * - 配置错误：500
 */
@RestControllerAdvice(basePackages = "com.work.oracle.app.web")
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ApiError("INVALID_ARGUMENT", e.getMessage(), false));
    }

    @ExceptionHandler(SettlementException.class)
    public ResponseEntity<ApiError> handleSettlement(SettlementException e) {
        boolean partial = e instanceof SubmissionException && ((SubmissionException) e).isPartial();
        HttpStatus status;
        switch (e.getKind()) {
            case SOURCE_UNAVAILABLE:
                status = HttpStatus.SERVICE_UNAVAILABLE;
                break;
            case READ:
            case SUBMISSION:
                status = HttpStatus.BAD_GATEWAY;
                break;
            case CONFIG:
            default:
                status = HttpStatus.INTERNAL_SERVER_ERROR;
                break;
        }
        log.warn("Admin request failed. kind={} partial={} err={}", e.getKind(), partial, e.getMessage());
        return ResponseEntity.status(status).body(new ApiError(e.getKind().name(), e.getMessage(), partial));
    }
}
