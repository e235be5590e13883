package com.memberly.backend.common.web;

import com.memberly.backend.member.exception.MemberNotFoundException;
import com.memberly.backend.subscription.payment.PaymentGatewayException;
import com.memberly.backend.subscription.service.ExpirySweepException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.HashMap;
import java.util.Map;

/**
 * 統一錯誤格式 {code, message, requestId}：
 * - 400：body 缺欄位 / JSON 壞掉 / path 參數型別錯
 * - 404：MEMBER_NOT_FOUND / 沒有對應的路徑
 * - 502：payment gateway 失敗
 * - 500：其他
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(MemberNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleMemberNotFound(MemberNotFoundException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(err("MEMBER_NOT_FOUND", ex.getMessage(), req));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNoRoute(NoResourceFoundException ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(err("NOT_FOUND", null, req));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException ex, HttpServletRequest req) {
        String msg = ex.getBindingResult().getFieldErrors().isEmpty()
                ? "VALIDATION_FAILED"
                : ex.getBindingResult().getFieldErrors().get(0).getField()
                  + " " + ex.getBindingResult().getFieldErrors().get(0).getDefaultMessage();

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(err("VALIDATION_FAILED", msg, req));
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception ex, HttpServletRequest req) {
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(err("BAD_REQUEST", null, req));
    }

    @ExceptionHandler(PaymentGatewayException.class)
    public ResponseEntity<Map<String, Object>> handlePaymentGateway(PaymentGatewayException ex, HttpServletRequest req) {
        log.warn("payment gateway failure. status={} code={} snippet={}", ex.getStatus(), ex.getMessage(), ex.getBodySnippet());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(err("PAYMENT_GATEWAY_ERROR", ex.getMessage(), req));
    }

    @ExceptionHandler(ExpirySweepException.class)
    public ResponseEntity<Map<String, Object>> handleSweep(ExpirySweepException ex, HttpServletRequest req) {
        Map<String, Object> body = err("EXPIRY_SWEEP_PARTIAL_FAILURE", null, req);
        body.put("failedMemberIds", ex.getFailedMemberIds());
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnknown(Exception ex, HttpServletRequest req) {
        log.error("unhandled error. uri={}", req.getRequestURI(), ex);
        // 不回 ex.getMessage()，避免洩漏內部資訊
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(err("INTERNAL_ERROR", null, req));
    }

    private static Map<String, Object> err(String code, String message, HttpServletRequest req) {
        Map<String, Object> m = new HashMap<>();
        m.put("code", code);
        if (message != null && !message.isBlank()) m.put("message", message);
        m.put("requestId", RequestIdFilter.currentId(req));
        return m;
    }
}
