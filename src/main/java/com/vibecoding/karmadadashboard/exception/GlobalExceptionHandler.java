package com.vibecoding.karmadadashboard.exception;

import com.vibecoding.karmadadashboard.model.BaseResponse;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 예외를 {code, message, data} 응답으로 변환하는 핸들러
 * - 인증/인가 예외만 실제 HTTP 상태 코드를 사용하고 나머지는 HTTP 200
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(DashboardAuthException.class)
    public ResponseEntity<BaseResponse<Void>> handleAuthException(DashboardAuthException ex) {
        log.warn("Authorization failed ({}): {}", ex.getStatus().value(), ex.getMessage());
        return ResponseEntity.status(ex.getStatus())
            .body(BaseResponse.fail(ex.getStatus().value(), ex.getMessage()));
    }

    @ExceptionHandler(K8sResourceNotFoundException.class)
    public BaseResponse<Void> handleResourceNotFound(K8sResourceNotFoundException ex) {
        log.error("Resource not found: {}", ex.getMessage());
        return BaseResponse.fail(ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(K8sApiException.class)
    public BaseResponse<Void> handleK8sApiException(K8sApiException ex) {
        log.error("Kubernetes API error: {}", ex.getMessage(), ex);
        return BaseResponse.fail(ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(DashboardException.class)
    public BaseResponse<Void> handleDashboardException(DashboardException ex) {
        log.warn("Request failed ({}): {}", ex.getCode(), ex.getMessage());
        return BaseResponse.fail(ex.getCode(), ex.getMessage());
    }

    @ExceptionHandler(KubernetesClientException.class)
    public BaseResponse<Void> handleK8sClientException(KubernetesClientException ex) {
        log.error("Kubernetes client error: {}", ex.getMessage(), ex);
        return BaseResponse.fail(ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public BaseResponse<Void> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .findFirst()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .orElse("invalid request body");
        log.warn("Invalid request: {}", message);
        return BaseResponse.fail(400, message);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public BaseResponse<Void> handleMissingParameter(MissingServletRequestParameterException ex) {
        log.warn("Missing parameter: {}", ex.getParameterName());
        return BaseResponse.fail(400, ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public BaseResponse<Void> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return BaseResponse.fail(ex.getMessage());
    }
}
