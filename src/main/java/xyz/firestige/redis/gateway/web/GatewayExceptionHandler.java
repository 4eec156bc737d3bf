package xyz.firestige.redis.gateway.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.validation.ObjectError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import xyz.firestige.redis.gateway.exception.ErrorType;
import xyz.firestige.redis.gateway.exception.GatewayException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 异常 → HTTP 响应映射
 * <p>
 * 响应体：{"code", "type", "message", "details"}，状态码由 {@link ErrorType} 决定。
 */
@RestControllerAdvice
public class GatewayExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GatewayExceptionHandler.class);

    private static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ErrorResponse> handleGatewayException(GatewayException ex) {
        ErrorType type = ex.getErrorType() != null ? ex.getErrorType() : ErrorType.SYSTEM_ERROR;
        if (type.isClientError()) {
            log.debug("[ExceptionHandler] 请求被拒绝: code={}, message={}", ex.getErrorCode(), ex.getMessage());
        } else {
            log.warn("[ExceptionHandler] 命令失败: code={}, type={}, message={}",
                    ex.getErrorCode(), type, ex.getMessage());
        }
        return respond(type, ex.getErrorCode(), ex.getMessage(), new LinkedHashMap<>(ex.getContext()));
    }

    /**
     * {@code @Valid @RequestBody} 校验失败，message 列出所有出错字段
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleBodyValidation(MethodArgumentNotValidException ex) {
        List<ObjectError> errors = ex.getBindingResult().getAllErrors();
        StringBuilder message = new StringBuilder();
        List<String> fields = errors.stream().map(GatewayExceptionHandler::fieldOf).toList();
        for (ObjectError error : errors) {
            if (message.length() > 0) {
                message.append("; ");
            }
            message.append(fieldOf(error)).append(": ").append(error.getDefaultMessage());
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("field", fields.isEmpty() ? null : fields.get(0));
        details.put("fields", fields);
        return respond(ErrorType.VALIDATION_ERROR, INVALID_ARGUMENT, message.toString(), details);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException ex) {
        return respond(ErrorType.VALIDATION_ERROR, INVALID_ARGUMENT,
                ex.getParameterName() + " 不能为空", fieldDetails(ex.getParameterName()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String expected = ex.getRequiredType() != null ? ex.getRequiredType().getSimpleName() : "unknown";
        return respond(ErrorType.VALIDATION_ERROR, INVALID_ARGUMENT,
                ex.getName() + " 格式错误，期望类型 " + expected, fieldDetails(ex.getName()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.debug("[ExceptionHandler] 请求体无法解析: {}", ex.getMessage());
        return respond(ErrorType.VALIDATION_ERROR, INVALID_ARGUMENT, "请求体不是合法的 JSON 或字段类型错误",
                fieldDetails("body"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
        log.error("[ExceptionHandler] 未预期的异常", ex);
        return respond(ErrorType.SYSTEM_ERROR, ErrorType.SYSTEM_ERROR.name(),
                ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName(), new LinkedHashMap<>());
    }

    private static String fieldOf(ObjectError error) {
        return error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
    }

    private static Map<String, Object> fieldDetails(String field) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("field", field);
        return details;
    }

    private static ResponseEntity<ErrorResponse> respond(ErrorType type, String code, String message,
                                                         Map<String, Object> details) {
        return ResponseEntity.status(type.getHttpStatus())
                .body(new ErrorResponse(code, type.name(), message, details));
    }
}
