package com.taskadmin.trigger.http;

import com.taskadmin.api.response.Response;
import com.taskadmin.types.enums.ResponseCode;
import com.taskadmin.types.exception.AppException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.EnumMap;
import java.util.Map;

/**
 * 统一 API 异常处理：AppException 按错误码映射 HTTP 状态，响应体始终为 {@link Response} 信封。
 */
@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    private static final int MAX_INFO_LENGTH = 300;

    private static final Map<ResponseCode, HttpStatus> STATUS_BY_CODE = new EnumMap<>(ResponseCode.class);

    static {
        STATUS_BY_CODE.put(ResponseCode.ILLEGAL_PARAMETER, HttpStatus.BAD_REQUEST);
        STATUS_BY_CODE.put(ResponseCode.INVALID_ID, HttpStatus.BAD_REQUEST);
        STATUS_BY_CODE.put(ResponseCode.INVALID_ROLE, HttpStatus.BAD_REQUEST);
        STATUS_BY_CODE.put(ResponseCode.INVALID_EXTERNAL_ID, HttpStatus.UNPROCESSABLE_ENTITY);
        STATUS_BY_CODE.put(ResponseCode.NOT_FOUND, HttpStatus.NOT_FOUND);
        STATUS_BY_CODE.put(ResponseCode.NO_AUTH_CONTEXT, HttpStatus.UNAUTHORIZED);
        STATUS_BY_CODE.put(ResponseCode.INVALID_CLAIMS, HttpStatus.UNAUTHORIZED);
        STATUS_BY_CODE.put(ResponseCode.FORBIDDEN, HttpStatus.FORBIDDEN);
        STATUS_BY_CODE.put(ResponseCode.IDENTITY_PROVIDER_ERROR, HttpStatus.BAD_GATEWAY);
        STATUS_BY_CODE.put(ResponseCode.CACHE_UNAVAILABLE, HttpStatus.SERVICE_UNAVAILABLE);
    }

    @ExceptionHandler(AppException.class)
    public ResponseEntity<Response<Object>> handleAppException(AppException ex, HttpServletRequest request) {
        String code = StringUtils.defaultIfBlank(ex.getCode(), ResponseCode.UN_ERROR.getCode());
        String info = StringUtils.defaultIfBlank(ex.getInfo(), ResponseCode.UN_ERROR.getInfo());
        HttpStatus status = resolveStatus(code);
        if (status.is5xxServerError()) {
            logError(request, ex, code, info);
        } else {
            logWarn(request, ex, code, info);
        }
        return ResponseEntity.status(status).body(Response.failure(code, info));
    }

    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            BindException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<Response<Object>> handleBadRequestException(Exception ex, HttpServletRequest request) {
        String info = truncate(StringUtils.defaultIfBlank(ex.getMessage(), ResponseCode.ILLEGAL_PARAMETER.getInfo()));
        logWarn(request, ex, ResponseCode.ILLEGAL_PARAMETER.getCode(), info);
        return ResponseEntity.badRequest().body(Response.failure(ResponseCode.ILLEGAL_PARAMETER, info));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Response<Object>> handleUnknownException(Exception ex, HttpServletRequest request) {
        logError(request, ex, ResponseCode.UN_ERROR.getCode(), truncate(ex.getMessage()));
        return ResponseEntity.internalServerError()
                .body(Response.failure(ResponseCode.UN_ERROR, null));
    }

    static HttpStatus resolveStatus(String code) {
        for (Map.Entry<ResponseCode, HttpStatus> entry : STATUS_BY_CODE.entrySet()) {
            if (entry.getKey().getCode().equals(code)) {
                return entry.getValue();
            }
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private void logWarn(HttpServletRequest request, Exception ex, String code, String info) {
        log.warn("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(request),
                resolveMethod(request),
                resolveTraceId(),
                resolveRequestId(),
                ex.getClass().getSimpleName(),
                code,
                info);
    }

    private void logError(HttpServletRequest request, Exception ex, String code, String info) {
        log.error("HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(request),
                resolveMethod(request),
                resolveTraceId(),
                resolveRequestId(),
                ex.getClass().getSimpleName(),
                code,
                info,
                ex);
    }

    private String resolvePath(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getRequestURI(), "-");
    }

    private String resolveMethod(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getMethod(), "-");
    }

    private String resolveTraceId() {
        return StringUtils.defaultIfBlank(MDC.get("traceId"), "-");
    }

    private String resolveRequestId() {
        return StringUtils.defaultIfBlank(MDC.get("requestId"), "-");
    }

    private String truncate(String text) {
        if (StringUtils.isBlank(text) || text.length() <= MAX_INFO_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_INFO_LENGTH);
    }
}
