package com.headspace.trigger.http;

import com.headspace.api.response.Response;
import com.headspace.types.enums.ResponseCode;
import com.headspace.types.exception.AppException;
import com.headspace.types.exception.LockReentrancyException;
import com.headspace.types.exception.LockTimeoutException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 统一 API 异常处理。锁超时与重入属于调用方可见的失败，单独记录锁键。
 */
@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    private static final int MAX_MESSAGE_LENGTH = 300;

    @ExceptionHandler(LockTimeoutException.class)
    public Response<Object> handleLockTimeout(LockTimeoutException ex, HttpServletRequest request) {
        log.warn("HTTP_ERROR request={}, errorType={}, errorCode={}, lockKey={}:{}, timeoutMs={}",
                describe(request),
                ex.getClass().getSimpleName(),
                ex.getCode(),
                ex.getNamespace(),
                ex.getKey(),
                ex.getTimeoutMillis());
        return build(ex.getCode(), ex.getInfo());
    }

    @ExceptionHandler(LockReentrancyException.class)
    public Response<Object> handleLockReentrancy(LockReentrancyException ex, HttpServletRequest request) {
        log.error("HTTP_ERROR request={}, errorType={}, errorCode={}, lockKey={}:{}",
                describe(request),
                ex.getClass().getSimpleName(),
                ex.getCode(),
                ex.getNamespace(),
                ex.getKey(),
                ex);
        return build(ex.getCode(), ex.getInfo());
    }

    @ExceptionHandler(AppException.class)
    public Response<Object> handleAppException(AppException ex, HttpServletRequest request) {
        String code = StringUtils.defaultIfBlank(ex.getCode(), ResponseCode.UN_ERROR.getCode());
        String info = StringUtils.defaultIfBlank(ex.getInfo(), ResponseCode.UN_ERROR.getInfo());
        log.warn("HTTP_ERROR request={}, errorType={}, errorCode={}, errorMessage={}",
                describe(request),
                ex.getClass().getSimpleName(),
                code,
                truncate(info));
        return build(code, info);
    }

    @ExceptionHandler({
            BindException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    public Response<Object> handleBadRequestException(Exception ex, HttpServletRequest request) {
        String info = truncate(StringUtils.defaultIfBlank(ex.getMessage(), ResponseCode.ILLEGAL_PARAMETER.getInfo()));
        log.warn("HTTP_ERROR request={}, errorType={}, errorCode={}, errorMessage={}",
                describe(request),
                ex.getClass().getSimpleName(),
                ResponseCode.ILLEGAL_PARAMETER.getCode(),
                info);
        return build(ResponseCode.ILLEGAL_PARAMETER.getCode(), info);
    }

    @ExceptionHandler(Exception.class)
    public Response<Object> handleUnknownException(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR request={}, errorType={}, errorCode={}, errorMessage={}",
                describe(request),
                ex.getClass().getSimpleName(),
                ResponseCode.UN_ERROR.getCode(),
                truncate(ex.getMessage()),
                ex);
        return build(ResponseCode.UN_ERROR.getCode(), ResponseCode.UN_ERROR.getInfo());
    }

    private Response<Object> build(String code, String info) {
        return Response.<Object>builder()
                .code(code)
                .info(info)
                .build();
    }

    private String describe(HttpServletRequest request) {
        if (request == null) {
            return "-";
        }
        return StringUtils.defaultIfBlank(request.getMethod(), "-") + " "
                + StringUtils.defaultIfBlank(request.getRequestURI(), "-");
    }

    private String truncate(String text) {
        if (StringUtils.isBlank(text) || text.length() <= MAX_MESSAGE_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_MESSAGE_LENGTH);
    }
}
