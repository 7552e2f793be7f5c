package com.work.exchange.demo.web;

import com.work.exchange.core.exception.ExchangeException;
import com.work.exchange.core.exception.InvalidOfferArgumentException;
import com.work.exchange.core.exception.InvalidOfferStateException;
import com.work.exchange.core.exception.LockNotAcquiredException;
import com.work.exchange.core.exception.OfferNotFoundException;
import com.work.exchange.core.exception.ReentrantCallException;
import com.work.exchange.core.exception.RegistryException;
import com.work.exchange.core.exception.UnauthorizedException;
import com.work.exchange.demo.web.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * 把 orderbook 的稳定错误消息映射为 HTTP 状态码，消息原样返回。
 */
@RestControllerAdvice
public class ExchangeExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ExchangeExceptionHandler.class);

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ErrorResponse> handleUnauthorized(UnauthorizedException e) {
        return build(HttpStatus.FORBIDDEN, "unauthorized", e.getMessage());
    }

    @ExceptionHandler(OfferNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(OfferNotFoundException e) {
        return build(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
    }

    @ExceptionHandler({InvalidOfferStateException.class, ReentrantCallException.class})
    public ResponseEntity<ErrorResponse> handleConflict(ExchangeException e) {
        return build(HttpStatus.CONFLICT, "invalid_state", e.getMessage());
    }

    @ExceptionHandler(InvalidOfferArgumentException.class)
    public ResponseEntity<ErrorResponse> handleInvalidArgument(InvalidOfferArgumentException e) {
        return build(HttpStatus.BAD_REQUEST, "invalid_argument", e.getMessage());
    }

    @ExceptionHandler(RegistryException.class)
    public ResponseEntity<ErrorResponse> handleRegistry(RegistryException e) {
        String msg = e.getMessage();
        if (RegistryException.APP_NOT_FOUND.equals(msg) || RegistryException.ACCOUNT_NOT_FOUND.equals(msg)) {
            return build(HttpStatus.NOT_FOUND, "not_found", msg);
        }
        if (RegistryException.APP_ALREADY_EXISTS.equals(msg) || RegistryException.ACCOUNT_ALREADY_EXISTS.equals(msg)) {
            return build(HttpStatus.CONFLICT, "already_exists", msg);
        }
        return build(HttpStatus.BAD_REQUEST, "invalid_argument", msg);
    }

    @ExceptionHandler(LockNotAcquiredException.class)
    public ResponseEntity<ErrorResponse> handleBusy(LockNotAcquiredException e) {
        log.warn("orderbook busy: {}", e.getMessage());
        return build(HttpStatus.SERVICE_UNAVAILABLE, "busy", e.getMessage());
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingRequestHeaderException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception e) {
        return build(HttpStatus.BAD_REQUEST, "invalid_argument", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
        FieldError fe = e.getBindingResult().getFieldError();
        String msg = fe == null ? "参数校验失败" : fe.getDefaultMessage();
        return build(HttpStatus.BAD_REQUEST, "invalid_argument", msg);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message) {
        ErrorResponse body = new ErrorResponse();
        body.setError(error);
        body.setMessage(message);
        return ResponseEntity.status(status).body(body);
    }
}
