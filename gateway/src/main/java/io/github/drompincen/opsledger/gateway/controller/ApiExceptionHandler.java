package io.github.drompincen.opsledger.gateway.controller;

import io.github.drompincen.opsledger.protocol.api.ErrorResponse;
import io.github.drompincen.opsledger.runtime.error.BudgetExceededException;
import io.github.drompincen.opsledger.runtime.error.DeliveryFailureException;
import io.github.drompincen.opsledger.runtime.error.ExecutionTimeoutException;
import io.github.drompincen.opsledger.runtime.error.InvalidStateException;
import io.github.drompincen.opsledger.runtime.error.LedgerException;
import io.github.drompincen.opsledger.runtime.error.NotFoundException;
import io.github.drompincen.opsledger.runtime.error.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;

/** Maps the ledger error taxonomy onto HTTP status codes. */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private final Clock clock;

    public ApiExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(LedgerException.class)
    public ResponseEntity<ErrorResponse> handleLedger(LedgerException e) {
        HttpStatus status = statusFor(e);
        if (status.is5xxServerError()) {
            log.warn("{}: {}", e.getCode(), e.getMessage());
        } else {
            log.debug("{}: {}", e.getCode(), e.getMessage());
        }
        return body(status, e.getCode(), e.getMessage());
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleConcurrentUpdate(OptimisticLockingFailureException e) {
        log.warn("Concurrent update rejected: {}", e.getMessage());
        return body(HttpStatus.CONFLICT, InvalidStateException.CODE, "Concurrent update, retry the request");
    }

    @ExceptionHandler({MethodArgumentTypeMismatchException.class, HttpMessageNotReadableException.class,
            IllegalArgumentException.class})
    public ResponseEntity<ErrorResponse> handleBadInput(Exception e) {
        return body(HttpStatus.BAD_REQUEST, ValidationException.CODE, rootMessage(e));
    }

    static HttpStatus statusFor(LedgerException e) {
        if (e instanceof ValidationException) return HttpStatus.BAD_REQUEST;
        if (e instanceof NotFoundException) return HttpStatus.NOT_FOUND;
        if (e instanceof InvalidStateException) return HttpStatus.CONFLICT;
        if (e instanceof BudgetExceededException) return HttpStatus.UNPROCESSABLE_ENTITY;
        if (e instanceof DeliveryFailureException) return HttpStatus.BAD_GATEWAY;
        if (e instanceof ExecutionTimeoutException) return HttpStatus.GATEWAY_TIMEOUT;
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private ResponseEntity<ErrorResponse> body(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(code, message, clock.instant()));
    }

    private static String rootMessage(Throwable e) {
        Throwable t = e;
        while (t.getCause() != null && t.getCause() != t) t = t.getCause();
        return t.getMessage() != null ? t.getMessage() : e.getMessage();
    }
}
