package io.github.drompincen.opsledger.gateway.controller;

import io.github.drompincen.opsledger.protocol.api.ErrorResponse;
import io.github.drompincen.opsledger.runtime.error.BudgetExceededException;
import io.github.drompincen.opsledger.runtime.error.DeliveryFailureException;
import io.github.drompincen.opsledger.runtime.error.ExecutionTimeoutException;
import io.github.drompincen.opsledger.runtime.error.InvalidStateException;
import io.github.drompincen.opsledger.runtime.error.NotFoundException;
import io.github.drompincen.opsledger.runtime.error.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.ResponseEntity;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class ApiExceptionHandlerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    private ApiExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new ApiExceptionHandler(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void taxonomyMapsToStatusCodes() {
        assertThat(handler.handleLedger(new ValidationException("bad")).getStatusCode().value()).isEqualTo(400);
        assertThat(handler.handleLedger(NotFoundException.of("Job", "j1")).getStatusCode().value()).isEqualTo(404);
        assertThat(handler.handleLedger(new InvalidStateException("done")).getStatusCode().value()).isEqualTo(409);
        assertThat(handler.handleLedger(new BudgetExceededException("cap")).getStatusCode().value()).isEqualTo(422);
        assertThat(handler.handleLedger(new DeliveryFailureException("smtp")).getStatusCode().value()).isEqualTo(502);
        assertThat(handler.handleLedger(new ExecutionTimeoutException("slow")).getStatusCode().value()).isEqualTo(504);
    }

    @Test
    void bodyCarriesCodeMessageAndTimestamp() {
        ResponseEntity<ErrorResponse> response = handler.handleLedger(NotFoundException.of("Schedule", "s9"));

        ErrorResponse body = response.getBody();
        assertThat(body.code()).isEqualTo("NOT_FOUND");
        assertThat(body.message()).isEqualTo("Schedule not found: s9");
        assertThat(body.timestamp()).isEqualTo(NOW);
    }

    @Test
    void optimisticLockConflictIsInvalidState() {
        ResponseEntity<ErrorResponse> response =
                handler.handleConcurrentUpdate(new OptimisticLockingFailureException("version 3 expected"));

        assertThat(response.getStatusCode().value()).isEqualTo(409);
        assertThat(response.getBody().code()).isEqualTo("INVALID_STATE");
    }

    @Test
    void unknownWireValueIsValidationError() {
        ResponseEntity<ErrorResponse> response = handler.handleBadInput(
                new IllegalStateException("conversion failed", new IllegalArgumentException("Unknown JobStatus: done")));

        assertThat(response.getStatusCode().value()).isEqualTo(400);
        assertThat(response.getBody().message()).isEqualTo("Unknown JobStatus: done");
    }
}
