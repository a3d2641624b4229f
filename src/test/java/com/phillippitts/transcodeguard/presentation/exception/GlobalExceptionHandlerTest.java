package com.phillippitts.transcodeguard.presentation.exception;

import com.phillippitts.transcodeguard.domain.JobId;
import com.phillippitts.transcodeguard.domain.JobState;
import com.phillippitts.transcodeguard.exception.AlreadyRunningException;
import com.phillippitts.transcodeguard.exception.EngineException;
import com.phillippitts.transcodeguard.exception.IllegalTransitionException;
import com.phillippitts.transcodeguard.exception.JobNotFoundException;
import com.phillippitts.transcodeguard.exception.OperationTimeoutException;
import com.phillippitts.transcodeguard.exception.TranscodeGuardException;
import com.phillippitts.transcodeguard.exception.ValidationException;
import com.phillippitts.transcodeguard.exception.ValidationException.ValidationFailure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void alreadyRunningReturns409WithActiveJob() {
        ResponseEntity<?> response = handler.handleAlreadyRunning(new AlreadyRunningException(JobId.of("job-1")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().toString())
                .contains("AlreadyRunningException")
                .contains("job-1");
    }

    @Test
    void validationReturns422WithFailureDescription() {
        ValidationException ex = new ValidationException(ValidationFailure.INSUFFICIENT_STORAGE,
                "needs 600 MB, 400 MB free");

        ResponseEntity<?> response = handler.handleValidation(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
        assertThat(response.getBody().toString())
                .contains("insufficient storage")
                .contains("needs 600 MB");
    }

    @Test
    void unknownJobReturns404() {
        ResponseEntity<?> response = handler.handleNotFound(new JobNotFoundException(JobId.of("missing")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(response.getBody().toString()).contains("missing");
    }

    @Test
    void illegalTransitionReturns409() {
        IllegalTransitionException ex = new IllegalTransitionException(JobId.of("job-2"), JobState.COMPLETED, "pause");

        ResponseEntity<?> response = handler.handleIllegalTransition(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
        assertThat(response.getBody().toString()).contains("pause from COMPLETED");
    }

    @Test
    void timeoutReturns504() {
        OperationTimeoutException ex = new OperationTimeoutException(
                OperationTimeoutException.Operation.PRECHECK, Duration.ofSeconds(5));

        ResponseEntity<?> response = handler.handleTimeout(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
        assertThat(response.getBody().toString()).contains("PRECHECK");
    }

    @Test
    void engineFailureReturns502WithoutProcessDetails() {
        EngineException ex = new EngineException("FFMPEG_START_FAILED", "Unable to start /opt/secret/ffmpeg");

        ResponseEntity<?> response = handler.handleEngine(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody().toString())
                .contains("FFMPEG_START_FAILED")
                .doesNotContain("/opt/secret");
    }

    @Test
    void otherDomainErrorsReturn500() {
        ResponseEntity<?> response = handler.handleDomain(new TranscodeGuardException("broken"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @Test
    void illegalArgumentReturns400() {
        ResponseEntity<?> response = handler.handleIllegalArgument(new IllegalArgumentException("limit must be > 0"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody().toString()).contains("limit must be > 0");
    }

    @Test
    void illegalStateReturns409() {
        ResponseEntity<?> response = handler.handleIllegalState(new IllegalStateException("already acknowledged"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    void unexpectedErrorsDoNotLeakMessage() {
        ResponseEntity<?> response = handler.handleUnexpected(new RuntimeException("NullPointer at line 42"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString())
                .contains("InternalServerError")
                .contains("timestamp")
                .doesNotContain("line 42");
    }
}
