package uk.gegc.livequiz.shared.result;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.livequiz.shared.exception.PreconditionFailedException;
import uk.gegc.livequiz.shared.exception.ValidationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Result")
class ResultTest {

    @Test
    @DisplayName("propagate keeps the failure kind and message under a new success type")
    void propagate_keepsFailure() {
        Result<String> failure = Result.failure(ErrorKind.FAILED_PRECONDITION, "already answered");

        Result<Integer> propagated = failure.propagate();

        assertThat(propagated.isFailure()).isTrue();
        assertThat(propagated.getErrorKind()).isEqualTo(ErrorKind.FAILED_PRECONDITION);
        assertThat(propagated.getMessage()).isEqualTo("already answered");
    }

    @Test
    @DisplayName("propagate on a success is a programming error")
    void propagate_success_throws() {
        assertThatThrownBy(() -> Result.success("ok").propagate())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("orElseThrow raises the exception mapped from the failure kind")
    void orElseThrow_mapsKind() {
        assertThat(Result.success(7).orElseThrow()).isEqualTo(7);
        assertThatThrownBy(() -> Result.failure(ErrorKind.INVALID_ARGUMENT, "bad index").orElseThrow())
                .isInstanceOf(ValidationException.class)
                .hasMessage("bad index");
        assertThatThrownBy(() -> Result.failure(ErrorKind.FAILED_PRECONDITION, "closed").orElseThrow())
                .isInstanceOf(PreconditionFailedException.class);
    }

    @Test
    @DisplayName("getValue on a failure throws")
    void getValue_failure_throws() {
        assertThatThrownBy(() -> Result.failure(ErrorKind.NOT_FOUND, "missing").getValue())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("NOT_FOUND");
    }
}
