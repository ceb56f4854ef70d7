package gcsclient;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class StatusTest {

  @ParameterizedTest
  @ValueSource(ints = {200, 204, 206})
  @DisplayName("should classify 2xx codes as ok")
  void should_classify_2xx_codes_as_ok(int code) {
    assertThat(Status.fromHttpCode(code, "").isOk()).isTrue();
  }

  @ParameterizedTest
  @ValueSource(ints = {408, 429, 500, 502, 503, 504})
  @DisplayName("should classify timeouts, throttling and server errors as transient")
  void should_classify_timeouts_throttling_and_server_errors_as_transient(int code) {
    assertThat(Status.fromHttpCode(code, "").isTransient()).isTrue();
  }

  @ParameterizedTest
  @ValueSource(ints = {304, 400, 401, 403, 404, 409, 412})
  @DisplayName("should classify other client errors as permanent")
  void should_classify_other_client_errors_as_permanent(int code) {
    assertThat(Status.fromHttpCode(code, "").isPermanent()).isTrue();
  }

  @Test
  @DisplayName("should treat network failures as transient")
  void should_treat_network_failures_as_transient() {
    // When
    Status status = Status.networkFailure("connection reset");

    // Then
    assertThat(status.isTransient()).isTrue();
    assertThat(status.statusCode()).isEqualTo(Status.NETWORK_FAILURE);
    assertThat(status.toString()).isEqualTo("[TRANSIENT] code=0, message=connection reset");
  }

  @Test
  @DisplayName("should compare statuses by value")
  void should_compare_statuses_by_value() {
    assertThat(Status.transientError(503, "x")).isEqualTo(Status.fromHttpCode(503, "x"));
    assertThat(Status.transientError(503, "x")).isNotEqualTo(Status.permanentError(503, "x"));
    assertThat(Status.permanentError(404, null).errorMessage()).isEmpty();
  }
}
