package gcsclient;

import com.google.common.collect.ImmutableMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ClientOptionsTest {

  @Test
  @DisplayName("should use the production defaults")
  void should_use_the_production_defaults() {
    // When
    ClientOptions options = ClientOptions.newBuilder(ClientOptions.insecureCredentials()).build();

    // Then
    assertThat(options.endpoint()).isEqualTo("https://storage.googleapis.com/");
    assertThat(options.projectId().isPresent()).isFalse();
    assertThat(options.enableRawClientTracing()).isFalse();
    assertThat(options.downloadBufferSize()).isEqualTo(3 * 1024 * 1024);
  }

  @Test
  @DisplayName("should read the endpoint, project and tracing flags from the environment")
  void should_read_the_endpoint_project_and_tracing_flags_from_the_environment() {
    // Given
    ImmutableMap<String, String> env = ImmutableMap.of(
      ClientOptions.ENDPOINT_ENV, "http://localhost:9000/",
      ClientOptions.PROJECT_ENV, "my-project",
      ClientOptions.TRACING_ENV, "http, raw-client");

    // When
    ClientOptions options = ClientOptions.fromEnvironment(ClientOptions.insecureCredentials(), env);

    // Then
    assertThat(options.endpoint()).isEqualTo("http://localhost:9000/");
    assertThat(options.projectId().get()).isEqualTo("my-project");
    assertThat(options.enableRawClientTracing()).isTrue();
  }

  @Test
  @DisplayName("should keep the defaults when the environment is empty")
  void should_keep_the_defaults_when_the_environment_is_empty() {
    // When
    ClientOptions options = ClientOptions.fromEnvironment(
      ClientOptions.insecureCredentials(), ImmutableMap.of(ClientOptions.TRACING_ENV, "raw-client-extra"));

    // Then
    assertThat(options.endpoint()).isEqualTo(ClientOptions.DEFAULT_ENDPOINT);
    assertThat(options.projectId().isPresent()).isFalse();
    assertThat(options.enableRawClientTracing()).isFalse();
  }

  @Test
  @DisplayName("should copy every setting through the builder")
  void should_copy_every_setting_through_the_builder() {
    // Given
    ClientOptions options = ClientOptions.newBuilder(ClientOptions.insecureCredentials())
      .setProjectId("p")
      .setDownloadBufferSize(1024)
      .setEnableRawClientTracing(true)
      .build();

    // When
    ClientOptions copy = options.toBuilder().setApplicationName("other").build();

    // Then
    assertThat(copy.projectId().get()).isEqualTo("p");
    assertThat(copy.downloadBufferSize()).isEqualTo(1024);
    assertThat(copy.enableRawClientTracing()).isTrue();
    assertThat(copy.applicationName()).isEqualTo("other");
    assertThat(copy.credentials()).isSameAs(options.credentials());
  }

  @Test
  @DisplayName("should reject invalid settings")
  void should_reject_invalid_settings() {
    ClientOptions.Builder builder = ClientOptions.newBuilder(ClientOptions.insecureCredentials());
    assertThatThrownBy(() -> builder.setEndpoint("")).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> builder.setDownloadBufferSize(0)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> ClientOptions.newBuilder(null)).isInstanceOf(NullPointerException.class);
  }
}
