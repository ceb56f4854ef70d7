package gcsclient;

import com.google.api.client.http.HttpRequest;
import com.google.api.client.http.HttpRequestInitializer;
import com.google.common.base.MoreObjects;
import com.google.common.base.Optional;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;

import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Configuration shared by every layer of a client: where to send requests, how to authorize them and the defaults
 * applied to calls. Immutable, and safe to share between threads.
 */
public final class ClientOptions {

  public static final String DEFAULT_ENDPOINT = "https://storage.googleapis.com/";
  public static final String DEFAULT_APPLICATION_NAME = "gcs-client";
  public static final int DEFAULT_DOWNLOAD_BUFFER_SIZE = 3 * 1024 * 1024;

  static final String ENDPOINT_ENV = "CLOUD_STORAGE_TESTBENCH_ENDPOINT";
  static final String PROJECT_ENV = "GOOGLE_CLOUD_PROJECT";
  static final String TRACING_ENV = "CLOUD_STORAGE_ENABLE_TRACING";
  static final String RAW_CLIENT_TRACING = "raw-client";

  private static final Splitter TRACING_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

  private static final HttpRequestInitializer INSECURE_CREDENTIALS = new HttpRequestInitializer() {
    @Override
    public void initialize(HttpRequest request) {
      // no authorization header
    }

    @Override
    public String toString() {
      return "InsecureCredentials";
    }
  };

  private final HttpRequestInitializer credentials;
  private final String endpoint;
  private final Optional<String> projectId;
  private final String applicationName;
  private final boolean enableRawClientTracing;
  private final int downloadBufferSize;

  private ClientOptions(final Builder builder) {
    this.credentials = builder.credentials;
    this.endpoint = builder.endpoint;
    this.projectId = builder.projectId;
    this.applicationName = builder.applicationName;
    this.enableRawClientTracing = builder.enableRawClientTracing;
    this.downloadBufferSize = builder.downloadBufferSize;
  }

  /**
   * Credentials that leave requests unauthorized, for emulators and tests.
   */
  public static HttpRequestInitializer insecureCredentials() {
    return INSECURE_CREDENTIALS;
  }

  public static Builder newBuilder(final HttpRequestInitializer credentials) {
    return new Builder(credentials);
  }

  public static ClientOptions fromEnvironment(final HttpRequestInitializer credentials) {
    return fromEnvironment(credentials, System.getenv());
  }

  /**
   * Reads the endpoint override, default project and tracing flags from {@code env}.
   */
  public static ClientOptions fromEnvironment(final HttpRequestInitializer credentials, final Map<String, String> env) {
    checkNotNull(env, "env");
    Builder builder = newBuilder(credentials);

    String endpoint = env.get(ENDPOINT_ENV);
    if (!Strings.isNullOrEmpty(endpoint)) {
      builder.setEndpoint(endpoint);
    }

    String project = env.get(PROJECT_ENV);
    if (!Strings.isNullOrEmpty(project)) {
      builder.setProjectId(project);
    }

    String tracing = Strings.nullToEmpty(env.get(TRACING_ENV));
    builder.setEnableRawClientTracing(TRACING_SPLITTER.splitToList(tracing).contains(RAW_CLIENT_TRACING));

    return builder.build();
  }

  public HttpRequestInitializer credentials() {
    return credentials;
  }

  public String endpoint() {
    return endpoint;
  }

  public Optional<String> projectId() {
    return projectId;
  }

  public String applicationName() {
    return applicationName;
  }

  public boolean enableRawClientTracing() {
    return enableRawClientTracing;
  }

  public int downloadBufferSize() {
    return downloadBufferSize;
  }

  public Builder toBuilder() {
    return new Builder(credentials)
      .setEndpoint(endpoint)
      .setProjectId(projectId.orNull())
      .setApplicationName(applicationName)
      .setEnableRawClientTracing(enableRawClientTracing)
      .setDownloadBufferSize(downloadBufferSize);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
      .add("endpoint", endpoint)
      .add("projectId", projectId.orNull())
      .add("applicationName", applicationName)
      .add("enableRawClientTracing", enableRawClientTracing)
      .add("downloadBufferSize", downloadBufferSize)
      .toString();
  }

  public static final class Builder {

    private final HttpRequestInitializer credentials;
    private String endpoint = DEFAULT_ENDPOINT;
    private Optional<String> projectId = Optional.absent();
    private String applicationName = DEFAULT_APPLICATION_NAME;
    private boolean enableRawClientTracing;
    private int downloadBufferSize = DEFAULT_DOWNLOAD_BUFFER_SIZE;

    private Builder(final HttpRequestInitializer credentials) {
      this.credentials = checkNotNull(credentials, "credentials");
    }

    public Builder setEndpoint(final String endpoint) {
      checkArgument(!Strings.isNullOrEmpty(endpoint), "endpoint cannot be empty");
      this.endpoint = endpoint;
      return this;
    }

    public Builder setProjectId(final String projectId) {
      this.projectId = Optional.fromNullable(Strings.emptyToNull(projectId));
      return this;
    }

    public Builder setApplicationName(final String applicationName) {
      checkArgument(!Strings.isNullOrEmpty(applicationName), "applicationName cannot be empty");
      this.applicationName = applicationName;
      return this;
    }

    public Builder setEnableRawClientTracing(final boolean enableRawClientTracing) {
      this.enableRawClientTracing = enableRawClientTracing;
      return this;
    }

    public Builder setDownloadBufferSize(final int downloadBufferSize) {
      checkArgument(downloadBufferSize > 0, "downloadBufferSize must be > 0");
      this.downloadBufferSize = downloadBufferSize;
      return this;
    }

    public ClientOptions build() {
      return new ClientOptions(this);
    }
  }
}
