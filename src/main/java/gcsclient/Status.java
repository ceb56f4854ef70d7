package gcsclient;

import com.google.common.base.Objects;
import com.google.common.base.Strings;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The outcome of a single attempt to call the storage service.
 *
 * The classification is assigned by the transport. Only {@link Kind#TRANSIENT} statuses are eligible for a retry.
 */
public final class Status {

  public enum Kind {
    OK,
    TRANSIENT,
    PERMANENT
  }

  // Used by transports for failures that never produced an HTTP response (timeouts, dropped connections).
  public static final int NETWORK_FAILURE = 0;

  private static final Status OK = new Status(200, "", Kind.OK);

  private final int statusCode;
  private final String errorMessage;
  private final Kind kind;

  private Status(final int statusCode, final String errorMessage, final Kind kind) {
    this.statusCode = statusCode;
    this.errorMessage = Strings.nullToEmpty(errorMessage);
    this.kind = checkNotNull(kind, "kind");
  }

  public static Status ok() {
    return OK;
  }

  public static Status transientError(final int statusCode, final String errorMessage) {
    return new Status(statusCode, errorMessage, Kind.TRANSIENT);
  }

  public static Status permanentError(final int statusCode, final String errorMessage) {
    return new Status(statusCode, errorMessage, Kind.PERMANENT);
  }

  public static Status networkFailure(final String errorMessage) {
    return transientError(NETWORK_FAILURE, errorMessage);
  }

  /**
   * Classifies an HTTP status code: 2xx is ok, 408, 429 and every 5xx are transient, anything else is permanent.
   */
  public static Status fromHttpCode(final int statusCode, final String errorMessage) {
    if (statusCode >= 200 && statusCode < 300) {
      return new Status(statusCode, errorMessage, Kind.OK);
    }
    if (statusCode == 408 || statusCode == 429 || statusCode >= 500) {
      return transientError(statusCode, errorMessage);
    }
    return permanentError(statusCode, errorMessage);
  }

  public int statusCode() {
    return statusCode;
  }

  public String errorMessage() {
    return errorMessage;
  }

  public Kind kind() {
    return kind;
  }

  public boolean isOk() {
    return kind == Kind.OK;
  }

  public boolean isTransient() {
    return kind == Kind.TRANSIENT;
  }

  public boolean isPermanent() {
    return kind == Kind.PERMANENT;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Status)) {
      return false;
    }
    Status other = (Status) o;
    return statusCode == other.statusCode && kind == other.kind && errorMessage.equals(other.errorMessage);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(statusCode, errorMessage, kind);
  }

  @Override
  public String toString() {
    return "[" + kind + "] code=" + statusCode + ", message=" + errorMessage;
  }
}
