package gcsclient.internal;

import com.google.common.base.MoreObjects;
import gcsclient.Status;

import javax.annotation.Nullable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The {@link Status} of a call together with its payload. The payload is only meaningful when the status is ok.
 *
 * @param <T> the payload type
 */
public final class Result<T> {

  private final Status status;
  @Nullable
  private final T payload;

  private Result(final Status status, @Nullable final T payload) {
    this.status = checkNotNull(status, "status");
    this.payload = payload;
  }

  public static <T> Result<T> ok(final T payload) {
    return new Result<>(Status.ok(), payload);
  }

  public static <T> Result<T> failure(final Status status) {
    return new Result<>(status, null);
  }

  public Status status() {
    return status;
  }

  @Nullable
  public T payload() {
    return payload;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
      .add("status", status)
      .add("payload", payload)
      .toString();
  }
}
