package gcsclient;

import java.io.Serializable;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Raised when a storage operation fails. Carries the name of the operation and the last {@link Status} received.
 */
public class StorageException extends RuntimeException implements Serializable {

  private static final long serialVersionUID = 4471932290817347412L;

  private final String operation;
  private final Status status;

  public StorageException(final String operation, final Status status) {
    this(String.format("Error in %s: %s", operation, status.errorMessage()), operation, status);
  }

  protected StorageException(final String message, final String operation, final Status status) {
    super(message);
    this.operation = checkNotNull(operation, "operation");
    this.status = checkNotNull(status, "status");
  }

  public StorageException(final String message, final String operation, final Status status, final Throwable cause) {
    super(message, cause);
    this.operation = checkNotNull(operation, "operation");
    this.status = checkNotNull(status, "status");
  }

  public String getOperation() {
    return operation;
  }

  public Status getStatus() {
    return status;
  }
}
