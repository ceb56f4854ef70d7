package gcsclient;

/**
 * The service answered with a failure that retrying would not fix (bad request, not found, permission denied...).
 */
public class PermanentFailureException extends StorageException {

  private static final long serialVersionUID = -8106317212035409765L;

  public PermanentFailureException(final String operation, final Status status) {
    super(String.format("Permanent error in %s: %s", operation, status.errorMessage()), operation, status);
  }
}
