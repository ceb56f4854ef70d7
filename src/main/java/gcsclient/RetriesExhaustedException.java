package gcsclient;

/**
 * A transient failure persisted past the budget of the retry policy in use.
 */
public class RetriesExhaustedException extends StorageException {

  private static final long serialVersionUID = -2594059122419022555L;

  public RetriesExhaustedException(final String operation, final Status status) {
    super(String.format("Retry policy exhausted in %s: %s", operation, status.errorMessage()), operation, status);
  }
}
