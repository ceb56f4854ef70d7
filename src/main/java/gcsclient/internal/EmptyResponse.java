package gcsclient.internal;

/**
 * Payload of operations that return nothing on success.
 */
public final class EmptyResponse {

  private static final EmptyResponse INSTANCE = new EmptyResponse();

  private EmptyResponse() {}

  public static EmptyResponse get() {
    return INSTANCE;
  }

  @Override
  public String toString() {
    return "{}";
  }
}
