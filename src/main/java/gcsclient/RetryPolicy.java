package gcsclient;

/**
 * Decides whether a failed call may be attempted again.
 *
 * Instances hold per-call state (failures seen, deadline). The retry layer asks for a {@link #copy()} of the
 * configured policy at the start of every top-level call, so one instance is never shared between calls.
 */
public interface RetryPolicy {

  /**
   * Returns a new policy with the same configuration and fresh state.
   */
  RetryPolicy copy();

  /**
   * Records a failure.
   * @return true iff the call may be attempted again
   */
  boolean onFailure(Status status);

  boolean isExhausted();

  boolean isPermanentFailure(Status status);
}
