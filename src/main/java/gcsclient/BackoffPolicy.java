package gcsclient;

import java.time.Duration;

/**
 * Computes how long to wait before the next attempt of a failed call.
 */
public interface BackoffPolicy {

  /**
   * Returns a new policy with the same configuration and fresh state.
   */
  BackoffPolicy copy();

  /**
   * Returns the delay before the next attempt, advancing the internal sequence.
   */
  Duration onCompletion();
}
