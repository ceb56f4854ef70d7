package gcsclient;

import com.google.common.base.MoreObjects;
import com.google.common.base.Stopwatch;
import com.google.common.base.Ticker;

import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

@SuppressWarnings("UnusedDeclaration")
public final class RetryPolicies {

  public static final Duration DEFAULT_MAXIMUM_DURATION = Duration.ofMinutes(5);

  private RetryPolicies() {}

  private abstract static class AbstractRetryPolicy implements RetryPolicy {

    @Override
    public boolean isPermanentFailure(final Status status) {
      return !status.isTransient();
    }

    @Override
    public boolean onFailure(final Status status) {
      if (isPermanentFailure(status)) {
        return false;
      }
      recordTransientFailure();
      return !isExhausted();
    }

    protected abstract void recordTransientFailure();
  }

  /**
   * Tolerates up to N transient failures. The (N+1)th transient failure exhausts the policy.
   */
  private static class LimitedErrorCount extends AbstractRetryPolicy {

    private final int maximumFailures;
    private int failureCount;

    LimitedErrorCount(final int maximumFailures) {
      checkArgument(maximumFailures >= 0, "maximumFailures must be >= 0");
      this.maximumFailures = maximumFailures;
    }

    @Override
    public RetryPolicy copy() {
      return new LimitedErrorCount(maximumFailures);
    }

    @Override
    protected void recordTransientFailure() {
      ++failureCount;
    }

    @Override
    public boolean isExhausted() {
      return failureCount > maximumFailures;
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper("LimitedErrorCountRetryPolicy")
        .add("maximumFailures", maximumFailures)
        .add("failureCount", failureCount)
        .toString();
    }
  }

  /**
   * Retries transient failures until a wall-clock budget, measured from the creation of the policy, has elapsed.
   */
  private static class LimitedTime extends AbstractRetryPolicy {

    private final Duration maximumDuration;
    private final Ticker ticker;
    private final Stopwatch stopwatch;

    LimitedTime(final Duration maximumDuration, final Ticker ticker) {
      checkNotNull(maximumDuration, "maximumDuration");
      checkArgument(!maximumDuration.isNegative(), "maximumDuration must be >= 0");
      this.maximumDuration = maximumDuration;
      this.ticker = checkNotNull(ticker, "ticker");
      this.stopwatch = Stopwatch.createStarted(ticker);
    }

    @Override
    public RetryPolicy copy() {
      return new LimitedTime(maximumDuration, ticker);
    }

    @Override
    protected void recordTransientFailure() {
      // nothing to count, only the clock matters
    }

    @Override
    public boolean isExhausted() {
      return stopwatch.elapsed().compareTo(maximumDuration) >= 0;
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper("LimitedTimeRetryPolicy")
        .add("maximumDuration", maximumDuration)
        .add("elapsed", stopwatch)
        .toString();
    }
  }

  public static RetryPolicy limitedErrorCount(final int maximumFailures) {
    return new LimitedErrorCount(maximumFailures);
  }

  public static RetryPolicy limitedTime(final Duration maximumDuration) {
    return new LimitedTime(maximumDuration, Ticker.systemTicker());
  }

  public static RetryPolicy limitedTime(final Duration maximumDuration, final Ticker ticker) {
    return new LimitedTime(maximumDuration, ticker);
  }

  /**
   * Does exactly what the name implies: the first transient failure exhausts the policy.
   */
  public static RetryPolicy noRetry() {
    return new LimitedErrorCount(0);
  }

  public static RetryPolicy defaultPolicy() {
    return limitedTime(DEFAULT_MAXIMUM_DURATION);
  }
}
