package gcsclient;

import com.google.common.base.MoreObjects;
import com.google.common.base.Supplier;

import java.time.Duration;
import java.util.Random;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

@SuppressWarnings("UnusedDeclaration")
public final class BackoffPolicies {

  public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
  public static final Duration DEFAULT_MAXIMUM_DELAY = Duration.ofMinutes(5);
  public static final double DEFAULT_SCALING = 2.0D;

  private static final Supplier<Random> NEW_RANDOM = new Supplier<Random>() {
    @Override
    public Random get() {
      return new Random();
    }
  };

  private BackoffPolicies() {}

  /**
   * Truncated exponential backoff (http://en.wikipedia.org/wiki/Exponential_backoff) with jitter.
   *
   * Each delay is chosen randomly in [D/2, D], where D starts at the initial delay and is multiplied by the
   * scaling factor after every call, never growing past the maximum delay.
   */
  private static class TruncatedExponential implements BackoffPolicy {

    private final long initialDelayInMs;
    private final long maximumDelayInMs;
    private final double scaling;
    private final Supplier<Random> randoms;

    private final Random rand;
    // fractional, rounded only when a delay is handed out
    private double currentDelayInMs;

    TruncatedExponential(final Duration initialDelay,
                         final Duration maximumDelay,
                         final double scaling,
                         final Supplier<Random> randoms) {
      checkNotNull(initialDelay, "initialDelay");
      checkNotNull(maximumDelay, "maximumDelay");
      checkArgument(!initialDelay.isNegative(), "initialDelay must be >= 0");
      checkArgument(maximumDelay.compareTo(initialDelay) >= 0, "maximumDelay must be >= initialDelay");
      checkArgument(scaling >= 1.0D, "scaling must be >= 1.0");
      this.initialDelayInMs = initialDelay.toMillis();
      this.maximumDelayInMs = maximumDelay.toMillis();
      this.scaling = scaling;
      this.randoms = checkNotNull(randoms, "randoms");
      this.rand = checkNotNull(randoms.get(), "random");
      this.currentDelayInMs = initialDelayInMs;
    }

    @Override
    public BackoffPolicy copy() {
      return new TruncatedExponential(
        Duration.ofMillis(initialDelayInMs), Duration.ofMillis(maximumDelayInMs), scaling, randoms);
    }

    @Override
    public Duration onCompletion() {
      long delay = Math.round(currentDelayInMs);
      long lower = delay / 2;
      long result = lower + (long) (rand.nextDouble() * (delay - lower + 1));
      result = Math.min(result, delay);

      currentDelayInMs = Math.min(currentDelayInMs * scaling, (double) maximumDelayInMs);

      return Duration.ofMillis(result);
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper("ExponentialBackoffPolicy")
        .add("initial delay(ms)", initialDelayInMs)
        .add("maximum delay(ms)", maximumDelayInMs)
        .add("scaling", scaling)
        .toString();
    }
  }

  /**
   * Waits the same interval before every attempt.
   */
  private static class Constant implements BackoffPolicy {

    private final Duration delay;

    Constant(final Duration delay) {
      checkNotNull(delay, "delay");
      checkArgument(!delay.isNegative(), "delay must be >= 0");
      this.delay = delay;
    }

    @Override
    public BackoffPolicy copy() {
      return this;
    }

    @Override
    public Duration onCompletion() {
      return delay;
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper("ConstantBackoffPolicy")
        .add("delay", delay)
        .toString();
    }
  }

  public static BackoffPolicy exponential(final Duration initialDelay, final Duration maximumDelay, final double scaling) {
    return new TruncatedExponential(initialDelay, maximumDelay, scaling, NEW_RANDOM);
  }

  public static BackoffPolicy exponential(final Duration initialDelay,
                                          final Duration maximumDelay,
                                          final double scaling,
                                          final Supplier<Random> randoms) {
    return new TruncatedExponential(initialDelay, maximumDelay, scaling, randoms);
  }

  public static BackoffPolicy constant(final Duration delay) {
    return new Constant(delay);
  }

  public static BackoffPolicy noDelay() {
    return new Constant(Duration.ZERO);
  }

  public static BackoffPolicy defaultPolicy() {
    return exponential(DEFAULT_INITIAL_DELAY, DEFAULT_MAXIMUM_DELAY, DEFAULT_SCALING);
  }
}
