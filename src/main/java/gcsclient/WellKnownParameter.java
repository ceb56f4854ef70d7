package gcsclient;

import com.google.common.base.Objects;
import com.google.common.base.Optional;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * An optional, named request parameter. The concrete subclass identifies the kind of parameter; a request accepts
 * at most one value per kind.
 *
 * @param <T> the type of the value sent to the service
 */
public abstract class WellKnownParameter<T> {

  private final Optional<T> value;

  /** Creates a parameter without a value, which is skipped when the request is sent. */
  protected WellKnownParameter() {
    this.value = Optional.absent();
  }

  protected WellKnownParameter(final T value) {
    this.value = Optional.of(checkNotNull(value, "value"));
  }

  /** The name of the query parameter, as the service spells it. */
  public abstract String parameterName();

  public boolean hasValue() {
    return value.isPresent();
  }

  public T value() {
    checkState(value.isPresent(), "%s has no value", parameterName());
    return value.get();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    return value.equals(((WellKnownParameter<?>) o).value);
  }

  @Override
  public int hashCode() {
    return Objects.hashCode(getClass(), value);
  }

  @Override
  public String toString() {
    return parameterName() + "=" + (value.isPresent() ? value.get() : "<not set>");
  }
}
