package gcsclient.internal;

import com.google.api.client.util.GenericData;
import com.google.common.base.Joiner;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import gcsclient.WellKnownParameter;

import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The optional parameters of one request.
 *
 * Each request type declares, in order, the parameter kinds it accepts. At most one parameter is kept per kind,
 * setting a kind again replaces the previous value, and a kind outside the declared list is rejected. Present values
 * are always rendered in declaration order, never in the order they were set.
 */
public final class RequestParameters {

  private static final String DUMP_SEPARATOR = ", ";

  private final String requestName;
  private final ImmutableList<Class<? extends WellKnownParameter<?>>> kinds;
  private final Map<Class<?>, WellKnownParameter<?>> parameters = Maps.newHashMap();

  public RequestParameters(final String requestName, final List<Class<? extends WellKnownParameter<?>>> kinds) {
    this.requestName = checkNotNull(requestName, "requestName");
    this.kinds = ImmutableList.copyOf(kinds);
    checkArgument(ImmutableSet.copyOf(this.kinds).size() == this.kinds.size(),
                  "duplicate parameter kinds declared for %s: %s", requestName, kinds);
  }

  public boolean accepts(final Class<?> kind) {
    return kinds.contains(kind);
  }

  /**
   * Stores {@code parameter}, replacing any earlier parameter of the same kind.
   * @throws IllegalArgumentException if the request does not accept this kind of parameter
   */
  public void set(final WellKnownParameter<?> parameter) {
    checkNotNull(parameter, "parameter");
    checkArgument(accepts(parameter.getClass()),
                  "%s is not a valid parameter for %s", parameter.getClass().getSimpleName(), requestName);
    parameters.put(parameter.getClass(), parameter);
  }

  /**
   * Applies {@link #set} to each parameter in argument order, so a later parameter wins over an earlier one of the
   * same kind.
   */
  public void setAll(final WellKnownParameter<?>... parameters) {
    checkNotNull(parameters, "parameters");
    for (WellKnownParameter<?> parameter : parameters) {
      set(parameter);
    }
  }

  public <P extends WellKnownParameter<?>> Optional<P> get(final Class<P> kind) {
    checkNotNull(kind, "kind");
    WellKnownParameter<?> parameter = parameters.get(kind);
    if (parameter == null || !parameter.hasValue()) {
      return Optional.absent();
    }
    return Optional.of(kind.cast(parameter));
  }

  /**
   * Parameters holding a value, in declaration order.
   */
  public List<WellKnownParameter<?>> present() {
    List<WellKnownParameter<?>> result = Lists.newArrayListWithCapacity(kinds.size());
    for (Class<? extends WellKnownParameter<?>> kind : kinds) {
      WellKnownParameter<?> parameter = parameters.get(kind);
      if (parameter != null && parameter.hasValue()) {
        result.add(parameter);
      }
    }
    return result;
  }

  public boolean isEmpty() {
    return present().isEmpty();
  }

  /**
   * Appends {@code name=value} for every present parameter to {@code sink}, entries separated by {@code separator}.
   * Nothing at all is appended when no parameter has a value.
   */
  public StringBuilder serialize(final StringBuilder sink, final String separator) {
    checkNotNull(sink, "sink");
    checkNotNull(separator, "separator");
    List<String> entries = Lists.newArrayList();
    for (WellKnownParameter<?> parameter : present()) {
      entries.add(parameter.parameterName() + "=" + parameter.value());
    }
    return Joiner.on(separator).appendTo(sink, entries);
  }

  /**
   * Human readable rendering of the present parameters, used in log lines.
   */
  public String dump() {
    return serialize(new StringBuilder(), DUMP_SEPARATOR).toString();
  }

  /**
   * Copies the present parameters onto an outgoing request, as query parameters.
   */
  public void addParametersTo(final GenericData request) {
    checkNotNull(request, "request");
    for (WellKnownParameter<?> parameter : present()) {
      request.set(parameter.parameterName(), parameter.value());
    }
  }

  @Override
  public String toString() {
    return dump();
  }
}
