package gcsclient.internal;

import com.google.common.base.Joiner;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import gcsclient.WellKnownParameter;

import java.util.List;
import java.util.Map;

/**
 * Common behavior of the per-operation request types: a fixed set of required fields plus the optional parameters
 * declared by the concrete type.
 *
 * To implement {@code FooRequest}, extend {@code GenericRequest<FooRequest>}, pass the list of accepted parameter
 * kinds (in the order they should be rendered) to the constructor and describe the required fields in
 * {@link #requiredFields()}.
 *
 * @param <R> the concrete request type, returned by the fluent setters
 */
public abstract class GenericRequest<R extends GenericRequest<R>> {

  private static final Joiner.MapJoiner FIELD_JOINER = Joiner.on(", ").withKeyValueSeparator("=");

  private final RequestParameters parameters;

  protected GenericRequest(final List<Class<? extends WellKnownParameter<?>>> parameterKinds) {
    this.parameters = new RequestParameters(getClass().getSimpleName(), parameterKinds);
  }

  public R setParameter(final WellKnownParameter<?> parameter) {
    parameters.set(parameter);
    return self();
  }

  public R setMultipleParameters(final WellKnownParameter<?>... parameters) {
    this.parameters.setAll(parameters);
    return self();
  }

  public <P extends WellKnownParameter<?>> Optional<P> getParameter(final Class<P> kind) {
    return parameters.get(kind);
  }

  public RequestParameters parameters() {
    return parameters;
  }

  /**
   * The required fields of the request, in the order they are rendered.
   */
  protected abstract Map<String, Object> requiredFields();

  @SuppressWarnings("unchecked")
  private R self() {
    return (R) this;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append("={");
    Map<String, Object> fields = requiredFields();
    FIELD_JOINER.appendTo(sb, fields);
    if (!parameters.isEmpty()) {
      parameters.serialize(fields.isEmpty() ? sb : sb.append(", "), ", ");
    }
    return sb.append('}').toString();
  }

  protected static Map<String, Object> fields(final String k1, final Object v1) {
    return ImmutableMap.of(k1, v1);
  }

  protected static Map<String, Object> fields(final String k1, final Object v1, final String k2, final Object v2) {
    return ImmutableMap.of(k1, v1, k2, v2);
  }
}
