package gcsclient;

/**
 * The optional parameters understood by the storage service. Each operation accepts only a subset of them.
 */
@SuppressWarnings("UnusedDeclaration")
public final class WellKnownParameters {

  private WellKnownParameters() {}

  /** Selects a specific version of an object. */
  public static final class Generation extends WellKnownParameter<Long> {
    public Generation() {}

    public Generation(final long generation) {
      super(generation);
    }

    @Override
    public String parameterName() {
      return "generation";
    }
  }

  public static final class IfGenerationMatch extends WellKnownParameter<Long> {
    public IfGenerationMatch() {}

    public IfGenerationMatch(final long generation) {
      super(generation);
    }

    @Override
    public String parameterName() {
      return "ifGenerationMatch";
    }
  }

  public static final class IfGenerationNotMatch extends WellKnownParameter<Long> {
    public IfGenerationNotMatch() {}

    public IfGenerationNotMatch(final long generation) {
      super(generation);
    }

    @Override
    public String parameterName() {
      return "ifGenerationNotMatch";
    }
  }

  public static final class IfMetagenerationMatch extends WellKnownParameter<Long> {
    public IfMetagenerationMatch() {}

    public IfMetagenerationMatch(final long metageneration) {
      super(metageneration);
    }

    @Override
    public String parameterName() {
      return "ifMetagenerationMatch";
    }
  }

  public static final class IfMetagenerationNotMatch extends WellKnownParameter<Long> {
    public IfMetagenerationNotMatch() {}

    public IfMetagenerationNotMatch(final long metageneration) {
      super(metageneration);
    }

    @Override
    public String parameterName() {
      return "ifMetagenerationNotMatch";
    }
  }

  /** Limits the number of items returned in a single page of a list operation. */
  public static final class MaxResults extends WellKnownParameter<Long> {
    public MaxResults() {}

    public MaxResults(final long maxResults) {
      super(maxResults);
    }

    @Override
    public String parameterName() {
      return "maxResults";
    }
  }

  /** Restricts a list operation to names starting with the given prefix. */
  public static final class Prefix extends WellKnownParameter<String> {
    public Prefix() {}

    public Prefix(final String prefix) {
      super(prefix);
    }

    @Override
    public String parameterName() {
      return "prefix";
    }
  }

  /** Controls whether ACLs are included in returned metadata. */
  public static final class Projection extends WellKnownParameter<String> {
    public Projection() {}

    public Projection(final String projection) {
      super(projection);
    }

    public static Projection noAcl() {
      return new Projection("noAcl");
    }

    public static Projection full() {
      return new Projection("full");
    }

    @Override
    public String parameterName() {
      return "projection";
    }
  }

  /** The project billed for requester-pays buckets. */
  public static final class UserProject extends WellKnownParameter<String> {
    public UserProject() {}

    public UserProject(final String project) {
      super(project);
    }

    @Override
    public String parameterName() {
      return "userProject";
    }
  }

  /** Lists every version of an object as a distinct result, not only the live one. */
  public static final class Versions extends WellKnownParameter<Boolean> {
    public Versions() {}

    public Versions(final boolean versions) {
      super(versions);
    }

    @Override
    public String parameterName() {
      return "versions";
    }
  }
}
