package gcsclient.internal;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import gcsclient.WellKnownParameter;
import gcsclient.WellKnownParameters.Generation;
import gcsclient.WellKnownParameters.IfGenerationMatch;
import gcsclient.WellKnownParameters.IfGenerationNotMatch;
import gcsclient.WellKnownParameters.IfMetagenerationMatch;
import gcsclient.WellKnownParameters.IfMetagenerationNotMatch;
import gcsclient.WellKnownParameters.UserProject;

import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Reads the bytes in {@code [begin, end)} of an object.
 */
public final class ReadObjectRangeRequest extends GenericRequest<ReadObjectRangeRequest> {

  private static final List<Class<? extends WellKnownParameter<?>>> PARAMETERS = ImmutableList.of(
    Generation.class, IfGenerationMatch.class, IfGenerationNotMatch.class, IfMetagenerationMatch.class,
    IfMetagenerationNotMatch.class, UserProject.class);

  private final String bucketName;
  private final String objectName;
  private final long begin;
  private final long end;

  public ReadObjectRangeRequest(final String bucketName, final String objectName, final long begin, final long end) {
    super(PARAMETERS);
    checkArgument(begin >= 0, "begin must be >= 0");
    checkArgument(end > begin, "end must be > begin");
    this.bucketName = checkNotNull(bucketName, "bucketName");
    this.objectName = checkNotNull(objectName, "objectName");
    this.begin = begin;
    this.end = end;
  }

  public String bucketName() {
    return bucketName;
  }

  public String objectName() {
    return objectName;
  }

  public long begin() {
    return begin;
  }

  public long end() {
    return end;
  }

  /** The value of the HTTP {@code Range} header selecting this range; HTTP ranges are inclusive. */
  public String rangeHeader() {
    return "bytes=" + begin + "-" + (end - 1);
  }

  @Override
  protected Map<String, Object> requiredFields() {
    return ImmutableMap.<String, Object>of(
      "bucket_name", bucketName, "object_name", objectName, "begin", begin, "end", end);
  }
}
