package gcsclient.internal;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import gcsclient.WellKnownParameter;
import gcsclient.WellKnownParameters.IfGenerationMatch;
import gcsclient.WellKnownParameters.IfGenerationNotMatch;
import gcsclient.WellKnownParameters.IfMetagenerationMatch;
import gcsclient.WellKnownParameters.IfMetagenerationNotMatch;
import gcsclient.WellKnownParameters.Projection;
import gcsclient.WellKnownParameters.UserProject;

import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Creates an object from an in-memory buffer, in a single request.
 */
public final class InsertObjectMediaRequest extends GenericRequest<InsertObjectMediaRequest> {

  private static final List<Class<? extends WellKnownParameter<?>>> PARAMETERS = ImmutableList.of(
    IfGenerationMatch.class, IfGenerationNotMatch.class, IfMetagenerationMatch.class, IfMetagenerationNotMatch.class,
    Projection.class, UserProject.class);

  private final String bucketName;
  private final String objectName;
  private final byte[] contents;

  public InsertObjectMediaRequest(final String bucketName, final String objectName, final byte[] contents) {
    super(PARAMETERS);
    this.bucketName = checkNotNull(bucketName, "bucketName");
    this.objectName = checkNotNull(objectName, "objectName");
    this.contents = checkNotNull(contents, "contents").clone();
  }

  public String bucketName() {
    return bucketName;
  }

  public String objectName() {
    return objectName;
  }

  public byte[] contents() {
    return contents.clone();
  }

  @Override
  protected Map<String, Object> requiredFields() {
    // the payload can be large, only its size goes into log lines
    return ImmutableMap.<String, Object>of(
      "bucket_name", bucketName, "object_name", objectName, "contents.size", contents.length);
  }
}
