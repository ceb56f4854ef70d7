package gcsclient.internal;

import com.google.common.collect.ImmutableList;
import gcsclient.WellKnownParameter;
import gcsclient.WellKnownParameters.Generation;
import gcsclient.WellKnownParameters.UserProject;

import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

public final class ListObjectAclRequest extends GenericRequest<ListObjectAclRequest> {

  private static final List<Class<? extends WellKnownParameter<?>>> PARAMETERS =
    ImmutableList.of(Generation.class, UserProject.class);

  private final String bucketName;
  private final String objectName;

  public ListObjectAclRequest(final String bucketName, final String objectName) {
    super(PARAMETERS);
    this.bucketName = checkNotNull(bucketName, "bucketName");
    this.objectName = checkNotNull(objectName, "objectName");
  }

  public String bucketName() {
    return bucketName;
  }

  public String objectName() {
    return objectName;
  }

  @Override
  protected Map<String, Object> requiredFields() {
    return fields("bucket_name", bucketName, "object_name", objectName);
  }
}
