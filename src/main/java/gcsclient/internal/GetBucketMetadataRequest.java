package gcsclient.internal;

import com.google.common.collect.ImmutableList;
import gcsclient.WellKnownParameter;
import gcsclient.WellKnownParameters.IfMetagenerationMatch;
import gcsclient.WellKnownParameters.IfMetagenerationNotMatch;
import gcsclient.WellKnownParameters.Projection;
import gcsclient.WellKnownParameters.UserProject;

import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

public final class GetBucketMetadataRequest extends GenericRequest<GetBucketMetadataRequest> {

  private static final List<Class<? extends WellKnownParameter<?>>> PARAMETERS = ImmutableList.of(
    IfMetagenerationMatch.class, IfMetagenerationNotMatch.class, Projection.class, UserProject.class);

  private final String bucketName;

  public GetBucketMetadataRequest(final String bucketName) {
    super(PARAMETERS);
    this.bucketName = checkNotNull(bucketName, "bucketName");
  }

  public String bucketName() {
    return bucketName;
  }

  @Override
  protected Map<String, Object> requiredFields() {
    return fields("bucket_name", bucketName);
  }
}
