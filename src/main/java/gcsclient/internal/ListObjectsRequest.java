package gcsclient.internal;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import gcsclient.WellKnownParameter;
import gcsclient.WellKnownParameters.MaxResults;
import gcsclient.WellKnownParameters.Prefix;
import gcsclient.WellKnownParameters.Projection;
import gcsclient.WellKnownParameters.UserProject;
import gcsclient.WellKnownParameters.Versions;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Fetches one page of the objects in a bucket. Use {@link #setPageToken} to continue from a previous page.
 */
public final class ListObjectsRequest extends GenericRequest<ListObjectsRequest> {

  private static final List<Class<? extends WellKnownParameter<?>>> PARAMETERS = ImmutableList.of(
    MaxResults.class, Prefix.class, Projection.class, UserProject.class, Versions.class);

  private final String bucketName;
  @Nullable
  private String pageToken;

  public ListObjectsRequest(final String bucketName) {
    super(PARAMETERS);
    this.bucketName = checkNotNull(bucketName, "bucketName");
  }

  public String bucketName() {
    return bucketName;
  }

  @Nullable
  public String pageToken() {
    return pageToken;
  }

  public ListObjectsRequest setPageToken(@Nullable final String pageToken) {
    this.pageToken = pageToken;
    return this;
  }

  @Override
  protected Map<String, Object> requiredFields() {
    ImmutableMap.Builder<String, Object> fields = ImmutableMap.<String, Object>builder().put("bucket_name", bucketName);
    if (pageToken != null) {
      fields.put("page_token", pageToken);
    }
    return fields.build();
  }
}
