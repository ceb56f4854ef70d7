package gcsclient.internal;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import gcsclient.WellKnownParameter;
import gcsclient.WellKnownParameters.MaxResults;
import gcsclient.WellKnownParameters.Prefix;
import gcsclient.WellKnownParameters.Projection;
import gcsclient.WellKnownParameters.UserProject;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Lists the buckets of a project.
 */
public final class ListBucketsRequest extends GenericRequest<ListBucketsRequest> {

  private static final List<Class<? extends WellKnownParameter<?>>> PARAMETERS =
    ImmutableList.of(MaxResults.class, Prefix.class, Projection.class, UserProject.class);

  private final String projectId;
  @Nullable
  private String pageToken;

  public ListBucketsRequest(final String projectId) {
    super(PARAMETERS);
    this.projectId = checkNotNull(projectId, "projectId");
  }

  public String projectId() {
    return projectId;
  }

  @Nullable
  public String pageToken() {
    return pageToken;
  }

  public ListBucketsRequest setPageToken(@Nullable final String pageToken) {
    this.pageToken = pageToken;
    return this;
  }

  @Override
  protected Map<String, Object> requiredFields() {
    ImmutableMap.Builder<String, Object> fields = ImmutableMap.<String, Object>builder().put("project_id", projectId);
    if (pageToken != null) {
      fields.put("page_token", pageToken);
    }
    return fields.build();
  }
}
