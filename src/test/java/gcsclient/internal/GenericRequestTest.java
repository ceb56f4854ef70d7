package gcsclient.internal;

import gcsclient.WellKnownParameters.Generation;
import gcsclient.WellKnownParameters.IfMetagenerationMatch;
import gcsclient.WellKnownParameters.MaxResults;
import gcsclient.WellKnownParameters.Prefix;
import gcsclient.WellKnownParameters.Projection;
import gcsclient.WellKnownParameters.UserProject;
import gcsclient.WellKnownParameters.Versions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GenericRequestTest {

  @Test
  @DisplayName("should render the required fields only when no parameter is set")
  void should_render_the_required_fields_only_when_no_parameter_is_set() {
    // Given
    GetBucketMetadataRequest request = new GetBucketMetadataRequest("foo-bar-baz");

    // Then
    assertThat(request.toString()).isEqualTo("GetBucketMetadataRequest={bucket_name=foo-bar-baz}");
  }

  @Test
  @DisplayName("should render the required fields followed by the parameters in declaration order")
  void should_render_the_required_fields_followed_by_the_parameters() {
    // Given
    GetBucketMetadataRequest request = new GetBucketMetadataRequest("foo-bar-baz")
      .setMultipleParameters(new UserProject("my-project"), new IfMetagenerationMatch(7));

    // Then
    assertThat(request.toString())
      .isEqualTo("GetBucketMetadataRequest={bucket_name=foo-bar-baz, ifMetagenerationMatch=7, userProject=my-project}");
  }

  @Test
  @DisplayName("should return the request itself from the fluent setters")
  void should_return_the_request_itself_from_the_fluent_setters() {
    // Given
    ListObjectsRequest request = new ListObjectsRequest("bucket");

    // Then
    assertThat(request.setParameter(new Versions(true))).isSameAs(request);
    assertThat(request.setMultipleParameters(new MaxResults(10), new Prefix("a/"))).isSameAs(request);
    assertThat(request.getParameter(MaxResults.class).get().value()).isEqualTo(10L);
  }

  @Test
  @DisplayName("should reject parameters outside the allowed list of the request type")
  void should_reject_parameters_outside_the_allowed_list() {
    // Given
    GetBucketMetadataRequest request = new GetBucketMetadataRequest("foo-bar-baz");

    // Then
    assertThatThrownBy(() -> request.setParameter(new Generation(1)))
      .isInstanceOf(IllegalArgumentException.class)
      .hasMessage("Generation is not a valid parameter for GetBucketMetadataRequest");
  }

  @Test
  @DisplayName("should render the page token of list requests only when set")
  void should_render_the_page_token_only_when_set() {
    // Given
    ListBucketsRequest request = new ListBucketsRequest("my-project").setMultipleParameters(new MaxResults(2));

    // Then
    assertThat(request.toString()).isEqualTo("ListBucketsRequest={project_id=my-project, maxResults=2}");
    assertThat(request.setPageToken("abc").toString())
      .isEqualTo("ListBucketsRequest={project_id=my-project, page_token=abc, maxResults=2}");
  }

  @Test
  @DisplayName("should log the size of an upload rather than its contents")
  void should_log_the_size_of_an_upload_rather_than_its_contents() {
    // Given
    InsertObjectMediaRequest request =
      new InsertObjectMediaRequest("bucket", "object", new byte[]{1, 2, 3}).setParameter(Projection.full());

    // Then
    assertThat(request.toString())
      .isEqualTo("InsertObjectMediaRequest={bucket_name=bucket, object_name=object, contents.size=3, projection=full}");
  }

  @Test
  @DisplayName("should not share the upload buffer with the caller")
  void should_not_share_the_upload_buffer_with_the_caller() {
    // Given
    byte[] contents = {1, 2, 3};
    InsertObjectMediaRequest request = new InsertObjectMediaRequest("bucket", "object", contents);

    // When
    contents[0] = 9;

    // Then
    assertThat(request.contents()).containsExactly(1, 2, 3);
  }

  @Test
  @DisplayName("should express a range request as an inclusive HTTP range")
  void should_express_a_range_request_as_an_inclusive_http_range() {
    // Given
    ReadObjectRangeRequest request = new ReadObjectRangeRequest("bucket", "object", 1024, 2048);

    // Then
    assertThat(request.rangeHeader()).isEqualTo("bytes=1024-2047");
    assertThatThrownBy(() -> new ReadObjectRangeRequest("bucket", "object", 10, 10))
      .isInstanceOf(IllegalArgumentException.class);
  }
}
