package gcsclient.internal;

import com.google.api.client.http.LowLevelHttpRequest;
import com.google.api.client.http.LowLevelHttpResponse;
import com.google.api.client.json.Json;
import com.google.api.client.testing.http.MockHttpTransport;
import com.google.api.client.testing.http.MockLowLevelHttpRequest;
import com.google.api.client.testing.http.MockLowLevelHttpResponse;
import com.google.api.services.storage.model.Bucket;
import com.google.api.services.storage.model.ObjectAccessControls;
import com.google.api.services.storage.model.Objects;
import com.google.api.services.storage.model.StorageObject;
import gcsclient.ClientOptions;
import gcsclient.Status;
import gcsclient.WellKnownParameters.Generation;
import gcsclient.WellKnownParameters.IfGenerationMatch;
import gcsclient.WellKnownParameters.Prefix;
import gcsclient.WellKnownParameters.UserProject;
import org.apache.http.NoHttpResponseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class StorageRawClientTest {

  private static final ClientOptions OPTIONS = ClientOptions.newBuilder(ClientOptions.insecureCredentials())
    .setEndpoint("http://localhost:9000/")
    .build();

  /**
   * Answers every request with the same canned response and remembers what was asked.
   */
  private static final class RecordingTransport extends MockHttpTransport {

    private final MockLowLevelHttpResponse response;
    private final List<MockLowLevelHttpRequest> requests = new ArrayList<>();

    RecordingTransport(final MockLowLevelHttpResponse response) {
      this.response = response;
    }

    @Override
    public LowLevelHttpRequest buildRequest(final String method, final String url) {
      MockLowLevelHttpRequest request = new MockLowLevelHttpRequest(method + " " + url).setResponse(response);
      requests.add(request);
      return request;
    }

    MockLowLevelHttpRequest lastRequest() {
      return requests.get(requests.size() - 1);
    }
  }

  private static final class FailingTransport extends MockHttpTransport {

    private final IOException failure;

    FailingTransport(final IOException failure) {
      this.failure = failure;
    }

    @Override
    public LowLevelHttpRequest buildRequest(final String method, final String url) {
      return new MockLowLevelHttpRequest(url) {
        @Override
        public LowLevelHttpResponse execute() throws IOException {
          throw failure;
        }
      };
    }
  }

  private static MockLowLevelHttpResponse json(final int statusCode, final String content) {
    return new MockLowLevelHttpResponse()
      .setStatusCode(statusCode)
      .setContentType(Json.MEDIA_TYPE)
      .setContent(content);
  }

  private static MockLowLevelHttpResponse error(final int statusCode, final String message) {
    return json(statusCode, "{\"error\":{\"code\":" + statusCode + ",\"message\":\"" + message + "\"}}");
  }

  @Test
  @DisplayName("should build its own transport from the options alone")
  void should_build_its_own_transport_from_the_options_alone() {
    // When
    StorageRawClient client = new StorageRawClient(OPTIONS);

    // Then
    assertThat(client.clientOptions()).isSameAs(OPTIONS);
  }

  @Test
  @DisplayName("should parse bucket metadata returned by the service")
  void should_parse_bucket_metadata_returned_by_the_service() {
    // Given
    RecordingTransport transport = new RecordingTransport(json(200, "{\"name\":\"foo-bar-baz\",\"metageneration\":\"3\"}"));
    StorageRawClient client = new StorageRawClient(OPTIONS, transport);

    // When
    Result<Bucket> result = client.getBucketMetadata(
      new GetBucketMetadataRequest("foo-bar-baz").setParameter(new UserProject("billing")));

    // Then
    assertThat(result.status().isOk()).isTrue();
    assertThat(result.payload().getName()).isEqualTo("foo-bar-baz");
    assertThat(result.payload().getMetageneration()).isEqualTo(3L);
    assertThat(transport.lastRequest().getUrl())
      .startsWith("GET http://localhost:9000/storage/v1/b/foo-bar-baz")
      .contains("userProject=billing");
  }

  @Test
  @DisplayName("should send the parameters of a request as query parameters")
  void should_send_the_parameters_of_a_request_as_query_parameters() {
    // Given
    RecordingTransport transport = new RecordingTransport(json(200, "{\"name\":\"object\",\"generation\":\"42\"}"));
    StorageRawClient client = new StorageRawClient(OPTIONS, transport);

    // When
    Result<StorageObject> result = client.getObjectMetadata(new GetObjectMetadataRequest("bucket", "object")
      .setMultipleParameters(new Generation(42), new IfGenerationMatch()));

    // Then
    assertThat(result.payload().getGeneration()).isEqualTo(42L);
    assertThat(transport.lastRequest().getUrl())
      .contains("/b/bucket/o/object")
      .contains("generation=42")
      .doesNotContain("ifGenerationMatch");
  }

  @Test
  @DisplayName("should classify service unavailable as transient")
  void should_classify_service_unavailable_as_transient() {
    // Given
    StorageRawClient client = new StorageRawClient(OPTIONS, new RecordingTransport(error(503, "backend unavailable")));

    // When
    Result<Bucket> result = client.getBucketMetadata(new GetBucketMetadataRequest("foo-bar-baz"));

    // Then
    assertThat(result.status().isTransient()).isTrue();
    assertThat(result.status().statusCode()).isEqualTo(503);
    assertThat(result.status().errorMessage()).isEqualTo("backend unavailable");
    assertThat(result.payload()).isNull();
  }

  @Test
  @DisplayName("should classify not found as permanent")
  void should_classify_not_found_as_permanent() {
    // Given
    StorageRawClient client = new StorageRawClient(OPTIONS, new RecordingTransport(error(404, "No such object")));

    // When
    Result<EmptyResponse> result = client.deleteObject(new DeleteObjectRequest("bucket", "object"));

    // Then
    assertThat(result.status().isPermanent()).isTrue();
    assertThat(result.status().statusCode()).isEqualTo(404);
    assertThat(result.status().errorMessage()).isEqualTo("No such object");
  }

  @Test
  @DisplayName("should classify a timed out call as transient")
  void should_classify_a_timed_out_call_as_transient() {
    // Given
    StorageRawClient client =
      new StorageRawClient(OPTIONS, new FailingTransport(new SocketTimeoutException("Read timed out")));

    // When
    Result<Objects> result = client.listObjects(new ListObjectsRequest("bucket"));

    // Then
    assertThat(result.status().isTransient()).isTrue();
    assertThat(result.status().statusCode()).isEqualTo(Status.NETWORK_FAILURE);
    assertThat(result.status().errorMessage()).contains("Read timed out");
  }

  @Test
  @DisplayName("should map I/O failures by whether the service may have missed the request")
  void should_map_io_failures_by_whether_the_service_may_have_missed_the_request() {
    assertThat(StorageRawClient.toStatus(new NoHttpResponseException("dropped")).isTransient()).isTrue();
    assertThat(StorageRawClient.toStatus(new ConnectException("refused")).isTransient()).isTrue();
    assertThat(StorageRawClient.toStatus(new FileNotFoundException("missing")).isPermanent()).isTrue();
  }

  @Test
  @DisplayName("should request a byte range and report where it sits in the object")
  void should_request_a_byte_range_and_report_where_it_sits_in_the_object() {
    // Given
    MockLowLevelHttpResponse response = new MockLowLevelHttpResponse()
      .setStatusCode(206)
      .addHeader("Content-Range", "bytes 0-3/10")
      .setContent("abcd");
    RecordingTransport transport = new RecordingTransport(response);
    StorageRawClient client = new StorageRawClient(OPTIONS, transport);

    // When
    Result<ReadObjectRangeResponse> result =
      client.readObjectRangeMedia(new ReadObjectRangeRequest("bucket", "object", 0, 4));

    // Then
    assertThat(result.status().isOk()).isTrue();
    assertThat(new String(result.payload().contents(), StandardCharsets.UTF_8)).isEqualTo("abcd");
    assertThat(result.payload().objectSize()).isEqualTo(10L);
    assertThat(result.payload().isLastRange()).isFalse();
    assertThat(transport.lastRequest().getFirstHeaderValue("Range")).isEqualTo("bytes=0-3");
    assertThat(transport.lastRequest().getUrl()).contains("alt=media");
  }

  @Test
  @DisplayName("should list the pages of a listing with the given token and parameters")
  void should_list_the_pages_of_a_listing_with_the_given_token_and_parameters() {
    // Given
    RecordingTransport transport = new RecordingTransport(
      json(200, "{\"items\":[{\"name\":\"a\"},{\"name\":\"b\"}],\"nextPageToken\":\"t2\"}"));
    StorageRawClient client = new StorageRawClient(OPTIONS, transport);

    // When
    Result<Objects> result = client.listObjects(
      new ListObjectsRequest("bucket").setPageToken("t1").setParameter(new Prefix("logs")));

    // Then
    assertThat(result.payload().getItems()).extracting(StorageObject::getName).containsExactly("a", "b");
    assertThat(result.payload().getNextPageToken()).isEqualTo("t2");
    assertThat(transport.lastRequest().getUrl()).contains("pageToken=t1").contains("prefix=logs");
  }

  @Test
  @DisplayName("should upload the contents of an insert in a single request")
  void should_upload_the_contents_of_an_insert_in_a_single_request() {
    // Given
    RecordingTransport transport = new RecordingTransport(json(200, "{\"name\":\"object\",\"size\":\"5\"}"));
    StorageRawClient client = new StorageRawClient(OPTIONS, transport);

    // When
    Result<StorageObject> result = client.insertObjectMedia(
      new InsertObjectMediaRequest("bucket", "object", "hello".getBytes(StandardCharsets.UTF_8)));

    // Then
    assertThat(result.status().isOk()).isTrue();
    assertThat(result.payload().getName()).isEqualTo("object");
    assertThat(transport.requests).hasSize(1);
    assertThat(transport.lastRequest().getUrl()).startsWith("POST http://localhost:9000/upload/storage/v1/b/bucket/o");
  }

  @Test
  @DisplayName("should parse the access control list of an object")
  void should_parse_the_access_control_list_of_an_object() {
    // Given
    RecordingTransport transport = new RecordingTransport(
      json(200, "{\"items\":[{\"entity\":\"user-jane@example.com\",\"role\":\"OWNER\"}]}"));
    StorageRawClient client = new StorageRawClient(OPTIONS, transport);

    // When
    Result<ObjectAccessControls> result = client.listObjectAcl(new ListObjectAclRequest("bucket", "object"));

    // Then
    assertThat(result.payload().getItems()).hasSize(1);
    assertThat(result.payload().getItems().get(0).getRole()).isEqualTo("OWNER");
    assertThat(transport.lastRequest().getUrl()).contains("/b/bucket/o/object/acl");
  }
}
