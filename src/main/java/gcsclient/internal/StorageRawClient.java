package gcsclient.internal;

import com.google.api.client.googleapis.json.GoogleJsonError;
import com.google.api.client.googleapis.json.GoogleJsonResponseException;
import com.google.api.client.http.ByteArrayContent;
import com.google.api.client.http.HttpResponse;
import com.google.api.client.http.HttpResponseException;
import com.google.api.client.http.HttpTransport;
import com.google.api.client.http.apache.v2.ApacheHttpTransport;
import com.google.api.client.json.gson.GsonFactory;
import com.google.api.services.storage.Storage;
import com.google.api.services.storage.StorageRequest;
import com.google.api.services.storage.model.Bucket;
import com.google.api.services.storage.model.Buckets;
import com.google.api.services.storage.model.ObjectAccessControls;
import com.google.api.services.storage.model.Objects;
import com.google.api.services.storage.model.StorageObject;
import com.google.common.base.Predicate;
import com.google.common.base.Predicates;
import com.google.common.base.Strings;
import com.google.common.io.ByteStreams;
import gcsclient.ClientOptions;
import gcsclient.Status;
import org.apache.http.NoHttpResponseException;

import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.SocketTimeoutException;

import static com.google.common.base.Preconditions.checkNotNull;
import static gcsclient.internal.Logging.debug;

/**
 * {@link RawClient} backed by the Cloud Storage JSON API client.
 *
 * Each call is made exactly once. HTTP errors and I/O failures are converted into a {@link Status}; nothing is thrown
 * for a failed call.
 */
public final class StorageRawClient implements RawClient {

  // Used for upload requests
  private static final String UPLOAD_CONTENT_TYPE = "application/octet-stream";

  // I/O failures where the service never saw the request or never answered. NoHttpResponseException comes from the
  // Apache HttpClient behind the default transport, which runs with automatic retries disabled.
  private static final Predicate<Object> IS_TRANSIENT_IO_FAILURE = Predicates.or(
    Predicates.instanceOf(SocketTimeoutException.class),
    Predicates.instanceOf(NoHttpResponseException.class),
    Predicates.instanceOf(ConnectException.class)
  );

  private final ClientOptions options;
  private final Storage storage;

  public StorageRawClient(final ClientOptions options) {
    this(options, new ApacheHttpTransport());
  }

  public StorageRawClient(final ClientOptions options, final HttpTransport transport) {
    this.options = checkNotNull(options, "options");
    checkNotNull(transport, "transport");
    this.storage = new Storage.Builder(transport, GsonFactory.getDefaultInstance(), options.credentials())
      .setRootUrl(options.endpoint())
      .setApplicationName(options.applicationName())
      .build();
  }

  private interface RequestFactory<T> {
    StorageRequest<T> create() throws IOException;
  }

  @Override
  public ClientOptions clientOptions() {
    return options;
  }

  @Override
  public Result<Buckets> listBuckets(final ListBucketsRequest request) {
    return execute(request, new RequestFactory<Buckets>() {
      @Override
      public StorageRequest<Buckets> create() throws IOException {
        return storage.buckets().list(request.projectId()).setPageToken(request.pageToken());
      }
    });
  }

  @Override
  public Result<Bucket> getBucketMetadata(final GetBucketMetadataRequest request) {
    return execute(request, new RequestFactory<Bucket>() {
      @Override
      public StorageRequest<Bucket> create() throws IOException {
        return storage.buckets().get(request.bucketName());
      }
    });
  }

  @Override
  public Result<StorageObject> insertObjectMedia(final InsertObjectMediaRequest request) {
    return execute(request, new RequestFactory<StorageObject>() {
      @Override
      public StorageRequest<StorageObject> create() throws IOException {
        Storage.Objects.Insert insert = storage.objects().insert(
          request.bucketName(),
          new StorageObject().setName(request.objectName()),
          new ByteArrayContent(UPLOAD_CONTENT_TYPE, request.contents()));
        insert.getMediaHttpUploader().setDirectUploadEnabled(true);
        return insert;
      }
    });
  }

  @Override
  public Result<StorageObject> getObjectMetadata(final GetObjectMetadataRequest request) {
    return execute(request, new RequestFactory<StorageObject>() {
      @Override
      public StorageRequest<StorageObject> create() throws IOException {
        return storage.objects().get(request.bucketName(), request.objectName());
      }
    });
  }

  @Override
  public Result<ReadObjectRangeResponse> readObjectRangeMedia(final ReadObjectRangeRequest request) {
    try {
      Storage.Objects.Get get = storage.objects().get(request.bucketName(), request.objectName());
      request.parameters().addParametersTo(get);
      get.getRequestHeaders().setRange(request.rangeHeader());

      HttpResponse response = get.executeMedia();
      try (InputStream content = response.getContent()) {
        byte[] contents = content == null ? new byte[0] : ByteStreams.toByteArray(content);
        return Result.ok(ReadObjectRangeResponse.fromContentRange(response.getHeaders().getContentRange(), contents));
      } finally {
        response.disconnect();
      }
    } catch (IOException e) {
      return failure(request, e);
    }
  }

  @Override
  public Result<Objects> listObjects(final ListObjectsRequest request) {
    return execute(request, new RequestFactory<Objects>() {
      @Override
      public StorageRequest<Objects> create() throws IOException {
        return storage.objects().list(request.bucketName()).setPageToken(request.pageToken());
      }
    });
  }

  @Override
  public Result<EmptyResponse> deleteObject(final DeleteObjectRequest request) {
    Result<Void> result = execute(request, new RequestFactory<Void>() {
      @Override
      public StorageRequest<Void> create() throws IOException {
        return storage.objects().delete(request.bucketName(), request.objectName());
      }
    });
    return result.status().isOk() ? Result.ok(EmptyResponse.get()) : Result.<EmptyResponse>failure(result.status());
  }

  @Override
  public Result<ObjectAccessControls> listObjectAcl(final ListObjectAclRequest request) {
    return execute(request, new RequestFactory<ObjectAccessControls>() {
      @Override
      public StorageRequest<ObjectAccessControls> create() throws IOException {
        return storage.objectAccessControls().list(request.bucketName(), request.objectName());
      }
    });
  }

  private static <T> Result<T> execute(final GenericRequest<?> envelope, final RequestFactory<T> factory) {
    try {
      StorageRequest<T> request = factory.create();
      envelope.parameters().addParametersTo(request);
      return Result.ok(request.execute());
    } catch (IOException e) {
      return failure(envelope, e);
    }
  }

  private static <T> Result<T> failure(final GenericRequest<?> envelope, final IOException e) {
    Status status = toStatus(e);
    debug("{} failed with {}: {}", envelope, e.getClass().getName(), status);
    return Result.failure(status);
  }

  /**
   * Maps a failed call onto a {@link Status}. The HTTP status code decides for errors returned by the service; of the
   * I/O failures, only the ones where the service may never have seen the request are transient.
   */
  static Status toStatus(final IOException e) {
    // GoogleJsonResponseException is a subclass of HttpResponseException so check it first
    if (e instanceof GoogleJsonResponseException) {
      final GoogleJsonError details = ((GoogleJsonResponseException) e).getDetails();
      final String message = details != null && !Strings.isNullOrEmpty(details.getMessage())
        ? details.getMessage()
        : e.getMessage();
      return Status.fromHttpCode(((GoogleJsonResponseException) e).getStatusCode(), message);
    } else if (e instanceof HttpResponseException) {
      final HttpResponseException httpException = (HttpResponseException) e;
      final String message = Strings.isNullOrEmpty(httpException.getStatusMessage())
        ? httpException.getMessage()
        : httpException.getStatusMessage();
      return Status.fromHttpCode(httpException.getStatusCode(), message);
    } else if (IS_TRANSIENT_IO_FAILURE.apply(e)) {
      return Status.networkFailure(e.getClass().getName() + ": " + e.getMessage());
    }
    return Status.permanentError(Status.NETWORK_FAILURE, e.getClass().getName() + ": " + e.getMessage());
  }
}
