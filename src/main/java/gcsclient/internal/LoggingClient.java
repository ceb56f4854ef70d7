package gcsclient.internal;

import com.google.api.services.storage.model.Bucket;
import com.google.api.services.storage.model.Buckets;
import com.google.api.services.storage.model.ObjectAccessControls;
import com.google.api.services.storage.model.Objects;
import com.google.api.services.storage.model.StorageObject;
import com.google.common.base.Function;
import gcsclient.ClientOptions;
import gcsclient.StorageException;

import static com.google.common.base.Preconditions.checkNotNull;
import static gcsclient.internal.Logging.info;

/**
 * Logs every call made through the wrapped client: one line with the request before the call, one line with the
 * status and payload after it. Results pass through untouched.
 *
 * Wrapped around a {@link RetryClient} it only sees the final outcome of each call; placed under it, it sees every
 * attempt.
 */
public final class LoggingClient implements RawClient {

  private final RawClient client;

  public LoggingClient(final RawClient client) {
    this.client = checkNotNull(client, "client");
  }

  @Override
  public ClientOptions clientOptions() {
    return client.clientOptions();
  }

  @Override
  public Result<Buckets> listBuckets(final ListBucketsRequest request) {
    return makeCall("ListBuckets", request, new Function<ListBucketsRequest, Result<Buckets>>() {
      @Override
      public Result<Buckets> apply(final ListBucketsRequest input) {
        return client.listBuckets(input);
      }
    });
  }

  @Override
  public Result<Bucket> getBucketMetadata(final GetBucketMetadataRequest request) {
    return makeCall("GetBucketMetadata", request, new Function<GetBucketMetadataRequest, Result<Bucket>>() {
      @Override
      public Result<Bucket> apply(final GetBucketMetadataRequest input) {
        return client.getBucketMetadata(input);
      }
    });
  }

  @Override
  public Result<StorageObject> insertObjectMedia(final InsertObjectMediaRequest request) {
    return makeCall("InsertObjectMedia", request, new Function<InsertObjectMediaRequest, Result<StorageObject>>() {
      @Override
      public Result<StorageObject> apply(final InsertObjectMediaRequest input) {
        return client.insertObjectMedia(input);
      }
    });
  }

  @Override
  public Result<StorageObject> getObjectMetadata(final GetObjectMetadataRequest request) {
    return makeCall("GetObjectMetadata", request, new Function<GetObjectMetadataRequest, Result<StorageObject>>() {
      @Override
      public Result<StorageObject> apply(final GetObjectMetadataRequest input) {
        return client.getObjectMetadata(input);
      }
    });
  }

  @Override
  public Result<ReadObjectRangeResponse> readObjectRangeMedia(final ReadObjectRangeRequest request) {
    return makeCall("ReadObjectRangeMedia", request, new Function<ReadObjectRangeRequest, Result<ReadObjectRangeResponse>>() {
      @Override
      public Result<ReadObjectRangeResponse> apply(final ReadObjectRangeRequest input) {
        return client.readObjectRangeMedia(input);
      }
    });
  }

  @Override
  public Result<Objects> listObjects(final ListObjectsRequest request) {
    return makeCall("ListObjects", request, new Function<ListObjectsRequest, Result<Objects>>() {
      @Override
      public Result<Objects> apply(final ListObjectsRequest input) {
        return client.listObjects(input);
      }
    });
  }

  @Override
  public Result<EmptyResponse> deleteObject(final DeleteObjectRequest request) {
    return makeCall("DeleteObject", request, new Function<DeleteObjectRequest, Result<EmptyResponse>>() {
      @Override
      public Result<EmptyResponse> apply(final DeleteObjectRequest input) {
        return client.deleteObject(input);
      }
    });
  }

  @Override
  public Result<ObjectAccessControls> listObjectAcl(final ListObjectAclRequest request) {
    return makeCall("ListObjectAcl", request, new Function<ListObjectAclRequest, Result<ObjectAccessControls>>() {
      @Override
      public Result<ObjectAccessControls> apply(final ListObjectAclRequest input) {
        return client.listObjectAcl(input);
      }
    });
  }

  private static <R, T> Result<T> makeCall(final String operation,
                                           final R request,
                                           final Function<R, Result<T>> call) {
    info("{} << {}", operation, request);
    final Result<T> result;
    try {
      result = call.apply(request);
    } catch (StorageException e) {
      info("{} >> exception={}", operation, e.getMessage());
      throw e;
    }
    info("{} >> status={}, payload={}", operation, result.status(), result.payload());
    return result;
  }
}
