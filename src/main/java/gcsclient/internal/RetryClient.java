package gcsclient.internal;

import com.google.api.client.util.Sleeper;
import com.google.api.services.storage.model.Bucket;
import com.google.api.services.storage.model.Buckets;
import com.google.api.services.storage.model.ObjectAccessControls;
import com.google.api.services.storage.model.Objects;
import com.google.api.services.storage.model.StorageObject;
import com.google.common.base.Function;
import gcsclient.BackoffPolicies;
import gcsclient.BackoffPolicy;
import gcsclient.ClientOptions;
import gcsclient.PermanentFailureException;
import gcsclient.RetriesExhaustedException;
import gcsclient.RetryPolicies;
import gcsclient.RetryPolicy;
import gcsclient.Status;
import gcsclient.StorageException;

import javax.inject.Inject;
import javax.inject.Provider;
import java.time.Duration;

import static com.google.common.base.Preconditions.checkNotNull;
import static gcsclient.internal.Logging.warn;

/**
 * Retries the calls of the wrapped client on transient failures.
 *
 * Every call gets its own {@link RetryPolicy} and {@link BackoffPolicy} from the providers, so concurrent calls never
 * share retry state. The calling thread sleeps between attempts. The same request object is sent on every attempt:
 * the service must treat the operation as idempotent, callers should not expect exactly-once execution of writes
 * that fail transiently.
 *
 * A call either returns an ok {@link Result} or throws: {@link PermanentFailureException} as soon as a permanent
 * failure is seen, {@link RetriesExhaustedException} once the retry policy gives up.
 */
public final class RetryClient implements RawClient {

  private final RawClient client;
  private final Provider<RetryPolicy> retryPolicies;
  private final Provider<BackoffPolicy> backoffPolicies;
  private final Sleeper sleeper;

  public RetryClient(final RawClient client) {
    this(client, RetryPolicies.defaultPolicy(), BackoffPolicies.defaultPolicy());
  }

  public RetryClient(final RawClient client, final RetryPolicy retryPolicy, final BackoffPolicy backoffPolicy) {
    this(client, retryPolicy, backoffPolicy, Sleeper.DEFAULT);
  }

  public RetryClient(final RawClient client,
                     final RetryPolicy retryPolicy,
                     final BackoffPolicy backoffPolicy,
                     final Sleeper sleeper) {
    this(client, copiesOf(retryPolicy), copiesOf(backoffPolicy), sleeper);
  }

  @Inject
  RetryClient(final RawClient client,
              final Provider<RetryPolicy> retryPolicies,
              final Provider<BackoffPolicy> backoffPolicies) {
    this(client, retryPolicies, backoffPolicies, Sleeper.DEFAULT);
  }

  RetryClient(final RawClient client,
              final Provider<RetryPolicy> retryPolicies,
              final Provider<BackoffPolicy> backoffPolicies,
              final Sleeper sleeper) {
    this.client = checkNotNull(client, "client");
    this.retryPolicies = checkNotNull(retryPolicies, "retryPolicies");
    this.backoffPolicies = checkNotNull(backoffPolicies, "backoffPolicies");
    this.sleeper = checkNotNull(sleeper, "sleeper");
  }

  private static Provider<RetryPolicy> copiesOf(final RetryPolicy prototype) {
    checkNotNull(prototype, "retryPolicy");
    return new Provider<RetryPolicy>() {
      @Override
      public RetryPolicy get() {
        return prototype.copy();
      }
    };
  }

  private static Provider<BackoffPolicy> copiesOf(final BackoffPolicy prototype) {
    checkNotNull(prototype, "backoffPolicy");
    return new Provider<BackoffPolicy>() {
      @Override
      public BackoffPolicy get() {
        return prototype.copy();
      }
    };
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

  private <R, T> Result<T> makeCall(final String operation,
                                    final R request,
                                    final Function<R, Result<T>> call) {
    final RetryPolicy retryPolicy = checkNotNull(retryPolicies.get(), "retryPolicy");
    final BackoffPolicy backoffPolicy = checkNotNull(backoffPolicies.get(), "backoffPolicy");

    while (true) {
      final Result<T> result = checkNotNull(call.apply(request), "%s returned null", operation);
      final Status status = result.status();
      if (status.isOk()) {
        return result;
      }
      if (retryPolicy.isPermanentFailure(status)) {
        throw new PermanentFailureException(operation, status);
      }
      if (!retryPolicy.onFailure(status)) {
        warn("retry policy exhausted in {} using {}; last status: {}", operation, retryPolicy, status);
        throw new RetriesExhaustedException(operation, status);
      }
      sleepBeforeRetry(operation, status, backoffPolicy.onCompletion());
    }
  }

  /**
   * Blocks the calling thread for {@code delay}.
   * @throws StorageException if the thread is interrupted while waiting; the interrupt flag is restored
   */
  private void sleepBeforeRetry(final String operation, final Status status, final Duration delay) {
    warn("transient failure in {} ({}); retrying in {}ms...", operation, status, delay.toMillis());
    try {
      sleeper.sleep(delay.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new StorageException("Interrupted while retrying " + operation, operation, status, e);
    }
  }
}
