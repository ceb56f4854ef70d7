package gcsclient;

import com.google.api.services.storage.model.Bucket;
import com.google.api.services.storage.model.ObjectAccessControl;
import com.google.api.services.storage.model.Objects;
import com.google.api.services.storage.model.StorageObject;
import com.google.common.base.Strings;
import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableList;
import gcsclient.internal.DeleteObjectRequest;
import gcsclient.internal.GetBucketMetadataRequest;
import gcsclient.internal.GetObjectMetadataRequest;
import gcsclient.internal.InsertObjectMediaRequest;
import gcsclient.internal.ListBucketsRequest;
import gcsclient.internal.ListObjectAclRequest;
import gcsclient.internal.ListObjectsRequest;
import gcsclient.internal.LoggingClient;
import gcsclient.internal.RawClient;
import gcsclient.internal.Result;
import gcsclient.internal.RetryClient;
import gcsclient.internal.StorageRawClient;

import java.util.Iterator;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

/**
 * The Google Cloud Storage client.
 *
 * Requests go through a chain of {@link RawClient}s: by default a {@link RetryClient} on top of the HTTP transport,
 * with a {@link LoggingClient} in between when raw-client tracing is enabled, so that every attempt is logged.
 *
 * Each operation accepts a variadic list of {@link WellKnownParameter}s. Passing a parameter the operation does not
 * accept raises an {@link IllegalArgumentException}. Failed operations raise a {@link StorageException}:
 * {@link PermanentFailureException} or {@link RetriesExhaustedException} when retries are enabled.
 */
public final class Client {

  private enum NoRetry { INSTANCE }

  private final RawClient rawClient;

  /**
   * Creates the default client chain for {@code options}.
   */
  public Client(final ClientOptions options) {
    this(new RetryClient(defaultTransport(options)), NoRetry.INSTANCE);
  }

  /**
   * Wraps {@code client} with the default retry and backoff policies.
   */
  public Client(final RawClient client) {
    this(client, RetryPolicies.defaultPolicy(), BackoffPolicies.defaultPolicy());
  }

  public Client(final RawClient client, final RetryPolicy retryPolicy) {
    this(client, retryPolicy, BackoffPolicies.defaultPolicy());
  }

  public Client(final RawClient client, final BackoffPolicy backoffPolicy) {
    this(client, RetryPolicies.defaultPolicy(), backoffPolicy);
  }

  public Client(final RawClient client, final RetryPolicy retryPolicy, final BackoffPolicy backoffPolicy) {
    this(new RetryClient(client, retryPolicy, backoffPolicy), NoRetry.INSTANCE);
  }

  // the chain is used as given, no retry layer is added
  private Client(final RawClient rawClient, final NoRetry noRetry) {
    this.rawClient = checkNotNull(rawClient, "rawClient");
  }

  /**
   * Uses {@code client} as-is, without retries.
   */
  public static Client withoutRetries(final RawClient client) {
    return new Client(client, NoRetry.INSTANCE);
  }

  private static RawClient defaultTransport(final ClientOptions options) {
    RawClient transport = new StorageRawClient(options);
    return options.enableRawClientTracing() ? new LoggingClient(transport) : transport;
  }

  public ClientOptions clientOptions() {
    return rawClient.clientOptions();
  }

  /**
   * Fetches the first page of buckets in the default project of the client options.
   * @throws IllegalStateException if the options have no default project
   */
  public List<Bucket> listBuckets(final WellKnownParameter<?>... parameters) {
    checkState(clientOptions().projectId().isPresent(), "no default project configured in %s", clientOptions());
    return listBuckets(clientOptions().projectId().get(), parameters);
  }

  /**
   * Fetches the first page of buckets in {@code projectId}.
   * Accepts {@code MaxResults}, {@code Prefix}, {@code Projection} and {@code UserProject}.
   */
  public List<Bucket> listBuckets(final String projectId, final WellKnownParameter<?>... parameters) {
    checkArgument(!Strings.isNullOrEmpty(projectId), "projectId cannot be empty");
    ListBucketsRequest request = new ListBucketsRequest(projectId).setMultipleParameters(parameters);
    List<Bucket> items = checkResult("ListBuckets", rawClient.listBuckets(request)).getItems();
    return items == null ? ImmutableList.<Bucket>of() : items;
  }

  /**
   * Accepts {@code IfMetagenerationMatch}, {@code IfMetagenerationNotMatch}, {@code Projection} and
   * {@code UserProject}.
   */
  public Bucket getBucketMetadata(final String bucketName, final WellKnownParameter<?>... parameters) {
    verifyBucket(bucketName);
    GetBucketMetadataRequest request = new GetBucketMetadataRequest(bucketName).setMultipleParameters(parameters);
    return checkResult("GetBucketMetadata", rawClient.getBucketMetadata(request));
  }

  /**
   * Creates an object from {@code contents}. Accepts the generation and metageneration preconditions,
   * {@code Projection} and {@code UserProject}.
   *
   * Transient failures are retried by re-sending the same contents; add an {@code IfGenerationMatch(0)} precondition
   * when a duplicate write must be detected.
   */
  public StorageObject insertObject(final String bucketName,
                                    final String objectName,
                                    final byte[] contents,
                                    final WellKnownParameter<?>... parameters) {
    verifyObjectSpecification(bucketName, objectName);
    checkNotNull(contents, "contents");
    InsertObjectMediaRequest request =
      new InsertObjectMediaRequest(bucketName, objectName, contents).setMultipleParameters(parameters);
    return checkResult("InsertObjectMedia", rawClient.insertObjectMedia(request));
  }

  /**
   * Accepts {@code Generation}, the generation and metageneration preconditions, {@code Projection} and
   * {@code UserProject}.
   */
  public StorageObject getObjectMetadata(final String bucketName,
                                         final String objectName,
                                         final WellKnownParameter<?>... parameters) {
    verifyObjectSpecification(bucketName, objectName);
    GetObjectMetadataRequest request =
      new GetObjectMetadataRequest(bucketName, objectName).setMultipleParameters(parameters);
    return checkResult("GetObjectMetadata", rawClient.getObjectMetadata(request));
  }

  /**
   * Returns a stream over the contents of an object. Nothing is fetched until the first read.
   * Accepts {@code Generation}, the generation and metageneration preconditions and {@code UserProject}.
   */
  public ObjectReadStream read(final String bucketName,
                               final String objectName,
                               final WellKnownParameter<?>... parameters) {
    verifyObjectSpecification(bucketName, objectName);
    return new ObjectReadStream(rawClient, bucketName, objectName, clientOptions().downloadBufferSize(), parameters);
  }

  /**
   * Lists the objects in a bucket. Pages are fetched lazily, each page is a separate call.
   * Accepts {@code MaxResults}, {@code Prefix}, {@code Projection}, {@code UserProject} and {@code Versions}.
   */
  public Iterable<StorageObject> listObjects(final String bucketName, final WellKnownParameter<?>... parameters) {
    verifyBucket(bucketName);
    // validate the parameters now rather than on the first call to next()
    new ListObjectsRequest(bucketName).setMultipleParameters(parameters);
    return new Iterable<StorageObject>() {
      @Override
      public Iterator<StorageObject> iterator() {
        return newPagedObjectIterator(bucketName, parameters);
      }
    };
  }

  /**
   * Accepts {@code Generation}, the generation and metageneration preconditions and {@code UserProject}.
   */
  public void deleteObject(final String bucketName, final String objectName, final WellKnownParameter<?>... parameters) {
    verifyObjectSpecification(bucketName, objectName);
    DeleteObjectRequest request = new DeleteObjectRequest(bucketName, objectName).setMultipleParameters(parameters);
    checkResult("DeleteObject", rawClient.deleteObject(request));
  }

  /**
   * Accepts {@code Generation} and {@code UserProject}.
   */
  public List<ObjectAccessControl> listObjectAcl(final String bucketName,
                                                 final String objectName,
                                                 final WellKnownParameter<?>... parameters) {
    verifyObjectSpecification(bucketName, objectName);
    ListObjectAclRequest request = new ListObjectAclRequest(bucketName, objectName).setMultipleParameters(parameters);
    List<ObjectAccessControl> items = checkResult("ListObjectAcl", rawClient.listObjectAcl(request)).getItems();
    return items == null ? ImmutableList.<ObjectAccessControl>of() : items;
  }

  private Iterator<StorageObject> newPagedObjectIterator(final String bucketName,
                                                         final WellKnownParameter<?>... parameters) {
    return new AbstractIterator<StorageObject>() {

      private Iterator<StorageObject> currentObjectsIter = null;
      private String nextPageToken = null;
      private boolean firstPage = true;

      /**
       * Attempts to advance to the next page of results
       * @return true if a new page was advanced to, false if there are no more pages
       */
      private boolean advancePage() {
        if (!firstPage && nextPageToken == null) {
          return false;
        }
        ListObjectsRequest request = new ListObjectsRequest(bucketName)
          .setMultipleParameters(parameters)
          .setPageToken(nextPageToken);
        Objects page = checkResult("ListObjects", rawClient.listObjects(request));
        firstPage = false;
        nextPageToken = Strings.emptyToNull(page.getNextPageToken());
        currentObjectsIter = page.getItems() == null
          ? ImmutableList.<StorageObject>of().iterator()
          : page.getItems().iterator();
        return true;
      }

      @Override
      protected StorageObject computeNext() {
        // pages may be empty but still carry a token, keep going until an item or the last page
        while (currentObjectsIter == null || !currentObjectsIter.hasNext()) {
          if (!advancePage()) {
            return endOfData();
          }
        }
        return currentObjectsIter.next();
      }
    };
  }

  /**
   * Returns the payload of an ok result. Failures only reach this point when the chain does not retry.
   */
  private static <T> T checkResult(final String operation, final Result<T> result) {
    if (!result.status().isOk()) {
      throw new StorageException(operation, result.status());
    }
    return result.payload();
  }

  private static void verifyBucket(final String bucketName) {
    checkArgument(!Strings.isNullOrEmpty(bucketName), "bucketName cannot be empty");
  }

  private static void verifyObjectSpecification(final String bucketName, final String objectName) {
    checkArgument(!Strings.isNullOrEmpty(bucketName), "bucketName cannot be empty");
    checkArgument(!Strings.isNullOrEmpty(objectName), "objectName cannot be empty");
  }
}
