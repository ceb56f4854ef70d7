package gcsclient.internal;

import com.google.api.services.storage.model.Bucket;
import com.google.api.services.storage.model.Buckets;
import com.google.api.services.storage.model.ObjectAccessControls;
import com.google.api.services.storage.model.Objects;
import com.google.api.services.storage.model.StorageObject;
import gcsclient.ClientOptions;

/**
 * One method per storage operation, each returning the {@link gcsclient.Status} of the call and its payload.
 *
 * Implementations that talk to the network classify failures as transient or permanent but never retry. Retries and
 * logging are added by wrapping a client in {@link RetryClient} and {@link LoggingClient}.
 */
public interface RawClient {

  ClientOptions clientOptions();

  Result<Buckets> listBuckets(ListBucketsRequest request);

  Result<Bucket> getBucketMetadata(GetBucketMetadataRequest request);

  Result<StorageObject> insertObjectMedia(InsertObjectMediaRequest request);

  Result<StorageObject> getObjectMetadata(GetObjectMetadataRequest request);

  Result<ReadObjectRangeResponse> readObjectRangeMedia(ReadObjectRangeRequest request);

  Result<Objects> listObjects(ListObjectsRequest request);

  Result<EmptyResponse> deleteObject(DeleteObjectRequest request);

  Result<ObjectAccessControls> listObjectAcl(ListObjectAclRequest request);
}
