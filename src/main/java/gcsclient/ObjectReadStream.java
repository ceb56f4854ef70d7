package gcsclient;

import gcsclient.internal.RawClient;
import gcsclient.internal.ReadObjectRangeRequest;
import gcsclient.internal.ReadObjectRangeResponse;
import gcsclient.internal.Result;

import java.io.IOException;
import java.io.InputStream;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkPositionIndexes;

/**
 * Reads the contents of an object, one range request of {@code bufferSize} bytes at a time.
 *
 * Failures of the underlying calls surface as {@link StorageException}s. Not thread safe.
 */
public final class ObjectReadStream extends InputStream {

  private final RawClient client;
  private final String bucketName;
  private final String objectName;
  private final WellKnownParameter<?>[] parameters;
  private final int bufferSize;

  private byte[] buffer = new byte[0];
  private int position;
  private long offset;
  private boolean lastRange;
  private boolean closed;

  ObjectReadStream(final RawClient client,
                   final String bucketName,
                   final String objectName,
                   final int bufferSize,
                   final WellKnownParameter<?>... parameters) {
    checkArgument(bufferSize > 0, "bufferSize must be > 0");
    this.client = checkNotNull(client, "client");
    this.bucketName = checkNotNull(bucketName, "bucketName");
    this.objectName = checkNotNull(objectName, "objectName");
    this.parameters = checkNotNull(parameters, "parameters").clone();
    this.bufferSize = bufferSize;
    // fail fast on parameters a range read does not accept
    newRequest();
  }

  private ReadObjectRangeRequest newRequest() {
    return new ReadObjectRangeRequest(bucketName, objectName, offset, offset + bufferSize)
      .setMultipleParameters(parameters);
  }

  /**
   * Fetches the next range.
   * @return false once the end of the object has been reached
   */
  private boolean fill() throws IOException {
    if (closed) {
      throw new IOException("stream is closed");
    }
    while (position >= buffer.length) {
      if (lastRange) {
        return false;
      }
      Result<ReadObjectRangeResponse> result = client.readObjectRangeMedia(newRequest());
      if (!result.status().isOk()) {
        throw new StorageException("ReadObjectRangeMedia", result.status());
      }
      ReadObjectRangeResponse response = checkNotNull(result.payload(), "payload");
      buffer = response.contents();
      position = 0;
      offset += buffer.length;
      lastRange = response.isLastRange();
    }
    return true;
  }

  @Override
  public int read() throws IOException {
    if (!fill()) {
      return -1;
    }
    return buffer[position++] & 0xFF;
  }

  @Override
  public int read(final byte[] b, final int off, final int len) throws IOException {
    checkNotNull(b, "b");
    checkPositionIndexes(off, off + len, b.length);
    if (len == 0) {
      return 0;
    }
    if (!fill()) {
      return -1;
    }
    int count = Math.min(len, buffer.length - position);
    System.arraycopy(buffer, position, b, off, count);
    position += count;
    return count;
  }

  @Override
  public int available() {
    return buffer.length - position;
  }

  @Override
  public void close() {
    closed = true;
    buffer = new byte[0];
    position = 0;
  }
}
