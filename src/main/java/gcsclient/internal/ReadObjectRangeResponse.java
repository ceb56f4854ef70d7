package gcsclient.internal;

import com.google.common.base.CharMatcher;
import com.google.common.base.MoreObjects;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.primitives.Longs;

import javax.annotation.Nullable;
import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A block of bytes read from an object, and where that block sits in the object.
 */
public final class ReadObjectRangeResponse {

  private static final Splitter RANGE_SPLITTER = Splitter.on(CharMatcher.anyOf("-/")).trimResults();

  private final byte[] contents;
  private final long firstByte;
  private final long lastByte;
  private final long objectSize;

  public ReadObjectRangeResponse(final byte[] contents, final long firstByte, final long lastByte, final long objectSize) {
    this.contents = checkNotNull(contents, "contents");
    this.firstByte = firstByte;
    this.lastByte = lastByte;
    this.objectSize = objectSize;
  }

  /**
   * Builds a response from the {@code Content-Range} header of an HTTP response, for example
   * {@code bytes 0-1023/4096}. A missing header means the whole object was returned.
   *
   * @throws IllegalArgumentException if the header cannot be parsed
   */
  public static ReadObjectRangeResponse fromContentRange(@Nullable final String contentRange, final byte[] contents) {
    checkNotNull(contents, "contents");
    if (Strings.isNullOrEmpty(contentRange)) {
      return new ReadObjectRangeResponse(contents, 0, contents.length - 1L, contents.length);
    }
    checkArgument(contentRange.startsWith("bytes "), "invalid Content-Range header: %s", contentRange);
    String range = contentRange.substring("bytes ".length()).trim();

    // "bytes */size" is sent for unsatisfiable ranges, no bytes follow
    if (range.startsWith("*/")) {
      Long size = Longs.tryParse(range.substring(2));
      checkArgument(size != null, "invalid Content-Range header: %s", contentRange);
      return new ReadObjectRangeResponse(new byte[0], size, size - 1, size);
    }

    List<String> parts = RANGE_SPLITTER.splitToList(range);
    checkArgument(parts.size() == 3, "invalid Content-Range header: %s", contentRange);
    Long first = Longs.tryParse(parts.get(0));
    Long last = Longs.tryParse(parts.get(1));
    Long size = "*".equals(parts.get(2)) ? Long.valueOf(-1L) : Longs.tryParse(parts.get(2));
    checkArgument(first != null && last != null && size != null, "invalid Content-Range header: %s", contentRange);
    return new ReadObjectRangeResponse(contents, first, last, size);
  }

  public byte[] contents() {
    return contents;
  }

  public long firstByte() {
    return firstByte;
  }

  public long lastByte() {
    return lastByte;
  }

  /** Total size of the object, or -1 when the service did not report it. */
  public long objectSize() {
    return objectSize;
  }

  public boolean isLastRange() {
    return contents.length == 0 || (objectSize >= 0 && lastByte + 1 >= objectSize);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
      .add("contents.size", contents.length)
      .add("first_byte", firstByte)
      .add("last_byte", lastByte)
      .add("object_size", objectSize)
      .toString();
  }
}
