package win.ixuni.quarry.core.model;

/**
 * Inclusive byte range {@code [start, end]} within an object
 *
 * @param start first byte offset
 * @param end   last byte offset (inclusive)
 */
public record ByteRange(long start, long end) {

    public ByteRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid byte range: " + start + "-" + end);
        }
    }

    /**
     * The whole object; only meaningful for non-empty objects
     */
    public static ByteRange full(long size) {
        return new ByteRange(0, size - 1);
    }

    public long length() {
        return end - start + 1;
    }

    public boolean coversWhole(long size) {
        return start == 0 && end == size - 1;
    }

    /**
     * Content-Range header value, e.g. {@code bytes 0-4/11}
     */
    public String toContentRange(long totalSize) {
        return "bytes " + start + "-" + end + "/" + totalSize;
    }
}
