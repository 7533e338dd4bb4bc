package win.ixuni.quarry.core.util;

import win.ixuni.quarry.core.model.ByteRange;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Range 头解析
 * <p>
 * Single byte ranges only: {@code bytes=start-end}, {@code bytes=start-} and {@code bytes=-suffix}.
 * Anything else (other units, multiple ranges, {@code end < start}) is treated as if no Range header was
 * sent, matching S3.
 */
public final class RangeHeaderParser {

    private static final Pattern RANGE_PATTERN = Pattern.compile("bytes=(\\d*)-(\\d*)");

    private RangeHeaderParser() {
    }

    public enum Kind {
        /**
         * No usable Range header, serve the whole object
         */
        NONE,
        SATISFIABLE,
        UNSATISFIABLE
    }

    /**
     * @param kind  parse outcome
     * @param range concrete offsets, only set for {@link Kind#SATISFIABLE}
     */
    public record Result(Kind kind, ByteRange range) {

        static final Result NONE = new Result(Kind.NONE, null);
        static final Result UNSATISFIABLE = new Result(Kind.UNSATISFIABLE, null);
    }

    /**
     * @param rangeHeader Range 头值，如 "bytes=0-999"、"bytes=1000-" 或 "bytes=-500"
     * @param totalSize   对象总大小
     */
    public static Result parse(String rangeHeader, long totalSize) {
        if (rangeHeader == null || rangeHeader.isBlank()) {
            return Result.NONE;
        }

        Matcher matcher = RANGE_PATTERN.matcher(rangeHeader.trim());
        if (!matcher.matches()) {
            return Result.NONE;
        }

        String startStr = matcher.group(1);
        String endStr = matcher.group(2);

        try {
            if (startStr.isEmpty() && endStr.isEmpty()) {
                return Result.NONE;
            }
            if (startStr.isEmpty()) {
                // bytes=-500 表示最后 500 字节
                long suffix = Long.parseLong(endStr);
                if (suffix == 0 || totalSize == 0) {
                    return Result.UNSATISFIABLE;
                }
                return satisfiable(Math.max(0, totalSize - suffix), totalSize - 1);
            }

            long start = Long.parseLong(startStr);
            if (endStr.isEmpty()) {
                // bytes=1000- 表示从 1000 到末尾
                return start >= totalSize ? Result.UNSATISFIABLE : satisfiable(start, totalSize - 1);
            }

            long end = Long.parseLong(endStr);
            if (end < start) {
                return Result.NONE;
            }
            if (start >= totalSize) {
                return Result.UNSATISFIABLE;
            }
            // 限制 end 不超过文件末尾
            return satisfiable(start, Math.min(end, totalSize - 1));
        } catch (NumberFormatException e) {
            // offsets beyond Long.MAX_VALUE
            return Result.NONE;
        }
    }

    private static Result satisfiable(long start, long end) {
        return new Result(Kind.SATISFIABLE, new ByteRange(start, end));
    }
}
