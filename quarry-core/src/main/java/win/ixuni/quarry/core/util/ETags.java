package win.ixuni.quarry.core.util;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;

/**
 * Entity tag helpers
 * <p>
 * Stored ETags are bare lowercase MD5 hex; quoting happens only on the wire.
 */
public final class ETags {

    private static final String WEAK_PREFIX = "W/";

    private ETags() {
    }

    public static MessageDigest newMd5() {
        try {
            return MessageDigest.getInstance("MD5");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }

    public static String md5Hex(byte[] content) {
        return HexFormat.of().formatHex(newMd5().digest(content));
    }

    public static String toHex(MessageDigest digest) {
        return HexFormat.of().formatHex(digest.digest());
    }

    public static String quote(String etag) {
        if (etag.startsWith("\"") && etag.endsWith("\"") && etag.length() >= 2) {
            return etag;
        }
        return "\"" + etag + "\"";
    }

    public static String unquote(String etag) {
        String value = etag.trim();
        if (value.length() >= 2 && value.startsWith("\"") && value.endsWith("\"")) {
            return value.substring(1, value.length() - 1);
        }
        return value;
    }

    public static boolean isWeak(String tag) {
        return tag.trim().startsWith(WEAK_PREFIX);
    }

    /**
     * Split an If-Match / If-None-Match header into its entity tags
     */
    public static List<String> parseList(String header) {
        List<String> tags = new ArrayList<>();
        if (header == null) {
            return tags;
        }
        for (String token : header.split(",")) {
            String tag = token.trim();
            if (!tag.isEmpty()) {
                tags.add(tag);
            }
        }
        return tags;
    }

    /**
     * Strong comparison (If-Match, If-Range): weak validators never match
     */
    public static boolean matchesStrong(String header, String currentEtag) {
        for (String tag : parseList(header)) {
            if (tag.equals("*")) {
                return true;
            }
            if (isWeak(tag)) {
                continue;
            }
            if (unquote(tag).equals(currentEtag)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Weak comparison (If-None-Match): the W/ prefix is ignored
     */
    public static boolean matchesWeak(String header, String currentEtag) {
        for (String tag : parseList(header)) {
            if (tag.equals("*")) {
                return true;
            }
            String opaque = isWeak(tag) ? tag.trim().substring(WEAK_PREFIX.length()) : tag;
            if (unquote(opaque).equals(currentEtag)) {
                return true;
            }
        }
        return false;
    }
}
