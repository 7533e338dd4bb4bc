package win.ixuni.quarry.server.auth;

import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * SigV4 canonical request, the string whose SHA-256 ends up in the string-to-sign
 */
final class CanonicalRequest {

    private static final String UNSIGNED_PAYLOAD = "UNSIGNED-PAYLOAD";

    private CanonicalRequest() {
    }

    static String of(ServerHttpRequest request, String signedHeaders) {
        HttpHeaders headers = request.getHeaders();
        String payloadHash = headers.getFirst("x-amz-content-sha256");

        return String.join("\n",
                request.getMethod().name(),
                uri(request.getURI().getRawPath()),
                query(request.getURI().getRawQuery()),
                headerBlock(headers, signedHeaders),
                signedHeaders,
                payloadHash != null ? payloadHash : UNSIGNED_PAYLOAD);
    }

    /**
     * One {@code name:value} line per signed header, each terminated by a newline
     */
    private static String headerBlock(HttpHeaders headers, String signedHeaders) {
        StringBuilder block = new StringBuilder();
        Arrays.stream(signedHeaders.split(";"))
                .map(name -> name.toLowerCase(Locale.ROOT))
                .sorted()
                .forEach(name -> block.append(name).append(':')
                        .append(headers.getOrDefault(name, List.of()).stream()
                                .map(value -> value.strip().replaceAll("\\s+", " "))
                                .collect(Collectors.joining(",")))
                        .append('\n'));
        return block.toString();
    }

    /**
     * 路径按段解码后重新编码，斜杠保留
     */
    static String uri(String rawPath) {
        if (rawPath == null || rawPath.isEmpty()) {
            return "/";
        }
        return Arrays.stream(rawPath.split("/", -1))
                .map(segment -> encode(decode(segment)))
                .collect(Collectors.joining("/"));
    }

    /**
     * Parameters sorted by encoded name then value; a bare {@code acl} becomes {@code acl=}
     */
    static String query(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return "";
        }
        return Arrays.stream(rawQuery.split("&"))
                .filter(param -> !param.isEmpty())
                .map(param -> {
                    int eq = param.indexOf('=');
                    String name = eq < 0 ? param : param.substring(0, eq);
                    String value = eq < 0 ? "" : param.substring(eq + 1);
                    return Map.entry(encode(decode(name)), encode(decode(value)));
                })
                .sorted(Map.Entry.<String, String>comparingByKey().thenComparing(Map.Entry.comparingByValue()))
                .map(param -> param.getKey() + "=" + param.getValue())
                .collect(Collectors.joining("&"));
    }

    private static String decode(String value) {
        // S3 路径里的 '+' 是字面量，不是空格
        return URLDecoder.decode(value.replace("+", "%2B"), StandardCharsets.UTF_8);
    }

    /**
     * RFC 3986 unreserved characters pass through, every other byte becomes %XX (uppercase)
     */
    static String encode(String input) {
        StringBuilder out = new StringBuilder();
        for (byte b : input.getBytes(StandardCharsets.UTF_8)) {
            int c = b & 0xFF;
            boolean unreserved = (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9')
                    || c == '-' || c == '.' || c == '_' || c == '~';
            if (unreserved) {
                out.append((char) c);
            } else {
                out.append('%').append(Character.toUpperCase(Character.forDigit(c >> 4, 16)))
                        .append(Character.toUpperCase(Character.forDigit(c & 0xF, 16)));
            }
        }
        return out.toString();
    }
}
