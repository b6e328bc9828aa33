package io.github.clickin.requestbuilder;

import io.github.clickin.requestbuilder.core.Params;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;

/**
 * Encodes parameters as {@code application/x-www-form-urlencoded} text.
 *
 * <p>Pairs are emitted in key order, then in value order within a key. Names and values are
 * percent-encoded as UTF-8: ASCII letters, digits and {@code -_.~} stay literal, a space becomes
 * {@code %20}, everything else becomes uppercase {@code %XX}. The same output serves as a GET query
 * string and as a POST body.
 */
public final class QueryEncoder {
    private QueryEncoder() {}

    public static String encode(Params params) {
        Objects.requireNonNull(params, "params");
        StringBuilder sb = new StringBuilder();
        params.forEach((name, values) -> appendPairs(sb, name, values));
        return sb.toString();
    }

    public static byte[] encodeToBytes(Params params) {
        return encode(params).getBytes(StandardCharsets.US_ASCII);
    }

    static String encodeComponent(String s) {
        // URLEncoder follows HTML forms: '+' for space, '*' literal, '~' escaped.
        return URLEncoder.encode(s, StandardCharsets.UTF_8)
                .replace("+", "%20")
                .replace("*", "%2A")
                .replace("%7E", "~");
    }

    private static void appendPairs(StringBuilder sb, String name, List<String> values) {
        String encodedName = encodeComponent(name);
        for (String value : values) {
            if (sb.length() > 0) sb.append('&');
            sb.append(encodedName).append('=').append(encodeComponent(value));
        }
    }
}
