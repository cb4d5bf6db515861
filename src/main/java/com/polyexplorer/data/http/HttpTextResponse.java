package com.polyexplorer.data.http;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * A completed HTTP exchange, whatever its status.
 */
public record HttpTextResponse(String url, int status, String body, Map<String, List<String>> headers) {
    public HttpTextResponse {
        body = body == null ? "" : body;
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((name, values) -> {
                if (name != null) {
                    copy.put(name.toLowerCase(Locale.ROOT), values == null ? List.of() : List.copyOf(values));
                }
            });
        }
        headers = Collections.unmodifiableMap(copy);
    }

    public boolean isSuccess() {
        return status >= 200 && status < 300;
    }

    public Optional<String> header(String name) {
        List<String> values = headers.get(name);
        if (values == null || values.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(0));
    }
}
