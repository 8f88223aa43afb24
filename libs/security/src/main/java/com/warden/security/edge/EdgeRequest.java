package com.warden.security.edge;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Transport-neutral view of an inbound request: what the edge needs to pick a tier and find the
 * caller's credential.
 *
 * @param method        HTTP method
 * @param path          request path without query string
 * @param headers       header values, looked up case-insensitively
 * @param cookies       cookie values by name
 * @param remoteAddress client address, nullable
 * @param secure        whether the request arrived over HTTPS
 */
public record EdgeRequest(
        String method,
        String path,
        Map<String, String> headers,
        Map<String, String> cookies,
        String remoteAddress,
        boolean secure
) {

    public EdgeRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method must not be null or blank");
        }
        if (path == null) {
            throw new IllegalArgumentException("path must not be null");
        }
        TreeMap<String, String> caseInsensitive = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            caseInsensitive.putAll(headers);
        }
        headers = Collections.unmodifiableMap(caseInsensitive);
        cookies = cookies == null ? Map.of() : Map.copyOf(cookies);
    }

    public Optional<String> header(String name) {
        return Optional.ofNullable(headers.get(name)).filter(v -> !v.isBlank());
    }

    public Optional<String> cookie(String name) {
        return Optional.ofNullable(cookies.get(name)).filter(v -> !v.isBlank());
    }

    public static Builder builder(String method, String path) {
        return new Builder(method, path);
    }

    public static final class Builder {

        private final String method;
        private final String path;
        private final Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private final Map<String, String> cookies = new TreeMap<>();
        private String remoteAddress;
        private boolean secure = true;

        private Builder(String method, String path) {
            this.method = method;
            this.path = path;
        }

        public Builder header(String name, String value) {
            if (value != null) {
                headers.put(name, value);
            }
            return this;
        }

        public Builder cookie(String name, String value) {
            if (value != null) {
                cookies.put(name, value);
            }
            return this;
        }

        public Builder remoteAddress(String remoteAddress) {
            this.remoteAddress = remoteAddress;
            return this;
        }

        public Builder secure(boolean secure) {
            this.secure = secure;
            return this;
        }

        public EdgeRequest build() {
            return new EdgeRequest(method, path, headers, cookies, remoteAddress, secure);
        }
    }
}
