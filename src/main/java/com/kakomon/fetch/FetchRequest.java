package com.kakomon.fetch;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * One outbound request. Signature params identify the request in the response cache;
 * transient params are sent but never part of the cache key.
 */
public final class FetchRequest {
    public enum Method {
        GET,
        POST
    }

    public final Method method;
    public final String url;
    public final List<Param> params;
    public final List<Param> transientParams;
    public final Map<String, String> headers;
    /** False for requests whose response must always come from the network, e.g. session priming. */
    public final boolean cacheable;

    private FetchRequest(Builder builder) {
        this.method = builder.method == null ? Method.GET : builder.method;
        this.url = builder.url == null ? "" : builder.url.trim();
        this.params = List.copyOf(builder.params);
        this.transientParams = List.copyOf(builder.transientParams);
        this.headers = Map.copyOf(builder.headers);
        this.cacheable = builder.cacheable;
    }

    public static Builder get(String url) {
        return new Builder(Method.GET, url);
    }

    public static Builder post(String url) {
        return new Builder(Method.POST, url);
    }

    public Builder toBuilder() {
        Builder builder = new Builder(method, url);
        builder.params.addAll(params);
        builder.transientParams.addAll(transientParams);
        builder.headers.putAll(headers);
        builder.cacheable = cacheable;
        return builder;
    }

    /**
     * All params in send order: signature params first, transient params after.
     */
    public List<Param> allParams() {
        List<Param> all = new ArrayList<>(params.size() + transientParams.size());
        all.addAll(params);
        all.addAll(transientParams);
        return all;
    }

    public String encodedParams() {
        return encode(allParams());
    }

    /**
     * GET requests carry their params in the query string; POST requests send them as the form body.
     */
    public String targetUrl() {
        if (method == Method.POST || params.isEmpty() && transientParams.isEmpty()) {
            return url;
        }
        return url + (url.contains("?") ? "&" : "?") + encodedParams();
    }

    /**
     * Method, URL and sorted signature params, the human readable form of {@link #cacheKey()}.
     */
    public String signature() {
        List<Param> sorted = new ArrayList<>(params);
        sorted.sort(Comparator.comparing((Param p) -> p.name).thenComparing(p -> p.value));
        return method.name() + " " + url + (sorted.isEmpty() ? "" : " " + encode(sorted));
    }

    public String cacheKey() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(signature().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        return signature();
    }

    private static String encode(List<Param> params) {
        StringBuilder sb = new StringBuilder();
        for (Param p : params) {
            if (sb.length() > 0) {
                sb.append('&');
            }
            sb.append(URLEncoder.encode(p.name, StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(p.value, StandardCharsets.UTF_8));
        }
        return sb.toString();
    }

    public record Param(String name, String value) {
        public Param {
            name = name == null ? "" : name;
            value = value == null ? "" : value;
        }
    }

    public static final class Builder {
        private final Method method;
        private final String url;
        private final List<Param> params = new ArrayList<>();
        private final List<Param> transientParams = new ArrayList<>();
        private final Map<String, String> headers = new LinkedHashMap<>();
        private boolean cacheable = true;

        private Builder(Method method, String url) {
            this.method = method;
            this.url = url;
        }

        public Builder param(String name, String value) {
            params.add(new Param(name, value));
            return this;
        }

        public Builder params(Map<String, List<String>> values) {
            if (values != null) {
                values.forEach((name, list) -> list.forEach(v -> param(name, v)));
            }
            return this;
        }

        public Builder transientParam(String name, String value) {
            transientParams.add(new Param(name, value));
            return this;
        }

        public Builder transientParams(Map<String, String> values) {
            if (values != null) {
                values.forEach(this::transientParam);
            }
            return this;
        }

        public Builder header(String name, String value) {
            if (name != null && value != null) {
                headers.put(name.toLowerCase(Locale.ROOT).equals("user-agent") ? "User-Agent" : name, value);
            }
            return this;
        }

        public Builder noCache() {
            this.cacheable = false;
            return this;
        }

        public FetchRequest build() {
            if (url == null || url.isBlank()) {
                throw new IllegalArgumentException("request url is required");
            }
            return new FetchRequest(this);
        }
    }
}
