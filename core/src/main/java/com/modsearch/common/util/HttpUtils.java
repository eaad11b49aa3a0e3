package com.modsearch.common.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.HttpURLConnection;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.StringJoiner;
import java.util.zip.GZIPInputStream;

public class HttpUtils {
    private static final Logger logger = LoggerFactory.getLogger(HttpUtils.class);

    /**
     * Connection settings shared by API calls and file downloads.
     */
    public record Options(String userAgent, int connectTimeoutMs, int readTimeoutMs) {
    }

    /**
     * Raw HTTP answer. The body is read from the error stream for 4xx/5xx codes.
     */
    public record Response(int status, String body) {
        public boolean isSuccess() {
            return status >= 200 && status < 300;
        }
    }

    private HttpUtils() {
    }

    public static Response get(String urlStr, Options options) throws IOException {
        HttpURLConnection conn = open(urlStr, options);
        try {
            conn.setRequestProperty("Accept", "application/json");
            conn.setRequestProperty("Accept-Encoding", "gzip");
            int code = conn.getResponseCode();
            logger.debug("GET {} -> {}", urlStr, code);
            return new Response(code, readBody(conn, code));
        } finally {
            conn.disconnect();
        }
    }

    /**
     * Opens a GET connection without reading it. The caller owns and must disconnect it.
     *
     * @throws MalformedURLException if the URL is not an absolute http(s) URL
     */
    public static HttpURLConnection open(String urlStr, Options options) throws IOException {
        HttpURLConnection conn = (HttpURLConnection) toHttpUrl(urlStr).openConnection();
        conn.setRequestMethod("GET");
        conn.setRequestProperty("User-Agent", options.userAgent());
        conn.setConnectTimeout(options.connectTimeoutMs());
        conn.setReadTimeout(options.readTimeoutMs());
        conn.setInstanceFollowRedirects(true);
        return conn;
    }

    /**
     * Builds {@code base?k1=v1&k2=v2} with URL-encoded values, in map iteration order.
     */
    public static String withQuery(String base, Map<String, String> params) {
        if (params.isEmpty()) return base;
        StringJoiner joiner = new StringJoiner("&", base + "?", "");
        params.forEach((k, v) -> joiner.add(k + "=" + URLEncoder.encode(v, StandardCharsets.UTF_8)));
        return joiner.toString();
    }

    public static String encodePathSegment(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static URL toHttpUrl(String urlStr) throws MalformedURLException {
        URI uri;
        try {
            uri = new URI(urlStr);
        } catch (URISyntaxException e) {
            MalformedURLException malformed = new MalformedURLException("Invalid URL: " + urlStr);
            malformed.initCause(e);
            throw malformed;
        }
        String scheme = uri.getScheme();
        if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
            throw new MalformedURLException("Not an http(s) URL: " + urlStr);
        }
        if (uri.getHost() == null) {
            throw new MalformedURLException("URL has no host: " + urlStr);
        }
        return uri.toURL();
    }

    private static String readBody(HttpURLConnection conn, int code) throws IOException {
        InputStream in = (code >= 400) ? conn.getErrorStream() : conn.getInputStream();
        if (in == null) return "";

        if ("gzip".equalsIgnoreCase(conn.getContentEncoding())) {
            in = new GZIPInputStream(in);
        }

        StringBuilder result = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) result.append(line).append('\n');
        }
        return result.toString();
    }
}
