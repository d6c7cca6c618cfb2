package com.xksgroup.streamarchiver.service.helper;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.regex.Pattern;

/**
 * Pulls the upstream video id out of a watch URL, short link or bare id, without a page fetch.
 */
public final class VideoIdExtractor {

    // An id is the URL-safe base64 form of a 64-bit value
    private static final Pattern BARE_ID = Pattern.compile("[A-Za-z0-9_-]{10}[AEIMQUYcgkosw048]");

    private VideoIdExtractor() {
    }

    public static String extractVideoId(String urlOrId) {
        if (urlOrId == null) {
            return null;
        }
        String input = urlOrId.trim();
        if (BARE_ID.matcher(input).matches()) {
            return input;
        }

        URI uri;
        try {
            uri = new URI(input);
        } catch (URISyntaxException e) {
            return null;
        }
        String host = uri.getHost();
        String path = uri.getPath() != null ? uri.getPath() : "";
        if (host == null) {
            return null;
        }
        if ("youtu.be".equalsIgnoreCase(host)) {
            // https://youtu.be/<id>
            return path.length() > 1 ? path.substring(1) : null;
        }
        if (!isMainDomain(host)) {
            return null;
        }
        if (path.startsWith("/shorts/") || path.startsWith("/live/")) {
            // https://youtube.com/live/<id>
            String[] segments = path.split("/");
            return segments.length > 0 ? segments[segments.length - 1] : null;
        }
        if ("/watch".equals(path) && uri.getRawQuery() != null) {
            // https://youtube.com/watch?v=<id>
            return Arrays.stream(uri.getRawQuery().split("&"))
                    .filter(param -> param.startsWith("v="))
                    .map(param -> URLDecoder.decode(param.substring(2), StandardCharsets.UTF_8))
                    .findFirst()
                    .orElse(null);
        }
        return null;
    }

    private static boolean isMainDomain(String host) {
        String[] labels = host.toLowerCase().split("\\.");
        // "youtube" must be the registrable label, never the suffix
        for (int i = 0; i < labels.length - 1; i++) {
            if ("youtube".equals(labels[i])) {
                return true;
            }
        }
        return false;
    }
}
