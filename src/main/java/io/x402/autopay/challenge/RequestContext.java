package io.x402.autopay.challenge;

import java.net.URI;
import java.util.Locale;

/**
 * Where an intercepted response came from.
 *
 * @param origin   scheme://host[:port]
 * @param endpoint request path
 * @param method   HTTP method, upper case
 */
public record RequestContext(String origin, String endpoint, String method) {

    public static RequestContext of(URI uri, String method) {
        StringBuilder origin = new StringBuilder()
            .append(uri.getScheme()).append("://").append(uri.getHost());
        if (uri.getPort() != -1) {
            origin.append(':').append(uri.getPort());
        }
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        return new RequestContext(origin.toString(), path, method.toUpperCase(Locale.ROOT));
    }
}
