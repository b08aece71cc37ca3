package com.ciaagent.mcp;

import java.net.URI;

/** A remote server URL split into the base URI and the endpoint path the SDK transports expect. */
record RemoteEndpoint(String baseUri, String path) {

    static RemoteEndpoint parse(String url, String defaultPath) {
        var uri = URI.create(url);
        var base = uri.getScheme() + "://" + uri.getRawAuthority();
        var path = uri.getRawPath();
        if (path == null || path.isEmpty() || "/".equals(path)) {
            path = defaultPath;
        }
        if (uri.getRawQuery() != null) {
            path = path + "?" + uri.getRawQuery();
        }
        return new RemoteEndpoint(base, path);
    }
}
