package com.ciaagent.mcp.auth;

import java.net.URI;

@FunctionalInterface
public interface BrowserLauncher {

    /** @return false when no browser could be opened; the caller prints the URL instead */
    boolean open(URI uri);
}
