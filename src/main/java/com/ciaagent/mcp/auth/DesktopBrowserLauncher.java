package com.ciaagent.mcp.auth;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Desktop;
import java.awt.GraphicsEnvironment;
import java.io.IOException;
import java.net.URI;

public class DesktopBrowserLauncher implements BrowserLauncher {

    private static final Logger log = LoggerFactory.getLogger(DesktopBrowserLauncher.class);

    @Override
    public boolean open(URI uri) {
        if (GraphicsEnvironment.isHeadless() || !Desktop.isDesktopSupported()
                || !Desktop.getDesktop().isSupported(Desktop.Action.BROWSE)) {
            return false;
        }
        try {
            Desktop.getDesktop().browse(uri);
            return true;
        } catch (IOException | UnsupportedOperationException e) {
            log.warn("Failed to open browser: {}", e.getMessage());
            return false;
        }
    }
}
