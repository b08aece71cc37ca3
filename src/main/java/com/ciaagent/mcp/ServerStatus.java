package com.ciaagent.mcp;

import java.util.Locale;

/**
 * Connection state of one server. {@code toolCount} is meaningful only when
 * connected, {@code error} only when failed or awaiting client registration.
 */
public record ServerStatus(State state, int toolCount, String error) {

    public enum State {
        CONNECTING, CONNECTED, FAILED, NEEDS_AUTH, NEEDS_CLIENT_REGISTRATION, DISABLED;

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    public static ServerStatus connecting() { return new ServerStatus(State.CONNECTING, 0, null); }
    public static ServerStatus connected(int toolCount) { return new ServerStatus(State.CONNECTED, toolCount, null); }
    public static ServerStatus failed(String error) { return new ServerStatus(State.FAILED, 0, error); }
    public static ServerStatus needsAuth() { return new ServerStatus(State.NEEDS_AUTH, 0, null); }
    public static ServerStatus disabled() { return new ServerStatus(State.DISABLED, 0, null); }

    public static ServerStatus needsClientRegistration(String error) {
        return new ServerStatus(State.NEEDS_CLIENT_REGISTRATION, 0, error);
    }

    public boolean is(State other) {
        return state == other;
    }

    @Override
    public String toString() {
        return switch (state) {
            case CONNECTED -> "connected (" + toolCount + " tools)";
            case FAILED, NEEDS_CLIENT_REGISTRATION -> state.label() + ": " + error;
            default -> state.label();
        };
    }
}
