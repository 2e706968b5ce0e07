package net.spookly.proxygroup.backend;

import java.util.Locale;

/**
 * Classifies dial errors that mean the remote end actively refused the connection.
 * Matches on the message anywhere in the cause chain; connect timeouts also surface
 * as {@link java.net.ConnectException} and must not match.
 */
public final class ConnectionRefused {
    private static final String REFUSED = "connection refused";
    private static final int MAX_DEPTH = 16;

    private ConnectionRefused() {
    }

    public static boolean matches(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < MAX_DEPTH) {
            String message = current.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains(REFUSED)) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
