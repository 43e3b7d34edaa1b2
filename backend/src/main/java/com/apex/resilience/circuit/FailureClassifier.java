package com.apex.resilience.circuit;

import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether an exception from a guarded call says something about the health of the
 * dependency (rate limiting, server errors, transport failures) or only about the request.
 */
public final class FailureClassifier {

    private static final List<String> SERVER_CODES = List.of("500", "502", "503", "504");
    private static final List<String> TRANSPORT_KEYWORDS =
            List.of("timeout", "timed out", "connection", "refused", "reset", "network");

    private FailureClassifier() {
    }

    public static boolean isCircuitFailure(Throwable error) {
        if (error == null) {
            return false;
        }
        if (error instanceof SocketTimeoutException
                || error instanceof ConnectException
                || error instanceof TimeoutException) {
            return true;
        }
        String message = message(error);
        if (message.contains("429") || message.contains("rate limit")) {
            return true;
        }
        if (SERVER_CODES.stream().anyMatch(message::contains)) {
            return true;
        }
        return TRANSPORT_KEYWORDS.stream().anyMatch(message::contains);
    }

    /**
     * Short label for the failure: an HTTP status, a transport category, or {@code unknown}.
     */
    public static String errorCode(Throwable error) {
        String message = message(error);
        if (message.contains("429")) {
            return "429";
        }
        for (String code : SERVER_CODES) {
            if (message.contains(code)) {
                return code;
            }
        }
        if (error instanceof SocketTimeoutException || error instanceof TimeoutException
                || message.contains("timeout") || message.contains("timed out")) {
            return "timeout";
        }
        if (message.contains("refused")) {
            return "refused";
        }
        if (message.contains("reset")) {
            return "reset";
        }
        if (error instanceof ConnectException || message.contains("connection")) {
            return "connection";
        }
        return "unknown";
    }

    private static String message(Throwable error) {
        if (error == null || error.getMessage() == null) {
            return "";
        }
        return error.getMessage().toLowerCase(Locale.ROOT);
    }
}
