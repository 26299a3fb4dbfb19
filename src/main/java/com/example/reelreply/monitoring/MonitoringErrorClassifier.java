package com.example.reelreply.monitoring;

import com.example.reelreply.content.ContentApiException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Best-effort mapping of failures to {@link MonitoringErrorType} and operator-facing text.
 * Looks at the exception chain for HTTP status and Graph error codes, then falls back to
 * markers in the message.
 */
@Component
public class MonitoringErrorClassifier {

    private static final Set<Integer> AUTH_CODES = Set.of(102, 190, 463, 467);
    private static final Set<Integer> RATE_LIMIT_CODES = Set.of(4, 17, 32, 613, 80001);
    private static final List<String> AUTH_MARKERS = List.of(
            "expired", "unauthorized", "invalid access token", "error validating access token", "oauthexception");
    private static final List<String> RATE_LIMIT_MARKERS = List.of(
            "rate limit", "too many calls", "too many requests");

    public MonitoringErrorType classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof CredentialUnavailableException) {
                return MonitoringErrorType.AUTHENTICATION;
            }
            if (t instanceof ContentApiException api) {
                if (api.getStatus() == 401 || api.getStatus() == 403) return MonitoringErrorType.AUTHENTICATION;
                if (api.getStatus() == 429) return MonitoringErrorType.RATE_LIMIT;
                if (api.getErrorCode() != null) {
                    if (AUTH_CODES.contains(api.getErrorCode())) return MonitoringErrorType.AUTHENTICATION;
                    if (RATE_LIMIT_CODES.contains(api.getErrorCode())) return MonitoringErrorType.RATE_LIMIT;
                }
            }
        }

        String text = messageChain(error).toLowerCase(Locale.ROOT);
        if (AUTH_MARKERS.stream().anyMatch(text::contains)) return MonitoringErrorType.AUTHENTICATION;
        if (RATE_LIMIT_MARKERS.stream().anyMatch(text::contains)) return MonitoringErrorType.RATE_LIMIT;
        return MonitoringErrorType.UNCLASSIFIED;
    }

    /**
     * Human-readable message for the operator.
     */
    public String describe(MonitoringErrorType type, Throwable error) {
        String raw = messageChain(error);
        return switch (type) {
            case AUTHENTICATION -> {
                if (error instanceof CredentialUnavailableException) {
                    yield "No usable access token. Please add your credentials in Settings.";
                }
                yield raw.toLowerCase(Locale.ROOT).contains("expired")
                        ? "Access token has expired. Please update your token in Settings."
                        : "Invalid access token. Please check your credentials in Settings.";
            }
            case RATE_LIMIT -> "API rate limit exceeded. Monitoring will retry later.";
            case UNCLASSIFIED -> "Monitoring failed: " + raw;
        };
    }

    private static String messageChain(Throwable error) {
        StringBuilder text = new StringBuilder();
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t.getMessage() != null) {
                if (!text.isEmpty()) text.append(": ");
                text.append(t.getMessage());
            }
            if (t.getCause() == t) break;
        }
        return text.isEmpty() ? error.getClass().getSimpleName() : text.toString();
    }
}
