package io.github.drompincen.sprintplanner.runtime.error;

import io.github.drompincen.sprintplanner.protocol.api.ErrorKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The issue tracker rejected a query or could not be reached. A status code of
 * {@code 0} means no HTTP response was received.
 */
public class RemoteQueryException extends PlannerException {

    private final int statusCode;
    private final String body;

    public RemoteQueryException(int statusCode, String body) {
        super(ErrorKind.REMOTE_QUERY_FAILURE,
                "Issue tracker query failed with status " + statusCode,
                "Check the tracker base URL and credentials, then retry");
        this.statusCode = statusCode;
        this.body = body;
    }

    public RemoteQueryException(String message, Throwable cause) {
        super(ErrorKind.REMOTE_QUERY_FAILURE, message,
                "Check that the issue tracker is reachable, then retry", cause);
        this.statusCode = 0;
        this.body = null;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getBody() {
        return body;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("statusCode", statusCode);
        if (body != null) {
            details.put("body", body);
        }
        return details;
    }
}
