package org.causalcalc.interfaces;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Map;

/**
 * HttpHandler: client-side helper for sending/receiving raw HTTP messages.
 * Only defines the wire-level methods. No clock or business logic.
 */
public interface HttpHandler {

    int OK = 200;
    int BAD_REQUEST = 400;
    int NOT_FOUND = 404;
    int INTERNAL_SERVER_ERROR = 500;
    int STATUS_UNKNOWN = -1;

    /** Build full HTTP/1.1 request headers (no body). */
    String buildRequest(String method,
                        String path,
                        String host,
                        int port,
                        Map<String, String> extraHeaders,
                        int contentLength);

    /** Send prepared request headers and optional body. */
    void send(OutputStream out, String requestHeaders, byte[] body) throws IOException;

    /** Read entire HTTP response (status line, headers, body) into a single string. */
    String readRawResponse(InputStream in) throws IOException;

    /** Numeric status of a raw response, or {@link #STATUS_UNKNOWN}. */
    int statusCodeOf(String rawResponse);

    /** Header value by name (case-insensitive), or {@code null}. */
    String headerValue(String rawResponse, String name);

    /** Text after the blank line ending the headers. */
    String bodyOf(String rawResponse);

    /** Map HTTP status codes to reason phrases. */
    String reason(int code);
}
