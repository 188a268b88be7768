package org.causalcalc.http;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import org.causalcalc.interfaces.HttpHandler;

/**
 * DefaultHttpHandler implements low-level HTTP wire formatting for client requests
 * and parsing of the raw responses.
 * <p>
 * <b>Notes:</b>
 * <ul>
 *   <li>This class focuses purely on serialization/deserialization of HTTP messages.</li>
 *   <li>Vector clocks travel in the JSON bodies, so nothing here touches a clock.</li>
 * </ul>
 */
public class DefaultHttpHandler implements HttpHandler {

    /**
     * Builds a raw HTTP/1.1 request string with headers.
     *
     * @param method         HTTP method (e.g. "GET", "POST").
     * @param path           resource path (must start with '/').
     * @param host           target host.
     * @param port           target port.
     * @param extraHeaders   optional map of additional headers (can be null).
     * @param contentLength  payload size in bytes.
     * @return complete HTTP request string ready to send.
     */
    @Override
    public String buildRequest(String method, String path, String host, int port,
                               Map<String, String> extraHeaders, int contentLength) {
        StringBuilder sb = new StringBuilder();
        sb.append(method).append(" ").append(path).append(" HTTP/1.1\r\n");
        sb.append("Host: ").append(host).append(":").append(port).append("\r\n");

        if (extraHeaders != null) {
            for (Map.Entry<String, String> e : extraHeaders.entrySet()) {
                sb.append(e.getKey()).append(": ").append(e.getValue()).append("\r\n");
            }
        }

        // Content-Length must always be present for well-formed HTTP/1.1
        sb.append("Content-Length: ").append(contentLength).append("\r\n\r\n");
        return sb.toString();
    }

    /**
     * Writes the full request (headers + body) to the output stream.
     *
     * @param out     destination stream.
     * @param headers request headers built via {@link #buildRequest}.
     * @param body    request payload; may be empty for GET.
     * @throws IOException if I/O fails during transmission.
     */
    @Override
    public void send(OutputStream out, String headers, byte[] body) throws IOException {
        out.write(headers.getBytes(StandardCharsets.UTF_8));
        if (body != null && body.length > 0) {
            out.write(body);
        }
        out.flush();
    }

    /**
     * Reads the entire raw HTTP response as UTF-8 text.
     * The server always answers with {@code Connection: close}, so end of stream ends the message.
     */
    @Override
    public String readRawResponse(InputStream in) throws IOException {
        return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    }

    @Override
    public int statusCodeOf(String rawResponse) {
        if (rawResponse == null) return STATUS_UNKNOWN;
        int eol = rawResponse.indexOf("\r\n");
        String statusLine = (eol >= 0) ? rawResponse.substring(0, eol) : rawResponse;
        String[] parts = statusLine.split(" ");
        if (parts.length >= 2) {
            try {
                return Integer.parseInt(parts[1]);
            } catch (NumberFormatException e) {
                return STATUS_UNKNOWN;
            }
        }
        return STATUS_UNKNOWN;
    }

    @Override
    public String headerValue(String rawResponse, String name) {
        if (rawResponse == null) return null;
        int headEnd = rawResponse.indexOf("\r\n\r\n");
        String headers = (headEnd >= 0) ? rawResponse.substring(0, headEnd) : rawResponse;
        for (String line : headers.split("\r\n")) {
            int i = line.indexOf(':');
            if (i > 0 && line.substring(0, i).trim().equalsIgnoreCase(name)) {
                return line.substring(i + 1).trim();
            }
        }
        return null;
    }

    @Override
    public String bodyOf(String rawResponse) {
        if (rawResponse == null) return "";
        int i = rawResponse.indexOf("\r\n\r\n");
        return (i >= 0) ? rawResponse.substring(i + 4) : "";
    }

    /**
     * Converts a numeric HTTP status code into a standard reason phrase.
     */
    @Override
    public String reason(int code) {
        return switch (code) {
            case OK -> "OK";
            case BAD_REQUEST -> "Bad Request";
            case NOT_FOUND -> "Not Found";
            case INTERNAL_SERVER_ERROR -> "Internal Server Error";
            default -> "Unknown";
        };
    }
}
