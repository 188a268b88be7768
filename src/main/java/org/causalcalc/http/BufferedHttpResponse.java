package org.causalcalc.http;

import org.causalcalc.interfaces.http.HttpResponse;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Response collected in memory by a route handler and sent in one piece once the handler returns.
 * Every response closes the connection, so the client reads until end of stream.
 */
public class BufferedHttpResponse implements HttpResponse {

    private int status = 200;
    private String reason = "OK";
    private final Map<String, String> headers = new LinkedHashMap<>();
    private byte[] body = new byte[0];

    @Override
    public void status(int code, String reason) {
        this.status = code;
        this.reason = reason;
    }

    @Override
    public void header(String name, String value) {
        headers.put(name, value);
    }

    @Override
    public void body(String text) {
        this.body = text == null ? new byte[0] : text.getBytes(StandardCharsets.UTF_8);
    }

    public int status() { return status; }
    public String header(String name) { return headers.get(name); }
    public String bodyText() { return new String(body, StandardCharsets.UTF_8); }

    /**
     * Status line, headers, {@code Content-Length}, {@code Connection: close}, blank line, body.
     * Header text is UTF-8 because process ids in {@code X-Vector-*} may be non-ASCII.
     */
    public void writeTo(OutputStream out) throws IOException {
        StringBuilder head = new StringBuilder(128);
        head.append("HTTP/1.1 ").append(status).append(' ').append(reason).append("\r\n");
        headers.forEach((k, v) -> head.append(k).append(": ").append(v).append("\r\n"));
        if (!headers.containsKey("Content-Length")) {
            head.append("Content-Length: ").append(body.length).append("\r\n");
        }
        if (!headers.containsKey("Connection")) {
            head.append("Connection: close\r\n");
        }
        head.append("\r\n");

        ByteArrayOutputStream frame = new ByteArrayOutputStream(head.length() + body.length);
        frame.write(head.toString().getBytes(StandardCharsets.UTF_8));
        frame.write(body);
        frame.writeTo(out);
        out.flush();
    }
}
