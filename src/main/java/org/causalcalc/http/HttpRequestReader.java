package org.causalcalc.http;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Parses one HTTP/1.1 request (request line, headers, Content-Length body) from a socket stream.
 */
public final class HttpRequestReader {

    /** Upper bound for request bodies; the calculator protocol only sends small JSON documents. */
    static final int MAX_BODY_BYTES = 1 << 20;

    private HttpRequestReader() {}

    /**
     * Reads a request.
     *
     * @return the request, or {@code null} if the stream ended before a request line arrived
     * @throws IllegalArgumentException if the request line, protocol or Content-Length is malformed
     * @throws IOException on socket errors
     */
    public static MinimalHttpRequest read(InputStream in) throws IOException {
        String start = readLineAscii(in); // e.g. "POST /sum HTTP/1.1"
        if (start == null || start.isEmpty()) return null;

        String[] p = start.split(" ", 3);
        if (p.length < 2) {
            throw new IllegalArgumentException("malformed request line: " + start);
        }
        String method = p[0];
        String target = p[1];
        if (p.length > 2 && !p[2].startsWith("HTTP/1.")) {
            throw new IllegalArgumentException("unsupported protocol: " + p[2]);
        }

        Map<String,String> headers = new LinkedHashMap<>();
        String line;
        while ((line = readLineAscii(in)) != null && !line.isEmpty()) {
            int idx = line.indexOf(':');
            if (idx > 0) {
                String k = line.substring(0, idx).trim();
                String v = line.substring(idx + 1).trim();
                headers.put(k, v);
                headers.put(k.toLowerCase(), v);
            }
        }

        int len;
        try {
            len = Integer.parseInt(headers.getOrDefault("content-length", "0"));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid Content-Length", e);
        }
        if (len < 0 || len > MAX_BODY_BYTES) {
            throw new IllegalArgumentException("unsupported Content-Length: " + len);
        }
        byte[] body = in.readNBytes(len);
        return new MinimalHttpRequest(method, target, headers, body);
    }

    static String readLineAscii(InputStream in) throws IOException {
        ByteArrayOutputStream buf = new ByteArrayOutputStream(128);
        int prev = -1, b;
        while ((b = in.read()) != -1) {
            if (prev == '\r' && b == '\n') {
                byte[] bytes = buf.toByteArray();
                int len = Math.max(0, bytes.length - 1);
                return new String(bytes, 0, len, StandardCharsets.US_ASCII);
            }
            buf.write(b);
            prev = b;
        }
        return (buf.size() == 0) ? null : buf.toString(StandardCharsets.US_ASCII);
    }
}
