package org.causalcalc;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;

public final class NetTestUtils {
    private NetTestUtils() {}

    /** Polls until the TCP port is open or times out. */
    public static void waitForPortOpen(String host, int port, long timeoutMs) throws IOException {
        long end = System.currentTimeMillis() + Math.max(0L, timeoutMs);
        IOException last = null;
        while (System.currentTimeMillis() < end) {
            try (Socket s = new Socket()) {
                s.connect(new InetSocketAddress(host, port), 200);
                return; // success
            } catch (IOException e) {
                last = e;
                try { Thread.sleep(50); } catch (InterruptedException ignored) {}
            }
        }
        if (last != null) throw last;
    }

    /** A port nothing listens on at the moment of the call. */
    public static int freePort() throws IOException {
        try (ServerSocket ss = new ServerSocket(0)) { return ss.getLocalPort(); }
    }

    /** Writes a raw request and reads until the server closes the connection. */
    public static String sendRaw(int port, String headers, byte[] body) throws IOException {
        try (Socket s = new Socket("localhost", port)) {
            s.setSoTimeout(5_000);
            OutputStream out = s.getOutputStream();
            InputStream in = s.getInputStream();
            out.write(headers.getBytes(StandardCharsets.UTF_8));
            if (body != null && body.length > 0) out.write(body);
            out.flush();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
