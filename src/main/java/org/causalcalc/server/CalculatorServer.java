package org.causalcalc.server;

import org.causalcalc.config.ClusterConfig;
import org.causalcalc.http.HttpRequestReader;
import org.causalcalc.http.BufferedHttpResponse;
import org.causalcalc.http.MinimalHttpRequest;
import org.causalcalc.interfaces.CalculatorService;
import org.causalcalc.interfaces.HttpServer;
import org.causalcalc.interfaces.RequestRouter;
import org.causalcalc.interfaces.RouteHandler;
import org.causalcalc.server.handlers.DefaultRequestRouter;
import org.causalcalc.server.handlers.JsonResponses;
import org.causalcalc.util.InMemoryEventLog;
import org.causalcalc.util.SynchronizedVectorClock;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;

/**
 * CalculatorServer answers partial-sum and health requests over HTTP/1.1.
 * <p>
 * <b>Design notes:</b>
 * <ul>
 *   <li>The server process owns exactly one vector clock, held by its {@link CalculatorService}
 *       and handed to every request handler; nothing is static.</li>
 *   <li>One thread per connection; concurrent requests meet only inside the clock and event log,
 *       which serialize themselves.</li>
 *   <li>Error handling avoids crashing the server: failures are logged and the accept loop continues.</li>
 * </ul>
 */
public final class CalculatorServer implements HttpServer {

    private final CalculatorService service;
    private final RequestRouter router;

    private volatile ServerSocket socket;
    private volatile boolean running;
    private Thread acceptor;

    public CalculatorServer(CalculatorService service) {
        this(service, new DefaultRequestRouter(service));
    }

    public CalculatorServer(CalculatorService service, RequestRouter router) {
        this.service = service;
        this.router = router;
    }

    /** Builds a server process from configuration: its clock tracks the whole roster. */
    public static CalculatorServer fromConfig(ClusterConfig config) {
        String processId = config.serverProcessId();
        SynchronizedVectorClock clock = new SynchronizedVectorClock(processId, config.roster());
        InMemoryEventLog log = new InMemoryEventLog(processId);
        return new CalculatorServer(new CalculatorServiceImpl(config.serverName(), clock, log));
    }

    /**
     * Starts a server. Usage: {@code CalculatorServer [port]} with {@code -DSERVER_NAME=Server2}.
     */
    public static void main(String[] args) throws Exception {
        int port = (args.length > 0) ? Integer.parseInt(args[0]) : ClusterConfig.DEFAULT_PORT;
        CalculatorServer server = fromConfig(ClusterConfig.fromSystemProperties());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                server.close();
            } catch (Exception e) {
                System.err.println("[Server] shutdown error: " + e.getMessage());
            }
        }, "calc-server-shutdown"));
        server.start(port);
        server.acceptor.join();
    }

    @Override
    public synchronized void start(int port) throws IOException {
        if (running) {
            throw new IllegalStateException("server already started on port " + port());
        }
        socket = new ServerSocket(port);
        running = true;
        acceptor = new Thread(this::acceptLoop, "calc-acceptor-" + service.serverName());
        acceptor.start();
        System.out.println("[Server] " + service.serverName() + " listening on port " + socket.getLocalPort());
    }

    @Override
    public int port() {
        ServerSocket s = socket;
        return s == null ? -1 : s.getLocalPort();
    }

    public CalculatorService service() {
        return service;
    }

    @Override
    public synchronized void close() throws IOException {
        running = false;
        ServerSocket s = socket;
        if (s != null && !s.isClosed()) {
            s.close();
            System.out.println("[Server] " + service.serverName() + " stopped");
        }
    }

    private void acceptLoop() {
        while (running) {
            try {
                Socket s = socket.accept();
                Thread worker = new Thread(() -> handle(s), "calc-conn");
                worker.setDaemon(true);
                worker.start();
            } catch (IOException e) {
                if (running) {
                    System.err.println("[Server] accept failed: " + e.getMessage());
                }
            }
        }
    }

    /**
     * Processes a single connection end-to-end (read request, route, respond).
     */
    private void handle(Socket s) {
        try (s; InputStream in = new BufferedInputStream(s.getInputStream()); OutputStream out = s.getOutputStream()) {
            BufferedHttpResponse res = new BufferedHttpResponse();
            MinimalHttpRequest req;
            try {
                req = HttpRequestReader.read(in);
            } catch (IllegalArgumentException e) {
                writeError(res, 400, "Bad Request", e.getMessage());
                res.writeTo(out);
                return;
            }
            if (req == null) {
                writeError(res, 400, "Bad Request", "empty request line");
                res.writeTo(out);
                return;
            }

            RouteHandler handler = router.route(req);
            try {
                handler.handle(req, res);
            } catch (Exception e) {
                System.err.println("[Server] handler failed for " + req.method() + " " + req.path() + ": " + e);
                res = new BufferedHttpResponse();
                writeError(res, 500, "Internal Server Error", String.valueOf(e.getMessage()));
            }
            res.writeTo(out);

        } catch (SocketException se) {
            String msg = String.valueOf(se.getMessage()).toLowerCase();
            if (!(msg.contains("connection reset") || msg.contains("broken pipe"))) {
                System.err.println("[Server] socket error: " + se.getMessage());
            }
        } catch (IOException e) {
            System.err.println("[Server] error: " + e.getMessage());
        }
    }

    private void writeError(BufferedHttpResponse res, int code, String reason, String message) {
        JsonResponses.error(res, code, reason, message, service.clock());
    }
}
