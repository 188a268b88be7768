package org.causalcalc.interfaces;

/*
AutoCloseable so tests and mains can stop the server with try-with-resources
 */
public interface HttpServer extends AutoCloseable {

    /** Binds and starts accepting; port 0 picks a free port. */
    void start(int port) throws Exception;

    /** Port actually bound, or -1 before {@link #start(int)}. */
    int port();

    @Override void close() throws Exception;
}
