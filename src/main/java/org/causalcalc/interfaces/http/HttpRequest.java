package org.causalcalc.interfaces.http;

/** Minimal request contract */
public interface HttpRequest {
    String method();

    /** Path without the query string. */
    String path();

    String header(String name);

    /** Query parameter value, or {@code null}. */
    String query(String name);

    byte[] body();
}
