package org.causalcalc.model;

/** Event type tags used by the client and the servers. The set is open; any non-blank tag is accepted. */
public final class EventTypes {

    public static final String SERVER_START = "SERVER_START";
    public static final String CLIENT_START = "CLIENT_START";
    public static final String CLIENT_STOP = "CLIENT_STOP";
    public static final String HEALTH_CHECK = "HEALTH_CHECK";
    public static final String REQUEST_INIT = "REQUEST_INIT";
    public static final String REQUEST_RECEIVED = "REQUEST_RECEIVED";
    public static final String CALCULATION_COMPLETE = "CALCULATION_COMPLETE";

    private EventTypes() {}
}
