package org.causalcalc.model;

/**
 * Thrown when a vector clock is built from an invalid roster or invalid initial counters.
 */
public class ClockConfigurationException extends IllegalArgumentException {

    public ClockConfigurationException(String message) {
        super(message);
    }
}
