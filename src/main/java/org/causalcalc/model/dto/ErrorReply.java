package org.causalcalc.model.dto;

/** JSON error body: {@code {"error":"..."}}. */
public record ErrorReply(String error) {
}
