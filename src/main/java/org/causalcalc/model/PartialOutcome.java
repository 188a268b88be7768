package org.causalcalc.model;

import org.causalcalc.model.dto.SumReply;

/**
 * One server's answer to a partial sum, with the client clock it was sent under,
 * the server clock it came back with, and how the two relate.
 */
public record PartialOutcome(ServerEndpoint server, SumReply reply, ClockSnapshot sent,
                             ClockSnapshot received, CausalRelation relation) {
}
