package com.controlsdashboard.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A {@code metadata/party} entry of a profile, as stored in {@code baselines.party_details}.
 */
public record PartyDetail(
        String uuid,
        String type,
        @JsonInclude(JsonInclude.Include.NON_NULL) String name,
        @JsonInclude(JsonInclude.Include.NON_NULL) String email,
        @JsonInclude(JsonInclude.Include.NON_NULL) String address
) {
}
