package com.escrow.jobs.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Request record for administrative grants and revocations */
public record RoleChangeRequest(
    @JsonProperty("identity") String identity,
    @JsonProperty("role") String role) {

  public boolean isValid() {
    return identity != null && !identity.trim().isEmpty() && role != null && !role.trim().isEmpty();
  }

  public String trimmedIdentity() {
    return identity != null ? identity.trim() : null;
  }
}
