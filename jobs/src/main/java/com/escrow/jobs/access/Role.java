package com.escrow.jobs.access;

/** Capability grants checked before gated ledger operations */
public enum Role {
  ADMINISTRATOR("Administrator", false),
  CLIENT("Client", true),
  FREELANCER("Freelancer", true);

  private final String value;
  private final boolean selfGrantable;

  Role(String value, boolean selfGrantable) {
    this.value = value;
    this.selfGrantable = selfGrantable;
  }

  public String value() {
    return value;
  }

  public boolean isSelfGrantable() {
    return selfGrantable;
  }

  /** Case-insensitive lookup, so both {@code client} and {@code Client} resolve. */
  public static Role fromValue(String value) {
    if (value != null) {
      for (Role role : values()) {
        if (role.value.equalsIgnoreCase(value.trim())) {
          return role;
        }
      }
    }
    throw new IllegalArgumentException("Unknown role: " + value);
  }
}
