package com.escrow.jobs.config;

import java.util.Map;

/**
 * Deployment settings, read from the Lambda environment.
 */
public record LedgerConfig(
    String jobsTableName,
    String rolesTableName,
    String accountsTableName,
    String paymentsTableName,
    String eventBusName,
    String eventSource,
    String bootstrapAdminId) {

  static final String DEFAULT_EVENT_SOURCE = "jobs-ledger";

  public static LedgerConfig fromEnvironment() {
    return fromEnvironment(System.getenv());
  }

  public static LedgerConfig fromEnvironment(Map<String, String> env) {
    String eventSource = env.get("EVENT_SOURCE");
    return new LedgerConfig(
        required(env, "JOBS_TABLE_NAME"),
        required(env, "ROLES_TABLE_NAME"),
        required(env, "ACCOUNTS_TABLE_NAME"),
        required(env, "PAYMENTS_TABLE_NAME"),
        required(env, "EVENT_BUS_NAME"),
        eventSource == null || eventSource.isBlank() ? DEFAULT_EVENT_SOURCE : eventSource,
        required(env, "BOOTSTRAP_ADMIN_ID"));
  }

  private static String required(Map<String, String> env, String name) {
    String value = env.get(name);
    if (value == null || value.isBlank()) {
      throw new IllegalStateException(name + " environment variable is not set");
    }
    return value;
  }
}
