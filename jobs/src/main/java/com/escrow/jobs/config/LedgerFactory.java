package com.escrow.jobs.config;

import com.escrow.jobs.access.Authorizer;
import com.escrow.jobs.access.DynamoDbRoleRegistry;
import com.escrow.jobs.events.EventBridgeAuditLog;
import com.escrow.jobs.ledger.JobLedger;
import com.escrow.jobs.payment.DynamoDbAccountTransfer;
import com.escrow.jobs.store.DynamoDbJobStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.eventbridge.EventBridgeClient;

/** Wires the AWS-backed ledger components */
public class LedgerFactory {

  private LedgerFactory() {}

  public static JobLedger create(LedgerConfig config) {
    return create(config, DynamoDbClient.create(), EventBridgeClient.create(), Clock.systemUTC());
  }

  /** Builds the ledger and seeds the bootstrap administrator. */
  public static JobLedger create(
      LedgerConfig config, DynamoDbClient dynamoDbClient, EventBridgeClient eventBridgeClient, Clock clock) {
    Authorizer authorizer = new DynamoDbRoleRegistry(dynamoDbClient, config.rolesTableName());
    authorizer.seedAdministrator(config.bootstrapAdminId());

    DynamoDbAccountTransfer accounts = new DynamoDbAccountTransfer(
        dynamoDbClient, config.accountsTableName(), config.paymentsTableName());

    return new JobLedger(
        authorizer,
        new DynamoDbJobStore(dynamoDbClient, config.jobsTableName()),
        accounts,
        accounts,
        new EventBridgeAuditLog(eventBridgeClient, new ObjectMapper(), config.eventBusName(), config.eventSource()),
        clock);
  }
}
