package com.escrow.jobs.access;

import com.escrow.jobs.exceptions.JobStoreException;
import java.util.Map;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.DeleteItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;

/**
 * Role registry backed by a DynamoDB table keyed by {@code callerId} (partition) and {@code role}
 * (sort). An item's presence is the membership.
 */
public class DynamoDbRoleRegistry extends RoleRegistry {

  private final DynamoDbClient dynamoDbClient;
  private final String rolesTableName;

  public DynamoDbRoleRegistry(DynamoDbClient dynamoDbClient, String rolesTableName) {
    this.dynamoDbClient = dynamoDbClient;
    this.rolesTableName = rolesTableName;
  }

  @Override
  protected boolean contains(String callerId, Role role) {
    try {
      GetItemRequest request =
          GetItemRequest.builder()
              .tableName(rolesTableName)
              .key(key(callerId, role))
              .consistentRead(true)
              .build();
      return dynamoDbClient.getItem(request).hasItem();
    } catch (Exception e) {
      throw new JobStoreException("Error reading role " + role.value() + " for " + callerId, e);
    }
  }

  @Override
  protected void add(String callerId, Role role) {
    try {
      dynamoDbClient.putItem(
          PutItemRequest.builder().tableName(rolesTableName).item(key(callerId, role)).build());
    } catch (Exception e) {
      throw new JobStoreException("Error granting role " + role.value() + " to " + callerId, e);
    }
  }

  @Override
  protected void remove(String callerId, Role role) {
    try {
      dynamoDbClient.deleteItem(
          DeleteItemRequest.builder().tableName(rolesTableName).key(key(callerId, role)).build());
    } catch (Exception e) {
      throw new JobStoreException("Error revoking role " + role.value() + " from " + callerId, e);
    }
  }

  private static Map<String, AttributeValue> key(String callerId, Role role) {
    return Map.of(
        "callerId", AttributeValue.builder().s(callerId).build(),
        "role", AttributeValue.builder().s(role.value()).build());
  }
}
