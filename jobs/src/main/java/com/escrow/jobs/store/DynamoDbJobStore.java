package com.escrow.jobs.store;

import com.escrow.jobs.entity.JobEntity;
import com.escrow.jobs.exceptions.ConcurrentJobUpdateException;
import com.escrow.jobs.exceptions.JobStoreException;
import com.escrow.jobs.mappers.JobEntityMapper;
import java.util.Map;
import java.util.Optional;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.ReturnValue;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemResponse;

/**
 * Job registry in a DynamoDB table with a numeric {@code jobId} partition key. The id sequence
 * lives in the same table as a counter item under {@code jobId = 0}, which no job ever uses.
 */
public class DynamoDbJobStore implements JobStore {

  static final long SEQUENCE_KEY = 0L;

  private final DynamoDbClient dynamoDbClient;
  private final String jobsTableName;

  public DynamoDbJobStore(DynamoDbClient dynamoDbClient, String jobsTableName) {
    this.dynamoDbClient = dynamoDbClient;
    this.jobsTableName = jobsTableName;
  }

  @Override
  public long nextJobId() {
    try {
      UpdateItemRequest request =
          UpdateItemRequest.builder()
              .tableName(jobsTableName)
              .key(key(SEQUENCE_KEY))
              .updateExpression("ADD #seq :one")
              .expressionAttributeNames(Map.of("#seq", "sequence"))
              .expressionAttributeValues(Map.of(":one", AttributeValue.builder().n("1").build()))
              .returnValues(ReturnValue.UPDATED_NEW)
              .build();

      UpdateItemResponse response = dynamoDbClient.updateItem(request);
      return Long.parseLong(response.attributes().get("sequence").n());
    } catch (Exception e) {
      throw new JobStoreException("Error allocating job id", e);
    }
  }

  @Override
  public long lastJobId() {
    GetItemResponse response = get(SEQUENCE_KEY);
    if (!response.hasItem() || !response.item().containsKey("sequence")) {
      return 0L;
    }
    return Long.parseLong(response.item().get("sequence").n());
  }

  @Override
  public Optional<JobEntity> findById(long jobId) {
    if (jobId <= SEQUENCE_KEY) {
      return Optional.empty();
    }
    GetItemResponse response = get(jobId);
    if (!response.hasItem()) {
      return Optional.empty();
    }
    return Optional.of(JobEntityMapper.mapToJobEntity(response.item()));
  }

  @Override
  public void create(JobEntity job) {
    try {
      PutItemRequest putItemRequest =
          PutItemRequest.builder()
              .tableName(jobsTableName)
              .item(JobEntityMapper.mapToItem(job))
              .conditionExpression("attribute_not_exists(jobId)")
              .build();

      dynamoDbClient.putItem(putItemRequest);
    } catch (ConditionalCheckFailedException e) {
      throw new ConcurrentJobUpdateException("Job " + job.jobId() + " already exists", e);
    } catch (Exception e) {
      throw new JobStoreException("Error saving job " + job.jobId(), e);
    }
  }

  @Override
  public void update(JobEntity job) {
    try {
      PutItemRequest putItemRequest =
          PutItemRequest.builder()
              .tableName(jobsTableName)
              .item(JobEntityMapper.mapToItem(job))
              .conditionExpression("#version = :expectedVersion")
              .expressionAttributeNames(Map.of("#version", "version"))
              .expressionAttributeValues(Map.of(
                  ":expectedVersion",
                  AttributeValue.builder().n(String.valueOf(job.version() - 1)).build()))
              .build();

      dynamoDbClient.putItem(putItemRequest);
    } catch (ConditionalCheckFailedException e) {
      throw new ConcurrentJobUpdateException("Job " + job.jobId() + " changed since it was read", e);
    } catch (Exception e) {
      throw new JobStoreException("Error updating job " + job.jobId(), e);
    }
  }

  private GetItemResponse get(long jobId) {
    try {
      GetItemRequest getItemRequest =
          GetItemRequest.builder()
              .tableName(jobsTableName)
              .key(key(jobId))
              .consistentRead(true)
              .build();

      return dynamoDbClient.getItem(getItemRequest);
    } catch (Exception e) {
      throw new JobStoreException("Error fetching job " + jobId, e);
    }
  }

  private static Map<String, AttributeValue> key(long jobId) {
    return Map.of("jobId", AttributeValue.builder().n(String.valueOf(jobId)).build());
  }
}
