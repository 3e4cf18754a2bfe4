package com.escrow.jobs.payment;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.CancellationReason;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.Put;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItem;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItemsRequest;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;
import software.amazon.awssdk.services.dynamodb.model.Update;

/**
 * Custody on the accounts table. Every movement writes a payment record keyed by its reference
 * in the same transaction as the balance change, so a reference is applied at most once.
 */
public class DynamoDbAccountTransfer implements ValueTransfer, EscrowDeposit {

  private static final Logger log = LoggerFactory.getLogger(DynamoDbAccountTransfer.class);

  static final String CREDIT = "credit";
  static final String DEBIT = "debit";

  private static final String CONDITIONAL_CHECK_FAILED = "ConditionalCheckFailed";

  private final DynamoDbClient dynamoDbClient;
  private final String accountsTableName;
  private final String paymentsTableName;

  public DynamoDbAccountTransfer(
      DynamoDbClient dynamoDbClient, String accountsTableName, String paymentsTableName) {
    this.dynamoDbClient = dynamoDbClient;
    this.accountsTableName = accountsTableName;
    this.paymentsTableName = paymentsTableName;
  }

  @Override
  public boolean transfer(String reference, String recipientId, BigDecimal amount) {
    if (!isValid(reference, recipientId, amount)) {
      log.warn("Transfer refused: reference={} userId={} amount={}", reference, recipientId, amount);
      return false;
    }

    Update credit = Update.builder()
        .tableName(accountsTableName)
        .key(accountKey(recipientId))
        .updateExpression("SET balance = if_not_exists(balance, :zero) + :amount")
        .expressionAttributeValues(Map.of(
            ":zero", AttributeValue.builder().n("0").build(),
            ":amount", AttributeValue.builder().n(amount.toPlainString()).build()))
        .build();

    return apply(reference, recipientId, amount, CREDIT, credit);
  }

  @Override
  public boolean collect(String reference, String payerId, BigDecimal amount) {
    if (!isValid(reference, payerId, amount)) {
      log.warn("Deposit refused: reference={} userId={} amount={}", reference, payerId, amount);
      return false;
    }

    Update debit = Update.builder()
        .tableName(accountsTableName)
        .key(accountKey(payerId))
        .updateExpression("SET balance = balance - :amount")
        .conditionExpression("balance >= :amount")
        .expressionAttributeValues(Map.of(
            ":amount", AttributeValue.builder().n(amount.toPlainString()).build()))
        .build();

    return apply(reference, payerId, amount, DEBIT, debit);
  }

  private boolean apply(
      String reference, String userId, BigDecimal amount, String direction, Update balanceChange) {
    try {
      dynamoDbClient.transactWriteItems(TransactWriteItemsRequest.builder()
          .transactItems(
              TransactWriteItem.builder().put(paymentRecord(reference, userId, amount, direction)).build(),
              TransactWriteItem.builder().update(balanceChange).build())
          .build());
      log.info("Account {} {}ed {} (reference {})", userId, direction, amount.toPlainString(), reference);
      return true;

    } catch (TransactionCanceledException e) {
      if (failedCondition(e, 0)) {
        return alreadyApplied(reference, userId, amount, direction);
      }
      if (failedCondition(e, 1)) {
        log.warn("Insufficient balance: userId={} amount={} reference={}", userId, amount, reference);
      } else {
        log.warn("Account {} cancelled for reference {}: {}", direction, reference, e.getMessage());
      }
      return false;

    } catch (Exception e) {
      log.error("Account {} failed for reference {}", direction, reference, e);
      return false;
    }
  }

  /** A retried reference succeeds only when the recorded movement is the same one. */
  private boolean alreadyApplied(String reference, String userId, BigDecimal amount, String direction) {
    try {
      GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
          .tableName(paymentsTableName)
          .key(Map.of("paymentId", AttributeValue.builder().s(reference).build()))
          .consistentRead(true)
          .build());
      if (!response.hasItem()) {
        return false;
      }
      Map<String, AttributeValue> item = response.item();
      boolean same = userId.equals(item.get("userId").s())
          && direction.equals(item.get("direction").s())
          && amount.compareTo(new BigDecimal(item.get("amount").n())) == 0;
      if (same) {
        log.info("Reference {} was already applied, not moving value again", reference);
      } else {
        log.warn("Reference {} is already recorded for a different movement", reference);
      }
      return same;
    } catch (Exception e) {
      log.error("Could not read payment record {}", reference, e);
      return false;
    }
  }

  private Put paymentRecord(String reference, String userId, BigDecimal amount, String direction) {
    Map<String, AttributeValue> item = new HashMap<>();
    item.put("paymentId", AttributeValue.builder().s(reference).build());
    item.put("userId", AttributeValue.builder().s(userId).build());
    item.put("amount", AttributeValue.builder().n(amount.toPlainString()).build());
    item.put("direction", AttributeValue.builder().s(direction).build());
    item.put("paymentDate", AttributeValue.builder().s(Instant.now().toString()).build());

    return Put.builder()
        .tableName(paymentsTableName)
        .item(item)
        .conditionExpression("attribute_not_exists(paymentId)")
        .build();
  }

  private static boolean failedCondition(TransactionCanceledException e, int index) {
    if (!e.hasCancellationReasons()) {
      return false;
    }
    List<CancellationReason> reasons = e.cancellationReasons();
    return reasons.size() > index && CONDITIONAL_CHECK_FAILED.equals(reasons.get(index).code());
  }

  private static boolean isValid(String reference, String userId, BigDecimal amount) {
    return reference != null && !reference.isBlank()
        && userId != null && !userId.isBlank()
        && amount != null && amount.signum() > 0;
  }

  private static Map<String, AttributeValue> accountKey(String userId) {
    return Map.of("userId", AttributeValue.builder().s(userId).build());
  }
}
