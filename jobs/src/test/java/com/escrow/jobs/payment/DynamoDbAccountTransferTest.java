package com.escrow.jobs.payment;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.ApiCallTimeoutException;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.CancellationReason;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.Put;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItemsRequest;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItemsResponse;
import software.amazon.awssdk.services.dynamodb.model.TransactionCanceledException;
import software.amazon.awssdk.services.dynamodb.model.Update;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DynamoDbAccountTransferTest {

    static final BigDecimal HUNDRED = new BigDecimal("100");

    @Mock DynamoDbClient dynamoDbClient;

    DynamoDbAccountTransfer accounts;

    @BeforeEach
    void setUp() {
        accounts = new DynamoDbAccountTransfer(dynamoDbClient, "accounts", "payments");
    }

    // ------------------------------------------------------------------
    // transfer()
    // ------------------------------------------------------------------

    @Test
    void transfer_recordsPaymentAndCreditsBalanceTogether() {
        when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
                .thenReturn(TransactWriteItemsResponse.builder().build());

        assertThat(accounts.transfer("job-1-payout", "freelancer-1", HUNDRED)).isTrue();

        TransactWriteItemsRequest request = captureTransaction();
        Put record = request.transactItems().get(0).put();
        Update credit = request.transactItems().get(1).update();
        assertThat(record.tableName()).isEqualTo("payments");
        assertThat(record.item().get("paymentId").s()).isEqualTo("job-1-payout");
        assertThat(record.item().get("direction").s()).isEqualTo(DynamoDbAccountTransfer.CREDIT);
        assertThat(record.conditionExpression()).isEqualTo("attribute_not_exists(paymentId)");
        assertThat(credit.tableName()).isEqualTo("accounts");
        assertThat(credit.key().get("userId").s()).isEqualTo("freelancer-1");
        assertThat(credit.expressionAttributeValues().get(":amount").n()).isEqualTo("100");
    }

    @Test
    void transfer_retryAfterTimeout_doesNotCreditTwice() {
        when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
                .thenThrow(ApiCallTimeoutException.create(1000L))
                .thenThrow(cancelled("ConditionalCheckFailed", "None"));
        when(dynamoDbClient.getItem(any(GetItemRequest.class)))
                .thenReturn(recorded("freelancer-1", "100", DynamoDbAccountTransfer.CREDIT));

        assertThat(accounts.transfer("job-1-payout", "freelancer-1", HUNDRED)).isFalse();
        assertThat(accounts.transfer("job-1-payout", "freelancer-1", HUNDRED)).isTrue();

        ArgumentCaptor<TransactWriteItemsRequest> requests = ArgumentCaptor.forClass(TransactWriteItemsRequest.class);
        verify(dynamoDbClient, times(2)).transactWriteItems(requests.capture());
        assertThat(requests.getAllValues())
                .extracting(r -> r.transactItems().get(0).put().item().get("paymentId").s())
                .containsOnly("job-1-payout");
        ArgumentCaptor<GetItemRequest> lookup = ArgumentCaptor.forClass(GetItemRequest.class);
        verify(dynamoDbClient).getItem(lookup.capture());
        assertThat(lookup.getValue().consistentRead()).isTrue();
    }

    @Test
    void transfer_referenceRecordedForAnotherRecipient_reportsFalse() {
        when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
                .thenThrow(cancelled("ConditionalCheckFailed", "None"));
        when(dynamoDbClient.getItem(any(GetItemRequest.class)))
                .thenReturn(recorded("freelancer-1", "100", DynamoDbAccountTransfer.CREDIT));

        assertThat(accounts.transfer("job-1-payout", "client-1", HUNDRED)).isFalse();
    }

    @Test
    void transfer_storeFailure_reportsFalse() {
        when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
                .thenThrow(DynamoDbException.builder().message("throttled").build());

        assertThat(accounts.transfer("job-1-payout", "freelancer-1", HUNDRED)).isFalse();
        verify(dynamoDbClient, never()).getItem(any(GetItemRequest.class));
    }

    @Test
    void transfer_invalidArguments_areRefused() {
        assertThat(accounts.transfer("job-1-payout", "freelancer-1", BigDecimal.ZERO)).isFalse();
        assertThat(accounts.transfer("job-1-payout", null, BigDecimal.TEN)).isFalse();
        assertThat(accounts.transfer("", "freelancer-1", BigDecimal.TEN)).isFalse();
        verifyNoInteractions(dynamoDbClient);
    }

    // ------------------------------------------------------------------
    // collect()
    // ------------------------------------------------------------------

    @Test
    void collect_debitsOnlyACoveringBalance() {
        when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
                .thenReturn(TransactWriteItemsResponse.builder().build());

        assertThat(accounts.collect("deposit-1", "client-1", HUNDRED)).isTrue();

        TransactWriteItemsRequest request = captureTransaction();
        Put record = request.transactItems().get(0).put();
        Update debit = request.transactItems().get(1).update();
        assertThat(record.item().get("direction").s()).isEqualTo(DynamoDbAccountTransfer.DEBIT);
        assertThat(debit.key().get("userId").s()).isEqualTo("client-1");
        assertThat(debit.updateExpression()).isEqualTo("SET balance = balance - :amount");
        assertThat(debit.conditionExpression()).isEqualTo("balance >= :amount");
    }

    @Test
    void collect_insufficientBalance_reportsFalse() {
        when(dynamoDbClient.transactWriteItems(any(TransactWriteItemsRequest.class)))
                .thenThrow(cancelled("None", "ConditionalCheckFailed"));

        assertThat(accounts.collect("deposit-1", "client-1", new BigDecimal("1000000"))).isFalse();
        verify(dynamoDbClient, never()).getItem(any(GetItemRequest.class));
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private TransactWriteItemsRequest captureTransaction() {
        ArgumentCaptor<TransactWriteItemsRequest> request = ArgumentCaptor.forClass(TransactWriteItemsRequest.class);
        verify(dynamoDbClient).transactWriteItems(request.capture());
        assertThat(request.getValue().transactItems()).hasSize(2);
        return request.getValue();
    }

    private static TransactionCanceledException cancelled(String recordCode, String balanceCode) {
        return TransactionCanceledException.builder()
                .message("Transaction cancelled")
                .cancellationReasons(List.of(
                        CancellationReason.builder().code(recordCode).build(),
                        CancellationReason.builder().code(balanceCode).build()))
                .build();
    }

    private static GetItemResponse recorded(String userId, String amount, String direction) {
        return GetItemResponse.builder()
                .item(Map.of(
                        "paymentId", AttributeValue.builder().s("job-1-payout").build(),
                        "userId", AttributeValue.builder().s(userId).build(),
                        "amount", AttributeValue.builder().n(amount).build(),
                        "direction", AttributeValue.builder().s(direction).build()))
                .build();
    }
}
