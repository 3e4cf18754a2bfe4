package com.escrow.jobs.config;

import com.escrow.jobs.ledger.JobLedger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.PutItemResponse;
import software.amazon.awssdk.services.eventbridge.EventBridgeClient;

import java.time.Clock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LedgerFactoryTest {

    @Mock DynamoDbClient    dynamoDbClient;
    @Mock EventBridgeClient eventBridgeClient;

    @Test
    void create_seedsBootstrapAdministrator() {
        when(dynamoDbClient.getItem(any(GetItemRequest.class))).thenReturn(GetItemResponse.builder().build());
        when(dynamoDbClient.putItem(any(PutItemRequest.class))).thenReturn(PutItemResponse.builder().build());
        LedgerConfig config = new LedgerConfig("jobs", "roles", "accounts", "payments", "bus", "jobs-ledger", "admin-1");

        JobLedger ledger = LedgerFactory.create(config, dynamoDbClient, eventBridgeClient, Clock.systemUTC());

        assertThat(ledger).isNotNull();
        ArgumentCaptor<PutItemRequest> request = ArgumentCaptor.forClass(PutItemRequest.class);
        verify(dynamoDbClient).putItem(request.capture());
        assertThat(request.getValue().tableName()).isEqualTo("roles");
        assertThat(request.getValue().item().get("callerId").s()).isEqualTo("admin-1");
        assertThat(request.getValue().item().get("role").s()).isEqualTo("Administrator");
    }
}
