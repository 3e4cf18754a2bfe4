package com.escrow.jobs.shared;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.LambdaLogger;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.escrow.jobs.access.InMemoryRoleRegistry;
import com.escrow.jobs.access.Role;
import com.escrow.jobs.events.AuditLog;
import com.escrow.jobs.ledger.JobLedger;
import com.escrow.jobs.payment.EscrowDeposit;
import com.escrow.jobs.payment.ValueTransfer;
import com.escrow.jobs.store.InMemoryJobStore;
import com.escrow.jobs.support.MutableClock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

import static com.escrow.jobs.payment.TransferReference.payout;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

/**
 * Drives the API Gateway surface end to end over an in-memory ledger.
 */
@ExtendWith(MockitoExtension.class)
class JobRouterTest {

    static final Instant T = Instant.parse("2026-03-01T12:00:00Z");

    @Mock Context       context;
    @Mock LambdaLogger  logger;
    @Mock EscrowDeposit escrowDeposit;
    @Mock ValueTransfer valueTransfer;
    @Mock AuditLog      auditLog;

    final ObjectMapper objectMapper = new ObjectMapper();
    InMemoryRoleRegistry roles;
    JobRouter router;

    @BeforeEach
    void setUp() {
        when(context.getLogger()).thenReturn(logger);
        roles = new InMemoryRoleRegistry();
        roles.seedAdministrator("admin");
        JobLedger ledger = new JobLedger(
                roles, new InMemoryJobStore(), escrowDeposit, valueTransfer, auditLog, new MutableClock(T));
        lenient().when(escrowDeposit.collect(anyString(), anyString(), any())).thenReturn(true);
        router = new JobRouter(ledger);
    }

    @Test
    void fullLifecycle_postSubmitApprove() throws Exception {
        assertThat(call("POST", "/roles/self/client", "alice", null).getStatusCode()).isEqualTo(200);
        assertThat(call("POST", "/roles/self/freelancer", "bob", null).getStatusCode()).isEqualTo(200);

        APIGatewayProxyResponseEvent posted = call("POST", "/job/client/post", "alice",
                "{\"title\":\"Logo\",\"description\":\"Vector\",\"deadline\":\"2026-03-01T12:00:10Z\",\"depositedValue\":100}");
        assertThat(posted.getStatusCode()).isEqualTo(201);
        JsonNode job = body(posted);
        assertThat(job.get("jobId").asLong()).isEqualTo(1L);
        assertThat(job.get("status").asText()).isEqualTo("open");
        assertThat(job.get("amount").decimalValue()).isEqualByComparingTo("100");

        APIGatewayProxyResponseEvent submitted = call("POST", "/job/freelancer/submit/1", "bob",
                "{\"proofHash\":\"ipfs://x\"}");
        assertThat(submitted.getStatusCode()).isEqualTo(200);
        assertThat(body(submitted).get("freelancerId").asText()).isEqualTo("bob");

        when(valueTransfer.transfer(payout(1L), "bob", new BigDecimal("100"))).thenReturn(true);
        APIGatewayProxyResponseEvent approved = call("POST", "/job/client/approve/1", "alice", null);
        assertThat(approved.getStatusCode()).isEqualTo(200);
        assertThat(body(approved).get("status").asText()).isEqualTo("completed");
        assertThat(body(approved).get("amount").decimalValue()).isEqualByComparingTo("0");

        APIGatewayProxyResponseEvent viewed = call("GET", "/job/view/1", "carol", null);
        assertThat(body(viewed).get("status").asText()).isEqualTo("completed");
    }

    @Test
    void updateAndReject_throughHttp() throws Exception {
        roles.grantSelf("alice", Role.CLIENT);
        roles.grantSelf("bob", Role.FREELANCER);
        call("POST", "/job/client/post", "alice",
                "{\"title\":\"Logo\",\"deadline\":\"2026-03-01T12:00:10Z\",\"depositedValue\":100}");

        APIGatewayProxyResponseEvent updated = call("PUT", "/job/client/update/1", "alice",
                "{\"title\":\"Logo v2\",\"description\":\"\",\"deadline\":\"2026-03-02T00:00:00Z\",\"additionalValue\":25}");
        assertThat(updated.getStatusCode()).isEqualTo(200);
        assertThat(body(updated).get("amount").decimalValue()).isEqualByComparingTo("125");

        call("POST", "/job/freelancer/submit/1", "bob", "{\"proofHash\":\"ipfs://x\"}");
        APIGatewayProxyResponseEvent rejected = call("POST", "/job/client/reject/1", "alice", null);

        assertThat(rejected.getStatusCode()).isEqualTo(200);
        assertThat(body(rejected).get("status").asText()).isEqualTo("open");
        assertThat(body(rejected).get("freelancerId").isNull()).isTrue();
    }

    @Test
    void transferFailure_mapsTo502AndLeavesJobOpen() throws Exception {
        roles.grantSelf("alice", Role.CLIENT);
        call("POST", "/job/client/post", "alice",
                "{\"title\":\"Logo\",\"deadline\":\"2026-03-01T12:00:10Z\",\"depositedValue\":100}");
        when(valueTransfer.transfer(payout(1L), "alice", new BigDecimal("100"))).thenReturn(false);

        APIGatewayProxyResponseEvent cancelled = call("POST", "/job/client/cancel/1", "alice", null);

        assertThat(cancelled.getStatusCode()).isEqualTo(502);
        assertThat(body(cancelled).get("error").asText()).isEqualTo("TransferFailed");
        assertThat(body(call("GET", "/job/view/1", "alice", null)).get("status").asText()).isEqualTo("open");
    }

    @Test
    void ledgerRejections_mapToHttpStatuses() throws Exception {
        roles.grantSelf("alice", Role.CLIENT);
        roles.grantSelf("mallory", Role.CLIENT);

        APIGatewayProxyResponseEvent noRole = call("POST", "/job/client/post", "bob",
                "{\"title\":\"Logo\",\"deadline\":\"2026-03-01T12:00:10Z\",\"depositedValue\":100}");
        assertThat(noRole.getStatusCode()).isEqualTo(403);
        assertThat(body(noRole).get("error").asText()).isEqualTo("Unauthorized");

        APIGatewayProxyResponseEvent noDeposit = call("POST", "/job/client/post", "alice",
                "{\"title\":\"Logo\",\"deadline\":\"2026-03-01T12:00:10Z\",\"depositedValue\":0}");
        assertThat(noDeposit.getStatusCode()).isEqualTo(400);
        assertThat(body(noDeposit).get("error").asText()).isEqualTo("NoValueDeposited");

        assertThat(call("GET", "/job/view/9", "alice", null).getStatusCode()).isEqualTo(404);

        call("POST", "/job/client/post", "alice",
                "{\"title\":\"Logo\",\"deadline\":\"2026-03-01T12:00:10Z\",\"depositedValue\":100}");
        assertThat(call("POST", "/job/client/cancel/1", "mallory", null).getStatusCode()).isEqualTo(403);
        assertThat(call("POST", "/job/client/approve/1", "alice", null).getStatusCode()).isEqualTo(409);
    }

    @Test
    void unfundedDeposit_isRejectedWith400() throws Exception {
        roles.grantSelf("alice", Role.CLIENT);
        when(escrowDeposit.collect(anyString(), eq("alice"), eq(new BigDecimal("1000000")))).thenReturn(false);

        APIGatewayProxyResponseEvent posted = call("POST", "/job/client/post", "alice",
                "{\"title\":\"Logo\",\"deadline\":\"2026-03-01T12:00:10Z\",\"depositedValue\":1000000}");

        assertThat(posted.getStatusCode()).isEqualTo(400);
        assertThat(body(posted).get("error").asText()).isEqualTo("NoValueDeposited");
        assertThat(call("POST", "/job/client/cancel/1", "alice", null).getStatusCode()).isEqualTo(404);
        verifyNoInteractions(valueTransfer);
    }

    @Test
    void requestProblems_mapTo4xx() {
        assertThat(call("POST", "/job/client/post", null, "{}").getStatusCode()).isEqualTo(401);
        assertThat(call("POST", "/job/client/post", "alice", "{not json").getStatusCode()).isEqualTo(400);
        assertThat(call("POST", "/roles/self/overlord", "alice", null).getStatusCode()).isEqualTo(400);
        assertThat(call("DELETE", "/job/client/cancel/1", "alice", null).getStatusCode()).isEqualTo(404);
        assertThat(call("GET", "/job/view/abc", "alice", null).getStatusCode()).isEqualTo(404);
    }

    @Test
    void selfGrantOfAdministrator_isForbidden() {
        APIGatewayProxyResponseEvent response = call("POST", "/roles/self/administrator", "alice", null);

        assertThat(response.getStatusCode()).isEqualTo(403);
        assertThat(roles.hasRole("alice", Role.ADMINISTRATOR)).isFalse();
    }

    @Test
    void adminEndpoints_requireAdministrator() {
        String body = "{\"identity\":\"bob\",\"role\":\"Administrator\"}";

        assertThat(call("POST", "/roles/admin/grant", "alice", body).getStatusCode()).isEqualTo(403);
        assertThat(call("POST", "/roles/admin/grant", "admin", body).getStatusCode()).isEqualTo(200);
        assertThat(roles.hasRole("bob", Role.ADMINISTRATOR)).isTrue();

        assertThat(call("POST", "/roles/admin/revoke", "bob", body).getStatusCode()).isEqualTo(403);
        assertThat(call("POST", "/roles/admin/revoke", "admin", body).getStatusCode()).isEqualTo(200);
        assertThat(roles.hasRole("bob", Role.ADMINISTRATOR)).isFalse();
    }

    @Test
    void options_answersCorsPreflight() {
        APIGatewayProxyResponseEvent response = call("OPTIONS", "/job/client/post", null, null);

        assertThat(response.getStatusCode()).isEqualTo(200);
        assertThat(response.getHeaders()).containsEntry("Access-Control-Max-Age", "86400");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private APIGatewayProxyResponseEvent call(String method, String path, String callerId, String body) {
        APIGatewayProxyRequestEvent input = new APIGatewayProxyRequestEvent()
                .withHttpMethod(method)
                .withPath(path)
                .withBody(body);
        if (callerId != null) {
            input.setHeaders(Map.of("X-User-ID", callerId));
        }
        return router.handleRequest(input, context);
    }

    private JsonNode body(APIGatewayProxyResponseEvent response) throws Exception {
        return objectMapper.readTree(response.getBody());
    }
}
