package com.escrow.jobs.shared;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.escrow.jobs.clients.ApproveWorkHandler;
import com.escrow.jobs.clients.CancelJobHandler;
import com.escrow.jobs.clients.PostJobHandler;
import com.escrow.jobs.clients.RejectWorkHandler;
import com.escrow.jobs.clients.UpdateJobHandler;
import com.escrow.jobs.config.LedgerConfig;
import com.escrow.jobs.config.LedgerFactory;
import com.escrow.jobs.freelancers.SubmitWorkHandler;
import com.escrow.jobs.ledger.JobLedger;
import com.escrow.jobs.roles.AdminRoleHandler;
import com.escrow.jobs.roles.GrantSelfRoleHandler;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.HashMap;
import java.util.Map;

/**
 * Main router that handles all ledger API Gateway requests. Routes to the client, freelancer,
 * role and view handlers based on path (/job/client/*, /job/freelancer/*, /roles/*, /job/view/*)
 */
public class JobRouter
    implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {

  private static final String JOB_ID = "[1-9][0-9]*";

  private final PostJobHandler postJobHandler;
  private final UpdateJobHandler updateJobHandler;
  private final CancelJobHandler cancelJobHandler;
  private final ApproveWorkHandler approveWorkHandler;
  private final RejectWorkHandler rejectWorkHandler;
  private final SubmitWorkHandler submitWorkHandler;
  private final ViewJobHandler viewJobHandler;
  private final GrantSelfRoleHandler grantSelfRoleHandler;
  private final AdminRoleHandler adminRoleHandler;

  public JobRouter() {
    this(LedgerFactory.create(LedgerConfig.fromEnvironment()));
  }

  public JobRouter(JobLedger ledger) {
    ObjectMapper objectMapper = new ObjectMapper();
    this.postJobHandler = new PostJobHandler(ledger, objectMapper);
    this.updateJobHandler = new UpdateJobHandler(ledger, objectMapper);
    this.cancelJobHandler = new CancelJobHandler(ledger, objectMapper);
    this.approveWorkHandler = new ApproveWorkHandler(ledger, objectMapper);
    this.rejectWorkHandler = new RejectWorkHandler(ledger, objectMapper);
    this.submitWorkHandler = new SubmitWorkHandler(ledger, objectMapper);
    this.viewJobHandler = new ViewJobHandler(ledger, objectMapper);
    this.grantSelfRoleHandler = new GrantSelfRoleHandler(ledger, objectMapper);
    this.adminRoleHandler = new AdminRoleHandler(ledger, objectMapper);
  }

  @Override
  public APIGatewayProxyResponseEvent handleRequest(
      APIGatewayProxyRequestEvent input, Context context) {
    try {
      String path = input.getPath();
      String httpMethod = input.getHttpMethod();

      context.getLogger().log("Processing request: " + httpMethod + " " + path);

      // Handle OPTIONS preflight requests for CORS
      if ("OPTIONS".equals(httpMethod)) {
        Map<String, String> headers = new HashMap<>(ResponseUtil.DEFAULT_HEADERS);
        headers.put("Access-Control-Max-Age", "86400");
        return new APIGatewayProxyResponseEvent()
            .withStatusCode(200)
            .withHeaders(headers)
            .withBody("");
      }

      if (path == null || httpMethod == null) {
        return ResponseUtil.createErrorResponse(400, "Request path and method are required");
      }

      RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> handler =
          route(httpMethod, path);
      if (handler == null) {
        context.getLogger().log("Path not found: " + httpMethod + " " + path);
        return ResponseUtil.createErrorResponse(404, "Endpoint not found: " + httpMethod + " " + path);
      }
      return handler.handleRequest(input, context);

    } catch (Exception e) {
      context.getLogger().log("Error processing request: " + e.getMessage());
      e.printStackTrace();
      return ResponseUtil.createErrorResponse(500, "Internal server error");
    }
  }

  private RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> route(
      String method, String path) {
    if (path.startsWith("/job/client/")) {
      return routeClientRequest(method, path);
    } else if (path.startsWith("/job/freelancer/")) {
      if (path.matches("/job/freelancer/submit/" + JOB_ID) && method.equals("POST")) {
        return submitWorkHandler;
      }
    } else if (path.matches("/job/view/" + JOB_ID) && method.equals("GET")) {
      return viewJobHandler;
    } else if (path.matches("/roles/self/[A-Za-z]+") && method.equals("POST")) {
      return grantSelfRoleHandler;
    } else if (path.matches("/roles/admin/(grant|revoke)") && method.equals("POST")) {
      return adminRoleHandler;
    }
    return null;
  }

  private RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> routeClientRequest(
      String method, String path) {
    if (path.equals("/job/client/post") && method.equals("POST")) {
      return postJobHandler;
    } else if (path.matches("/job/client/update/" + JOB_ID) && method.equals("PUT")) {
      return updateJobHandler;
    } else if (path.matches("/job/client/cancel/" + JOB_ID) && method.equals("POST")) {
      return cancelJobHandler;
    } else if (path.matches("/job/client/approve/" + JOB_ID) && method.equals("POST")) {
      return approveWorkHandler;
    } else if (path.matches("/job/client/reject/" + JOB_ID) && method.equals("POST")) {
      return rejectWorkHandler;
    }
    return null;
  }
}
