package com.escrow.jobs.roles;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.escrow.jobs.access.Role;
import com.escrow.jobs.ledger.JobLedger;
import com.escrow.jobs.mappers.RequestMapper;
import com.escrow.jobs.model.RoleChangeRequest;
import com.escrow.jobs.shared.LedgerRequestHandler;
import com.escrow.jobs.shared.ResponseUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;

/**
 * Handler for POST /roles/admin/grant and POST /roles/admin/revoke
 * Administrator-only management of any role, including Administrator
 */
public class AdminRoleHandler extends LedgerRequestHandler {

  public AdminRoleHandler(JobLedger ledger, ObjectMapper objectMapper) {
    super(ledger, objectMapper);
  }

  @Override
  protected String operation() {
    return "adminRoleChange";
  }

  @Override
  protected APIGatewayProxyResponseEvent handle(
      APIGatewayProxyRequestEvent input, String callerId, Context context) throws Exception {
    String action = RequestMapper.extractLastPathSegment(input.getPath());
    RoleChangeRequest request = objectMapper.readValue(RequestMapper.readBody(input), RoleChangeRequest.class);
    if (!request.isValid()) {
      return ResponseUtil.createErrorResponse(400, "Both identity and role are required");
    }
    Role role = Role.fromValue(request.role());
    String targetId = request.trimmedIdentity();

    context.getLogger().log("Admin " + callerId + " requested " + action + " of " + role.value() + " for " + targetId);

    if ("grant".equals(action)) {
      ledger.authorizer().grantRole(callerId, targetId, role);
    } else if ("revoke".equals(action)) {
      ledger.authorizer().revokeRole(callerId, targetId, role);
    } else {
      return ResponseUtil.createErrorResponse(404, "Unknown role action: " + action);
    }

    return ResponseUtil.createSuccessResponse(200, Map.of(
        "identity", targetId,
        "role", role.value(),
        "action", action));
  }
}
