package com.escrow.jobs.roles;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.escrow.jobs.access.Role;
import com.escrow.jobs.ledger.JobLedger;
import com.escrow.jobs.mappers.RequestMapper;
import com.escrow.jobs.shared.LedgerRequestHandler;
import com.escrow.jobs.shared.ResponseUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;

/**
 * Handler for POST /roles/self/{role}
 * Grants the caller Client or Freelancer standing
 */
public class GrantSelfRoleHandler extends LedgerRequestHandler {

  public GrantSelfRoleHandler(JobLedger ledger, ObjectMapper objectMapper) {
    super(ledger, objectMapper);
  }

  @Override
  protected String operation() {
    return "grantSelfRole";
  }

  @Override
  protected APIGatewayProxyResponseEvent handle(
      APIGatewayProxyRequestEvent input, String callerId, Context context) throws Exception {
    Role role = Role.fromValue(RequestMapper.extractLastPathSegment(input.getPath()));

    context.getLogger().log("Granting " + role.value() + " role to " + callerId);

    ledger.authorizer().grantSelf(callerId, role);

    return ResponseUtil.createSuccessResponse(200, Map.of(
        "callerId", callerId,
        "role", role.value(),
        "granted", true));
  }
}
