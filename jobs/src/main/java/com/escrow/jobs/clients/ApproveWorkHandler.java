package com.escrow.jobs.clients;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.escrow.jobs.entity.JobEntity;
import com.escrow.jobs.ledger.JobLedger;
import com.escrow.jobs.model.JobView;
import com.escrow.jobs.shared.LedgerRequestHandler;
import com.escrow.jobs.shared.ResponseUtil;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Handler for POST /job/client/approve/{jobId}
 * Approves submitted work and releases the escrow to the freelancer
 */
public class ApproveWorkHandler extends LedgerRequestHandler {

  public ApproveWorkHandler(JobLedger ledger, ObjectMapper objectMapper) {
    super(ledger, objectMapper);
  }

  @Override
  protected String operation() {
    return "approveWork";
  }

  @Override
  protected APIGatewayProxyResponseEvent handle(
      APIGatewayProxyRequestEvent input, String callerId, Context context) throws Exception {
    long jobId = requireJobId(input);

    context.getLogger().log("Approving job " + jobId + " by client " + callerId);

    JobEntity completed = ledger.approveWork(callerId, jobId);

    return ResponseUtil.createSuccessResponse(200, JobView.from(completed));
  }
}
