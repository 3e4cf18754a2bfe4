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
 * Handler for POST /job/client/reject/{jobId}
 * Rejects submitted work and reopens the job
 */
public class RejectWorkHandler extends LedgerRequestHandler {

  public RejectWorkHandler(JobLedger ledger, ObjectMapper objectMapper) {
    super(ledger, objectMapper);
  }

  @Override
  protected String operation() {
    return "rejectWork";
  }

  @Override
  protected APIGatewayProxyResponseEvent handle(
      APIGatewayProxyRequestEvent input, String callerId, Context context) throws Exception {
    long jobId = requireJobId(input);

    context.getLogger().log("Rejecting work on job " + jobId + " by client " + callerId);

    JobEntity reopened = ledger.rejectWork(callerId, jobId);

    return ResponseUtil.createSuccessResponse(200, JobView.from(reopened));
  }
}
