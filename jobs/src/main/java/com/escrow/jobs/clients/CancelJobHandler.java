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
 * Handler for POST /job/client/cancel/{jobId}
 * Cancels an Open job and refunds the escrow to the client
 */
public class CancelJobHandler extends LedgerRequestHandler {

  public CancelJobHandler(JobLedger ledger, ObjectMapper objectMapper) {
    super(ledger, objectMapper);
  }

  @Override
  protected String operation() {
    return "cancelJob";
  }

  @Override
  protected APIGatewayProxyResponseEvent handle(
      APIGatewayProxyRequestEvent input, String callerId, Context context) throws Exception {
    long jobId = requireJobId(input);

    context.getLogger().log("Cancelling job " + jobId + " by client " + callerId);

    JobEntity cancelled = ledger.cancelJob(callerId, jobId);

    return ResponseUtil.createSuccessResponse(200, JobView.from(cancelled));
  }
}
