package com.escrow.jobs.shared;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.escrow.jobs.ledger.JobLedger;
import com.escrow.jobs.model.JobView;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Handler for GET /job/view/{jobId}
 * Returns the current job record to any identified caller
 */
public class ViewJobHandler extends LedgerRequestHandler {

  public ViewJobHandler(JobLedger ledger, ObjectMapper objectMapper) {
    super(ledger, objectMapper);
  }

  @Override
  protected String operation() {
    return "getJob";
  }

  @Override
  protected APIGatewayProxyResponseEvent handle(
      APIGatewayProxyRequestEvent input, String callerId, Context context) throws Exception {
    long jobId = requireJobId(input);
    return ResponseUtil.createSuccessResponse(200, JobView.from(ledger.getJob(jobId)));
  }
}
