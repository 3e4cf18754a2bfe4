package com.escrow.jobs.freelancers;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.escrow.jobs.entity.JobEntity;
import com.escrow.jobs.ledger.JobLedger;
import com.escrow.jobs.mappers.RequestMapper;
import com.escrow.jobs.model.JobView;
import com.escrow.jobs.model.SubmitWorkRequest;
import com.escrow.jobs.shared.LedgerRequestHandler;
import com.escrow.jobs.shared.ResponseUtil;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Handler for POST /job/freelancer/submit/{jobId}
 * Submits a proof reference against an Open job before its deadline
 */
public class SubmitWorkHandler extends LedgerRequestHandler {

  public SubmitWorkHandler(JobLedger ledger, ObjectMapper objectMapper) {
    super(ledger, objectMapper);
  }

  @Override
  protected String operation() {
    return "submitWork";
  }

  @Override
  protected APIGatewayProxyResponseEvent handle(
      APIGatewayProxyRequestEvent input, String callerId, Context context) throws Exception {
    long jobId = requireJobId(input);
    SubmitWorkRequest request = objectMapper.readValue(RequestMapper.readBody(input), SubmitWorkRequest.class);

    context.getLogger().log("Submitting work on job " + jobId + " by freelancer " + callerId);

    JobEntity submitted = ledger.submitWork(callerId, jobId, request.proofHash());

    return ResponseUtil.createSuccessResponse(200, JobView.from(submitted));
  }
}
