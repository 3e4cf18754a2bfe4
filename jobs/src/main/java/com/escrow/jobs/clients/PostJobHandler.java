package com.escrow.jobs.clients;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.escrow.jobs.ledger.JobLedger;
import com.escrow.jobs.mappers.RequestMapper;
import com.escrow.jobs.model.JobView;
import com.escrow.jobs.model.PostJobRequest;
import com.escrow.jobs.shared.LedgerRequestHandler;
import com.escrow.jobs.shared.ResponseUtil;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Handler for POST /job/client/post
 * Flow: Parse → postJob (role, validation, escrow) → Return created job
 */
public class PostJobHandler extends LedgerRequestHandler {

  public PostJobHandler(JobLedger ledger, ObjectMapper objectMapper) {
    super(ledger, objectMapper);
  }

  @Override
  protected String operation() {
    return "postJob";
  }

  @Override
  protected APIGatewayProxyResponseEvent handle(
      APIGatewayProxyRequestEvent input, String callerId, Context context) throws Exception {
    PostJobRequest request = objectMapper.readValue(RequestMapper.readBody(input), PostJobRequest.class);

    context.getLogger().log("Posting job for client: " + callerId);

    long jobId = ledger.postJob(
        callerId,
        request.title(),
        request.description(),
        request.parsedDeadline(),
        request.depositedValue());

    return ResponseUtil.createSuccessResponse(201, JobView.from(ledger.getJob(jobId)));
  }
}
