package com.escrow.jobs.clients;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.escrow.jobs.entity.JobEntity;
import com.escrow.jobs.ledger.JobLedger;
import com.escrow.jobs.mappers.RequestMapper;
import com.escrow.jobs.model.JobView;
import com.escrow.jobs.model.UpdateJobRequest;
import com.escrow.jobs.shared.LedgerRequestHandler;
import com.escrow.jobs.shared.ResponseUtil;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Handler for PUT /job/client/update/{jobId}
 * Edits an Open job and optionally tops up its escrow
 */
public class UpdateJobHandler extends LedgerRequestHandler {

  public UpdateJobHandler(JobLedger ledger, ObjectMapper objectMapper) {
    super(ledger, objectMapper);
  }

  @Override
  protected String operation() {
    return "updateJob";
  }

  @Override
  protected APIGatewayProxyResponseEvent handle(
      APIGatewayProxyRequestEvent input, String callerId, Context context) throws Exception {
    long jobId = requireJobId(input);
    UpdateJobRequest request = objectMapper.readValue(RequestMapper.readBody(input), UpdateJobRequest.class);

    context.getLogger().log("Updating job " + jobId + " for client: " + callerId);

    JobEntity updated = ledger.updateJob(
        callerId,
        jobId,
        request.title(),
        request.description(),
        request.parsedDeadline(),
        request.additionalValue());

    return ResponseUtil.createSuccessResponse(200, JobView.from(updated));
  }
}
