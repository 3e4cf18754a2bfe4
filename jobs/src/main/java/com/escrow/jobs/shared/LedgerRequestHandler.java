package com.escrow.jobs.shared;

import com.amazonaws.services.lambda.runtime.Context;
import com.amazonaws.services.lambda.runtime.RequestHandler;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.escrow.jobs.exceptions.ConcurrentJobUpdateException;
import com.escrow.jobs.exceptions.JobLedgerException;
import com.escrow.jobs.ledger.JobLedger;
import com.escrow.jobs.mappers.RequestMapper;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.DateTimeException;

/**
 * Common frame for ledger endpoints: resolves the caller, then maps ledger rejections and request
 * errors to HTTP responses.
 */
public abstract class LedgerRequestHandler
    implements RequestHandler<APIGatewayProxyRequestEvent, APIGatewayProxyResponseEvent> {

  protected final JobLedger ledger;
  protected final ObjectMapper objectMapper;

  protected LedgerRequestHandler(JobLedger ledger, ObjectMapper objectMapper) {
    this.ledger = ledger;
    this.objectMapper = objectMapper;
  }

  @Override
  public final APIGatewayProxyResponseEvent handleRequest(
      APIGatewayProxyRequestEvent input, Context context) {
    try {
      String callerId = RequestMapper.extractCallerId(input);
      if (callerId == null) {
        return ResponseUtil.createErrorResponse(401, "Unauthorized: User ID not found");
      }
      return handle(input, callerId, context);

    } catch (JobLedgerException e) {
      context.getLogger().log(operation() + " rejected: " + e.errorCode() + " - " + e.getMessage());
      return ResponseUtil.createErrorResponse(e);
    } catch (JsonProcessingException e) {
      return ResponseUtil.createErrorResponse(400, "Invalid JSON in request body");
    } catch (IllegalArgumentException | DateTimeException e) {
      return ResponseUtil.createErrorResponse(400, "Invalid request", e.getMessage());
    } catch (ConcurrentJobUpdateException e) {
      context.getLogger().log("Conditional check failed during " + operation() + ": " + e.getMessage());
      return ResponseUtil.createErrorResponse(409, "Job changed concurrently, retry the request");
    } catch (Exception e) {
      context.getLogger().log("Error in " + operation() + ": " + e.getMessage());
      e.printStackTrace();
      return ResponseUtil.createErrorResponse(500, "Internal server error");
    }
  }

  /** Operation name used in log lines. */
  protected abstract String operation();

  protected abstract APIGatewayProxyResponseEvent handle(
      APIGatewayProxyRequestEvent input, String callerId, Context context) throws Exception;

  protected long requireJobId(APIGatewayProxyRequestEvent input) {
    Long jobId = RequestMapper.extractJobIdFromPath(input.getPath());
    if (jobId == null) {
      throw new IllegalArgumentException("Job ID not found in path");
    }
    return jobId;
  }
}
