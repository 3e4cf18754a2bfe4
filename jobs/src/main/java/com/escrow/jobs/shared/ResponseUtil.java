package com.escrow.jobs.shared;

import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyResponseEvent;
import com.escrow.jobs.exceptions.JobLedgerException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;

/** Utility class for creating standardized API Gateway responses across all handlers */
public class ResponseUtil {

  private static final ObjectMapper objectMapper = new ObjectMapper();

  static final Map<String, String> DEFAULT_HEADERS =
      Map.of(
          "Content-Type", "application/json",
          "Access-Control-Allow-Origin", "*",
          "Access-Control-Allow-Methods", "GET,POST,PUT,OPTIONS",
          "Access-Control-Allow-Headers", "Content-Type,Authorization,X-User-ID,Accept,X-Requested-With");

  private ResponseUtil() {}

  /**
   * Creates a success response with the given status code and body
   *
   * @param statusCode HTTP status code
   * @param body Response body object
   * @return APIGatewayProxyResponseEvent
   */
  public static APIGatewayProxyResponseEvent createSuccessResponse(int statusCode, Object body) {
    try {
      return new APIGatewayProxyResponseEvent()
          .withStatusCode(statusCode)
          .withHeaders(DEFAULT_HEADERS)
          .withBody(objectMapper.writeValueAsString(body));
    } catch (Exception e) {
      throw new RuntimeException("Error creating success response", e);
    }
  }

  /**
   * Creates an error response with the given status code and message
   *
   * @param statusCode HTTP status code
   * @param message Error message
   * @return APIGatewayProxyResponseEvent
   */
  public static APIGatewayProxyResponseEvent createErrorResponse(int statusCode, String message) {
    return createErrorResponse(statusCode, message, null);
  }

  /**
   * Creates an error response with the given status code, message, and additional details
   *
   * @param statusCode HTTP status code
   * @param message Error message
   * @param details Additional error details
   * @return APIGatewayProxyResponseEvent
   */
  public static APIGatewayProxyResponseEvent createErrorResponse(
      int statusCode, String message, String details) {
    try {
      Map<String, String> errorBody =
          Map.of("error", message, "details", details != null ? details : "");
      return new APIGatewayProxyResponseEvent()
          .withStatusCode(statusCode)
          .withHeaders(DEFAULT_HEADERS)
          .withBody(objectMapper.writeValueAsString(errorBody));
    } catch (Exception e) {
      return new APIGatewayProxyResponseEvent()
          .withStatusCode(500)
          .withBody("{\"error\":\"Internal server error\"}");
    }
  }

  /**
   * Creates an error response for a rejected ledger operation, using the error code as the
   * message and the exception text as details
   */
  public static APIGatewayProxyResponseEvent createErrorResponse(JobLedgerException e) {
    return createErrorResponse(statusFor(e), e.errorCode(), e.getMessage());
  }

  static int statusFor(JobLedgerException e) {
    switch (e.errorCode()) {
      case "Unauthorized":
        return 403;
      case "JobNotFound":
        return 404;
      case "JobNotOpen":
      case "NoWorkSubmitted":
      case "ReentrantCall":
        return 409;
      case "EmptyField":
      case "InvalidDeadline":
      case "NoValueDeposited":
        return 400;
      case "TransferFailed":
        return 502;
      default:
        return 500;
    }
  }
}
