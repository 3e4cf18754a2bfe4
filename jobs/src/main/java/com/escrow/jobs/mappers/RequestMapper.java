package com.escrow.jobs.mappers;

import com.amazonaws.services.lambda.runtime.events.APIGatewayProxyRequestEvent;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Map;

/**
 * Utility class for extracting common parameters from API Gateway request events
 */
public class RequestMapper {

    private RequestMapper() {
        // Utility class - prevent instantiation
    }

    /**
     * Extracts the job id from the last segment of the path, e.g. /job/client/cancel/{jobId}
     *
     * @param path The request path
     * @return Job id or null if the path has no trailing segment
     * @throws IllegalArgumentException if the segment is not a positive number
     */
    public static Long extractJobIdFromPath(String path) {
        String segment = extractLastPathSegment(path);
        if (segment == null) {
            return null;
        }
        try {
            long jobId = Long.parseLong(segment);
            if (jobId <= 0) {
                throw new IllegalArgumentException("Job ID must be positive: " + segment);
            }
            return jobId;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Job ID must be numeric: " + segment);
        }
    }

    /**
     * Returns the last non-empty segment of the path
     *
     * @param path The request path
     * @return Last segment or null
     */
    public static String extractLastPathSegment(String path) {
        if (path == null) {
            return null;
        }
        String[] parts = path.split("/");
        for (int i = parts.length - 1; i >= 0; i--) {
            if (!parts[i].isEmpty()) {
                return parts[i];
            }
        }
        return null;
    }

    /**
     * Extracts the caller identity from the Cognito authorizer claims, falling back to the
     * X-User-ID header
     *
     * @param input API Gateway request event
     * @return Caller identity or null if not found
     */
    public static String extractCallerId(APIGatewayProxyRequestEvent input) {
        APIGatewayProxyRequestEvent.ProxyRequestContext requestContext = input.getRequestContext();
        if (requestContext != null) {
            Map<String, Object> authorizer = requestContext.getAuthorizer();
            if (authorizer != null && authorizer.containsKey("claims")) {
                @SuppressWarnings("unchecked")
                Map<String, Object> claims = (Map<String, Object>) authorizer.get("claims");
                if (claims != null && claims.get("sub") instanceof String) {
                    return (String) claims.get("sub");
                }
            }
        }

        // Fallback to header-based extraction
        Map<String, String> headers = input.getHeaders();
        if (headers != null) {
            // Try both case variations as headers can be normalized differently
            String callerId = headers.get("X-User-ID");
            if (callerId == null || callerId.isEmpty()) {
                callerId = headers.get("x-user-id");
            }
            if (callerId != null && !callerId.isEmpty()) {
                return callerId;
            }
        }
        return null;
    }

    /**
     * Returns the request body, decoding it when API Gateway marked it base64
     *
     * @param input API Gateway request event
     * @return Body text, or "{}" when the request has none
     */
    public static String readBody(APIGatewayProxyRequestEvent input) {
        String requestBody = input.getBody();
        if (requestBody == null || requestBody.trim().isEmpty()) {
            return "{}";
        }
        if (input.getIsBase64Encoded() != null && input.getIsBase64Encoded()) {
            requestBody = new String(Base64.getDecoder().decode(requestBody), StandardCharsets.UTF_8);
        }
        return requestBody;
    }
}
