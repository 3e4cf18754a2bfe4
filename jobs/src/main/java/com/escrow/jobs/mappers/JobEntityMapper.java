package com.escrow.jobs.mappers;

import com.escrow.jobs.entity.JobEntity;
import com.escrow.jobs.entity.JobStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Utility class for mapping between DynamoDB items and JobEntity objects
 */
public class JobEntityMapper {

    private JobEntityMapper() {
        // Utility class - prevent instantiation
    }

    /**
     * Maps a DynamoDB item to a JobEntity object
     *
     * @param item DynamoDB item map
     * @return JobEntity object, or null for an empty item
     */
    public static JobEntity mapToJobEntity(Map<String, AttributeValue> item) {
        if (item == null || item.isEmpty()) {
            return null;
        }

        return JobEntity.builder()
                .jobId(Long.parseLong(getStringValue(item, "jobId")))
                .clientId(getStringValue(item, "clientId"))
                .freelancerId(getStringValue(item, "freelancerId"))
                .status(JobStatus.fromValue(getStringValue(item, "status")))
                .title(getStringValue(item, "title"))
                .description(getStringValue(item, "description"))
                .amount(new BigDecimal(getStringValue(item, "amount")))
                .deadline(parseInstant(getStringValue(item, "deadline")))
                .proofHash(getStringValue(item, "proofHash"))
                .createdAt(parseInstant(getStringValue(item, "createdAt")))
                .updatedAt(parseInstant(getStringValue(item, "updatedAt")))
                .version(Long.parseLong(getStringValue(item, "version")))
                .build();
    }

    /**
     * Maps a JobEntity to a DynamoDB item. Absent freelancer and empty proof are left out, since
     * DynamoDB rejects empty string key attributes and null values.
     *
     * @param job the job record
     * @return DynamoDB item map
     */
    public static Map<String, AttributeValue> mapToItem(JobEntity job) {
        Map<String, AttributeValue> item = new HashMap<>();
        item.put("jobId", AttributeValue.builder().n(String.valueOf(job.jobId())).build());
        item.put("clientId", AttributeValue.builder().s(job.clientId()).build());
        if (job.freelancerId() != null) {
            item.put("freelancerId", AttributeValue.builder().s(job.freelancerId()).build());
        }
        item.put("status", AttributeValue.builder().s(job.status().value()).build());
        item.put("title", AttributeValue.builder().s(job.title()).build());
        item.put("description", AttributeValue.builder().s(job.description() == null ? "" : job.description()).build());
        item.put("amount", AttributeValue.builder().n(job.amount().toPlainString()).build());
        item.put("deadline", AttributeValue.builder().s(job.deadline().toString()).build());
        if (!job.proofHash().isEmpty()) {
            item.put("proofHash", AttributeValue.builder().s(job.proofHash()).build());
        }
        item.put("createdAt", AttributeValue.builder().s(job.createdAt().toString()).build());
        item.put("updatedAt", AttributeValue.builder().s(job.updatedAt().toString()).build());
        item.put("version", AttributeValue.builder().n(String.valueOf(job.version())).build());
        return item;
    }

    /**
     * Extracts string value from DynamoDB AttributeValue, handling both string and number types
     *
     * @param item DynamoDB item map
     * @param key The attribute key
     * @return String value or null if not found
     */
    public static String getStringValue(Map<String, AttributeValue> item, String key) {
        AttributeValue value = item.get(key);
        if (value != null && value.s() != null) {
            return value.s();
        } else if (value != null && value.n() != null) {
            return value.n();
        }
        return null;
    }

    private static Instant parseInstant(String value) {
        return value == null ? null : Instant.parse(value);
    }
}
