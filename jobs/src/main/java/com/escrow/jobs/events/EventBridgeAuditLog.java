package com.escrow.jobs.events;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.eventbridge.EventBridgeClient;
import software.amazon.awssdk.services.eventbridge.model.PutEventsRequest;
import software.amazon.awssdk.services.eventbridge.model.PutEventsRequestEntry;
import software.amazon.awssdk.services.eventbridge.model.PutEventsResponse;

/** Publishes ledger events to an EventBridge bus, one entry per event */
public class EventBridgeAuditLog implements AuditLog {

  private static final Logger log = LoggerFactory.getLogger(EventBridgeAuditLog.class);

  private final EventBridgeClient eventBridgeClient;
  private final ObjectMapper objectMapper;
  private final String eventBusName;
  private final String source;

  public EventBridgeAuditLog(
      EventBridgeClient eventBridgeClient, ObjectMapper objectMapper, String eventBusName, String source) {
    this.eventBridgeClient = eventBridgeClient;
    this.objectMapper = objectMapper;
    this.eventBusName = eventBusName;
    this.source = source;
  }

  @Override
  public void publish(LedgerEvent event) {
    try {
      String eventJson = objectMapper.writeValueAsString(event);

      PutEventsRequestEntry eventEntry =
          PutEventsRequestEntry.builder()
              .source(source)
              .detailType(event.eventType())
              .detail(eventJson)
              .eventBusName(eventBusName)
              .build();

      PutEventsRequest putEventsRequest = PutEventsRequest.builder().entries(eventEntry).build();

      PutEventsResponse response = eventBridgeClient.putEvents(putEventsRequest);

      if (response.failedEntryCount() != null && response.failedEntryCount() > 0) {
        log.warn("AuditPublishFailed type={} jobId={} entries={}",
            event.eventType(), event.jobId(), response.entries());
      } else {
        log.info("AuditPublished type={} jobId={}", event.eventType(), event.jobId());
      }

    } catch (Exception e) {
      log.error("AuditPublishError type={} jobId={}", event.eventType(), event.jobId(), e);
    }
  }
}
