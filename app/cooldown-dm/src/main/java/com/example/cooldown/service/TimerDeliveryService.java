/*
 * Where: Cooldown service layer
 * What: one poll cycle of due timers: fetch, format, send the DM, record the outcome
 * Why: every due timer must end sent or canceled without one bad record blocking the batch
 */
package com.example.cooldown.service;

import com.example.cooldown.config.TimerDeliveryProperties;
import com.example.cooldown.model.TimerRecord;
import com.example.cooldown.repository.TimerRepository;
import com.example.cooldown.repository.UserProfileRepository;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Drives the {@code scheduled -> sent} and failure-driven {@code scheduled -> canceled} edges of a
 * timer.
 *
 * <p>Records are processed one at a time. Delivery errors are converted into persisted state and
 * a log line; they never escape the cycle. Timer and profile writes are independent and
 * best-effort: no transaction spans the two tables, so a write failure on one side is logged and
 * the other side is still attempted.
 */
@Service
@RequiredArgsConstructor
public class TimerDeliveryService {

  private static final Logger logger = LoggerFactory.getLogger(TimerDeliveryService.class);
  private static final String MDC_USER_ID = "user_id";
  private static final String MDC_TIMER_KIND = "timer_kind";

  private final TimerRepository timerRepository;
  private final UserProfileRepository userProfileRepository;
  private final DiscordDmClient dmClient;
  private final LocalTimeFormatter localTimeFormatter;
  private final TimerDeliveryProperties properties;
  private final TimerDeliveryMetrics metrics;
  private final Clock clock;

  public DeliveryBatchResult processDueBatch() {
    final Instant now = Instant.now(clock);
    final List<TimerRecord> due;
    try {
      due = timerRepository.fetchDue(properties.batchSize(), now);
    } catch (DataAccessException ex) {
      // nothing was claimed, so the next cycle picks the same rows up again
      logger.warn("due timer fetch failed; cycle abandoned", ex);
      metrics.recordCycleResult("fetch_failed");
      return DeliveryBatchResult.abandoned();
    }
    metrics.updateBatchCurrent(due.size());
    int sent = 0;
    int failed = 0;
    for (TimerRecord record : due) {
      if (deliverSafely(record)) {
        sent++;
      } else {
        failed++;
      }
    }
    metrics.recordCycleResult("completed");
    if (!due.isEmpty()) {
      logger.info("timer delivery cycle done fetched={} sent={} failed={}", due.size(), sent, failed);
    }
    return new DeliveryBatchResult(false, due.size(), sent, failed);
  }

  private boolean deliverSafely(TimerRecord record) {
    MDC.put(MDC_USER_ID, record.discordUserId());
    MDC.put(MDC_TIMER_KIND, record.kind().value());
    try {
      return deliver(record);
    } catch (RuntimeException ex) {
      logger.error(
          "timer delivery aborted unexpectedly userId={} kind={}",
          record.discordUserId(),
          record.kind().value(),
          ex);
      // not a delivery verdict; the profile DM status stays as it was
      try {
        timerRepository.markFailed(
            record.discordUserId(), record.kind(), describe(ex), Instant.now(clock));
      } catch (RuntimeException recordEx) {
        logger.warn(
            "timer failure not recorded after unexpected error userId={} kind={}",
            record.discordUserId(),
            record.kind().value(),
            recordEx);
      }
      metrics.recordDeliveryResult("error", record.kind().value());
      return false;
    } finally {
      MDC.remove(MDC_USER_ID);
      MDC.remove(MDC_TIMER_KIND);
    }
  }

  @VisibleForTesting
  boolean deliver(TimerRecord record) {
    final String message = buildMessage(record);
    try {
      dmClient.sendDirectMessage(record.discordUserId(), message);
    } catch (RuntimeException ex) {
      // DiscordTransportException already reads "<status> <body>"
      handleFailure(record, describe(ex), ex);
      return false;
    }
    handleSuccess(record);
    return true;
  }

  @VisibleForTesting
  String buildMessage(TimerRecord record) {
    final String localDueAt = localTimeFormatter.format(record.dueAt(), resolveTimezone(record));
    return record.kind().formatMessage(localDueAt);
  }

  private String resolveTimezone(TimerRecord record) {
    try {
      return userProfileRepository.findTimezone(record.discordUserId());
    } catch (DataAccessException ex) {
      // the formatter falls back to the default zone for a null id
      logger.warn("timezone lookup failed userId={}; using default zone", record.discordUserId(), ex);
      return null;
    }
  }

  private void handleSuccess(TimerRecord record) {
    final Instant sentAt = Instant.now(clock);
    try {
      final int updated = timerRepository.markSent(record.discordUserId(), record.kind(), sentAt);
      if (updated == 0) {
        logger.warn(
            "timer sent but row was not found userId={} kind={}",
            record.discordUserId(),
            record.kind().value());
      }
    } catch (DataAccessException ex) {
      logger.warn(
          "timer sent but mark_sent failed userId={} kind={}",
          record.discordUserId(),
          record.kind().value(),
          ex);
    }
    try {
      userProfileRepository.recordDeliveryResult(record.discordUserId(), true, null, sentAt);
    } catch (DataAccessException ex) {
      logger.warn("delivery success not recorded on profile userId={}", record.discordUserId(), ex);
    }
    metrics.recordDeliveryResult("sent", record.kind().value());
    metrics.recordDeliveryLag(record.dueAt(), sentAt);
  }

  private void handleFailure(TimerRecord record, String reason, RuntimeException cause) {
    logger.warn(
        "timer delivery failed userId={} kind={} reason={}",
        record.discordUserId(),
        record.kind().value(),
        reason,
        cause);
    final Instant failedAt = Instant.now(clock);
    try {
      timerRepository.markFailed(record.discordUserId(), record.kind(), reason, failedAt);
    } catch (DataAccessException ex) {
      logger.warn(
          "timer failure not recorded userId={} kind={}",
          record.discordUserId(),
          record.kind().value(),
          ex);
    }
    try {
      userProfileRepository.recordDeliveryResult(record.discordUserId(), false, reason, failedAt);
    } catch (DataAccessException ex) {
      logger.warn("delivery failure not recorded on profile userId={}", record.discordUserId(), ex);
    }
    metrics.recordDeliveryResult("failed", record.kind().value());
  }

  @VisibleForTesting
  static String describe(RuntimeException ex) {
    final String message = ex.getMessage();
    if (message == null || message.isBlank()) {
      return ex.getClass().getSimpleName();
    }
    return message;
  }
}
