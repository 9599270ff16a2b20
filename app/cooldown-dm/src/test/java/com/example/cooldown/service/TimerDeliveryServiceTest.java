/*
 * Where: Cooldown delivery service unit test
 * What: per-record outcome handling of one poll cycle
 * Why: a failing DM or store write must not stop the rest of the batch
 */
package com.example.cooldown.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.example.cooldown.config.TimerDeliveryProperties;
import com.example.cooldown.config.UserProfileProperties;
import com.example.cooldown.model.TimerKind;
import com.example.cooldown.model.TimerRecord;
import com.example.cooldown.model.TimerStatus;
import com.example.cooldown.repository.TimerRepository;
import com.example.cooldown.repository.UserProfileRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class TimerDeliveryServiceTest {

  private static final Instant FIXED_NOW = Instant.parse("2026-01-17T03:00:01Z");
  private static final Instant DUE_AT = Instant.parse("2026-01-17T03:00:00Z");
  private static final TimerDeliveryProperties PROPERTIES =
      new TimerDeliveryProperties(true, Duration.ofSeconds(30), 50);
  private static final String SEOUL_MESSAGE = "🦌 루돌프 코 쿨타임 끝! (01/17 12:00)";

  @Mock private TimerRepository timerRepository;
  @Mock private UserProfileRepository userProfileRepository;
  @Mock private DiscordDmClient dmClient;

  private SimpleMeterRegistry registry;
  private TimerDeliveryService service;

  @BeforeEach
  void setUp() {
    registry = new SimpleMeterRegistry();
    final Clock clock = Clock.fixed(FIXED_NOW, ZoneOffset.UTC);
    service =
        new TimerDeliveryService(
            timerRepository,
            userProfileRepository,
            dmClient,
            new LocalTimeFormatter(new UserProfileProperties("Asia/Seoul")),
            PROPERTIES,
            new TimerDeliveryMetrics(registry),
            clock);
  }

  @Test
  void successfulDeliveryMarksSentAndRecordsOkProfile() {
    final TimerRecord record = scheduled("u1", TimerKind.RUDOLPH);
    when(timerRepository.fetchDue(50, FIXED_NOW)).thenReturn(List.of(record));
    when(userProfileRepository.findTimezone("u1")).thenReturn("Asia/Seoul");
    when(timerRepository.markSent("u1", TimerKind.RUDOLPH, FIXED_NOW)).thenReturn(1);

    final DeliveryBatchResult result = service.processDueBatch();

    assertThat(result).isEqualTo(new DeliveryBatchResult(false, 1, 1, 0));
    verify(dmClient).sendDirectMessage("u1", SEOUL_MESSAGE);
    verify(userProfileRepository).recordDeliveryResult("u1", true, null, FIXED_NOW);
    verify(timerRepository, never()).markFailed(any(), any(), any(), any());
    assertThat(
            registry
                .get("cooldown.delivery.total")
                .tag("result", "sent")
                .tag("timer_kind", "rudolph")
                .counter()
                .count())
        .isEqualTo(1.0d);
    assertThat(registry.get("cooldown.delivery.lag").timer().count()).isEqualTo(1L);
  }

  @Test
  void rejectedDeliveryMarksFailedWithStatusAndBody() {
    final TimerRecord record = scheduled("u1", TimerKind.RUDOLPH);
    when(timerRepository.fetchDue(50, FIXED_NOW)).thenReturn(List.of(record));
    when(userProfileRepository.findTimezone("u1")).thenReturn("Asia/Seoul");
    doThrow(new DiscordTransportException(403, "Cannot send messages to this user", null))
        .when(dmClient)
        .sendDirectMessage("u1", SEOUL_MESSAGE);

    final DeliveryBatchResult result = service.processDueBatch();

    assertThat(result).isEqualTo(new DeliveryBatchResult(false, 1, 0, 1));
    verify(timerRepository)
        .markFailed("u1", TimerKind.RUDOLPH, "403 Cannot send messages to this user", FIXED_NOW);
    verify(userProfileRepository)
        .recordDeliveryResult("u1", false, "403 Cannot send messages to this user", FIXED_NOW);
    verify(timerRepository, never()).markSent(any(), any(), any());
  }

  @Test
  void failingSecondOfThreeDoesNotStopTheOthers() {
    when(timerRepository.fetchDue(50, FIXED_NOW))
        .thenReturn(
            List.of(
                scheduled("u1", TimerKind.RUDOLPH),
                scheduled("u2", TimerKind.BANDAGE),
                scheduled("u3", TimerKind.RUDOLPH)));
    when(userProfileRepository.findTimezone(anyString())).thenReturn("Asia/Seoul");
    when(timerRepository.markSent(anyString(), any(), eq(FIXED_NOW))).thenReturn(1);
    lenient()
        .doThrow(
            new DiscordDeliveryException(
                DiscordDeliveryException.Reason.TIMEOUT, "discord request timeout: read"))
        .when(dmClient)
        .sendDirectMessage(eq("u2"), anyString());

    final DeliveryBatchResult result = service.processDueBatch();

    assertThat(result).isEqualTo(new DeliveryBatchResult(false, 3, 2, 1));
    verify(timerRepository).markSent("u1", TimerKind.RUDOLPH, FIXED_NOW);
    verify(timerRepository).markSent("u3", TimerKind.RUDOLPH, FIXED_NOW);
    verify(timerRepository)
        .markFailed("u2", TimerKind.BANDAGE, "discord request timeout: read", FIXED_NOW);
  }

  @Test
  void fetchFailureAbandonsCycleWithoutSending() {
    when(timerRepository.fetchDue(50, FIXED_NOW))
        .thenThrow(new DataAccessResourceFailureException("db down"));

    final DeliveryBatchResult result = service.processDueBatch();

    assertThat(result.fetchFailed()).isTrue();
    verifyNoInteractions(dmClient);
    assertThat(
            registry
                .get("cooldown.delivery.cycle.total")
                .tag("result", "fetch_failed")
                .counter()
                .count())
        .isEqualTo(1.0d);
  }

  @Test
  void storeWriteFailureKeepsSuccessOutcomeAndContinues() {
    when(timerRepository.fetchDue(50, FIXED_NOW))
        .thenReturn(List.of(scheduled("u1", TimerKind.RUDOLPH), scheduled("u2", TimerKind.BANDAGE)));
    when(userProfileRepository.findTimezone(anyString())).thenReturn("Asia/Seoul");
    when(timerRepository.markSent("u1", TimerKind.RUDOLPH, FIXED_NOW))
        .thenThrow(new DataAccessResourceFailureException("write lost"));
    when(timerRepository.markSent("u2", TimerKind.BANDAGE, FIXED_NOW)).thenReturn(1);

    final DeliveryBatchResult result = service.processDueBatch();

    assertThat(result).isEqualTo(new DeliveryBatchResult(false, 2, 2, 0));
    verify(userProfileRepository).recordDeliveryResult("u1", true, null, FIXED_NOW);
    verify(userProfileRepository).recordDeliveryResult("u2", true, null, FIXED_NOW);
  }

  @Test
  void unexpectedErrorMovesTimerOutOfScheduledAndClearsMdc() {
    when(timerRepository.fetchDue(50, FIXED_NOW))
        .thenReturn(List.of(scheduled("u1", TimerKind.RUDOLPH), scheduled("u2", TimerKind.BANDAGE)));
    when(userProfileRepository.findTimezone("u1")).thenThrow(new IllegalStateException("boom"));
    when(userProfileRepository.findTimezone("u2")).thenReturn("Asia/Seoul");
    when(timerRepository.markSent("u2", TimerKind.BANDAGE, FIXED_NOW)).thenReturn(1);

    final DeliveryBatchResult result = service.processDueBatch();

    assertThat(result).isEqualTo(new DeliveryBatchResult(false, 2, 1, 1));
    verify(dmClient, never()).sendDirectMessage(eq("u1"), anyString());
    verify(timerRepository).markFailed("u1", TimerKind.RUDOLPH, "boom", FIXED_NOW);
    verify(userProfileRepository, never())
        .recordDeliveryResult(eq("u1"), anyBoolean(), any(), any());
    assertThat(MDC.get("user_id")).isNull();
    assertThat(MDC.get("timer_kind")).isNull();
  }

  @Test
  void unexpectedErrorWhileRecordingFailureDoesNotStopBatch() {
    when(timerRepository.fetchDue(50, FIXED_NOW))
        .thenReturn(List.of(scheduled("u1", TimerKind.RUDOLPH), scheduled("u2", TimerKind.BANDAGE)));
    when(userProfileRepository.findTimezone("u1")).thenThrow(new IllegalStateException("boom"));
    when(userProfileRepository.findTimezone("u2")).thenReturn("Asia/Seoul");
    when(timerRepository.markFailed("u1", TimerKind.RUDOLPH, "boom", FIXED_NOW))
        .thenThrow(new IllegalStateException("still broken"));
    when(timerRepository.markSent("u2", TimerKind.BANDAGE, FIXED_NOW)).thenReturn(1);

    final DeliveryBatchResult result = service.processDueBatch();

    assertThat(result).isEqualTo(new DeliveryBatchResult(false, 2, 1, 1));
    verify(dmClient).sendDirectMessage(eq("u2"), anyString());
  }

  @Test
  void buildMessageFallsBackToDefaultZoneWhenLookupFails() {
    when(userProfileRepository.findTimezone("u1"))
        .thenThrow(new DataAccessResourceFailureException("db down"));

    assertThat(service.buildMessage(scheduled("u1", TimerKind.RUDOLPH))).isEqualTo(SEOUL_MESSAGE);
  }

  @Test
  void buildMessageFallsBackToDefaultZoneForInvalidZoneId() {
    when(userProfileRepository.findTimezone("u1")).thenReturn("Not/AZone");

    assertThat(service.buildMessage(scheduled("u1", TimerKind.RUDOLPH))).isEqualTo(SEOUL_MESSAGE);
  }

  @Test
  void buildMessageUsesUserZone() {
    when(userProfileRepository.findTimezone("u1")).thenReturn("America/New_York");

    assertThat(service.buildMessage(scheduled("u1", TimerKind.BANDAGE)))
        .isEqualTo("🩹 반창고 쿨타임 끝! (01/16 22:00)");
  }

  @Test
  void describeUsesClassNameWhenMessageIsMissing() {
    assertThat(TimerDeliveryService.describe(new IllegalStateException()))
        .isEqualTo("IllegalStateException");
    assertThat(TimerDeliveryService.describe(new IllegalStateException("x"))).isEqualTo("x");
  }

  private TimerRecord scheduled(String userId, TimerKind kind) {
    return new TimerRecord(
        userId, kind, TimerStatus.SCHEDULED, DUE_AT, DUE_AT.minus(kind.cooldown()), DUE_AT, null);
  }
}
