/*
 * Where: Cooldown service layer
 * What: arms, cancels and lists a user's cooldown timers
 * Why: keep the request-side state changes next to the same store the poller reads
 */
package com.example.cooldown.service;

import com.example.cooldown.api.response.TimerArmResponse;
import com.example.cooldown.api.response.TimerCancelResponse;
import com.example.cooldown.api.response.TimerStatusResponse;
import com.example.cooldown.api.response.TimerView;
import com.example.cooldown.model.TimerKind;
import com.example.cooldown.model.TimerRecord;
import com.example.cooldown.model.TimerStatus;
import com.example.cooldown.repository.TimerRepository;
import com.example.cooldown.repository.UserProfileRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class TimerService {

  static final String USER_CANCEL_REASON = "user_canceled";

  private static final Logger logger = LoggerFactory.getLogger(TimerService.class);
  private static final String DM_NOT_READY_MESSAGE =
      "DM 알림을 받으려면 먼저 개인 서버에 봇을 초대하고, ‘테스트 DM’으로 활성화를 확인해 주세요.";

  private final TimerRepository timerRepository;
  private final UserProfileRepository userProfileRepository;
  private final LocalTimeFormatter localTimeFormatter;
  private final Clock clock;

  /** (Re-)arms a timer: due = now + cooldown, whatever the previous state was. */
  public TimerArmResponse arm(String discordUserId, String timerType) {
    final TimerKind kind = TimerKind.fromValue(timerType);
    if (!userProfileRepository.isDeliveryReady(discordUserId)) {
      throw new DmNotReadyException(DM_NOT_READY_MESSAGE);
    }
    final Instant now = Instant.now(clock);
    final Instant dueAt = now.plus(kind.cooldown());
    timerRepository.upsert(discordUserId, kind, dueAt, now);
    final String tz = userProfileRepository.findTimezone(discordUserId);
    logger.info("timer armed userId={} kind={} dueAt={}", discordUserId, kind.value(), dueAt);
    return new TimerArmResponse(
        kind.value(), kind.displayLabel(), dueAt, localTimeFormatter.format(dueAt, tz), tz);
  }

  public TimerCancelResponse cancel(String discordUserId, String timerType) {
    final TimerKind kind = TimerKind.fromValue(timerType);
    final int updated =
        timerRepository.cancel(discordUserId, kind, USER_CANCEL_REASON, Instant.now(clock));
    logger.info("timer canceled userId={} kind={} rows={}", discordUserId, kind.value(), updated);
    return new TimerCancelResponse(kind.value(), kind.displayLabel(), TimerStatus.CANCELED.value());
  }

  public TimerStatusResponse status(String discordUserId) {
    final Instant now = Instant.now(clock);
    final String tz = userProfileRepository.findTimezone(discordUserId);
    final Map<TimerKind, TimerRecord> timers = timerRepository.findAllByUser(discordUserId);
    final Map<String, TimerView> views = new LinkedHashMap<>();
    for (TimerKind kind : TimerKind.values()) {
      views.put(kind.value(), toView(timers.get(kind), tz));
    }
    return new TimerStatusResponse(now, localTimeFormatter.format(now, tz), tz, views);
  }

  private TimerView toView(TimerRecord record, String tz) {
    if (record == null) {
      return null;
    }
    return new TimerView(
        record.kind().value(),
        record.status().value(),
        record.lastSetAt(),
        record.dueAt(),
        localTimeFormatter.format(record.lastSetAt(), tz),
        localTimeFormatter.format(record.dueAt(), tz),
        record.failReason());
  }
}
