/*
 * Where: Cooldown service layer
 * What: timezone submission, DM health, test DM and banner state for the signed-in user
 * Why: a user must pass a test DM before timers can be armed
 */
package com.example.cooldown.service;

import com.example.cooldown.api.response.BannerResponse;
import com.example.cooldown.api.response.DmHealthResponse;
import com.example.cooldown.api.response.TestSendResponse;
import com.example.cooldown.api.response.TimezoneResponse;
import com.example.cooldown.model.DeliveryStatus;
import com.example.cooldown.model.UserProfileRecord;
import com.example.cooldown.repository.UserProfileRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class UserProfileService {

  static final int TIMEZONE_MAX_LENGTH = 64;
  static final String TEST_MESSAGE = "✅ 테스트 DM: 테스트 메시지가 정상적으로 도착했어요!";

  private static final Logger logger = LoggerFactory.getLogger(UserProfileService.class);
  private static final String TEST_SENT_MESSAGE = "✅ 테스트 DM을 보냈어요! (Discord DM 확인)";
  private static final String TEST_REJECTED_GUIDANCE =
      "→ 개인 서버에 봇을 초대했는지 확인하고, 디스코드에서 서버/DM 설정을 확인해 주세요.";

  private final UserProfileRepository userProfileRepository;
  private final DiscordDmClient dmClient;
  private final Clock clock;

  /** Stores a browser-reported IANA zone id. Writes only when it differs from the stored one. */
  public TimezoneResponse updateTimezone(String discordUserId, String rawTimezone) {
    final String tz = validateTimezone(rawTimezone);
    final String current =
        userProfileRepository.findByUserId(discordUserId).map(UserProfileRecord::timezone).orElse(null);
    if (!tz.equals(current)) {
      userProfileRepository.updateTimezone(discordUserId, tz, Instant.now(clock));
      logger.info("timezone updated userId={} tz={}", discordUserId, tz);
    }
    return new TimezoneResponse(true, tz);
  }

  public DmHealthResponse health(String discordUserId) {
    final Optional<UserProfileRecord> profile = userProfileRepository.findByUserId(discordUserId);
    if (profile.isEmpty()) {
      return new DmHealthResponse(discordUserId, DeliveryStatus.UNKNOWN.value(), null, null, null);
    }
    final UserProfileRecord record = profile.get();
    return new DmHealthResponse(
        record.discordUserId(),
        record.dmStatus().value(),
        record.dmLastError(),
        record.dmOkAt(),
        record.timezone());
  }

  /** Sends a fixed DM and records the result, which is what makes the user delivery-ready. */
  public TestSendResponse sendTestMessage(String discordUserId) {
    try {
      dmClient.sendDirectMessage(discordUserId, TEST_MESSAGE);
    } catch (DiscordTransportException ex) {
      userProfileRepository.recordDeliveryResult(
          discordUserId, false, ex.getMessage(), Instant.now(clock));
      logger.warn("test DM rejected userId={} status={}", discordUserId, ex.statusCode(), ex);
      throw new TestDmFailedException(TEST_REJECTED_GUIDANCE, ex);
    } catch (RuntimeException ex) {
      final String reason = TimerDeliveryService.describe(ex);
      userProfileRepository.recordDeliveryResult(discordUserId, false, reason, Instant.now(clock));
      logger.warn("test DM failed userId={}", discordUserId, ex);
      throw new TestDmFailedException("❌ DM 전송 실패: " + reason, ex);
    }
    userProfileRepository.recordDeliveryResult(discordUserId, true, null, Instant.now(clock));
    return new TestSendResponse(true, TEST_SENT_MESSAGE);
  }

  public BannerResponse banner(Optional<String> discordUserId) {
    if (discordUserId.isEmpty()) {
      return BannerResponse.anonymous();
    }
    return BannerResponse.of(userProfileRepository.isDeliveryReady(discordUserId.get()));
  }

  static String validateTimezone(String rawTimezone) {
    final String tz = rawTimezone == null ? "" : rawTimezone.trim();
    if (tz.isEmpty() || tz.length() > TIMEZONE_MAX_LENGTH || !tz.contains("/")) {
      throw new InvalidTimezoneException("bad tz");
    }
    return tz;
  }
}
