/*
 * Where: Cooldown repository integration test
 * What: profile upserts, truncation and timezone fallback against Postgres
 * Why: Upsert and COALESCE behaviour depend on the real dialect
 */
package com.example.cooldown.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.cooldown.AbstractPostgresContainerTest;
import com.example.cooldown.model.DeliveryStatus;
import com.example.cooldown.model.UserProfileRecord;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class UserProfileRepositoryTest extends AbstractPostgresContainerTest {

  private static final Instant T0 = Instant.parse("2026-01-17T00:00:00Z");

  @Autowired private UserProfileRepository userProfileRepository;
  @Autowired private NamedParameterJdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanup() {
    jdbcTemplate.update("DELETE FROM discord_users", new MapSqlParameterSource());
  }

  @Test
  void missingProfileIsNotReadyAndUsesDefaultZone() {
    assertThat(userProfileRepository.findByUserId("u1")).isEmpty();
    assertThat(userProfileRepository.isDeliveryReady("u1")).isFalse();
    assertThat(userProfileRepository.findTimezone("u1")).isEqualTo("Asia/Seoul");
  }

  @Test
  void successThenFailureKeepsLastSuccessTime() {
    userProfileRepository.recordDeliveryResult("u1", true, null, T0);
    assertThat(userProfileRepository.isDeliveryReady("u1")).isTrue();

    final Instant later = T0.plusSeconds(600);
    userProfileRepository.recordDeliveryResult("u1", false, "403 Cannot send", later);

    final UserProfileRecord profile = userProfileRepository.findByUserId("u1").orElseThrow();
    assertThat(profile.dmStatus()).isEqualTo(DeliveryStatus.FAIL);
    assertThat(profile.dmLastError()).isEqualTo("403 Cannot send");
    assertThat(profile.dmOkAt()).isEqualTo(T0);
    assertThat(profile.updatedAt()).isEqualTo(later);
    assertThat(userProfileRepository.isDeliveryReady("u1")).isFalse();
  }

  @Test
  void successClearsPreviousError() {
    userProfileRepository.recordDeliveryResult("u1", false, "boom", T0);
    userProfileRepository.recordDeliveryResult("u1", true, null, T0.plusSeconds(1));

    final UserProfileRecord profile = userProfileRepository.findByUserId("u1").orElseThrow();
    assertThat(profile.dmStatus()).isEqualTo(DeliveryStatus.OK);
    assertThat(profile.dmLastError()).isNull();
    assertThat(profile.dmOkAt()).isEqualTo(T0.plusSeconds(1));
  }

  @Test
  void failureErrorIsTruncatedTo800Characters() {
    userProfileRepository.recordDeliveryResult("u1", false, "e".repeat(2000), T0);

    assertThat(userProfileRepository.findByUserId("u1").orElseThrow().dmLastError())
        .hasSize(UserProfileRepository.LAST_ERROR_MAX_LENGTH);
  }

  @Test
  void timezoneSubmissionCreatesUnknownProfileAndKeepsDeliveryState() {
    userProfileRepository.updateTimezone("u1", "Europe/Paris", T0);

    UserProfileRecord profile = userProfileRepository.findByUserId("u1").orElseThrow();
    assertThat(profile.dmStatus()).isEqualTo(DeliveryStatus.UNKNOWN);
    assertThat(userProfileRepository.findTimezone("u1")).isEqualTo("Europe/Paris");

    userProfileRepository.recordDeliveryResult("u1", true, null, T0.plusSeconds(5));
    userProfileRepository.updateTimezone("u1", "America/New_York", T0.plusSeconds(10));

    profile = userProfileRepository.findByUserId("u1").orElseThrow();
    assertThat(profile.dmStatus()).isEqualTo(DeliveryStatus.OK);
    assertThat(profile.timezone()).isEqualTo("America/New_York");
  }
}
