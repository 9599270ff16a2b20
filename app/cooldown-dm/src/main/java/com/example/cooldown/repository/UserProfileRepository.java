/*
 * Where: Cooldown data access
 * What: reads and writes the discord_users table (DM health and timezone)
 * Why: rows are created lazily by the first delivery attempt or timezone submission
 */
package com.example.cooldown.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;
import static com.example.common.StringLimits.truncate;

import com.example.cooldown.config.UserProfileProperties;
import com.example.cooldown.model.DeliveryStatus;
import com.example.cooldown.model.UserProfileRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class UserProfileRepository {

  public static final int LAST_ERROR_MAX_LENGTH = 800;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final UserProfileProperties properties;

  public Optional<UserProfileRecord> findByUserId(String discordUserId) {
    final String sql =
        """
        SELECT discord_user_id, dm_status, dm_last_error, dm_ok_at, tz, updated_at
        FROM discord_users
        WHERE discord_user_id = :discordUserId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("discordUserId", discordUserId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public boolean isDeliveryReady(String discordUserId) {
    return findByUserId(discordUserId).map(UserProfileRecord::deliveryReady).orElse(false);
  }

  /**
   * Upserts the outcome of a DM attempt. dm_ok_at only moves forward on success; a failure keeps
   * the previous success time.
   */
  public void recordDeliveryResult(String discordUserId, boolean ok, String error, Instant now) {
    final String sql =
        """
        INSERT INTO discord_users (discord_user_id, dm_status, dm_last_error, dm_ok_at, updated_at)
        VALUES (:discordUserId, :dmStatus, :dmLastError, :dmOkAt, :now)
        ON CONFLICT (discord_user_id) DO UPDATE
        SET dm_status = EXCLUDED.dm_status,
            dm_last_error = EXCLUDED.dm_last_error,
            dm_ok_at = COALESCE(EXCLUDED.dm_ok_at, discord_users.dm_ok_at),
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("discordUserId", discordUserId)
            .addValue("dmStatus", ok ? DeliveryStatus.OK.value() : DeliveryStatus.FAIL.value())
            .addValue(
                "dmLastError",
                ok ? null : truncate(error == null ? "" : error, LAST_ERROR_MAX_LENGTH))
            .addValue("dmOkAt", ok ? toTimestamp(now) : null)
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }

  /** Stores a timezone id. The caller validates the IANA format first. */
  public void updateTimezone(String discordUserId, String timezone, Instant now) {
    final String sql =
        """
        INSERT INTO discord_users (discord_user_id, dm_status, tz, updated_at)
        VALUES (:discordUserId, 'unknown', :tz, :now)
        ON CONFLICT (discord_user_id) DO UPDATE
        SET tz = EXCLUDED.tz,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("discordUserId", discordUserId)
            .addValue("tz", timezone)
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }

  public String findTimezone(String discordUserId) {
    return findByUserId(discordUserId)
        .map(UserProfileRecord::timezone)
        .filter(tz -> !tz.isBlank())
        .orElse(properties.defaultTimezone());
  }

  private UserProfileRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new UserProfileRecord(
        rs.getString("discord_user_id"),
        DeliveryStatus.fromValue(rs.getString("dm_status")),
        rs.getString("dm_last_error"),
        toInstant(rs.getTimestamp("dm_ok_at")),
        rs.getString("tz"),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
