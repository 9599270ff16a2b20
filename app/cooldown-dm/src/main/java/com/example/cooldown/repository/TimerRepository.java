/*
 * Where: Cooldown data access
 * What: reads and writes the user_timers table
 * Why: arm/cancel API and the due-timer poller share one store contract
 */
package com.example.cooldown.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;
import static com.example.common.StringLimits.truncate;

import com.example.cooldown.model.TimerKind;
import com.example.cooldown.model.TimerRecord;
import com.example.cooldown.model.TimerStatus;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Store for per-user, per-kind cooldown timers.
 *
 * <p>Every write is a single statement with last-writer-wins semantics. The arm/cancel API and
 * the poller may update the same row concurrently; whichever statement commits last decides
 * the terminal state.
 */
@Repository
@RequiredArgsConstructor
public class TimerRepository {

  public static final int FAIL_REASON_MAX_LENGTH = 400;

  private static final String SELECT_COLUMNS =
      """
      SELECT discord_user_id, timer_type, status, due_at, last_set_at, updated_at, fail_reason
      FROM user_timers
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  /** Arms (or re-arms) a timer. Insert and overwrite are the same operation. */
  public void upsert(String discordUserId, TimerKind kind, Instant dueAt, Instant now) {
    final String sql =
        """
        INSERT INTO user_timers (
          discord_user_id,
          timer_type,
          status,
          due_at,
          last_set_at,
          updated_at,
          fail_reason
        ) VALUES (
          :discordUserId,
          :timerType,
          'scheduled',
          :dueAt,
          :now,
          :now,
          NULL
        )
        ON CONFLICT (discord_user_id, timer_type) DO UPDATE
        SET status = EXCLUDED.status,
            due_at = EXCLUDED.due_at,
            last_set_at = EXCLUDED.last_set_at,
            updated_at = EXCLUDED.updated_at,
            fail_reason = NULL
        """;
    final MapSqlParameterSource params =
        keyParams(discordUserId, kind)
            .addValue("dueAt", toTimestamp(dueAt))
            .addValue("now", toTimestamp(now));
    jdbcTemplate.update(sql, params);
  }

  public int cancel(String discordUserId, TimerKind kind, String reason, Instant now) {
    return updateStatus(discordUserId, kind, TimerStatus.CANCELED, reason, now);
  }

  public Map<TimerKind, TimerRecord> findAllByUser(String discordUserId) {
    final String sql = SELECT_COLUMNS + "WHERE discord_user_id = :discordUserId";
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("discordUserId", discordUserId);
    final Map<TimerKind, TimerRecord> timers = new EnumMap<>(TimerKind.class);
    for (TimerRecord record : jdbcTemplate.query(sql, params, this::mapRow)) {
      timers.put(record.kind(), record);
    }
    return timers;
  }

  /**
   * Returns at most {@code limit} scheduled timers whose due time is at or before {@code now}.
   * Oldest due first so that a backlog larger than one batch drains in arrival order.
   */
  public List<TimerRecord> fetchDue(int limit, Instant now) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE status = 'scheduled'
              AND due_at <= :now
            ORDER BY due_at, discord_user_id, timer_type
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  public int markSent(String discordUserId, TimerKind kind, Instant now) {
    return updateStatus(discordUserId, kind, TimerStatus.SENT, null, now);
  }

  /** Failed delivery ends as {@code canceled}; the stored reason carries the upstream error. */
  public int markFailed(String discordUserId, TimerKind kind, String reason, Instant now) {
    return updateStatus(
        discordUserId, kind, TimerStatus.CANCELED, truncate(reason, FAIL_REASON_MAX_LENGTH), now);
  }

  private int updateStatus(
      String discordUserId, TimerKind kind, TimerStatus status, String failReason, Instant now) {
    final String sql =
        """
        UPDATE user_timers
        SET status = :status,
            updated_at = :now,
            fail_reason = :failReason
        WHERE discord_user_id = :discordUserId
          AND timer_type = :timerType
        """;
    final MapSqlParameterSource params =
        keyParams(discordUserId, kind)
            .addValue("status", status.value())
            .addValue("failReason", failReason)
            .addValue("now", toTimestamp(now));
    return jdbcTemplate.update(sql, params);
  }

  private MapSqlParameterSource keyParams(String discordUserId, TimerKind kind) {
    return new MapSqlParameterSource()
        .addValue("discordUserId", discordUserId)
        .addValue("timerType", kind.value());
  }

  private TimerRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new TimerRecord(
        rs.getString("discord_user_id"),
        TimerKind.fromValue(rs.getString("timer_type")),
        TimerStatus.fromValue(rs.getString("status")),
        toInstant(rs.getTimestamp("due_at")),
        toInstant(rs.getTimestamp("last_set_at")),
        toInstant(rs.getTimestamp("updated_at")),
        rs.getString("fail_reason"));
  }
}
