/*
 * どこで: Discovery データアクセス
 * 何を: mvp_sessions / mvp_players から検索候補を読み出す
 * なぜ: 粗い条件だけを SQL に押し下げ、残りの絞り込みはアプリ側で行うため
 */
package com.badmintongroup.discovery.repository;

import static com.badmintongroup.common.JdbcTimestampUtils.toInstant;
import static com.badmintongroup.common.JdbcTimestampUtils.toTimestamp;

import com.badmintongroup.discovery.model.SessionRecord;
import com.badmintongroup.discovery.model.SessionStatus;
import com.badmintongroup.discovery.model.SessionVisibility;
import com.badmintongroup.discovery.model.SkillLevel;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcSessionCandidateRepository implements SessionCandidateRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT s.id, s.name, s.location, s.latitude, s.longitude, s.scheduled_at,
             s.max_players, s.skill_level, s.court_type, s.visibility, s.status,
             s.owner_name, s.share_code,
             (SELECT COUNT(*) FROM mvp_players p
               WHERE p.session_id = s.id AND p.status = 'ACTIVE') AS current_players
      FROM mvp_sessions s
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public List<SessionRecord> findCandidates(CoarsePredicate predicate, int limit, int offset) {
    final MapSqlParameterSource params = new MapSqlParameterSource();
    final String sql =
        SELECT_COLUMNS
            + whereClause(predicate, params)
            + """
            ORDER BY s.scheduled_at ASC, s.id ASC
            LIMIT :limit OFFSET :offset
            """;
    params.addValue("limit", limit).addValue("offset", offset);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public long count(CoarsePredicate predicate) {
    final MapSqlParameterSource params = new MapSqlParameterSource();
    final String sql = "SELECT COUNT(*) FROM mvp_sessions s\n" + whereClause(predicate, params);
    final Long count = jdbcTemplate.queryForObject(sql, params, Long.class);
    return count == null ? 0L : count;
  }

  @Override
  public Optional<SessionRecord> findById(String sessionId) {
    final String sql = SELECT_COLUMNS + "WHERE s.id = :id\n";
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("id", sessionId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public List<SessionRecord> findPopular(Instant now, int limit) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE s.status = 'ACTIVE'
              AND s.visibility = 'PUBLIC'
              AND s.scheduled_at >= :now
            ORDER BY current_players DESC, s.scheduled_at ASC, s.id ASC
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public List<SessionRecord> findUpcomingWithCoordinates(Instant now, int limit) {
    final String sql =
        SELECT_COLUMNS
            + """
            WHERE s.status = 'ACTIVE'
              AND s.visibility = 'PUBLIC'
              AND s.scheduled_at >= :now
              AND s.latitude IS NOT NULL
              AND s.longitude IS NOT NULL
            ORDER BY s.scheduled_at ASC, s.id ASC
            LIMIT :limit
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("now", toTimestamp(now)).addValue("limit", limit);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private String whereClause(CoarsePredicate predicate, MapSqlParameterSource params) {
    final StringBuilder where =
        new StringBuilder("WHERE s.status = 'ACTIVE'\n  AND s.visibility = 'PUBLIC'\n");
    if (predicate.skillLevel() != null) {
      where.append("  AND s.skill_level = :skillLevel\n");
      params.addValue("skillLevel", predicate.skillLevel().name());
    }
    if (predicate.courtType() != null) {
      where.append("  AND s.court_type = :courtType\n");
      params.addValue("courtType", predicate.courtType());
    }
    if (predicate.scheduledFrom() != null) {
      where.append("  AND s.scheduled_at >= :scheduledFrom\n");
      params.addValue("scheduledFrom", toTimestamp(predicate.scheduledFrom()));
    }
    if (predicate.scheduledTo() != null) {
      where.append("  AND s.scheduled_at <= :scheduledTo\n");
      params.addValue("scheduledTo", toTimestamp(predicate.scheduledTo()));
    }
    if (predicate.requireCoordinates()) {
      where.append("  AND s.latitude IS NOT NULL\n  AND s.longitude IS NOT NULL\n");
    }
    return where.toString();
  }

  private SessionRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String skillLevel = rs.getString("skill_level");
    return new SessionRecord(
        rs.getString("id"),
        rs.getString("name"),
        rs.getString("location"),
        rs.getObject("latitude", Double.class),
        rs.getObject("longitude", Double.class),
        toInstant(rs.getTimestamp("scheduled_at")),
        rs.getInt("max_players"),
        rs.getInt("current_players"),
        skillLevel == null ? null : SkillLevel.valueOf(skillLevel),
        rs.getString("court_type"),
        SessionVisibility.valueOf(rs.getString("visibility")),
        SessionStatus.valueOf(rs.getString("status")),
        rs.getString("owner_name"),
        rs.getString("share_code"));
  }
}
