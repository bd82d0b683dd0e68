package com.badmintongroup.discovery.repository;

import com.badmintongroup.discovery.model.SessionRecord;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Discovery が読み取るセッションストア。
 *
 * <p>実装は {@link org.springframework.dao.DataAccessException} で失敗を通知する。
 */
public interface SessionCandidateRepository {

  /** scheduledAt 昇順 (同時刻は id 昇順) で predicate に一致する候補を 1 ページ分返す。 */
  List<SessionRecord> findCandidates(CoarsePredicate predicate, int limit, int offset);

  long count(CoarsePredicate predicate);

  Optional<SessionRecord> findById(String sessionId);

  /** now 以降の公開 ACTIVE セッションを参加人数の多い順に返す。 */
  List<SessionRecord> findPopular(Instant now, int limit);

  /** now 以降で座標を持つ公開 ACTIVE セッションを scheduledAt 昇順に返す。 */
  List<SessionRecord> findUpcomingWithCoordinates(Instant now, int limit);
}
