package com.github.spud.apply.orchestrator.infrastructure.persistence.repository;

import com.github.spud.apply.orchestrator.infrastructure.persistence.entity.SessionTimelineEvent;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SessionTimelineEventRepository extends JpaRepository<SessionTimelineEvent, UUID> {

  default List<SessionTimelineEvent> listEvents(String sessionId, long sinceSequence) {
    return findAllBySessionIdAndSeqGreaterThanOrderBySeqAsc(sessionId, sinceSequence);
  }

  List<SessionTimelineEvent> findAllBySessionIdAndSeqGreaterThanOrderBySeqAsc(String sessionId,
    Long seq);

  Optional<SessionTimelineEvent> findFirstBySessionIdOrderBySeqDesc(String sessionId);

  long countBySessionId(String sessionId);
}
