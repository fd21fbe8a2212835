package com.github.spud.apply.orchestrator.infrastructure.persistence.repository;

import com.github.spud.apply.orchestrator.domain.session.SessionStatus;
import com.github.spud.apply.orchestrator.infrastructure.persistence.entity.ApplicationSession;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ApplicationSessionRepository extends JpaRepository<ApplicationSession, String> {

  List<ApplicationSession> findAllByOrderByCreatedAtAsc();

  List<ApplicationSession> findAllByStatusOrderByCreatedAtAsc(SessionStatus status);

}
