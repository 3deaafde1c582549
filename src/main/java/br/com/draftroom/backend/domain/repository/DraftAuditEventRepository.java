package br.com.draftroom.backend.domain.repository;

import br.com.draftroom.backend.domain.entity.DraftAuditEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface DraftAuditEventRepository extends JpaRepository<DraftAuditEvent, Long> {
    Optional<DraftAuditEvent> findTopByRoomIdOrderByIdDesc(String roomId);

    List<DraftAuditEvent> findByRoomIdOrderByIdAsc(String roomId);
}
