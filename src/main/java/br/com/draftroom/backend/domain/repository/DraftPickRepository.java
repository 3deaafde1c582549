package br.com.draftroom.backend.domain.repository;

import br.com.draftroom.backend.domain.entity.DraftPickEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DraftPickRepository extends JpaRepository<DraftPickEntity, Long> {
    List<DraftPickEntity> findByRoomIdOrderByPickNumberAsc(String roomId);

    long countByRoomId(String roomId);
}
