package br.com.draftroom.backend.domain.repository;

import br.com.draftroom.backend.domain.entity.DraftSeatEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface DraftSeatRepository extends JpaRepository<DraftSeatEntity, Long> {
    List<DraftSeatEntity> findByRoomIdOrderBySeatIndexAsc(String roomId);

    Optional<DraftSeatEntity> findByRoomIdAndSeatIndex(String roomId, Integer seatIndex);
}
