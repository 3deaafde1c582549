package br.com.draftroom.backend.domain.repository;

import br.com.draftroom.backend.domain.entity.DraftRoomEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface DraftRoomRepository extends JpaRepository<DraftRoomEntity, String> {
    List<DraftRoomEntity> findByStatusIn(Collection<String> statuses);
}
