package br.com.draftroom.backend.service;

import br.com.draftroom.backend.service.draft.DraftRoom;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Salas vivas desta instância. Salas completas saem daqui e passam a ser lidas do banco.
 */
@Component
public class DraftRoomRegistry {

    private final Map<String, DraftRoom> rooms = new ConcurrentHashMap<>();

    public void register(DraftRoom room) {
        rooms.put(room.getId(), room);
    }

    /**
     * Registra a sala se ninguém registrou antes.
     *
     * @return a instância que ficou no registro
     */
    public DraftRoom registerIfAbsent(DraftRoom room) {
        DraftRoom existing = rooms.putIfAbsent(room.getId(), room);
        return existing == null ? room : existing;
    }

    public Optional<DraftRoom> find(String roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    public void remove(String roomId) {
        rooms.remove(roomId);
    }

    public Collection<DraftRoom> liveRooms() {
        return List.copyOf(rooms.values());
    }

    public int size() {
        return rooms.size();
    }
}
