package com.ktb.roomchat.service;

import com.ktb.roomchat.model.Session;
import com.ktb.roomchat.repository.DirectoryKeys;
import com.ktb.roomchat.repository.DirectoryRow;
import com.ktb.roomchat.repository.DirectoryStore;
import com.ktb.roomchat.repository.DirectoryStoreException;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 연결 → 닉네임 → 방 디렉터리 관리.
 *
 * 닉네임과 방은 같은 handle 을 partitionKey 로 갖는 별도 행으로 저장된다.
 * - username:{name}
 * - room:{roomName}
 * - node:{nodeId}  (연결을 가진 서버)
 *
 * 같은 handle 에 대한 read-then-write 는 직렬화되지 않는다 (last-write-wins).
 * destroySession 을 제외한 모든 메서드는 저장소 오류를 그대로 전파한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionRouter {

    private final DirectoryStore directoryStore;

    /**
     * 빈 닉네임 행을 기록한다. 중복 connect 알림이 와도 같은 행을 덮어쓸 뿐이다.
     */
    public void createSession(String handle) {
        directoryStore.put(new DirectoryRow(handle, DirectoryKeys.username("")));
    }

    public Session getSession(String handle) {
        List<DirectoryRow> rows = directoryStore.getAll(handle);

        String username = pick(handle, rows, DirectoryKeys.USERNAME).orElse("");
        String room = pick(handle, rows, DirectoryKeys.ROOM).orElse(null);
        return new Session(handle, username, room);
    }

    /**
     * 닉네임은 sortKey 의 일부라서 수정이 아니라 삭제 후 재기록이다.
     * oldName 이 "" (첫 로그인) 이거나 newName 과 같아도 결과는 username:{newName} 한 행.
     * 경합으로 남은 다른 username 행도 함께 지운다.
     */
    public void setUsername(String handle, String oldName, String newName) {
        String newKey = DirectoryKeys.username(newName);
        directoryStore.delete(handle, DirectoryKeys.username(oldName));
        for (DirectoryRow row : directoryStore.getAll(handle)) {
            boolean staleName = DirectoryKeys.valueOf(row.sortKey(), DirectoryKeys.USERNAME).isPresent()
                    && !row.sortKey().equals(newKey);
            if (staleName) {
                directoryStore.delete(handle, row.sortKey());
            }
        }
        directoryStore.put(new DirectoryRow(handle, newKey));
    }

    /**
     * 연결이 붙어 있는 노드를 기록한다. 다른 노드는 이 값을 보고 전송을 중계한다.
     */
    public void claimConnection(String handle, String nodeId) {
        directoryStore.put(new DirectoryRow(handle, DirectoryKeys.node(nodeId)));
    }

    public Optional<String> ownerOf(String handle) {
        return pick(handle, directoryStore.getAll(handle), DirectoryKeys.NODE);
    }

    public void setRoom(String handle, String room) {
        directoryStore.put(new DirectoryRow(handle, DirectoryKeys.room(room)));
    }

    /**
     * 정확한 키로 삭제하므로 getSession 으로 읽은 현재 방 이름을 넘겨야 한다.
     */
    public void clearRoom(String handle, String room) {
        directoryStore.delete(handle, DirectoryKeys.room(room));
    }

    public Set<String> listRoomMembers(String room) {
        Set<String> handles = new LinkedHashSet<>();
        for (DirectoryRow row : directoryStore.queryBySortKey(DirectoryKeys.room(room))) {
            handles.add(row.partitionKey());
        }
        return handles;
    }

    /**
     * 전체 스캔. /ls (방 밖) 에서만 쓰인다.
     */
    public Set<String> listRooms() {
        Set<String> rooms = new TreeSet<>();
        for (DirectoryRow row : directoryStore.scan()) {
            DirectoryKeys.valueOf(row.sortKey(), DirectoryKeys.ROOM).ifPresent(rooms::add);
        }
        return rooms;
    }

    /**
     * handle 의 모든 행 삭제. 이미 지워졌어도 오류가 아니다.
     * 연결 종료 경로를 깨뜨리면 안 되므로 저장소 오류는 로그만 남긴다.
     */
    public void destroySession(String handle) {
        try {
            for (DirectoryRow row : directoryStore.getAll(handle)) {
                directoryStore.delete(handle, row.sortKey());
            }
            log.debug("Session destroyed - handle: {}", handle);
        } catch (DirectoryStoreException e) {
            log.error("Failed to destroy session - handle: {}", handle, e);
        }
    }

    private Optional<String> pick(String handle, List<DirectoryRow> rows, String attribute) {
        List<String> values = rows.stream()
                .map(row -> DirectoryKeys.valueOf(row.sortKey(), attribute))
                .flatMap(Optional::stream)
                .sorted()
                .toList();
        if (values.size() > 1) {
            log.warn("Multiple {} rows for handle {}: {}", attribute, handle, values);
        }
        // 빈 닉네임 행과 새 닉네임 행이 같이 남은 경우 새 닉네임 쪽을 쓴다
        return values.stream()
                .filter(value -> !value.isEmpty())
                .findFirst()
                .or(() -> values.stream().findFirst());
    }
}
