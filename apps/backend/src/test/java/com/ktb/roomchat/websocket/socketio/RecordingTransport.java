package com.ktb.roomchat.websocket.socketio;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 전송 내용을 handle 별로 기록하는 테스트용 ChatTransport.
 */
public class RecordingTransport implements ChatTransport {

    private final Map<String, List<String>> inbox = new ConcurrentHashMap<>();
    private final Set<String> gone = ConcurrentHashMap.newKeySet();
    private final Set<String> broken = ConcurrentHashMap.newKeySet();

    @Override
    public PushResult push(String handle, String text) {
        if (gone.contains(handle)) {
            return PushResult.PEER_GONE;
        }
        if (broken.contains(handle)) {
            return PushResult.FAILED;
        }
        inbox.computeIfAbsent(handle, k -> new CopyOnWriteArrayList<>()).add(text);
        return PushResult.DELIVERED;
    }

    public void markGone(String handle) {
        gone.add(handle);
    }

    public void markBroken(String handle) {
        broken.add(handle);
    }

    public List<String> received(String handle) {
        return List.copyOf(inbox.getOrDefault(handle, List.of()));
    }

    public String last(String handle) {
        List<String> messages = received(handle);
        return messages.isEmpty() ? null : messages.get(messages.size() - 1);
    }

    public void clear() {
        inbox.clear();
    }
}
