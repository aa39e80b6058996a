package com.ktb.roomchat.model;

/**
 * 연결 하나의 현재 상태.
 *
 * username 이 "" 이면 아직 닉네임을 정하지 않은 상태,
 * room 이 null 이면 어느 방에도 들어가 있지 않은 상태이다.
 */
public record Session(String connectionHandle, String username, String room) {

    public Session {
        if (username == null) {
            username = "";
        }
    }

    public boolean isNamed() {
        return !username.isEmpty();
    }

    public boolean hasRoom() {
        return room != null;
    }

    public SessionState state() {
        if (!isNamed()) {
            return SessionState.ANONYMOUS;
        }
        return hasRoom() ? SessionState.NAMED_IN_ROOM : SessionState.NAMED_NO_ROOM;
    }
}
