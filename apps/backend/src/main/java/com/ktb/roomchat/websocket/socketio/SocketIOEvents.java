package com.ktb.roomchat.websocket.socketio;

/**
 * Socket.IO 이벤트 이름.
 * 클라이언트와 서버 모두 일반 텍스트를 "message" 이벤트로 주고받는다.
 */
public final class SocketIOEvents {

    public static final String MESSAGE = "message";

    private SocketIOEvents() {
    }
}
