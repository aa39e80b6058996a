package com.ktb.roomchat.websocket.socketio;

/**
 * connection handle 로 텍스트를 밀어 넣는 전송 계층.
 */
public interface ChatTransport {

    PushResult push(String handle, String text);
}
