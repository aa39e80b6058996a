package com.ktb.roomchat.websocket.socketio;

/**
 * 단일 전송 결과.
 */
public enum PushResult {
    DELIVERED,
    /** 대상 연결이 이미 끊어짐. 디렉터리에서 지워야 한다. */
    PEER_GONE,
    /** 그 외 전송 실패. 재시도하지 않는다. */
    FAILED
}
