package com.ktb.roomchat.model;

/**
 * 연결 상태. 저장하지 않고 Session 값에서 매번 계산한다.
 */
public enum SessionState {
    ANONYMOUS,
    NAMED_NO_ROOM,
    NAMED_IN_ROOM
}
