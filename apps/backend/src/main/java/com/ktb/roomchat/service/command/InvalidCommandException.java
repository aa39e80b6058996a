package com.ktb.roomchat.service.command;

/**
 * 사용자 입력 오류. 메시지는 그대로 요청한 연결에만 응답된다.
 */
public class InvalidCommandException extends RuntimeException {

    public InvalidCommandException(String message) {
        super(message);
    }
}
