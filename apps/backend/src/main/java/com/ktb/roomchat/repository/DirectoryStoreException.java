package com.ktb.roomchat.repository;

/**
 * 디렉터리 저장소 오류 (Redis 연결 실패, 타임아웃 등).
 */
public class DirectoryStoreException extends RuntimeException {

    public DirectoryStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
