package com.ktb.roomchat.repository;

/**
 * 디렉터리 한 행.
 *
 * partitionKey 는 connection handle, sortKey 는 "{속성}:{값}" 형태의 속성 키이다.
 */
public record DirectoryRow(String partitionKey, String sortKey) {

    public DirectoryRow {
        if (partitionKey == null || partitionKey.isEmpty()) {
            throw new IllegalArgumentException("partitionKey must not be empty");
        }
        if (sortKey == null) {
            throw new IllegalArgumentException("sortKey must not be null");
        }
    }
}
