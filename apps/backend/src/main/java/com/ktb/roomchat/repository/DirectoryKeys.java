package com.ktb.roomchat.repository;

import java.util.Optional;

/**
 * 디렉터리 sortKey 인코딩.
 *
 * 속성 이름과 값은 첫 번째 ':' 에서 나뉜다. 값에 ':' 가 들어가도 된다.
 */
public final class DirectoryKeys {

    public static final String USERNAME = "username";
    public static final String ROOM = "room";
    public static final String NODE = "node";

    private static final char SEPARATOR = ':';

    private DirectoryKeys() {
    }

    public static String username(String name) {
        return USERNAME + SEPARATOR + name;
    }

    public static String room(String roomName) {
        return ROOM + SEPARATOR + roomName;
    }

    public static String node(String nodeId) {
        return NODE + SEPARATOR + nodeId;
    }

    public static Optional<String> valueOf(String sortKey, String attribute) {
        String prefix = attribute + SEPARATOR;
        if (!sortKey.startsWith(prefix)) {
            return Optional.empty();
        }
        return Optional.of(sortKey.substring(prefix.length()));
    }
}
