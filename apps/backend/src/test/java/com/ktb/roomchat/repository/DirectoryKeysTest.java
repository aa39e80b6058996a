package com.ktb.roomchat.repository;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DirectoryKeysTest {

    @Test
    @DisplayName("값은 첫 번째 ':' 뒤 전체이다")
    void valueKeepsLaterSeparators() {
        String sortKey = DirectoryKeys.room("team:backend");

        assertThat(sortKey).isEqualTo("room:team:backend");
        assertThat(DirectoryKeys.valueOf(sortKey, DirectoryKeys.ROOM)).contains("team:backend");
    }

    @Test
    @DisplayName("빈 닉네임 행은 빈 문자열 값을 가진다")
    void emptyUsername() {
        assertThat(DirectoryKeys.username("")).isEqualTo("username:");
        assertThat(DirectoryKeys.valueOf("username:", DirectoryKeys.USERNAME)).contains("");
    }

    @Test
    @DisplayName("다른 속성의 키에서는 값을 꺼내지 않는다")
    void otherAttribute() {
        assertThat(DirectoryKeys.valueOf("username:room", DirectoryKeys.ROOM)).isEmpty();
        assertThat(DirectoryKeys.valueOf("roomy:x", DirectoryKeys.ROOM)).isEmpty();
        assertThat(DirectoryKeys.valueOf("noseparator", DirectoryKeys.ROOM)).isEmpty();
    }
}
