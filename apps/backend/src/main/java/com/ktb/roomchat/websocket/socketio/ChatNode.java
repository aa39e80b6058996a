package com.ktb.roomchat.websocket.socketio;

import java.util.UUID;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * 이 서버 인스턴스의 식별자.
 *
 * 연결을 받은 서버가 디렉터리에 node:{id} 행으로 기록하고,
 * 다른 서버는 이 값을 보고 전송을 Redis 로 중계한다.
 * chat.node.id 를 지정하지 않으면 기동할 때마다 새 UUID.
 */
@Slf4j
@Getter
@Component
public class ChatNode {

    private final String id;

    public ChatNode(@Value("${chat.node.id:}") String configuredId) {
        this.id = configuredId == null || configuredId.isBlank()
                ? UUID.randomUUID().toString()
                : configuredId;
        log.info("Chat node id: {}", id);
    }
}
