package com.ktb.roomchat.websocket.socketio.pubsub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ktb.roomchat.config.RedisPubSubConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Component;

/**
 * 중계 메시지 발행자.
 *
 * [흐름]
 * SocketIOTransport (연결 없음, 소유 서버가 다름) → publish() → Redis → 소유 서버의 RelaySubscriber
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "chat.datastore.type", havingValue = "redis", matchIfMissing = true)
@RequiredArgsConstructor
public class RelayPublisher {

    private final RedisTemplate<String, String> redisTemplate;
    private final ObjectMapper objectMapper;

    /**
     * Redis 오류는 그대로 전파한다.
     *
     * @return 직렬화에 실패하면 false
     */
    public boolean publish(RelayMessage message) {
        try {
            String payload = objectMapper.writeValueAsString(message);
            redisTemplate.convertAndSend(RedisPubSubConfig.RELAY_CHANNEL, payload);

            log.debug("Relay 메시지 발행 - target: {}, handle: {}", message.getTargetNode(), message.getHandle());
            return true;
        } catch (JsonProcessingException e) {
            log.error("Relay 메시지 직렬화 실패 - handle: {}", message.getHandle(), e);
            return false;
        }
    }
}
