package com.ktb.roomchat.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ktb.roomchat.websocket.socketio.pubsub.RelaySubscriber;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;
import org.springframework.data.redis.listener.adapter.MessageListenerAdapter;

/**
 * 서버 간 전송 중계용 Redis Pub/Sub 설정.
 *
 * [동작 방식]
 * 1. 모든 서버가 RELAY_CHANNEL 을 구독
 * 2. 연결을 갖지 않은 서버가 소유 서버 id 를 담아 PUBLISH
 * 3. 소유 서버만 자신의 Socket.IO 클라이언트에게 전송
 *
 * 디렉터리가 Redis 에 있을 때만 여러 서버가 같은 연결을 볼 수 있으므로 그때만 활성화.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "chat.datastore.type", havingValue = "redis", matchIfMissing = true)
public class RedisPubSubConfig {

    public static final String RELAY_CHANNEL = "chat:relay";

    @Bean
    public RedisMessageListenerContainer redisMessageListenerContainer(
            RedisConnectionFactory connectionFactory,
            MessageListenerAdapter relayListenerAdapter) {

        RedisMessageListenerContainer container = new RedisMessageListenerContainer();
        container.setConnectionFactory(connectionFactory);
        container.addMessageListener(relayListenerAdapter, new ChannelTopic(RELAY_CHANNEL));

        log.info("Redis Pub/Sub 리스너 등록 완료 - 채널: {}", RELAY_CHANNEL);
        return container;
    }

    @Bean
    public MessageListenerAdapter relayListenerAdapter(RelaySubscriber subscriber) {
        return new MessageListenerAdapter(subscriber, "onMessage");
    }

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper objectMapper() {
        return new ObjectMapper();
    }
}
