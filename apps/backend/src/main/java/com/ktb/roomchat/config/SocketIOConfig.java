package com.ktb.roomchat.config;

import com.corundumstudio.socketio.SocketIOServer;
import com.corundumstudio.socketio.protocol.JacksonJsonSupport;
import com.corundumstudio.socketio.store.MemoryStoreFactory;
import com.corundumstudio.socketio.store.RedissonStoreFactory;
import com.corundumstudio.socketio.store.StoreFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ktb.roomchat.repository.DirectoryStore;
import com.ktb.roomchat.repository.LocalDirectoryStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RedissonClient;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class SocketIOConfig {
    private final ObjectProvider<RedissonClient> redissonClientProvider;

    @Value("${socketio.server.host:0.0.0.0}")
    private String host;

    @Value("${socketio.server.port:5002}")
    private Integer port;

    @Value("${socketio.store.type:local}")
    private String storeType;

    /**
     * Socket.IO 클라이언트 스토어 팩토리.
     *
     * redis: RedissonStoreFactory - 클라이언트 속성을 Redis 에 보관
     * local: MemoryStoreFactory - 단일 서버 환경
     *
     * 채팅 디렉터리(DirectoryStore)와는 별개의 저장소이다.
     */
    @Bean
    public StoreFactory socketIOStoreFactory() {
        if ("redis".equalsIgnoreCase(storeType)) {
            log.info("Using RedissonStoreFactory for Socket.IO client store");
            return new RedissonStoreFactory(redissonClientProvider.getObject());
        }

        log.info("Using MemoryStoreFactory for Socket.IO client store");
        return new MemoryStoreFactory();
    }

    @Bean(destroyMethod = "stop")
    public SocketIOServer socketIOServer(StoreFactory storeFactory) {
        com.corundumstudio.socketio.Configuration config = new com.corundumstudio.socketio.Configuration();
        config.setHostname(host);
        config.setPort(port);

        // 연결 생존 여부는 전송 계층이 판단한다
        config.setPingInterval(25000);
        config.setPingTimeout(60000);

        // 채팅 한 줄 텍스트만 오간다
        config.setMaxFramePayloadLength(64 * 1024);
        config.setMaxHttpContentLength(64 * 1024);
        config.setOrigin("*");

        config.setJsonSupport(new JacksonJsonSupport(new JavaTimeModule()));
        config.setStoreFactory(storeFactory);

        SocketIOServer server = new SocketIOServer(config);

        log.info("Socket.IO server created for {}:{}", host, port);
        return server;
    }

    // 인메모리 디렉터리, 단일 노드 환경에서만 사용 (chat.datastore.type=local 일 때만 활성화)
    @Bean
    @ConditionalOnProperty(name = "chat.datastore.type", havingValue = "local")
    public DirectoryStore localDirectoryStore() {
        log.warn("Using LocalDirectoryStore - NOT suitable for multi-server environment");
        return new LocalDirectoryStore();
    }
}
