package com.ktb.roomchat.websocket.socketio.pubsub;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ktb.roomchat.service.SessionRouter;
import com.ktb.roomchat.websocket.socketio.ChatNode;
import com.ktb.roomchat.websocket.socketio.PushResult;
import com.ktb.roomchat.websocket.socketio.SocketIOTransport;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 중계 메시지 수신자.
 *
 * 이 서버가 소유한 연결 앞으로 온 메시지만 로컬 Socket.IO 클라이언트에 전달한다.
 * 연결이 이미 끊어졌으면 소유 서버인 여기서 디렉터리를 정리한다.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "chat.datastore.type", havingValue = "redis", matchIfMissing = true)
@RequiredArgsConstructor
public class RelaySubscriber {

    private final SocketIOTransport socketIOTransport;
    private final SessionRouter sessionRouter;
    private final ChatNode chatNode;
    private final ObjectMapper objectMapper;

    /**
     * RedisMessageListenerContainer 가 호출한다.
     */
    public void onMessage(String message) {
        try {
            RelayMessage relay = objectMapper.readValue(message, RelayMessage.class);
            if (!chatNode.getId().equals(relay.getTargetNode())) {
                return;
            }

            PushResult result = socketIOTransport.pushLocal(relay.getHandle(), relay.getText());
            if (result == PushResult.PEER_GONE) {
                log.info("Relayed peer gone, removing from directory - handle: {}", relay.getHandle());
                sessionRouter.destroySession(relay.getHandle());
            } else if (result == PushResult.FAILED) {
                log.warn("Relayed message not delivered - handle: {}", relay.getHandle());
            }
        } catch (Exception e) {
            log.error("Relay 메시지 처리 실패 - message: {}", message, e);
        }
    }
}
