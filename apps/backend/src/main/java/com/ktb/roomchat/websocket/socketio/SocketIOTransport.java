package com.ktb.roomchat.websocket.socketio;

import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIOServer;
import com.ktb.roomchat.service.SessionRouter;
import com.ktb.roomchat.websocket.socketio.pubsub.RelayMessage;
import com.ktb.roomchat.websocket.socketio.pubsub.RelayPublisher;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import static com.ktb.roomchat.websocket.socketio.SocketIOEvents.MESSAGE;

/**
 * Socket.IO 기반 ChatTransport.
 *
 * handle 은 Socket.IO 클라이언트 sessionId(UUID) 문자열이다.
 * - 이 서버에 연결된 클라이언트: 직접 전송
 * - 다른 서버가 소유한 연결: RelayPublisher 로 중계 (끊김 판정은 소유 서버가 한다)
 * - 소유 서버가 없거나 이 서버인데 클라이언트가 없음: PEER_GONE
 */
@Slf4j
@Component
public class SocketIOTransport implements ChatTransport {

    private final SocketIOServer socketIOServer;
    private final ChatNode chatNode;
    private final SessionRouter sessionRouter;
    private final ObjectProvider<RelayPublisher> relayPublisherProvider;

    public SocketIOTransport(
            @Lazy SocketIOServer socketIOServer,
            ChatNode chatNode,
            SessionRouter sessionRouter,
            ObjectProvider<RelayPublisher> relayPublisherProvider) {
        this.socketIOServer = socketIOServer;
        this.chatNode = chatNode;
        this.sessionRouter = sessionRouter;
        this.relayPublisherProvider = relayPublisherProvider;
    }

    @Override
    public PushResult push(String handle, String text) {
        PushResult local = pushLocal(handle, text);
        if (local != PushResult.PEER_GONE) {
            return local;
        }
        return relay(handle, text);
    }

    /**
     * 이 서버의 클라이언트에게만 전송한다.
     */
    public PushResult pushLocal(String handle, String text) {
        final UUID sessionId;
        try {
            sessionId = UUID.fromString(handle);
        } catch (IllegalArgumentException e) {
            log.warn("handle is not UUID: {}", handle);
            return PushResult.PEER_GONE;
        }

        SocketIOClient client = socketIOServer.getClient(sessionId);
        if (client == null || !client.isChannelOpen()) {
            return PushResult.PEER_GONE;
        }

        try {
            client.sendEvent(MESSAGE, text);
            return PushResult.DELIVERED;
        } catch (Exception e) {
            log.warn("Socket.IO send failed - handle: {}", handle, e);
            return PushResult.FAILED;
        }
    }

    private PushResult relay(String handle, String text) {
        Optional<String> owner = sessionRouter.ownerOf(handle);
        if (owner.isEmpty() || owner.get().equals(chatNode.getId())) {
            return PushResult.PEER_GONE;
        }

        RelayPublisher relayPublisher = relayPublisherProvider.getIfAvailable();
        if (relayPublisher == null) {
            log.warn("No relay channel for remote handle - handle: {}, owner: {}", handle, owner.get());
            return PushResult.FAILED;
        }

        RelayMessage message = RelayMessage.builder()
                .targetNode(owner.get())
                .handle(handle)
                .text(text)
                .build();
        try {
            return relayPublisher.publish(message) ? PushResult.DELIVERED : PushResult.FAILED;
        } catch (RuntimeException e) {
            log.warn("Relay publish failed - handle: {}, owner: {}", handle, owner.get(), e);
            return PushResult.FAILED;
        }
    }
}
