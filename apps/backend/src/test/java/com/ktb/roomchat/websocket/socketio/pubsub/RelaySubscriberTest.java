package com.ktb.roomchat.websocket.socketio.pubsub;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIOServer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ktb.roomchat.repository.LocalDirectoryStore;
import com.ktb.roomchat.service.SessionRouter;
import com.ktb.roomchat.websocket.socketio.ChatNode;
import com.ktb.roomchat.websocket.socketio.SocketIOEvents;
import com.ktb.roomchat.websocket.socketio.SocketIOTransport;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

@ExtendWith(MockitoExtension.class)
class RelaySubscriberTest {

    @Mock
    private SocketIOServer socketIOServer;

    @Mock
    private SocketIOClient client;

    @Mock
    private ObjectProvider<RelayPublisher> relayPublisherProvider;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private SessionRouter sessionRouter;
    private RelaySubscriber subscriber;
    private UUID sessionId;

    @BeforeEach
    void setUp() {
        sessionRouter = new SessionRouter(new LocalDirectoryStore());
        ChatNode node = new ChatNode("node-b");
        SocketIOTransport transport =
                new SocketIOTransport(socketIOServer, node, sessionRouter, relayPublisherProvider);
        subscriber = new RelaySubscriber(transport, sessionRouter, node, objectMapper);
        sessionId = UUID.randomUUID();
    }

    private String relay(String targetNode, String text) throws Exception {
        return objectMapper.writeValueAsString(RelayMessage.builder()
                .targetNode(targetNode)
                .handle(sessionId.toString())
                .text(text)
                .build());
    }

    @Test
    @DisplayName("이 노드 앞으로 온 메시지는 로컬 클라이언트에게 전달한다")
    void deliversOwnMessages() throws Exception {
        when(socketIOServer.getClient(sessionId)).thenReturn(client);
        when(client.isChannelOpen()).thenReturn(true);

        subscriber.onMessage(relay("node-b", "alice: hi"));

        verify(client).sendEvent(SocketIOEvents.MESSAGE, "alice: hi");
    }

    @Test
    @DisplayName("다른 노드 앞으로 온 메시지는 무시한다")
    void ignoresOtherNodes() throws Exception {
        subscriber.onMessage(relay("node-c", "alice: hi"));

        verifyNoInteractions(socketIOServer);
    }

    @Test
    @DisplayName("소유한 연결이 끊어져 있으면 디렉터리에서 지운다")
    void removesGoneOwnedConnection() throws Exception {
        String handle = sessionId.toString();
        sessionRouter.createSession(handle);
        sessionRouter.claimConnection(handle, "node-b");
        sessionRouter.setUsername(handle, "", "bob");
        sessionRouter.setRoom(handle, "lobby");
        when(socketIOServer.getClient(sessionId)).thenReturn(null);

        subscriber.onMessage(relay("node-b", "alice: hi"));

        assertThat(sessionRouter.listRoomMembers("lobby")).isEmpty();
        assertThat(sessionRouter.getSession(handle).username()).isEmpty();
        verifyNoInteractions(relayPublisherProvider);
    }

    @Test
    @DisplayName("해석할 수 없는 메시지는 로그만 남긴다")
    void ignoresMalformedPayload() {
        subscriber.onMessage("not json");

        verify(socketIOServer, never()).getClient(sessionId);
    }
}
