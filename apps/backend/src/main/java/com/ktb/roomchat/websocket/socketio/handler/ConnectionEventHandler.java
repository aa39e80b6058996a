package com.ktb.roomchat.websocket.socketio.handler;

import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.SocketIOServer;
import com.corundumstudio.socketio.annotation.OnConnect;
import com.corundumstudio.socketio.annotation.OnDisconnect;
import com.corundumstudio.socketio.annotation.OnEvent;
import com.ktb.roomchat.service.SessionRouter;
import com.ktb.roomchat.service.command.CommandInterpreter;
import com.ktb.roomchat.websocket.socketio.ChatNode;
import com.ktb.roomchat.websocket.socketio.ChatTransport;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Component;

import static com.ktb.roomchat.websocket.socketio.SocketIOEvents.MESSAGE;

/**
 * Socket.IO 연결 이벤트 핸들러
 * 연결/해제 시 디렉터리 세션 생성/삭제, 수신 메시지는 CommandInterpreter 로 전달
 * 연결 시 이 서버를 연결 소유자로 기록한다
 *
 * 이벤트 하나의 처리 실패는 그 연결에만 영향을 준다.
 */
@Slf4j
@Component
public class ConnectionEventHandler {

    static final String PROCESSING_FAILED = "Failed to process message. Please try again.";

    private final SessionRouter sessionRouter;
    private final CommandInterpreter commandInterpreter;
    private final ChatTransport chatTransport;
    private final ChatNode chatNode;

    public ConnectionEventHandler(
            SessionRouter sessionRouter,
            CommandInterpreter commandInterpreter,
            ChatTransport chatTransport,
            ChatNode chatNode,
            MeterRegistry meterRegistry,
            @Lazy SocketIOServer socketIOServer
    ) {
        this.sessionRouter = sessionRouter;
        this.commandInterpreter = commandInterpreter;
        this.chatTransport = chatTransport;
        this.chatNode = chatNode;

        // 이 노드에 붙어 있는 클라이언트 수
        Gauge.builder("socketio.concurrent.users", () -> socketIOServer.getAllClients().size())
                .description("Current number of concurrent Socket.IO users")
                .register(meterRegistry);
    }

    @OnConnect
    public void onConnect(SocketIOClient client) {
        String handle = handleOf(client);
        log.info("[CONNECT] handle={}", handle);

        try {
            sessionRouter.createSession(handle);
            sessionRouter.claimConnection(handle, chatNode.getId());
        } catch (Exception e) {
            log.error("Error creating session - handle: {}", handle, e);
            client.disconnect();
        }
    }

    @OnDisconnect
    public void onDisconnect(SocketIOClient client) {
        String handle = handleOf(client);
        log.info("[DISCONNECT] handle={} transport={}", handle, client.getTransport());

        // 저장소 오류는 destroySession 안에서 로그만 남는다
        sessionRouter.destroySession(handle);
    }

    @OnEvent(MESSAGE)
    public void onMessage(SocketIOClient client, String text) {
        String handle = handleOf(client);
        if (text == null) {
            log.debug("Empty message payload - handle: {}", handle);
            return;
        }

        try {
            commandInterpreter.handle(handle, text);
        } catch (Exception e) {
            log.error("Error handling message - handle: {}", handle, e);
            chatTransport.push(handle, PROCESSING_FAILED);
        }
    }

    private String handleOf(SocketIOClient client) {
        return client.getSessionId().toString();
    }
}
