package com.ktb.roomchat.config;

import com.corundumstudio.socketio.SocketIOServer;
import com.ktb.roomchat.websocket.socketio.handler.ConnectionEventHandler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Socket.IO 이벤트 핸들러 등록자.
 *
 * [동작 시점]
 * - ApplicationReadyEvent: 모든 Bean 생성이 끝난 뒤 핸들러를 등록하고 서버를 시작한다
 * - 핸들러 등록 전에 서버가 열리면 connect 이벤트를 놓칠 수 있음
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SocketIOEventRegistrar {

    private final SocketIOServer socketIOServer;
    private final ConnectionEventHandler connectionEventHandler;

    @EventListener(ApplicationReadyEvent.class)
    public void registerEventHandlers() {
        socketIOServer.addListeners(connectionEventHandler);
        log.info("Socket.IO 이벤트 핸들러 등록 완료");

        socketIOServer.start();
        log.info("Socket.IO 서버 시작 완료 - port: {}", socketIOServer.getConfiguration().getPort());
    }
}
