package com.ktb.roomchat.websocket.socketio.broadcast;

import com.ktb.roomchat.service.SessionRouter;
import com.ktb.roomchat.websocket.socketio.ChatTransport;
import com.ktb.roomchat.websocket.socketio.PushResult;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * ChatTransport 로 직접 전송하는 브로드캐스트 서비스.
 *
 * 방 인원 수만큼의 전송을 broadcastExecutor 에서 병렬로 실행하고,
 * 호출한 스레드는 전부 끝날 때까지 기다린다.
 */
@Slf4j
@Service
public class DirectBroadcastService implements BroadcastService {

    private final ChatTransport chatTransport;
    private final SessionRouter sessionRouter;
    private final Executor broadcastExecutor;

    public DirectBroadcastService(
            ChatTransport chatTransport,
            SessionRouter sessionRouter,
            @Qualifier("broadcastExecutor") Executor broadcastExecutor) {
        this.chatTransport = chatTransport;
        this.sessionRouter = sessionRouter;
        this.broadcastExecutor = broadcastExecutor;
    }

    @Override
    public PushResult send(String handle, String message) {
        PushResult result;
        try {
            result = chatTransport.push(handle, message);
        } catch (RuntimeException e) {
            log.warn("Push failed - handle: {}", handle, e);
            result = PushResult.FAILED;
        }

        if (result == PushResult.PEER_GONE) {
            // 끊어진 연결이 디렉터리에 남아 있으면 이후 브로드캐스트마다 다시 시도하게 된다
            log.info("Peer gone, removing from directory - handle: {}", handle);
            sessionRouter.destroySession(handle);
        } else if (result == PushResult.FAILED) {
            log.warn("Message not delivered - handle: {}", handle);
        }
        return result;
    }

    @Override
    public BroadcastResult broadcast(Collection<String> handles, String message) {
        if (handles.isEmpty()) {
            return BroadcastResult.EMPTY;
        }

        List<CompletableFuture<PushResult>> sends = handles.stream()
                .map(handle -> CompletableFuture.supplyAsync(() -> send(handle, message), broadcastExecutor))
                .toList();

        CompletableFuture.allOf(sends.toArray(new CompletableFuture[0])).join();

        BroadcastResult result = BroadcastResult.of(sends.stream().map(CompletableFuture::join).toList());
        log.debug("Broadcast done - targets: {}, delivered: {}, peerGone: {}, failed: {}",
                handles.size(), result.delivered(), result.peerGone(), result.failed());
        return result;
    }
}
