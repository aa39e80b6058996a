package com.ktb.roomchat.websocket.socketio.broadcast;

import com.ktb.roomchat.websocket.socketio.PushResult;
import java.util.Collection;

/**
 * 연결 단위 메시지 전송 서비스.
 *
 * 끊어진 연결로 전송하면 해당 연결을 디렉터리에서 지운다 (self-heal).
 * 전달 보장은 없다.
 */
public interface BroadcastService {

    /**
     * 단일 연결에 전송
     *
     * @param handle  대상 connection handle
     * @param message 전송할 텍스트
     * @return 전송 결과
     */
    PushResult send(String handle, String message);

    /**
     * 여러 연결에 독립적으로 전송. 모든 전송이 끝난 뒤 반환한다.
     * 한 연결의 실패가 다른 연결의 전송을 막지 않으며 수신자 간 순서는 보장하지 않는다.
     *
     * @param handles 대상 connection handle 목록
     * @param message 전송할 텍스트
     * @return 결과 집계
     */
    BroadcastResult broadcast(Collection<String> handles, String message);
}
