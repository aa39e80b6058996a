package com.ktb.roomchat.websocket.socketio.pubsub;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 다른 서버에 붙어 있는 연결로 보낼 메시지.
 *
 * 모든 서버가 같은 채널을 구독하므로 targetNode 가 자신인 서버만 처리한다.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RelayMessage {

    private String targetNode;

    private String handle;

    private String text;
}
