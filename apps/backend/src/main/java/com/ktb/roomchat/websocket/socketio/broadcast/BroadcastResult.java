package com.ktb.roomchat.websocket.socketio.broadcast;

import com.ktb.roomchat.websocket.socketio.PushResult;
import java.util.Collection;

public record BroadcastResult(int delivered, int peerGone, int failed) {

    public static final BroadcastResult EMPTY = new BroadcastResult(0, 0, 0);

    public static BroadcastResult of(Collection<PushResult> results) {
        int delivered = 0;
        int peerGone = 0;
        int failed = 0;
        for (PushResult result : results) {
            switch (result) {
                case DELIVERED -> delivered++;
                case PEER_GONE -> peerGone++;
                case FAILED -> failed++;
            }
        }
        return new BroadcastResult(delivered, peerGone, failed);
    }
}
