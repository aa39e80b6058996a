package com.ktb.roomchat.service.command;

import com.ktb.roomchat.model.Session;
import java.util.List;

/**
 * '/' 로 시작하는 명령 하나의 처리기.
 */
@FunctionalInterface
public interface ChatCommand {

    /**
     * @param handle  명령을 보낸 connection handle
     * @param args    명령 이름 뒤의 인자 (공백 하나 기준 분리)
     * @param session 명령 처리 직전에 읽은 세션
     * @throws InvalidCommandException 인자가 잘못된 경우
     */
    void execute(String handle, List<String> args, Session session);
}
