package com.ktb.roomchat.service.command;

import com.ktb.roomchat.model.Session;
import com.ktb.roomchat.model.SessionState;
import com.ktb.roomchat.service.SessionRouter;
import com.ktb.roomchat.websocket.socketio.broadcast.BroadcastService;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 수신 텍스트 해석기.
 *
 * 상태를 따로 저장하지 않고 매 이벤트마다 SessionRouter 에서 읽은 값으로 판단한다.
 * - 닉네임 없음: 받은 텍스트 전체를 닉네임으로 사용
 * - '/' 로 시작: 명령
 * - 그 외: 현재 방 전체에 채팅 메시지
 */
@Slf4j
@Service
public class CommandInterpreter {

    static final String HELP_TEXT = String.join("\n",
            "Commands available:",
            "    /help",
            "          Display this message.",
            "    /join {chat_room_name}",
            "          Join a chatroom named {chat_room_name}.",
            "    /nick {nickname}",
            "          Change your name to {nickname}. If no {nickname}",
            "          is provided then your current name will be printed",
            "    /room",
            "          Print out the name of the room you are currently ",
            "          in.",
            "    /ls",
            "          If you are in a room, list all users also in the",
            "          room. Otherwise, list all rooms.",
            "    /quit",
            "          Leave current room.",
            "",
            "If you are in a room, raw text messages that do not start ",
            "with a / will be sent to everyone else in the room.");

    private final SessionRouter sessionRouter;
    private final BroadcastService broadcastService;
    private final Map<String, ChatCommand> commandTable;

    public CommandInterpreter(SessionRouter sessionRouter, BroadcastService broadcastService) {
        this.sessionRouter = sessionRouter;
        this.broadcastService = broadcastService;
        this.commandTable = Map.of(
                "help", this::help,
                "nick", this::nick,
                "join", this::join,
                "room", this::room,
                "quit", this::quit,
                "ls", this::list
        );
    }

    public void handle(String handle, String text) {
        Session session = sessionRouter.getSession(handle);

        try {
            switch (session.state()) {
                case ANONYMOUS -> handleLogin(handle, text);
                case NAMED_NO_ROOM, NAMED_IN_ROOM -> {
                    if (text.startsWith("/")) {
                        handleCommand(handle, text.substring(1), session);
                    } else {
                        handleText(handle, text, session);
                    }
                }
            }
        } catch (InvalidCommandException e) {
            log.debug("Invalid command - handle: {}, reason: {}", handle, e.getMessage());
            broadcastService.send(handle, e.getMessage());
        }
    }

    private void handleLogin(String handle, String text) {
        if (text.isEmpty()) {
            throw new InvalidCommandException("Nickname must not be empty.");
        }
        sessionRouter.setUsername(handle, "", text);
        log.info("[LOGIN] handle={} username={}", handle, text);
        broadcastService.send(handle,
                String.format("Using nickname: %s\nType /help for list of commands.", text));
    }

    private void handleCommand(String handle, String commandLine, Session session) {
        List<String> tokens = Arrays.asList(commandLine.split(" ", -1));
        String commandName = tokens.get(0).toLowerCase(Locale.ROOT);
        List<String> args = tokens.subList(1, tokens.size());

        ChatCommand command = commandTable.get(commandName);
        if (command == null) {
            broadcastService.send(handle, "Unknown command: " + commandName);
            return;
        }
        log.debug("Command - handle: {}, name: {}, args: {}", handle, commandName, args);
        command.execute(handle, args, session);
    }

    private void handleText(String handle, String text, Session session) {
        if (session.state() == SessionState.NAMED_NO_ROOM) {
            broadcastService.send(handle, "Cannot send message if not in chatroom.");
            return;
        }
        Set<String> members = sessionRouter.listRoomMembers(session.room());
        broadcastService.broadcast(members, session.username() + ": " + text);
    }

    private void help(String handle, List<String> args, Session session) {
        broadcastService.send(handle, HELP_TEXT);
    }

    private void nick(String handle, List<String> args, Session session) {
        if (args.isEmpty() || args.get(0).isEmpty()) {
            broadcastService.send(handle, "Current nickname: " + session.username());
            return;
        }
        String oldName = session.username();
        String newName = args.get(0);

        sessionRouter.setUsername(handle, oldName, newName);
        broadcastService.send(handle, "Nickname is: " + newName);

        if (session.hasRoom()) {
            Set<String> others = sessionRouter.listRoomMembers(session.room());
            others.remove(handle);
            broadcastService.broadcast(others, String.format("%s is now known as %s.", oldName, newName));
        }
    }

    private void join(String handle, List<String> args, Session session) {
        if (args.isEmpty() || args.get(0).isEmpty()) {
            throw new InvalidCommandException("Missing room name. Usage: /join {chat_room_name}");
        }
        String room = args.get(0);

        quit(handle, List.of(), session);

        // 입장 전 인원 (본인은 아직 포함되지 않음)
        Set<String> existing = sessionRouter.listRoomMembers(room);
        sessionRouter.setRoom(handle, room);
        log.info("[JOIN] handle={} room={}", handle, room);

        broadcastService.send(handle, String.format("Joined chat room \"%s\"", room));
        broadcastService.broadcast(existing, session.username() + " joined room.");
    }

    private void room(String handle, List<String> args, Session session) {
        if (session.hasRoom()) {
            broadcastService.send(handle, session.room());
        } else {
            broadcastService.send(handle, "Not currently in a room. Type /join {room_name} to do so.");
        }
    }

    private void quit(String handle, List<String> args, Session session) {
        if (!session.hasRoom()) {
            return;
        }
        String room = session.room();
        sessionRouter.clearRoom(handle, room);
        log.info("[LEAVE] handle={} room={}", handle, room);

        broadcastService.send(handle, String.format("Left chat room \"%s\"", room));
        // 퇴장 후 조회하므로 본인은 빠져 있다
        broadcastService.broadcast(sessionRouter.listRoomMembers(room), session.username() + " left room.");
    }

    private void list(String handle, List<String> args, Session session) {
        List<String> result;
        if (session.hasRoom()) {
            result = sessionRouter.listRoomMembers(session.room()).stream()
                    .map(member -> sessionRouter.getSession(member).username())
                    // 조회 사이에 삭제된 연결은 닉네임이 비어 있다
                    .filter(name -> !name.isEmpty())
                    .sorted()
                    .toList();
        } else {
            result = List.copyOf(sessionRouter.listRooms());
        }
        broadcastService.send(handle, String.join("\n", result));
    }
}
