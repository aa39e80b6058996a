package com.ktb.roomchat.service.command;

import static org.assertj.core.api.Assertions.assertThat;

import com.ktb.roomchat.repository.LocalDirectoryStore;
import com.ktb.roomchat.service.SessionRouter;
import com.ktb.roomchat.websocket.socketio.RecordingTransport;
import com.ktb.roomchat.websocket.socketio.broadcast.DirectBroadcastService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CommandInterpreterTest {

    private RecordingTransport transport;
    private SessionRouter router;
    private CommandInterpreter interpreter;

    @BeforeEach
    void setUp() {
        transport = new RecordingTransport();
        router = new SessionRouter(new LocalDirectoryStore());
        interpreter = new CommandInterpreter(router, new DirectBroadcastService(transport, router, Runnable::run));
    }

    private void connect(String handle) {
        router.createSession(handle);
    }

    private void login(String handle, String name) {
        connect(handle);
        interpreter.handle(handle, name);
    }

    @Test
    @DisplayName("alice/bob 로비 시나리오")
    void lobbyScenario() {
        connect("C1");
        assertThat(router.getSession("C1").username()).isEmpty();

        interpreter.handle("C1", "alice");
        assertThat(router.getSession("C1").username()).isEqualTo("alice");
        assertThat(transport.last("C1")).isEqualTo("Using nickname: alice\nType /help for list of commands.");

        interpreter.handle("C1", "/join lobby");
        assertThat(transport.last("C1")).isEqualTo("Joined chat room \"lobby\"");

        connect("C2");
        interpreter.handle("C2", "bob");
        interpreter.handle("C2", "/join lobby");
        assertThat(transport.last("C2")).isEqualTo("Joined chat room \"lobby\"");
        assertThat(transport.last("C1")).isEqualTo("bob joined room.");

        interpreter.handle("C1", "hi");
        assertThat(transport.last("C1")).isEqualTo("alice: hi");
        assertThat(transport.last("C2")).isEqualTo("alice: hi");

        interpreter.handle("C2", "/quit");
        assertThat(transport.last("C2")).isEqualTo("Left chat room \"lobby\"");
        assertThat(transport.last("C1")).isEqualTo("bob left room.");

        router.destroySession("C1");
        assertThat(router.listRooms()).doesNotContain("lobby");
    }

    @Test
    @DisplayName("첫 메시지는 공백을 포함한 그대로 닉네임이 된다")
    void firstMessageIsLiteralUsername() {
        login("C1", " al ice ");

        assertThat(router.getSession("C1").username()).isEqualTo(" al ice ");
    }

    @Test
    @DisplayName("빈 첫 메시지는 닉네임으로 쓰지 않는다")
    void emptyLoginIsRejected() {
        connect("C1");

        interpreter.handle("C1", "");

        assertThat(router.getSession("C1").username()).isEmpty();
        assertThat(transport.last("C1")).isEqualTo("Nickname must not be empty.");
    }

    @Test
    @DisplayName("인자 없는 /nick은 상태를 바꾸지 않고 현재 닉네임을 알려준다")
    void nickWithoutArgumentEchoes() {
        login("C1", "alice");

        interpreter.handle("C1", "/nick");

        assertThat(transport.last("C1")).isEqualTo("Current nickname: alice");
        assertThat(router.getSession("C1").username()).isEqualTo("alice");
    }

    @Test
    @DisplayName("/nick은 본인을 제외한 방 구성원에게 변경을 알리고 /ls에 반영된다")
    void nickAnnouncesToOthers() {
        login("C1", "alice");
        login("C2", "bob");
        interpreter.handle("C1", "/join lobby");
        interpreter.handle("C2", "/join lobby");
        transport.clear();

        interpreter.handle("C1", "/nick carol extra");

        assertThat(transport.received("C1")).containsExactly("Nickname is: carol");
        assertThat(transport.received("C2")).containsExactly("alice is now known as carol.");
        assertThat(router.getSession("C1").username()).isEqualTo("carol");

        interpreter.handle("C2", "/ls");
        assertThat(transport.last("C2")).isEqualTo("bob\ncarol");
    }

    @Test
    @DisplayName("다른 방에 들어가면 이전 방에서 나간다")
    void joinLeavesPreviousRoom() {
        login("C1", "alice");
        login("C2", "bob");
        interpreter.handle("C2", "/join A");
        interpreter.handle("C1", "/join A");
        transport.clear();

        interpreter.handle("C1", "/join B");

        assertThat(transport.received("C1")).containsExactly("Left chat room \"A\"", "Joined chat room \"B\"");
        assertThat(transport.received("C2")).containsExactly("alice left room.");
        assertThat(router.listRoomMembers("A")).containsExactly("C2");
        assertThat(router.listRoomMembers("B")).containsExactly("C1");
    }

    @Test
    @DisplayName("방 이름 없는 /join은 사용자 오류로 응답하고 상태를 바꾸지 않는다")
    void joinWithoutRoomName() {
        login("C1", "alice");
        interpreter.handle("C1", "/join lobby");

        interpreter.handle("C1", "/join");

        assertThat(transport.last("C1")).isEqualTo("Missing room name. Usage: /join {chat_room_name}");
        assertThat(router.getSession("C1").room()).isEqualTo("lobby");
    }

    @Test
    @DisplayName("명령 이름은 대소문자를 구분하지 않지만 인자는 구분한다")
    void commandNameIsCaseInsensitive() {
        login("C1", "alice");

        interpreter.handle("C1", "/JOIN Lobby");

        assertThat(router.getSession("C1").room()).isEqualTo("Lobby");
    }

    @Test
    @DisplayName("모르는 명령은 보낸 사람에게만 알린다")
    void unknownCommand() {
        login("C1", "alice");
        login("C2", "bob");
        interpreter.handle("C1", "/join lobby");
        interpreter.handle("C2", "/join lobby");
        transport.clear();

        interpreter.handle("C1", "/Dance now");

        assertThat(transport.received("C1")).containsExactly("Unknown command: dance");
        assertThat(transport.received("C2")).isEmpty();
    }

    @Test
    @DisplayName("방 밖에서 보낸 텍스트는 오류로 응답한다")
    void textOutsideRoom() {
        login("C1", "alice");

        interpreter.handle("C1", "hello?");

        assertThat(transport.last("C1")).isEqualTo("Cannot send message if not in chatroom.");
    }

    @Test
    @DisplayName("/room은 현재 방 이름이나 안내 문구를 보낸다")
    void roomCommand() {
        login("C1", "alice");

        interpreter.handle("C1", "/room");
        assertThat(transport.last("C1")).isEqualTo("Not currently in a room. Type /join {room_name} to do so.");

        interpreter.handle("C1", "/join lobby");
        interpreter.handle("C1", "/room");
        assertThat(transport.last("C1")).isEqualTo("lobby");
    }

    @Test
    @DisplayName("방 밖의 /ls는 모든 방 이름을 보낸다")
    void listRoomsOutsideRoom() {
        login("C1", "alice");
        login("C2", "bob");
        login("C3", "carol");
        interpreter.handle("C1", "/join lobby");
        interpreter.handle("C2", "/join games");

        interpreter.handle("C3", "/ls");

        assertThat(transport.last("C3")).isEqualTo("games\nlobby");
    }

    @Test
    @DisplayName("방에 없을 때 /quit은 아무 일도 하지 않는다")
    void quitOutsideRoomIsNoop() {
        login("C1", "alice");
        transport.clear();

        interpreter.handle("C1", "/quit");

        assertThat(transport.received("C1")).isEmpty();
    }

    @Test
    @DisplayName("/help는 사용법을 보낸 사람에게만 보낸다")
    void help() {
        login("C1", "alice");

        interpreter.handle("C1", "/help");

        assertThat(transport.last("C1"))
                .isEqualTo(CommandInterpreter.HELP_TEXT)
                .startsWith("Commands available:")
                .contains("/join {chat_room_name}");
    }

    @Test
    @DisplayName("채팅 중 끊어진 구성원은 디렉터리에서 지워진다")
    void deadMemberDuringChat() {
        login("C1", "alice");
        login("C2", "bob");
        interpreter.handle("C1", "/join lobby");
        interpreter.handle("C2", "/join lobby");
        transport.markGone("C2");

        interpreter.handle("C1", "anyone?");

        assertThat(transport.last("C1")).isEqualTo("alice: anyone?");
        assertThat(router.listRoomMembers("lobby")).containsExactly("C1");
    }
}
