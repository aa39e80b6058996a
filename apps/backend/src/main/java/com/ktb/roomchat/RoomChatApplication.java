package com.ktb.roomchat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RoomChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoomChatApplication.class, args);
    }
}
