package com.taskmate.websocket.dto;

import lombok.Data;
import lombok.NoArgsConstructor;

/** Inbound frame: {@code {"message": "..."}}. */
@Data
@NoArgsConstructor
public class ClientMessage {
    private String message;
}
