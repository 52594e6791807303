package io.mural.server.dto;

import java.util.List;

/** JSON response for GET /messages, in display order. */
public class MessagesResponse {
    public String nodeId;
    public List<MessageDto> messages;
}
