package io.mural.server.dto;

import io.mural.core.Message;

/**
 * JSON form of a board message.
 *   {
 *     "id": "node-a:7",
 *     "author": "alice",
 *     "content": "hello board",
 *     "counter": 7,
 *     "clockNode": "node-a",
 *     "originNode": "node-a"
 *   }
 */
public class MessageDto {
    public String id;
    public String author;
    public String content;
    public long counter;
    public String clockNode;
    public String originNode;

    public static MessageDto from(Message m) {
        var dto = new MessageDto();
        dto.id = m.id().toString();
        dto.author = m.author();
        dto.content = m.content();
        dto.counter = m.timestamp().counter();
        dto.clockNode = m.timestamp().nodeId();
        dto.originNode = m.originNode();
        return dto;
    }
}
