// file: server/src/main/java/io/mural/server/dto/PostMessageRequest.java
package io.mural.server.dto;

/**
 * JSON body for POST /messages.
 * Example:
 *   {
 *     "content": "hello board",
 *     "author": "alice",
 *     "token": "4f1c..."
 *   }
 * author is optional and defaults to the authenticated user. token may be sent
 * in an "Authorization: Bearer" header instead.
 */
public class PostMessageRequest {
    public String content;
    public String author;
    public String token;
}
