package com.sparky.suppress.retrieve;

import io.vertx.core.json.JsonObject;

/**
 * A listing page carried a link relation the paging protocol does not define.
 */
public class UnexpectedLinkException extends RuntimeException {
    public UnexpectedLinkException(JsonObject link) {
        super("Unexpected link in response: " + link.encode());
    }
}
