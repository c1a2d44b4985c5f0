package com.sparky.suppress.web;

import java.net.URI;

/**
 * The remote could not be reached at all. Not recoverable within a run.
 */
public class RemoteConnectionException extends RuntimeException {
    public RemoteConnectionException(URI uri, Throwable cause) {
        super("Connection to " + uri + " failed: " + cause, cause);
    }
}
