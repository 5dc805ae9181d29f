package com.lrucache;

import java.io.IOException;

/**
 * Signals that a cache file is corrupt or was written in an unsupported format.
 */
public class CacheFormatException extends IOException {

    public CacheFormatException(String message) {
        super(message);
    }

    public CacheFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
