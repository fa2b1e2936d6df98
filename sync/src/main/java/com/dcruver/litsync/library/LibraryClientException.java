package com.dcruver.litsync.library;

/**
 * The library could not be read at all (missing database, unreadable schema).
 */
public class LibraryClientException extends RuntimeException {

    public LibraryClientException(String message) {
        super(message);
    }

    public LibraryClientException(String message, Throwable cause) {
        super(message, cause);
    }
}
