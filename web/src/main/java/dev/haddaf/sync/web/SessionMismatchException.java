package dev.haddaf.sync.web;

public class SessionMismatchException extends RuntimeException {

    public SessionMismatchException(String uid) {
        super("The session is not signed in as " + uid);
    }
}
