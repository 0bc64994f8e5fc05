package dev.haddaf.sync.web;

public class NotSignedInException extends RuntimeException {

    public NotSignedInException() {
        super("Sign in to use this endpoint");
    }
}
