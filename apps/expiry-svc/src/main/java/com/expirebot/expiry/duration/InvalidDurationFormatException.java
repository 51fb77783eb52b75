package com.expirebot.expiry.duration;

public class InvalidDurationFormatException extends IllegalArgumentException {

    public InvalidDurationFormatException(String input) {
        super("Invalid duration format: " + input);
    }

    public InvalidDurationFormatException(String input, Throwable cause) {
        super("Invalid duration format: " + input, cause);
    }
}
