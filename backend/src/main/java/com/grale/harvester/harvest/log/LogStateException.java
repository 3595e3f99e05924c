package com.grale.harvester.harvest.log;

public class LogStateException extends RuntimeException {
    public LogStateException(String message) {
        super(message);
    }
}
