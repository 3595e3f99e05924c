package com.grale.harvester.harvest.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidHarvestRequestException extends RuntimeException {
    public InvalidHarvestRequestException(String message) {
        super(message);
    }

    public InvalidHarvestRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
