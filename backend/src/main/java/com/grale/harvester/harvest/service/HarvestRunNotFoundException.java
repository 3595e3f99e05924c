package com.grale.harvester.harvest.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class HarvestRunNotFoundException extends RuntimeException {
    public HarvestRunNotFoundException(String ppid) {
        super("No harvest run with id " + ppid);
    }
}
