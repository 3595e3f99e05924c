package com.grale.harvester.harvest.plan;

public class PlanningException extends RuntimeException {
    public PlanningException(String message) {
        super(message);
    }
}
