package com.grale.harvester.harvest.model;

public enum OutputMode {
    MEMORY,
    SPILL
}
