package com.grale.harvester.harvest.model;

public final class OutcomeStatus {
    public static final String SUCCESS = "Success";
    public static final String TIMEOUT = "Timeout";
    public static final String TRANSPORT_ERROR = "Error:(Transport)";
    public static final String UNIDENTIFIED_ERROR = "Error:(Unidentified)";

    private OutcomeStatus() {
    }

    public static String serviceError(String code) {
        if (code == null || code.isBlank()) {
            return UNIDENTIFIED_ERROR;
        }
        return "Error:(" + code.trim() + ")";
    }

    public static boolean isError(String status) {
        return status != null && (status.startsWith("Error:") || TIMEOUT.equals(status));
    }
}
