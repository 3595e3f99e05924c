package com.grale.harvester.harvest.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.grale.harvester.harvest.http.SessionResponse;
import com.grale.harvester.harvest.model.OutcomeStatus;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.List;

@Component
public class OutcomeClassifier {
    private final ObjectMapper objectMapper;

    public OutcomeClassifier(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Outcome classify(SessionResponse response) {
        long elapsedMillis = response.elapsedOrZero().toMillis();
        if (response.isTransportError()) {
            String status = SessionResponse.TIMEOUT.equals(response.errorCode())
                ? OutcomeStatus.TIMEOUT
                : OutcomeStatus.TRANSPORT_ERROR;
            String message = response.errorMessage() == null ? response.errorCode() : response.errorMessage();
            return new Outcome(status, List.of(message), elapsedMillis, 0L, null);
        }

        String text = response.bodyText();
        long size = response.size();
        JsonNode body = parse(response.body());
        if (body == null || !body.isObject()) {
            return new Outcome(OutcomeStatus.UNIDENTIFIED_ERROR, List.of(text), elapsedMillis, size, null);
        }
        JsonNode error = body.get("error");
        if (error != null && !error.isNull()) {
            return new Outcome(OutcomeStatus.serviceError(errorCode(error)), List.of(text), elapsedMillis, size, body);
        }
        if (!response.isHttpSuccess()) {
            return new Outcome(OutcomeStatus.serviceError("HTTP " + response.statusCode()), List.of(text), elapsedMillis, size, body);
        }
        return new Outcome(OutcomeStatus.SUCCESS, List.of(successMessage(size, elapsedMillis)), elapsedMillis, size, body);
    }

    public Outcome unidentified(Outcome outcome, String detail) {
        return new Outcome(OutcomeStatus.UNIDENTIFIED_ERROR, List.of(detail), outcome.elapsedMillis(), outcome.sizeBytes(), null);
    }

    public static String successMessage(long sizeBytes, long elapsedMillis) {
        return "Size: " + sizeBytes + "(B), Time :" + (elapsedMillis / 1000.0) + "(s)";
    }

    private String errorCode(JsonNode error) {
        if (error.isObject()) {
            JsonNode code = error.get("code");
            if (code != null && !code.isNull() && !code.asText().isBlank()) {
                return code.asText();
            }
            return null;
        }
        return null;
    }

    private JsonNode parse(byte[] body) {
        if (body == null || body.length == 0) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (IOException e) {
            return null;
        }
    }

    public record Outcome(
        String status,
        List<String> results,
        long elapsedMillis,
        long sizeBytes,
        JsonNode body
    ) {
        public boolean isSuccess() {
            return OutcomeStatus.SUCCESS.equals(status);
        }
    }
}
