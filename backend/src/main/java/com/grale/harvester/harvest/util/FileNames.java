package com.grale.harvester.harvest.util;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

public final class FileNames {
    private static final int MAX_NAME_LENGTH = 255;
    private static final Pattern DISALLOWED = Pattern.compile("[^.\\w\\s-]");
    private static final Pattern SEPARATORS = Pattern.compile("[-\\s]+");

    private FileNames() {
    }

    public static String sanitize(String name, String extension) {
        String value = name == null ? "" : name.toLowerCase(Locale.ROOT);
        value = DISALLOWED.matcher(value).replaceAll("");
        value = SEPARATORS.matcher(value).replaceAll("-");
        value = stripEdges(value);
        if (value.isEmpty()) {
            value = UUID.randomUUID().toString();
        }
        if (extension == null || extension.isBlank()) {
            return value.substring(0, Math.min(value.length(), MAX_NAME_LENGTH));
        }
        int prefixLength = MAX_NAME_LENGTH - (extension.length() + 1);
        return value.substring(0, Math.min(value.length(), prefixLength)) + "." + extension;
    }

    public static Path nextFreePath(Path directory, String name, String extension) {
        String fileName = sanitize(name, extension);
        Path candidate = directory.resolve(fileName);
        int sequence = 0;
        while (Files.exists(candidate)) {
            sequence++;
            candidate = directory.resolve(sequence + "_" + fileName);
        }
        return candidate;
    }

    private static String stripEdges(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && isEdge(value.charAt(start))) {
            start++;
        }
        while (end > start && isEdge(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    private static boolean isEdge(char c) {
        return c == '-' || c == '_';
    }
}
