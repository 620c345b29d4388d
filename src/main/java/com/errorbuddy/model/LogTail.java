package com.errorbuddy.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Last lines of a log file, oldest first.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class LogTail {

    private static final LogTail EMPTY = new LogTail(List.of());

    private final List<String> lines;

    private LogTail(List<String> lines) {
        this.lines = lines;
    }

    public static LogTail of(List<String> lines) {
        return lines.isEmpty() ? EMPTY : new LogTail(List.copyOf(lines));
    }

    public static LogTail empty() {
        return EMPTY;
    }

    public int size() {
        return lines.size();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }

    public String asText() {
        return String.join("\n", lines);
    }
}
