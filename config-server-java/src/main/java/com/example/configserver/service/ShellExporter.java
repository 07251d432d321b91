package com.example.configserver.service;

import java.util.Map;

/**
 * Renders variables as shell {@code export} lines.
 */
public final class ShellExporter {

    private ShellExporter() {
    }

    public static String render(Map<String, String> variables) {
        StringBuilder body = new StringBuilder();
        for (Map.Entry<String, String> entry : variables.entrySet()) {
            body.append("export ")
                .append(entry.getKey())
                .append("=\"")
                .append(escape(entry.getValue()))
                .append("\"\n");
        }
        return body.toString();
    }

    static String escape(String value) {
        return value
            .replace("\\", "\\\\")
            .replace("\"", "\\\"")
            .replace("$", "\\$");
    }
}
