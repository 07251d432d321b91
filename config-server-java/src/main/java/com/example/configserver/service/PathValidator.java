package com.example.configserver.service;

import com.example.configserver.exception.BadRequestException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a user-supplied relative path into a clean, forward-slash path that cannot leave
 * the repository root.
 */
@Component
public class PathValidator {

    public String validate(String rawPath) {
        if (rawPath == null) {
            throw new BadRequestException("Path is required");
        }
        if (rawPath.startsWith("/") || rawPath.startsWith("\\") || hasDrivePrefix(rawPath)) {
            throw new BadRequestException("Absolute or root-relative paths are not allowed");
        }

        List<String> segments = new ArrayList<>();
        for (String segment : rawPath.split("[/\\\\]")) {
            if (segment.isEmpty() || segment.equals(".")) {
                continue;
            }
            if (segment.equals("..")) {
                throw new BadRequestException("Parent '..' segments are not allowed");
            }
            segments.add(segment);
        }
        return String.join("/", segments);
    }

    private boolean hasDrivePrefix(String path) {
        return path.length() >= 2 && path.charAt(1) == ':' && Character.isLetter(path.charAt(0));
    }
}
