package com.example.configserver.model;

import lombok.Value;

import java.time.OffsetDateTime;

@Value
public class ResolvedVersion {
    /** Full commit hash. */
    String commitId;
    OffsetDateTime commitTime;
}
