package com.example.configserver.model;

import lombok.Value;
import org.springframework.http.MediaType;

@Value
public class RawFile {
    byte[] content;
    MediaType contentType;
    boolean binary;
}
