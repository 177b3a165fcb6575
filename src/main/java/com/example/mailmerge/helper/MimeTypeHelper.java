package com.example.mailmerge.helper;

import jakarta.activation.MimetypesFileTypeMap;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Content type from file extension. The table comes from {@code META-INF/mime.types} on the
 * classpath; unknown extensions fall back to {@value #DEFAULT_TYPE}.
 */
@Component
public class MimeTypeHelper {
    public static final String DEFAULT_TYPE = "application/octet-stream";

    private final MimetypesFileTypeMap typeMap = new MimetypesFileTypeMap();

    public String contentType(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return DEFAULT_TYPE;
        }
        String type = typeMap.getContentType(name.toString().toLowerCase(Locale.ROOT));
        return type == null || type.isBlank() ? DEFAULT_TYPE : type;
    }
}
