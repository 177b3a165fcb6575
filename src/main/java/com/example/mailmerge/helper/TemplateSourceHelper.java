package com.example.mailmerge.helper;

import com.example.mailmerge.exception.ConfigException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class TemplateSourceHelper {

    /** {@code @path} reads the template from a UTF-8 file, anything else is the template itself. */
    public String read(String source) {
        if (source == null) {
            return "";
        }
        if (!source.startsWith("@")) {
            return source;
        }
        Path path = Path.of(source.substring(1));
        try {
            return Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigException("Failed to read template file " + path, e);
        }
    }
}
