package com.example.mailmerge.service;

import com.example.mailmerge.exception.ConfigException;
import com.example.mailmerge.model.RecipientRecord;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Reads the recipient table. Structural problems (unreadable file, bad CSV, missing header
 * columns) abort the run; a row without an address is only skipped.
 */
@Service
@Slf4j
public class RecipientLoader {
    public static final String EMAIL = "email";
    public static final String FIRSTNAME = "firstname";
    public static final String COMPANY = "company";
    public static final String CC = "cc";
    public static final String BCC = "bcc";
    public static final String ATTACHMENT = "attachment";
    public static final List<String> REQUIRED_COLUMNS = List.of(EMAIL, FIRSTNAME, COMPANY, CC, BCC, ATTACHMENT);

    private static final char BOM = '\uFEFF';

    private final CsvMapper csvMapper;

    public RecipientLoader() {
        this.csvMapper = CsvMapper.builder()
                .enable(CsvParser.Feature.WRAP_AS_ARRAY)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .enable(CsvParser.Feature.TRIM_SPACES)
                .build();
    }

    public List<RecipientRecord> load(Path csvPath) {
        if (!Files.isRegularFile(csvPath) || !Files.isReadable(csvPath)) {
            throw new ConfigException("Recipient table is missing or unreadable: " + csvPath);
        }

        try (Reader reader = Files.newBufferedReader(csvPath, StandardCharsets.UTF_8);
             MappingIterator<String[]> rows = csvMapper.readerFor(String[].class).readValues(reader)) {
            if (!rows.hasNextValue()) {
                throw new ConfigException("Recipient table is empty: " + csvPath);
            }
            List<String> header = readHeader(rows.nextValue());
            List<String> missing = REQUIRED_COLUMNS.stream()
                    .filter(column -> !header.contains(column))
                    .collect(Collectors.toList());
            if (!missing.isEmpty()) {
                throw new ConfigException("Recipient table " + csvPath + " is missing required columns " + missing);
            }

            List<RecipientRecord> recipients = new ArrayList<>();
            int rowNumber = 0;
            while (rows.hasNextValue()) {
                rowNumber++;
                Map<String, String> fields = toFields(header, rows.nextValue());
                if (fields.get(EMAIL).isEmpty()) {
                    log.warn("Skipping row {}: missing recipient address", rowNumber);
                    continue;
                }
                recipients.add(toRecord(rowNumber, fields));
            }
            log.info("Loaded {} recipient(s) from {}", recipients.size(), csvPath);
            return recipients;
        } catch (IOException | RuntimeJsonMappingException e) {
            throw new ConfigException("Failed to read recipient table " + csvPath + ": " + e.getMessage(), e);
        }
    }

    /** Splits a comma separated cell, trimming entries and dropping blank ones. */
    public static List<String> splitList(String cell) {
        if (cell == null || cell.isBlank()) {
            return Collections.emptyList();
        }
        return Arrays.stream(cell.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static List<String> readHeader(String[] row) {
        List<String> header = new ArrayList<>(row.length);
        for (int i = 0; i < row.length; i++) {
            String name = row[i] == null ? "" : row[i].trim();
            if (i == 0 && !name.isEmpty() && name.charAt(0) == BOM) {
                name = name.substring(1).trim();
            }
            header.add(name);
        }
        return header;
    }

    private static Map<String, String> toFields(List<String> header, String[] row) {
        Map<String, String> fields = new LinkedHashMap<>();
        for (int i = 0; i < header.size(); i++) {
            String name = header.get(i);
            if (name.isEmpty() || fields.containsKey(name)) {
                continue;
            }
            String value = i < row.length && row[i] != null ? row[i].trim() : "";
            fields.put(name, value);
        }
        return fields;
    }

    private static RecipientRecord toRecord(int rowNumber, Map<String, String> fields) {
        return RecipientRecord.builder()
                .rowNumber(rowNumber)
                .email(fields.get(EMAIL))
                .firstname(fields.get(FIRSTNAME))
                .company(fields.get(COMPANY))
                .cc(fields.get(CC))
                .bcc(fields.get(BCC))
                .attachments(splitList(fields.get(ATTACHMENT)))
                .fields(fields)
                .build();
    }
}
