package com.hemovita.repository;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.hemovita.exception.ReferenceDataException;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

/**
 * Reads header-first CSV tables into ordered row maps.
 * Header names and cell values are trimmed; blank cells become empty strings.
 */
@Component
public class CsvTableReader {

    private final ResourceLoader resourceLoader;
    private final CsvMapper csvMapper;

    public CsvTableReader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
        this.csvMapper = CsvMapper.builder()
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();
    }

    public boolean exists(String location) {
        return resourceLoader.getResource(location).exists();
    }

    /**
     * Reads every row of the table at the given resource location.
     *
     * @throws ReferenceDataException if the resource is missing or unreadable
     */
    public List<Map<String, String>> read(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ReferenceDataException("Reference table not found: " + location);
        }

        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<Map<String, String>> rows = new ArrayList<>();
        try (InputStream in = resource.getInputStream();
             MappingIterator<Map<String, String>> it = csvMapper
                 .readerFor(Map.class)
                 .with(schema)
                 .readValues(in)) {
            while (it.hasNext()) {
                Map<String, String> raw = it.next();
                Map<String, String> row = new LinkedHashMap<>();
                raw.forEach((k, v) -> row.put(k.trim(), v == null ? "" : v.trim()));
                rows.add(row);
            }
        } catch (IOException | RuntimeException e) {
            throw new ReferenceDataException("Failed to read reference table: " + location, e);
        }
        return rows;
    }
}
