package com.techstock.infrastructure.csv;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.techstock.domain.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.function.Consumer;

/**
 * Streams rows of a headered CSV export. Columns are matched by header name,
 * so column order does not matter and extra columns are ignored.
 */
@Slf4j
@Component
public class ResourceCsvReader {

    private final ObjectReader reader;

    public ResourceCsvReader() {
        CsvMapper mapper = CsvMapper.builder()
                .enable(CsvParser.Feature.TRIM_SPACES)
                .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
                .build();
        this.reader = mapper.readerFor(ResourceCsvRow.class)
                .with(CsvSchema.emptySchema().withHeader());
    }

    /**
     * Hands every readable row to {@code consumer}.
     *
     * @return number of lines that could not be mapped to a row
     */
    public int read(InputStream input, Consumer<ResourceCsvRow> consumer) {
        int unreadable = 0;
        try (MappingIterator<ResourceCsvRow> rows = reader.readValues(input)) {
            while (true) {
                long offset = rows.getCurrentLocation().getCharOffset();
                ResourceCsvRow row;
                try {
                    if (!rows.hasNextValue()) {
                        break;
                    }
                    row = rows.nextValue();
                } catch (JsonProcessingException | RuntimeJsonMappingException e) {
                    unreadable++;
                    log.warn("Skipping unreadable CSV line: {}", e.getMessage());
                    // A parser that cannot move past the bad input ends the run
                    if (rows.getCurrentLocation().getCharOffset() == offset) {
                        break;
                    }
                    continue;
                }
                consumer.accept(row);
            }
        } catch (IOException e) {
            throw new InvalidInputException("Unreadable CSV: " + e.getMessage());
        }
        return unreadable;
    }
}
