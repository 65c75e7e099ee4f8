package com.faqchat.service.data;

import com.faqchat.config.DatasetConfig;
import com.faqchat.exception.DatasetException;
import com.faqchat.model.QaEntry;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parses the delimited Q&A source into ordered {@link QaEntry} records.
 * Columns: question, answer, category, reference, remarks, display_order. The first row is a header.
 */
@Slf4j
@Component
public class QaDatasetParser {

    static final int COL_QUESTION = 0;
    static final int COL_ANSWER = 1;
    static final int COL_CATEGORY = 2;
    static final int COL_REFERENCE = 3;
    static final int COL_REMARKS = 4;
    static final int COL_DISPLAY_ORDER = 5;

    private final CsvMapper csvMapper;
    private final CsvSchema schema;

    @Autowired
    public QaDatasetParser(DatasetConfig datasetConfig) {
        this(datasetConfig.getDelimiter());
    }

    public QaDatasetParser(char delimiter) {
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.schema = CsvSchema.emptySchema().withColumnSeparator(delimiter);
    }

    public List<QaEntry> parse(Reader reader, String sourceName) {
        List<QaEntry> entries = new ArrayList<>();
        int row = 0;
        int dropped = 0;

        try (MappingIterator<String[]> rows = csvMapper.readerFor(String[].class)
                .with(schema)
                .readValues(reader)) {

            while (rows.hasNextValue()) {
                String[] columns = rows.nextValue();
                row++;

                if (row == 1 || isEmptyRow(columns)) {
                    continue;
                }
                if (columns.length < 2) {
                    throw DatasetException.malformedRow(row, columns.length);
                }

                String question = cell(columns, COL_QUESTION);
                String answer = cell(columns, COL_ANSWER);
                if (question == null || answer == null) {
                    log.warn("Dropping row {} of {}: blank question or answer", row, sourceName);
                    dropped++;
                    continue;
                }

                entries.add(QaEntry.builder()
                        .id(entries.size() + 1)
                        .question(question)
                        .answer(answer)
                        .category(cell(columns, COL_CATEGORY))
                        .reference(cell(columns, COL_REFERENCE))
                        .remarks(cell(columns, COL_REMARKS))
                        .displayOrder(displayOrder(cell(columns, COL_DISPLAY_ORDER)))
                        .build());
            }

        } catch (IOException | RuntimeJsonMappingException e) {
            throw new DatasetException(DatasetException.Kind.UNREADABLE,
                    "Failed to read " + sourceName + ": " + e.getMessage(), e);
        }

        if (entries.isEmpty()) {
            throw DatasetException.emptyDataset(sourceName);
        }

        log.info("Parsed {} Q&A entries from {} ({} dropped)", entries.size(), sourceName, dropped);
        return List.copyOf(entries);
    }

    private boolean isEmptyRow(String[] columns) {
        return columns.length == 0 || Arrays.stream(columns).allMatch(c -> c == null || c.isBlank());
    }

    private String cell(String[] columns, int index) {
        if (index >= columns.length || columns[index] == null) {
            return null;
        }
        String value = columns[index].strip();
        return value.isEmpty() ? null : value;
    }

    private int displayOrder(String raw) {
        if (raw == null) {
            return QaEntry.DEFAULT_DISPLAY_ORDER;
        }
        try {
            return (int) Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            return QaEntry.DEFAULT_DISPLAY_ORDER;
        }
    }
}
