package io.github.yok.dwloader.parser;

import io.github.yok.dwloader.core.SourceFormat;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.io.input.BOMInputStream;

/**
 * Streams the records of a source extract with Apache Commons CSV.
 *
 * <p>
 * Every field is returned as the raw string found in the file (empty fields stay {@code ""}).
 * Records are recognized with any of CRLF, LF and CR; a leading UTF-8 byte order mark is dropped.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class CsvSourceParser {

    /**
     * Receives one data record.
     */
    @FunctionalInterface
    public interface RecordHandler {

        /**
         * Handles a record.
         *
         * @param recordNumber 1-based physical record number in the file (header records count)
         * @param fields raw field values
         * @throws Exception to stop parsing
         */
        void accept(long recordNumber, List<String> fields) throws Exception;
    }

    /**
     * Parses the file and passes every data record to the handler.
     *
     * @param source source extract
     * @param format CSV contract
     * @param handler record consumer
     * @return number of data records handed to the handler
     * @throws IOException if the file cannot be read or is malformed
     * @throws Exception if the handler fails
     */
    public long parse(Path source, SourceFormat format, RecordHandler handler) throws Exception {
        CSVFormat csvFormat = toCsvFormat(format);
        long data = 0;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(
                BOMInputStream.builder().setPath(source).get(), format.getCharset()));
                CSVParser parser = csvFormat.parse(reader)) {
            for (CSVRecord record : parser) {
                if (record.getRecordNumber() <= format.getHeaderRowsToSkip()) {
                    continue;
                }
                List<String> fields = new ArrayList<>(record.size());
                record.forEach(fields::add);
                handler.accept(record.getRecordNumber(), fields);
                data++;
            }
        } catch (UncheckedIOException e) {
            // Commons CSV reports malformed input from its iterator this way
            throw e.getCause();
        }
        log.debug("Parsed {} data record(s) from {}", data, source);
        return data;
    }

    /**
     * Builds the Commons CSV format of a source contract.
     *
     * @param format source contract
     * @return commons-csv format
     */
    static CSVFormat toCsvFormat(SourceFormat format) {
        return CSVFormat.DEFAULT.builder().setDelimiter(format.getDelimiter())
                .setQuote(format.getQuoteChar()).setRecordSeparator(format.getLineTerminator())
                .setIgnoreEmptyLines(true).setIgnoreSurroundingSpaces(false).setTrim(false)
                .build();
    }
}
