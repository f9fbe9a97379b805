package com.txledger.adapter.in.csv;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.txledger.application.port.out.TransactionSource;
import com.txledger.domain.exception.TransactionParseException;
import com.txledger.domain.exception.TransactionParseException.Reason;
import com.txledger.domain.model.TransactionRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;

/**
 * Reads transactions lazily from CSV.
 *
 * <p>The first row is a header naming the columns {@code type, client, tx} and
 * optionally {@code amount}, in any order; cells are mapped by those names.
 * Values may be padded with spaces, and the amount cell may be missing
 * entirely on dispute, resolve and chargeback rows.
 */
@Slf4j
public class CsvTransactionSource implements TransactionSource {

    static final List<String> REQUIRED_COLUMNS = List.of("type", "client", "tx");
    static final String AMOUNT_COLUMN = "amount";

    private static final CsvMapper MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .build();

    private final Reader reader;
    private final MappingIterator<String[]> rows;
    private final TransactionRowMapper mapper;
    private boolean iterated;

    public CsvTransactionSource(Reader reader) throws IOException {
        this(reader, new TransactionRowMapper(new TransactionRowValidator()));
    }

    public CsvTransactionSource(Reader reader, TransactionRowMapper mapper) throws IOException {
        this.reader = reader;
        this.mapper = mapper;
        this.rows = MAPPER.readerFor(String[].class).readValues(reader);
    }

    public static CsvTransactionSource open(Path path) throws IOException {
        log.info("Reading input from {}", path);
        return new CsvTransactionSource(Files.newBufferedReader(path, StandardCharsets.UTF_8));
    }

    @Override
    public Iterator<TransactionRecord> iterator() {
        if (iterated) {
            throw new IllegalStateException("CSV transaction source can only be iterated once");
        }
        iterated = true;
        return new RecordIterator();
    }

    @Override
    public void close() throws IOException {
        try {
            rows.close();
        } finally {
            reader.close();
        }
    }

    /**
     * Column positions by name, or a MALFORMED_ROW failure if the header is not a valid one
     */
    static Map<String, Integer> columnsOf(String[] header) {
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            String name = header[i].trim();
            boolean known = REQUIRED_COLUMNS.contains(name) || AMOUNT_COLUMN.equals(name);
            if (!known || columns.putIfAbsent(name, i) != null) {
                throw invalidHeader(header);
            }
        }
        if (!columns.keySet().containsAll(REQUIRED_COLUMNS)) {
            throw invalidHeader(header);
        }
        return columns;
    }

    private static TransactionParseException invalidHeader(String[] header) {
        return new TransactionParseException(Reason.MALFORMED_ROW,
                "header must name the columns type, client, tx and optionally amount (got "
                        + String.join(",", header) + ")");
    }

    private class RecordIterator implements Iterator<TransactionRecord> {
        private Map<String, Integer> columns;
        private long rowNumber;

        @Override
        public boolean hasNext() {
            if (columns == null) {
                if (!hasNextRow()) {
                    return false;
                }
                columns = columnsOf(nextRow());
                log.debug("Input columns: {}", columns);
            }
            return hasNextRow();
        }

        @Override
        public TransactionRecord next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }

            rowNumber++;
            String[] cells = nextRow();
            if (cells.length > columns.size()) {
                throw TransactionParseException.malformed(rowNumber,
                        "expected at most " + columns.size() + " columns (got " + Arrays.toString(cells) + ")");
            }

            TransactionRow row = new TransactionRow(
                    cell(cells, "type"),
                    cell(cells, "client"),
                    cell(cells, "tx"),
                    cell(cells, AMOUNT_COLUMN));
            return mapper.toRecord(row, rowNumber);
        }

        private String cell(String[] cells, String column) {
            Integer index = columns.get(column);
            return index != null && index < cells.length ? cells[index] : null;
        }

        private boolean hasNextRow() {
            try {
                return rows.hasNextValue();
            } catch (JsonProcessingException e) {
                throw TransactionParseException.malformed(rowNumber + 1, e.getOriginalMessage());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read transaction input", e);
            }
        }

        private String[] nextRow() {
            try {
                return rows.nextValue();
            } catch (JsonProcessingException e) {
                throw TransactionParseException.malformed(rowNumber, e.getOriginalMessage());
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read transaction input", e);
            }
        }
    }
}
