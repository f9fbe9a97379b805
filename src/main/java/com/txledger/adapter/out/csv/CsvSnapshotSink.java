package com.txledger.adapter.out.csv;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.txledger.application.port.out.SnapshotSink;
import com.txledger.domain.model.AccountSnapshot;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes snapshots as CSV with a {@code client,available,held,total,locked} header.
 * The target stream is flushed but never closed, so standard output can be used.
 */
@Slf4j
public class CsvSnapshotSink implements SnapshotSink {

    private static final CsvMapper MAPPER = CsvMapper.builder()
            .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
            .build();

    private static final CsvSchema SCHEMA = MAPPER.schemaFor(SnapshotRow.class)
            .withHeader()
            .withLineSeparator("\n");

    private final Writer writer;

    public CsvSnapshotSink(OutputStream out) {
        this(new OutputStreamWriter(out, StandardCharsets.UTF_8));
    }

    public CsvSnapshotSink(Writer writer) {
        this.writer = writer;
    }

    @Override
    public Future<Void> accept(List<AccountSnapshot> snapshots) {
        try (SequenceWriter rows = MAPPER.writerFor(SnapshotRow.class).with(SCHEMA).writeValues(writer)) {
            for (AccountSnapshot snapshot : snapshots) {
                rows.write(SnapshotRow.from(snapshot));
            }
            rows.flush();
            writer.flush();
        } catch (IOException e) {
            log.error("Failed to write snapshots", e);
            return Future.failedFuture(e);
        }

        log.info("Wrote {} client snapshots", snapshots.size());
        return Future.succeededFuture();
    }
}
