package com.txledger.adapter.out.csv;

import com.txledger.domain.model.AccountSnapshot;
import com.txledger.domain.model.Amount;
import io.vertx.core.Future;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CsvSnapshotSink
 */
class CsvSnapshotSinkTest {

    @Test
    void accept_writesHeaderAndOneRowPerClient() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        Future<Void> result = new CsvSnapshotSink(out).accept(List.of(
                new AccountSnapshot(1, Amount.parse("7.5"), Amount.ZERO, Amount.parse("7.5"), true),
                new AccountSnapshot(2, Amount.parse("9"), Amount.ZERO, Amount.parse("9"), false)
        ));

        assertTrue(result.succeeded());
        assertEquals("client,available,held,total,locked\n"
                + "1,7.5,0.0,7.5,true\n"
                + "2,9.0,0.0,9.0,false\n", out.toString(StandardCharsets.UTF_8));
    }

    @Test
    void accept_rendersFourDigitsAndNegativeHeld() {
        StringWriter out = new StringWriter();

        new CsvSnapshotSink(out).accept(List.of(
                new AccountSnapshot(3, Amount.parse("0.0001"), Amount.parse("-1.25"), Amount.parse("-1.2499"), false)
        ));

        assertEquals("client,available,held,total,locked\n"
                + "3,0.0001,-1.25,-1.2499,false\n", out.toString());
    }

    @Test
    void accept_noSnapshots_writesHeaderOnly() {
        StringWriter out = new StringWriter();

        new CsvSnapshotSink(out).accept(List.of());

        assertEquals("client,available,held,total,locked\n", out.toString());
    }

    @Test
    void accept_writeFailure_failsFuture() {
        Writer broken = new Writer() {
            @Override
            public void write(char[] cbuf, int off, int len) throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public void flush() throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public void close() {
            }
        };

        Future<Void> result = new CsvSnapshotSink(broken).accept(List.of(
                new AccountSnapshot(1, Amount.ZERO, Amount.ZERO, Amount.ZERO, false)
        ));

        assertTrue(result.failed());
        assertInstanceOf(IOException.class, result.cause());
    }

    @Test
    void snapshotRow_rendersAmounts() {
        SnapshotRow row = SnapshotRow.from(new AccountSnapshot(4, Amount.parse("100"), Amount.parse("2.5"), Amount.parse("102.5"), true));

        assertEquals(new SnapshotRow(4, "100.0", "2.5", "102.5", true), row);
    }
}
