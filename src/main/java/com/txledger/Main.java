package com.txledger;

import com.txledger.adapter.in.csv.CsvTransactionSource;
import com.txledger.adapter.out.csv.CsvSnapshotSink;
import com.txledger.application.engine.EngineType;
import com.txledger.application.engine.LedgerEngine;
import com.txledger.application.engine.SerialLedgerEngine;
import com.txledger.application.engine.StreamLedgerEngine;
import com.txledger.application.service.TransactionProcessingService;
import com.txledger.domain.model.LedgerStore;
import com.txledger.infrastructure.config.ApplicationConfig;
import com.txledger.infrastructure.config.ConfigLoader;
import com.txledger.infrastructure.config.EngineConfig;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Main application entry point.
 * Usage: {@code transaction-ledger-engine <transactions.csv>}; snapshots go to standard output.
 */
public class Main {

    static {
        // Route Vert.x internal logging through SLF4J
        System.setProperty("vertx.logger-delegate-factory-class-name", "io.vertx.core.logging.SLF4JLogDelegateFactory");
    }

    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_FAILED = 2;

    private static final long CLOSE_TIMEOUT_SECONDS = 10;

    public static void main(String[] args) {
        System.exit(run(args, System.out));
    }

    static int run(String[] args, OutputStream out) {
        if (args.length != 1) {
            log.error("Usage: transaction-ledger-engine <transactions.csv>");
            return EXIT_USAGE;
        }

        Path input = Path.of(args[0]);
        if (!Files.isReadable(input)) {
            log.error("Input file not readable: {}", input);
            return EXIT_USAGE;
        }

        EngineConfig engineConfig;
        try {
            ApplicationConfig config = ConfigLoader.load();
            engineConfig = config.getEngine();
        } catch (IllegalStateException e) {
            log.error(e.getMessage(), e);
            return EXIT_FAILED;
        }

        Vertx vertx = null;
        try (CsvTransactionSource source = CsvTransactionSource.open(input)) {
            LedgerStore store = new LedgerStore();
            LedgerEngine engine;
            if (engineConfig.getEngineType() == EngineType.STREAM) {
                vertx = Vertx.vertx(new VertxOptions().setWorkerPoolSize(1));
                engine = new StreamLedgerEngine(vertx, store, engineConfig);
            } else {
                engine = new SerialLedgerEngine(store);
            }

            TransactionProcessingService service = new TransactionProcessingService(engine, new CsvSnapshotSink(out));
            service.process(source)
                    .toCompletionStage()
                    .toCompletableFuture()
                    .get();
            return EXIT_OK;

        } catch (ExecutionException e) {
            log.error("Processing failed: {}", e.getCause().getMessage());
            return EXIT_FAILED;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while processing", e);
            return EXIT_FAILED;
        } catch (IOException e) {
            log.error("Failed to read {}: {}", input, e.getMessage());
            return EXIT_FAILED;
        } finally {
            if (vertx != null) {
                close(vertx);
            }
        }
    }

    private static void close(Vertx vertx) {
        try {
            vertx.close().toCompletionStage().toCompletableFuture().get(CLOSE_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while shutting down Vert.x");
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Failed to shut down Vert.x cleanly: {}", e.getMessage());
        }
    }
}
