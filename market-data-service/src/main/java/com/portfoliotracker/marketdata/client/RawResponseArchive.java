package com.portfoliotracker.marketdata.client;

import com.portfoliotracker.common.model.DataClass;
import com.portfoliotracker.common.model.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Keeps the latest raw provider body per (symbol, call kind) on disk for audit and debugging,
 * as {@code <dir>/<kind>_data_<SYMBOL>.json}.
 *
 * <p>Writes are fire-and-forget on {@code boundedElastic}: {@link #record} returns immediately
 * and a failed write is only logged.
 */
@Component
public class RawResponseArchive {

    private static final Logger log = LoggerFactory.getLogger(RawResponseArchive.class);

    private final Path directory;

    public RawResponseArchive(@Value("${market-data.archive-dir:logs}") String directory) {
        this.directory = Path.of(directory);
    }

    public void record(Symbol symbol, DataClass dataClass, String body) {
        write(symbol, dataClass, body)
            .subscribeOn(Schedulers.boundedElastic())
            .subscribe(
                path -> log.debug("RAW_ARCHIVED symbol={} kind={} path={}", symbol, dataClass.archiveKey(), path),
                e -> log.warn("RAW_ARCHIVE_FAILED symbol={} kind={} err={}",
                    symbol, dataClass.archiveKey(), e.toString()));
    }

    Mono<Path> write(Symbol symbol, DataClass dataClass, String body) {
        return Mono.fromCallable(() -> {
            Files.createDirectories(directory);
            Path target = pathFor(symbol, dataClass);
            // temp file + move so readers never see a half-written body
            Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            try {
                Files.writeString(temp, body == null ? "" : body, StandardCharsets.UTF_8);
                return Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException | RuntimeException e) {
                Files.deleteIfExists(temp);
                throw e;
            }
        });
    }

    Path pathFor(Symbol symbol, DataClass dataClass) {
        return directory.resolve(dataClass.archiveKey() + "_data_" + symbol.value() + ".json");
    }
}
