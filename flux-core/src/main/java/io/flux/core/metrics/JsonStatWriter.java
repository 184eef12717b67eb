package io.flux.core.metrics;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.flux.api.pool.PoolStat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.function.Consumer;

/**
 * Appends pool snapshots to a JSON-lines file, one object per line.
 * Meant to be plugged in as a pool's metric handler:
 * <pre>{@code
 * var writer = new JsonStatWriter(Path.of("pool-stats.jsonl"));
 * PoolConfig.create().metricInterval(Duration.ofSeconds(5)).metricHandler(writer);
 * }</pre>
 */
public class JsonStatWriter implements Consumer<PoolStat>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(JsonStatWriter.class);

    private final Path path;
    private final ObjectMapper objectMapper;
    private BufferedWriter streamWriter;

    public JsonStatWriter(Path path) {
        this.path = path;
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public synchronized void accept(PoolStat stat) {
        try {
            if (streamWriter == null) {
                streamWriter = Files.newBufferedWriter(path,
                        StandardOpenOption.CREATE, StandardOpenOption.APPEND);
                log.info("Writing pool stats to: {}", path.toAbsolutePath());
            }
            streamWriter.write(objectMapper.writeValueAsString(stat));
            streamWriter.newLine();
            streamWriter.flush();
        } catch (IOException e) {
            log.error("Failed to append pool stat to {}", path, e);
        }
    }

    @Override
    public synchronized void close() {
        if (streamWriter != null) {
            try {
                streamWriter.close();
            } catch (IOException e) {
                log.error("Failed to close stat writer", e);
            }
            streamWriter = null;
        }
    }
}
