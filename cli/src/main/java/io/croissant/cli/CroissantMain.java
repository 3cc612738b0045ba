package io.croissant.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.croissant.cli.config.CliConfig;
import io.croissant.cli.config.ConfigLoadException;
import io.croissant.cli.config.ConfigLoader;
import io.croissant.core.Dataset;
import io.croissant.core.DatasetOptions;
import io.croissant.core.error.CroissantException;
import java.io.PrintStream;
import java.time.Duration;
import java.util.Iterator;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the {@code croissant} command-line tool.
 *
 * <ul>
 * <li>{@code validate} checks a metadata document and reports every problem found.</li>
 * <li>{@code load} prints the records of one record set as JSON lines on standard output.</li>
 * </ul>
 *
 * Exits with 0 on success, 1 when the document is invalid or cannot be materialized, 2 on a
 * usage or configuration error.
 */
public final class CroissantMain {

    private static final Logger LOG = LoggerFactory.getLogger(CroissantMain.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final int OK = 0;
    static final int FAILED = 1;
    static final int USAGE = 2;

    private CroissantMain() {
        // utility class
    }

    public static void main(String[] args) {
        CliConfig config;
        try {
            config = ConfigLoader.load(args);
        } catch (ConfigLoadException | IllegalArgumentException e) {
            LOG.error("Configuration failed: {}", e.getMessage());
            System.exit(USAGE);
            return;
        }
        LogbackConfigurator.configure(config);
        System.exit(run(args, config, System.out));
    }

    /**
     * Runs one command.
     *
     * @param out where {@code load} writes records
     * @return the process exit code
     */
    static int run(String[] args, CliConfig config, PrintStream out) {
        CliArguments arguments;
        try {
            arguments = CliArguments.parse(args);
        } catch (IllegalArgumentException e) {
            LOG.error("{}", e.getMessage());
            return USAGE;
        }
        DatasetOptions options = DatasetOptions.builder()
                .cacheDirectory(config.cacheDirectory())
                .httpTimeout(Duration.ofMillis(config.httpTimeoutMs()))
                .debug(arguments.debug())
                .build();
        try {
            Dataset dataset = Dataset.load(arguments.file(), options);
            if (arguments.command() == CliArguments.Command.LOAD) {
                long printed = print(dataset, arguments, out);
                LOG.info("Loaded records: record_set={}, count={}", arguments.recordSet(), printed);
            }
            LOG.info("Done.");
            return OK;
        } catch (CroissantException e) {
            LOG.error("{}", e.getMessage());
            LOG.debug("Failure detail: phase={}, node={}", e.phase(), e.nodeUid(), e);
            return FAILED;
        } catch (IllegalArgumentException e) {
            LOG.error("{}", e.getMessage());
            return USAGE;
        }
    }

    private static long print(Dataset dataset, CliArguments arguments, PrintStream out) {
        long printed = 0;
        try (Stream<ObjectNode> records = dataset.records(arguments.recordSet())) {
            Iterator<ObjectNode> iterator = records.iterator();
            while ((arguments.numRecords() < 0 || printed < arguments.numRecords()) && iterator.hasNext()) {
                out.println(MAPPER.writeValueAsString(iterator.next()));
                printed++;
            }
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize record: " + e.getMessage(), e);
        }
        out.flush();
        return printed;
    }
}
