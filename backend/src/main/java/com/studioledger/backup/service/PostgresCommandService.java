package com.studioledger.backup.service;

import com.studioledger.backup.exception.DatabaseCommandException;
import com.studioledger.backup.util.FormatUtils;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the PostgreSQL client tools against the application database.
 * Connection details come from {@code spring.datasource.*}; the password is passed
 * through {@code PGPASSWORD} so it never appears on a command line.
 */
@Slf4j
@Service
public class PostgresCommandService {

    /**
     * Prepended to every restore script so the dump is applied to an empty schema,
     * inside the same transaction as the dump itself.
     */
    static final String SCHEMA_RESET_SQL = "DROP SCHEMA IF EXISTS public CASCADE;\nCREATE SCHEMA public;\n";

    private static final int OUTPUT_TAIL_CHARS = 2000;

    @Value("${spring.datasource.url}")
    private String datasourceUrl;

    @Value("${spring.datasource.username:}")
    private String datasourceUsername;

    @Value("${spring.datasource.password:}")
    private String datasourcePassword;

    @Value("${backup.pg-dump-command:pg_dump}")
    private String pgDumpCommand;

    @Value("${backup.psql-command:psql}")
    private String psqlCommand;

    @Value("${backup.command-timeout-minutes:30}")
    private long commandTimeoutMinutes;

    private ConnectionInfo connectionInfo;

    /**
     * Write a plain-SQL dump of the database, without ownership or privilege statements.
     */
    public void dumpDatabase(Path outputFile) {
        runCommand(buildDumpCommand(outputFile), "pg_dump");
        log.info("Database dumped to {} ({})", outputFile.getFileName(), FormatUtils.formatBytes(sizeOf(outputFile)));
    }

    /**
     * Replace the contents of the public schema with a plain-SQL dump. The schema reset
     * and the dump run in a single transaction that stops at the first error, so a failed
     * restore leaves the database untouched.
     */
    public void restoreDatabase(Path dumpFile) {
        Path script = dumpFile.resolveSibling("restore-script.sql");
        try (OutputStream out = Files.newOutputStream(script)) {
            out.write(SCHEMA_RESET_SQL.getBytes(StandardCharsets.UTF_8));
            Files.copy(dumpFile, out);
        } catch (IOException e) {
            throw new DatabaseCommandException("Failed to prepare restore script", e);
        }

        try {
            runCommand(buildRestoreCommand(script), "psql");
            log.info("Database restored from {}", dumpFile.getFileName());
        } finally {
            try {
                Files.deleteIfExists(script);
            } catch (IOException e) {
                log.warn("Failed to remove restore script {}: {}", script, e.getMessage());
            }
        }
    }

    public String getDatabaseName() {
        return connectionInfo().database();
    }

    List<String> buildDumpCommand(Path outputFile) {
        List<String> command = new ArrayList<>();
        command.add(pgDumpCommand);
        command.addAll(connectionArgs());
        command.add("--format=plain");
        command.add("--no-owner");
        command.add("--no-privileges");
        command.add("--file=" + outputFile.toAbsolutePath());
        return command;
    }

    List<String> buildRestoreCommand(Path scriptFile) {
        List<String> command = new ArrayList<>();
        command.add(psqlCommand);
        command.addAll(connectionArgs());
        command.add("--quiet");
        command.add("--no-psqlrc");
        command.add("--single-transaction");
        command.add("--set=ON_ERROR_STOP=1");
        command.add("--file=" + scriptFile.toAbsolutePath());
        return command;
    }

    void runCommand(List<String> command, String toolName) {
        log.debug("Running {} against database {}", toolName, connectionInfo().database());
        Instant start = Instant.now();

        ProcessBuilder builder = new ProcessBuilder(command);
        builder.redirectErrorStream(true);
        if (datasourcePassword != null && !datasourcePassword.isEmpty()) {
            builder.environment().put("PGPASSWORD", datasourcePassword);
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new DatabaseCommandException(toolName + " could not be started: " + e.getMessage(), e);
        }

        ByteArrayOutputStream output = new ByteArrayOutputStream();
        Thread drain = drainOutput(process, output);
        try {
            boolean finished = process.waitFor(commandTimeoutMinutes, TimeUnit.MINUTES);
            if (!finished) {
                process.destroyForcibly();
                throw new DatabaseCommandException(toolName + " timed out after " + commandTimeoutMinutes + " minutes");
            }
            drain.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new DatabaseCommandException(toolName + " was interrupted", e);
        }

        int exitCode = process.exitValue();
        String tail = FormatUtils.tail(output.toString(StandardCharsets.UTF_8), OUTPUT_TAIL_CHARS);
        if (exitCode != 0) {
            throw new DatabaseCommandException(toolName + " failed with exit code " + exitCode
                    + (tail.isEmpty() ? "" : ": " + tail));
        }
        log.debug("{} finished in {}", toolName, FormatUtils.formatDuration(Duration.between(start, Instant.now())));
    }

    private List<String> connectionArgs() {
        ConnectionInfo info = connectionInfo();
        List<String> args = new ArrayList<>(List.of("--host=" + info.host(), "--port=" + info.port()));
        if (datasourceUsername != null && !datasourceUsername.isBlank()) {
            args.add("--username=" + datasourceUsername);
        }
        args.add("--dbname=" + info.database());
        return args;
    }

    private synchronized ConnectionInfo connectionInfo() {
        if (connectionInfo == null) {
            connectionInfo = ConnectionInfo.parse(datasourceUrl);
        }
        return connectionInfo;
    }

    private static Thread drainOutput(Process process, ByteArrayOutputStream sink) {
        Thread thread = new Thread(() -> {
            try (InputStream input = process.getInputStream()) {
                input.transferTo(sink);
            } catch (IOException e) {
                log.debug("Stopped reading process output: {}", e.getMessage());
            }
        }, "pg-command-output");
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static long sizeOf(Path file) {
        try {
            return Files.size(file);
        } catch (IOException e) {
            return 0L;
        }
    }

    /**
     * Host, port and database name taken from a {@code jdbc:postgresql://} URL.
     */
    record ConnectionInfo(String host, int port, String database) {

        static ConnectionInfo parse(String jdbcUrl) {
            if (jdbcUrl == null || !jdbcUrl.startsWith("jdbc:postgresql://")) {
                throw new IllegalStateException("Datasource is not a PostgreSQL JDBC URL: " + jdbcUrl);
            }
            URI uri = URI.create(jdbcUrl.substring("jdbc:".length()));
            String host = uri.getHost() != null ? uri.getHost() : "localhost";
            int port = uri.getPort() > 0 ? uri.getPort() : 5432;
            String path = uri.getPath();
            if (path == null || path.length() <= 1) {
                throw new IllegalStateException("Datasource URL has no database name: " + jdbcUrl);
            }
            return new ConnectionInfo(host, port, path.substring(1));
        }
    }
}
