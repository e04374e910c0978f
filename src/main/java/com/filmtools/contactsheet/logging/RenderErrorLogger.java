package com.filmtools.contactsheet.logging;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.logging.Level;

/**
 * Appends failed render and export attempts to a CSV so they can be reviewed
 * after a batch run without scrolling through console output.
 */
public final class RenderErrorLogger {

    private static final String LOG_FILE_PROPERTY = "contactsheet.errorLog";
    private static final Path DEFAULT_LOG_FILE = Paths.get("target", "contact-sheet-errors.csv");
    private static final String HEADER = "timestamp,stage,format,image_count,target,exception_type,message";
    private static final DateTimeFormatter TIMESTAMP_FORMAT =
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
            .withZone(ZoneId.systemDefault());

    private RenderErrorLogger() {
    }

    public static void logFailure(String stage,
                                  String formatId,
                                  int imageCount,
                                  Path target,
                                  Exception exception) {
        String timestamp = TIMESTAMP_FORMAT.format(Instant.now());
        String message = (exception == null) ? "" : exception.getMessage();
        String exceptionType = (exception == null) ? "" : exception.getClass().getName();

        String[] columns = new String[] {
            timestamp,
            stage,
            formatId != null ? formatId : "",
            Integer.toString(imageCount),
            target == null ? "" : target.toString(),
            exceptionType,
            message != null ? message : ""
        };

        writeRow(logFile(), columns);
    }

    static Path logFile() {
        String override = System.getProperty(LOG_FILE_PROPERTY);
        if (override != null && !override.isBlank()) {
            return Paths.get(override.trim());
        }
        return DEFAULT_LOG_FILE;
    }

    private static void writeRow(Path logFile, String[] columns) {
        synchronized (RenderErrorLogger.class) {
            try {
                if (logFile.getParent() != null) {
                    Files.createDirectories(logFile.getParent());
                }
                boolean fileExists = Files.exists(logFile);
                try (BufferedWriter writer = Files.newBufferedWriter(
                    logFile,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND
                )) {
                    if (!fileExists) {
                        writer.write(HEADER);
                        writer.newLine();
                    }
                    writer.write(toCsv(columns));
                    writer.newLine();
                }
            } catch (IOException ioEx) {
                AppLogger.get().log(Level.WARNING, "Failed to write render error log: " + ioEx.getMessage());
            }
        }
    }

    static String toCsv(String[] columns) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < columns.length; i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(escape(columns[i]));
        }
        return sb.toString();
    }

    private static String escape(String value) {
        if (value == null) {
            return "";
        }
        boolean needsQuotes = value.contains(",") || value.contains("\"") || value.contains("\n") || value.contains("\r");
        String escaped = value.replace("\"", "\"\"");
        if (needsQuotes) {
            return "\"" + escaped + "\"";
        }
        return escaped;
    }
}
