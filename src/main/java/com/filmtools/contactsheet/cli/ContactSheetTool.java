package com.filmtools.contactsheet.cli;

import com.filmtools.contactsheet.config.ConfigService;
import com.filmtools.contactsheet.core.export.ExportFormat;
import com.filmtools.contactsheet.core.export.SheetExporter;
import com.filmtools.contactsheet.core.format.FormatCatalog;
import com.filmtools.contactsheet.core.format.FormatSpec;
import com.filmtools.contactsheet.core.image.ImageLoader;
import com.filmtools.contactsheet.core.model.MetadataField;
import com.filmtools.contactsheet.core.render.ContactSheetRenderer;
import com.filmtools.contactsheet.core.render.FontRegistry;
import com.filmtools.contactsheet.logging.AppLogger;
import com.filmtools.contactsheet.session.ContactSheetSession;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line entry point: builds one contact sheet from image files and folders.
 * <pre>
 * contact-sheet [--format ID] [--output FILE] [--type jpeg|png|pdf]
 *               [--date V] [--location V] [--developer V] [--camera V] [--lens V] [--film V]
 *               [--font-dir DIR] [--list-formats] INPUT...
 * </pre>
 * Inputs fall back to the comma separated {@code contactsheet.inputs} system property.
 */
public final class ContactSheetTool {
    private static final Logger LOGGER = AppLogger.get();

    static final String INPUTS_PROPERTY = "contactsheet.inputs";
    static final String DEFAULT_OUTPUT_NAME = "contact-sheet";

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 2;
    static final int EXIT_FAILURE = 1;

    private ContactSheetTool() {}

    public static void main(String[] args) {
        int code = run(args, System.out, System.err, System.getProperties());
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    static int run(String[] args, PrintStream out, PrintStream err, Properties properties) {
        Options options;
        try {
            options = Options.parse(args, properties);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(usage());
            return EXIT_USAGE;
        }

        FormatCatalog catalog = FormatCatalog.defaultCatalog();
        if (options.listFormats) {
            for (FormatSpec format : catalog.formats()) {
                out.println(format.id() + "\t" + format.displayName());
            }
            return EXIT_OK;
        }
        if (options.inputs.isEmpty()) {
            err.println("No input images given.");
            err.println(usage());
            return EXIT_USAGE;
        }

        ConfigService config = ConfigService.getInstance();
        try {
            loadFonts(options.fontDir.or(config::getFontDirectory));

            String formatId = options.formatId.orElseGet(config::getDefaultFormatId);
            ExportFormat type = options.type
                .or(() -> options.output.flatMap(ExportFormat::fromFileName))
                .orElse(ExportFormat.JPEG);
            Path output = options.output
                .orElseGet(() -> config.getOutputDirectory().resolve(DEFAULT_OUTPUT_NAME + "." + type.defaultExtension()));

            ContactSheetSession session = new ContactSheetSession(
                catalog,
                formatId,
                new ImageLoader(),
                new ContactSheetRenderer(catalog, config.getSheetSettings()),
                new SheetExporter());
            session.addImages(options.inputs);
            if (session.images().isEmpty()) {
                err.println("No supported images found in the given inputs.");
                return EXIT_FAILURE;
            }
            options.metadata.forEach(session::setMetadata);

            Path written = session.export(output, type);
            config.rememberFormat(session.format().id());
            if (written.getParent() != null) {
                config.rememberOutputDirectory(written.getParent());
            }
            out.println(written);
            return EXIT_OK;
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        } catch (IOException e) {
            LOGGER.log(Level.SEVERE, "Contact sheet generation failed", e);
            err.println("Failed: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static void loadFonts(Optional<Path> fontDir) {
        if (fontDir.isEmpty()) {
            return;
        }
        try {
            FontRegistry.loadFontsFromDirectory(fontDir.get().toString());
        } catch (IOException e) {
            LOGGER.warning("Custom fonts not loaded: " + e.getMessage());
        }
    }

    static String usage() {
        return "Usage: contact-sheet [--format ID] [--output FILE] [--type jpeg|png|pdf] "
            + "[--date V] [--location V] [--developer V] [--camera V] [--lens V] [--film V] "
            + "[--font-dir DIR] [--list-formats] INPUT...";
    }

    static final class Options {
        Optional<String> formatId = Optional.empty();
        Optional<Path> output = Optional.empty();
        Optional<ExportFormat> type = Optional.empty();
        Optional<Path> fontDir = Optional.empty();
        boolean listFormats;
        final Map<MetadataField, String> metadata = new EnumMap<>(MetadataField.class);
        final List<Path> inputs = new ArrayList<>();

        static Options parse(String[] args, Properties properties) {
            Options options = new Options();
            String[] safeArgs = args == null ? new String[0] : args;
            for (int i = 0; i < safeArgs.length; i++) {
                String arg = safeArgs[i];
                if (arg == null || arg.isBlank()) continue;
                if (!arg.startsWith("--")) {
                    options.inputs.add(Path.of(arg.trim()));
                    continue;
                }
                String name = arg.substring(2);
                switch (name) {
                    case "list-formats":
                        options.listFormats = true;
                        break;
                    case "format":
                        options.formatId = Optional.of(value(safeArgs, ++i, arg));
                        break;
                    case "output":
                        options.output = Optional.of(Path.of(value(safeArgs, ++i, arg)));
                        break;
                    case "type":
                        options.type = Optional.of(ExportFormat.parse(value(safeArgs, ++i, arg)));
                        break;
                    case "font-dir":
                        options.fontDir = Optional.of(Path.of(value(safeArgs, ++i, arg)));
                        break;
                    default:
                        MetadataField field = MetadataField.fromKey(name)
                            .orElseThrow(() -> new IllegalArgumentException("Unknown option: " + arg));
                        options.metadata.put(field, value(safeArgs, ++i, arg));
                }
            }

            if (options.type.isPresent() && options.output.isPresent()) {
                ExportFormat requested = options.type.get();
                ExportFormat.fromFileName(options.output.get())
                    .filter(fromName -> fromName != requested)
                    .ifPresent(fromName -> {
                        throw new IllegalArgumentException("--type " + requested.defaultExtension()
                            + " does not match output file " + options.output.get().getFileName());
                    });
            }

            if (options.inputs.isEmpty() && properties != null) {
                String csv = properties.getProperty(INPUTS_PROPERTY);
                if (csv != null && !csv.isBlank()) {
                    for (String p : csv.split(",")) {
                        String s = p.trim();
                        if (s.isEmpty()) continue;
                        Path path = Path.of(s);
                        if (Files.exists(path)) options.inputs.add(path);
                    }
                }
            }
            return options;
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length || args[index] == null || args[index].startsWith("--")) {
                throw new IllegalArgumentException("Missing value for " + option);
            }
            return args[index].trim();
        }
    }
}
