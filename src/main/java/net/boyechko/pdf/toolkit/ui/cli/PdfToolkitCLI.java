/*
 * PDF-Toolkit - Command-line PDF page assembly and extraction
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.toolkit.ui.cli;

import ch.qos.logback.classic.Level;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import net.boyechko.pdf.toolkit.core.DocumentAssembler;
import net.boyechko.pdf.toolkit.core.MergeOptions;
import net.boyechko.pdf.toolkit.core.NamingStrategy;
import net.boyechko.pdf.toolkit.core.OutputTarget;
import net.boyechko.pdf.toolkit.core.PageSelection;
import net.boyechko.pdf.toolkit.core.PdfOperationException;
import net.boyechko.pdf.toolkit.core.SplitRequest;
import net.boyechko.pdf.toolkit.core.ToolkitDefaults;
import net.boyechko.pdf.toolkit.core.VerbosityLevel;
import net.boyechko.pdf.toolkit.document.PdfCustodian;
import net.boyechko.pdf.toolkit.extract.AttachmentService;
import net.boyechko.pdf.toolkit.extract.FormFieldService;
import net.boyechko.pdf.toolkit.extract.InformationService;
import net.boyechko.pdf.toolkit.extract.PageObjectService;
import net.boyechko.pdf.toolkit.extract.TextExtractionService;
import net.boyechko.pdf.toolkit.extract.WatermarkOptions;
import net.boyechko.pdf.toolkit.extract.WatermarkService;
import net.boyechko.pdf.toolkit.render.ImageFormat;
import net.boyechko.pdf.toolkit.render.RenderRequest;
import net.boyechko.pdf.toolkit.render.RenderService;
import net.boyechko.pdf.toolkit.ui.OutputFormat;
import net.boyechko.pdf.toolkit.ui.ProcessingReporter;
import net.boyechko.pdf.toolkit.ui.ResultPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class PdfToolkitCLI {
    private static final String TOOLKIT_LOGGER = "net.boyechko.pdf.toolkit";

    private static Logger logger;

    /** Option names taking a value, by command. Options shared by all commands are added below. */
    private static final Map<String, Set<String>> VALUE_OPTIONS = new LinkedHashMap<>();

    /** Option names without a value, by command. */
    private static final Map<String, Set<String>> SWITCHES = new LinkedHashMap<>();

    static {
        command("split", Set.of("--range", "--names", "--name-list"), Set.of("--use-bookmarks"));
        command(
                "merge",
                Set.of("--input-directory", "--input-list"),
                Set.of("--recursive", "--delete-originals", "--strict"));
        command("convert", Set.of("--range", "--dpi", "--image-format", "--names"), Set.of());
        command("imagetopdf", Set.of(), Set.of());
        command("text", Set.of("--range", "--format"), Set.of());
        command("bookmarks", Set.of("--format"), Set.of());
        command("info", Set.of("--format"), Set.of());
        command("rotate", Set.of("--range", "--rotation"), Set.of());
        command("remove", Set.of("--pages"), Set.of());
        command("insert", Set.of("--positions", "--width", "--height"), Set.of());
        command("reorder", Set.of("--order"), Set.of());
        command("list-attachments", Set.of("--format"), Set.of());
        command("extract-attachments", Set.of("--index"), Set.of());
        command("list-objects", Set.of("--range", "--format"), Set.of());
        command("list-forms", Set.of("--format"), Set.of());
        command(
                "watermark",
                Set.of(
                        "--range",
                        "--text",
                        "--image",
                        "--font",
                        "--font-size",
                        "--color",
                        "--opacity",
                        "--angle",
                        "--scale"),
                Set.of());
        command("unlock", Set.of(), Set.of());
    }

    private static void command(String name, Set<String> values, Set<String> switches) {
        Set<String> allValues = new LinkedHashSet<>(values);
        allValues.addAll(Set.of("--input", "--output", "--password", "--config"));
        VALUE_OPTIONS.put(name, allValues);
        SWITCHES.put(name, switches);
    }

    // Configuration record to hold parsed CLI arguments
    public record CLIConfig(
            String command,
            List<Path> inputs,
            Path outputPath,
            String password,
            VerbosityLevel verbosity,
            Path configPath,
            Map<String, String> options,
            Set<String> switches) {
        public CLIConfig {
            if (command == null) {
                throw new IllegalArgumentException("Command is required");
            }
            if (verbosity == null) {
                throw new IllegalArgumentException("Verbosity level is required");
            }
            inputs = List.copyOf(inputs);
            options = Map.copyOf(options);
            switches = Set.copyOf(switches);
        }

        String option(String name) {
            return options.get(name);
        }

        boolean has(String name) {
            return switches.contains(name);
        }

        Path input() {
            return inputs.isEmpty() ? null : inputs.get(0);
        }
    }

    // Custom exception for CLI errors
    public static class CLIException extends Exception {
        public CLIException(String message) {
            super(message);
        }
    }

    /** Mutable builder that accumulates parsed CLI arguments. */
    static class CLIConfigBuilder {
        String command;
        List<Path> inputs = new ArrayList<>();
        Path outputPath;
        String password;
        VerbosityLevel verbosity = VerbosityLevel.NORMAL;
        Path configPath;
        Map<String, String> options = new LinkedHashMap<>();
        Set<String> switches = new LinkedHashSet<>();

        CLIConfig build() throws CLIException {
            if (command == null) {
                throw new CLIException("No command specified\n" + usageMessage());
            }
            return new CLIConfig(
                    command, inputs, outputPath, password, verbosity, configPath, options, switches);
        }
    }

    public static void main(String[] args) {
        int status = run(args, System.out, System.err);
        if (status != 0) {
            System.exit(status);
        }
    }

    /** Runs one command and returns the process exit status. */
    public static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0 || isHelpRequested(args)) {
            out.println(usageMessage());
            return args.length == 0 ? 1 : 0;
        }
        CLIConfig config;
        try {
            config = parseArguments(args);
        } catch (CLIException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        }
        configureLogging(config.verbosity());
        logger().info(
                        "Running {} with verbosity level {}",
                        config.command(),
                        config.verbosity());
        try {
            ToolkitDefaults defaults =
                    config.configPath() != null
                            ? ToolkitDefaults.fromFile(config.configPath())
                            : ToolkitDefaults.loadDefault();
            return new CommandRunner(config, defaults, out).execute();
        } catch (CLIException | IllegalArgumentException | IllegalStateException e) {
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (PdfOperationException e) {
            logger().debug("Operation failed", e);
            err.println("Error: " + e.getMessage());
            return 1;
        } catch (RuntimeException e) {
            logger().debug("Unexpected failure", e);
            String message = e.getMessage();
            err.println("Error: " + (message != null ? message : e.getClass().getSimpleName()));
            return 1;
        }
    }

    static CLIConfig parseArguments(String[] args) throws CLIException {
        CLIConfigBuilder b = new CLIConfigBuilder();
        String command = args[0].toLowerCase(Locale.ROOT);
        if (!VALUE_OPTIONS.containsKey(command)) {
            throw new CLIException("Unknown command: " + args[0] + "\n" + usageMessage());
        }
        b.command = command;

        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            String inlineValue = null;
            int equals = arg.indexOf('=');
            if (arg.startsWith("--") && equals > 0) {
                inlineValue = arg.substring(equals + 1);
                arg = arg.substring(0, equals);
            }
            switch (arg) {
                case "-q", "--quiet" -> b.verbosity = VerbosityLevel.QUIET;
                case "-v", "--verbose" -> b.verbosity = VerbosityLevel.VERBOSE;
                case "-vv", "--debug" -> b.verbosity = VerbosityLevel.DEBUG;
                case "-p" -> b.password = requireValue(args, ++i, "-p");
                default -> {
                    if (VALUE_OPTIONS.get(command).contains(arg)) {
                        String value = inlineValue != null ? inlineValue : requireValue(args, ++i, arg);
                        store(b, arg, value);
                    } else if (SWITCHES.get(command).contains(arg)) {
                        b.switches.add(arg);
                    } else if (arg.startsWith("-")) {
                        throw new CLIException("Unknown option " + arg + " for " + command);
                    } else {
                        b.inputs.add(Paths.get(arg));
                    }
                }
            }
        }
        return b.build();
    }

    private static void store(CLIConfigBuilder b, String option, String value) {
        switch (option) {
            case "--input" -> b.inputs.add(Paths.get(value));
            case "--output" -> b.outputPath = Paths.get(value);
            case "--password" -> b.password = value;
            case "--config" -> b.configPath = Paths.get(value);
            default -> b.options.put(option, value);
        }
    }

    private static String requireValue(String[] args, int i, String option) throws CLIException {
        if (i >= args.length) {
            throw new CLIException("Value not specified after " + option);
        }
        return args[i];
    }

    private static void configureLogging(VerbosityLevel verbosity) {
        Level level =
                switch (verbosity) {
                    case QUIET -> Level.ERROR;
                    case NORMAL -> Level.WARN;
                    case VERBOSE -> Level.INFO;
                    case DEBUG -> Level.DEBUG;
                };
        ((ch.qos.logback.classic.Logger) LoggerFactory.getLogger(TOOLKIT_LOGGER)).setLevel(level);
    }

    private static Logger logger() {
        if (logger == null) {
            logger = LoggerFactory.getLogger(PdfToolkitCLI.class);
        }
        return logger;
    }

    /** Executes one parsed command against the services. */
    private static final class CommandRunner {
        private final CLIConfig config;
        private final ToolkitDefaults defaults;
        private final PrintStream out;

        CommandRunner(CLIConfig config, ToolkitDefaults defaults, PrintStream out) {
            this.config = config;
            this.defaults = defaults;
            this.out = out;
        }

        int execute() throws CLIException, PdfOperationException {
            switch (config.command()) {
                case "split" -> split();
                case "merge" -> merge();
                case "convert" -> convert();
                case "imagetopdf" -> imageToPdf();
                case "text" -> printer().printText(
                        new TextExtractionService().extract(custodian("text extraction"), range()));
                case "bookmarks" -> printer().printBookmarks(
                        assembler(null).bookmarks(inputFile("bookmarks"), config.password()));
                case "info" -> printer().printInfo(
                        new InformationService().read(custodian("information")));
                case "rotate" -> rotate();
                case "remove" -> remove();
                case "insert" -> insert();
                case "reorder" -> reorder();
                case "list-attachments" -> printer().printAttachments(
                        new AttachmentService().list(custodian("listing attachments")));
                case "extract-attachments" -> extractAttachments();
                case "list-objects" -> printer().printObjects(
                        new PageObjectService().list(custodian("listing objects"), range()));
                case "list-forms" -> printer().printFormFields(
                        new FormFieldService().list(custodian("listing form fields")));
                case "watermark" -> watermark();
                case "unlock" -> unlock();
                default -> throw new CLIException("Unknown command: " + config.command());
            }
            return 0;
        }

        // ── Page assembly ───────────────────────────────────────────

        private void split() throws CLIException, PdfOperationException {
            Path input = inputFile("PDF splitting");
            Path outputDir = outputDirectory(input);
            Map<Integer, String> overrides = Map.of();
            String nameList = config.option("--name-list");
            if (nameList != null) {
                overrides = NamingStrategy.parseNameList(readLines(Paths.get(nameList)));
            }
            String template = config.option("--names");
            SplitRequest request =
                    new SplitRequest(
                            input,
                            config.password(),
                            range(),
                            config.has("--use-bookmarks"),
                            overrides,
                            template != null ? template : defaults.name_template);

            try (ProcessingReporter reporter = reporter()) {
                reporter.onOperationStart("Split " + input.getFileName());
                List<Path> written =
                        assembler(reporter).split(request, OutputTarget.directory(outputDir));
                reporter.onSuccess("Split " + written.size() + " page(s) into " + outputDir);
            }
        }

        private void merge() throws CLIException, PdfOperationException {
            Path output = config.outputPath();
            if (output == null) {
                throw new CLIException("Missing output filename --output");
            }
            if (Files.exists(output)) {
                throw new CLIException(output + " already exists, specify another location");
            }
            List<Path> inputs = mergeInputs();
            if (inputs.isEmpty()) {
                throw new CLIException("No valid PDF files found for merge operation");
            }
            MergeOptions options =
                    new MergeOptions(
                            config.password(),
                            config.has("--delete-originals"),
                            config.has("--strict") || Boolean.TRUE.equals(defaults.strict_merge));

            try (ProcessingReporter reporter = reporter()) {
                reporter.onOperationStart("Merge " + inputs.size() + " file(s)");
                int merged = assembler(reporter).merge(inputs, output, options);
                reporter.onSuccess("Merged " + merged + " file(s) into " + output);
            }
        }

        private List<Path> mergeInputs() throws CLIException {
            List<Path> inputs = new ArrayList<>(config.inputs());
            String directory = config.option("--input-directory");
            if (directory != null) {
                Path dir = Paths.get(directory);
                if (!Files.isDirectory(dir)) {
                    throw new CLIException("Input directory does not exist: " + dir);
                }
                int depth = config.has("--recursive") ? Integer.MAX_VALUE : 1;
                try (Stream<Path> files = Files.walk(dir, depth)) {
                    inputs.addAll(
                            files.filter(Files::isRegularFile)
                                    .filter(PdfToolkitCLI::isPdfName)
                                    .sorted()
                                    .collect(Collectors.toList()));
                } catch (IOException e) {
                    throw new CLIException("Failed to list " + dir + ": " + e.getMessage());
                }
            }
            String inputList = config.option("--input-list");
            if (inputList != null) {
                for (String line : readLines(Paths.get(inputList))) {
                    String entry = line.strip();
                    if (entry.isEmpty()) {
                        continue;
                    }
                    Path candidate = Paths.get(entry);
                    if (Files.isRegularFile(candidate) && isPdfName(candidate)) {
                        inputs.add(candidate);
                    } else {
                        logger().warn("Skipping input list entry {}", entry);
                    }
                }
            }
            return inputs;
        }

        private void rotate() throws CLIException, PdfOperationException {
            Path input = inputFile("rotate operation");
            Path output = requiredOutput("rotate");
            int rotation = intOption("--rotation", null);
            try (ProcessingReporter reporter = reporter()) {
                reporter.onOperationStart(
                        "Rotate " + input.getFileName() + " -> " + output.getFileName());
                assembler(reporter).rotate(input, config.password(), output, rotation, range());
                reporter.onSuccess("PDF pages rotated successfully");
            }
        }

        private void remove() throws CLIException, PdfOperationException {
            Path input = inputFile("remove operation");
            Path output = requiredOutput("remove");
            String pages = config.option("--pages");
            if (pages == null || pages.isBlank()) {
                throw new CLIException("No valid pages specified for removal");
            }
            PageSelection selection = PageSelection.parseRequired(pages);
            try (ProcessingReporter reporter = reporter()) {
                reporter.onOperationStart(
                        "Remove pages " + selection + " from " + input.getFileName());
                assembler(reporter).remove(input, config.password(), output, selection);
                reporter.onSuccess("PDF pages removed successfully");
            }
        }

        private void insert() throws CLIException, PdfOperationException {
            Path input = inputFile("insert operation");
            Path output = requiredOutput("insert");
            Map<Integer, Integer> positions = parsePositions(config.option("--positions"));
            float width = floatOption("--width", defaults.blank_page_width);
            float height = floatOption("--height", defaults.blank_page_height);
            try (ProcessingReporter reporter = reporter()) {
                reporter.onOperationStart("Insert blank pages into " + input.getFileName());
                assembler(reporter)
                        .insert(input, config.password(), output, positions, width, height);
                reporter.onSuccess("Blank pages inserted successfully");
            }
        }

        private void reorder() throws CLIException, PdfOperationException {
            Path input = inputFile("reorder operation");
            Path output = requiredOutput("reorder");
            List<Integer> order = parseOrder(config.option("--order"));
            try (ProcessingReporter reporter = reporter()) {
                reporter.onOperationStart("Reorder " + input.getFileName());
                assembler(reporter).reorder(input, config.password(), output, order);
                reporter.onSuccess("PDF pages reordered successfully");
            }
        }

        private void unlock() throws CLIException, PdfOperationException {
            Path input = inputFile("unlock operation");
            Path output = requiredOutput("unlock");
            try (ProcessingReporter reporter = reporter()) {
                reporter.onOperationStart(
                        "Unlock " + input.getFileName() + " -> " + output.getFileName());
                assembler(reporter).unlock(input, config.password(), output);
                reporter.onSuccess("PDF unlocked successfully");
            }
        }

        // ── Rendering ───────────────────────────────────────────────

        private void convert() throws CLIException, PdfOperationException {
            Path input = inputFile("PDF conversion");
            String formatName = config.option("--image-format");
            ImageFormat format =
                    ImageFormat.fromName(formatName != null ? formatName : defaults.image_format);
            String template = config.option("--names");
            RenderRequest request =
                    new RenderRequest(
                            input,
                            config.password(),
                            outputDirectory(input),
                            range(),
                            intOption("--dpi", defaults.dpi),
                            format,
                            template != null ? template : defaults.name_template);
            try (ProcessingReporter reporter = reporter()) {
                reporter.onOperationStart("Convert " + input.getFileName());
                List<Path> images = new RenderService(reporter).convertToImages(request);
                reporter.onSuccess(
                        "Rendered "
                                + images.size()
                                + " page(s) into "
                                + request.outputDirectory());
            }
        }

        private void imageToPdf() throws CLIException, PdfOperationException {
            Path image = inputFile("image conversion");
            try (ProcessingReporter reporter = reporter()) {
                reporter.onOperationStart("Convert " + image.getFileName() + " to PDF");
                Path written = new RenderService(reporter).imageToPdf(image, config.outputPath());
                reporter.onSuccess("Saved " + written);
            }
        }

        // ── Extraction ──────────────────────────────────────────────

        private void extractAttachments() throws CLIException, PdfOperationException {
            PdfCustodian custodian = custodian("extracting attachments");
            Path outputDir = outputDirectory(custodian.inputPath());
            AttachmentService service = new AttachmentService();
            try (ProcessingReporter reporter = reporter()) {
                reporter.onOperationStart(
                        "Extract attachments from " + custodian.inputPath().getFileName());
                if (config.option("--index") != null) {
                    int index = intOption("--index", null);
                    Path written = service.extract(custodian, index, outputDir);
                    reporter.onSuccess("Extracted " + written.getFileName());
                } else {
                    int count = service.extractAll(custodian, outputDir);
                    reporter.onSuccess("Extracted " + count + " attachment(s) into " + outputDir);
                }
            }
        }

        private void watermark() throws CLIException, PdfOperationException {
            PdfCustodian custodian = custodian("watermarking");
            Path output = requiredOutput("watermark");
            ToolkitDefaults.Watermark preset = defaults.watermark;
            int[] color =
                    WatermarkOptions.parseColor(
                            config.option("--color") != null
                                    ? config.option("--color")
                                    : preset.color);
            String image = config.option("--image");
            String font = config.option("--font");
            WatermarkOptions options =
                    new WatermarkOptions.WatermarkOptionsBuilder()
                            .withText(config.option("--text"))
                            .withImage(image != null ? Paths.get(image) : null)
                            .withFont(font != null ? font : preset.font)
                            .withFontSize(floatOption("--font-size", preset.font_size))
                            .withColor(color[0], color[1], color[2])
                            .withOpacity(intOption("--opacity", preset.opacity))
                            .withRotation(floatOption("--angle", preset.rotation))
                            .withScale(floatOption("--scale", preset.scale))
                            .build();
            try (ProcessingReporter reporter = reporter()) {
                reporter.onOperationStart(
                        "Watermark "
                                + custodian.inputPath().getFileName()
                                + " -> "
                                + output.getFileName());
                new WatermarkService(reporter).apply(custodian, output, options, range());
                reporter.onSuccess("Watermark added successfully.");
            }
        }

        // ── Helpers ─────────────────────────────────────────────────

        private DocumentAssembler assembler(ProcessingReporter reporter) {
            return new DocumentAssembler.DocumentAssemblerBuilder()
                    .withListener(reporter)
                    .withNamingStrategy(new NamingStrategy(defaults.bookmark_title_max_length))
                    .build();
        }

        private ProcessingReporter reporter() {
            return new ProcessingReporter(out, config.verbosity());
        }

        private ResultPrinter printer() {
            return new ResultPrinter(out, OutputFormat.fromName(config.option("--format")));
        }

        private PdfCustodian custodian(String operation) throws CLIException {
            return new PdfCustodian(inputFile(operation), config.password());
        }

        private Path inputFile(String operation) throws CLIException {
            if (config.inputs().isEmpty()) {
                throw new CLIException("Input file is required for " + operation);
            }
            if (config.inputs().size() > 1) {
                throw new CLIException("Only one input file is accepted for " + operation);
            }
            Path input = config.input();
            if (!Files.isRegularFile(input)) {
                throw new CLIException("Input file does not exist: " + input);
            }
            try {
                if (Files.size(input) == 0) {
                    throw new CLIException("Input file is empty: " + input);
                }
            } catch (IOException e) {
                throw new CLIException("Cannot read " + input + ": " + e.getMessage());
            }
            return input;
        }

        private Path requiredOutput(String operation) throws CLIException {
            if (config.outputPath() == null) {
                throw new CLIException("Output file is required for " + operation + " operation");
            }
            return config.outputPath();
        }

        /** The --output directory, or the input's directory when none is given. */
        private Path outputDirectory(Path input) throws CLIException {
            Path dir = config.outputPath();
            if (dir == null) {
                Path parent = input.toAbsolutePath().getParent();
                dir = parent != null ? parent : Paths.get(".");
            }
            if (Files.exists(dir) && !Files.isDirectory(dir)) {
                throw new CLIException("Output is not a directory: " + dir);
            }
            return dir;
        }

        private PageSelection range() {
            String spec = config.option("--range");
            return spec == null || spec.isBlank()
                    ? PageSelection.all()
                    : PageSelection.parseRequired(spec);
        }

        private int intOption(String name, Integer fallback) throws CLIException {
            String value = config.option(name);
            if (value == null) {
                if (fallback == null) {
                    throw new CLIException("Missing required option " + name);
                }
                return fallback;
            }
            try {
                return Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                throw new CLIException("Invalid value for " + name + ": " + value);
            }
        }

        private float floatOption(String name, Float fallback) throws CLIException {
            String value = config.option(name);
            if (value == null) {
                return fallback;
            }
            try {
                return Float.parseFloat(value.trim());
            } catch (NumberFormatException e) {
                throw new CLIException("Invalid value for " + name + ": " + value);
            }
        }

        private static List<String> readLines(Path file) throws CLIException {
            try {
                return Files.readAllLines(file);
            } catch (IOException e) {
                throw new CLIException("Failed to read " + file + " - " + e.getMessage());
            }
        }
    }

    /** Parses {@code "1:2,5:1"} into position to page count; a later entry for a position wins. */
    static Map<Integer, Integer> parsePositions(String spec) throws CLIException {
        if (spec == null || spec.isBlank()) {
            throw new CLIException("No valid insert positions specified");
        }
        Map<Integer, Integer> positions = new LinkedHashMap<>();
        for (String token : spec.split(",")) {
            String entry = token.trim();
            if (entry.isEmpty()) {
                continue;
            }
            String[] parts = entry.split(":");
            try {
                int position = Integer.parseInt(parts[0].trim());
                int count = parts.length > 1 ? Integer.parseInt(parts[1].trim()) : 1;
                if (parts.length > 2) {
                    throw new NumberFormatException(entry);
                }
                positions.put(position, count);
            } catch (NumberFormatException e) {
                throw new CLIException("Invalid insert position: " + entry);
            }
        }
        if (positions.isEmpty()) {
            throw new CLIException("No valid insert positions specified");
        }
        return positions;
    }

    /** Parses {@code "3,1,2"} into a page order. */
    static List<Integer> parseOrder(String spec) throws CLIException {
        if (spec == null || spec.isBlank()) {
            throw new CLIException("No valid page order specified");
        }
        List<Integer> order = new ArrayList<>();
        for (String token : spec.split(",")) {
            try {
                order.add(Integer.parseInt(token.trim()));
            } catch (NumberFormatException e) {
                throw new CLIException("Invalid page number in order: " + token.trim());
            }
        }
        return order;
    }

    private static boolean isPdfName(Path path) {
        return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf");
    }

    private static boolean isHelpRequested(String[] args) {
        for (String arg : args) {
            if ("-h".equals(arg) || "--help".equals(arg)) {
                return true;
            }
        }
        return false;
    }

    static String usageMessage() {
        return "Usage: pdf-toolkit <command> [options]\n"
                + "Commands:\n"
                + "  split                Split into one file per page\n"
                + "  merge                Merge several PDFs into one\n"
                + "  convert              Render pages to images\n"
                + "  imagetopdf           Wrap an image in a one-page PDF\n"
                + "  text                 Extract page text\n"
                + "  bookmarks            List bookmarks (outlines)\n"
                + "  info                 Show document information\n"
                + "  rotate               Rotate pages\n"
                + "  remove               Remove pages\n"
                + "  insert               Insert blank pages\n"
                + "  reorder              Reorder pages\n"
                + "  list-attachments     List embedded files\n"
                + "  extract-attachments  Save embedded files\n"
                + "  list-objects         List page objects with their bounds\n"
                + "  list-forms           List form fields\n"
                + "  watermark            Stamp text or an image on pages\n"
                + "  unlock               Save without encryption\n"
                + "Common options:\n"
                + "  --input <file>       Input file (repeatable for merge)\n"
                + "  --output <path>      Output file or directory\n"
                + "  -p, --password <pw>  Password for encrypted PDFs\n"
                + "  --range <pages>      Pages such as 1-3,5\n"
                + "  --format text|json   Result format for listing commands\n"
                + "  --config <file>      YAML file with defaults\n"
                + "  -q, --quiet          Only show results and errors\n"
                + "  -v, --verbose        Show operation log lines\n"
                + "  -vv, --debug         Show all debug information\n"
                + "  -h, --help           Show this help message\n"
                + "Command options:\n"
                + "  split      --names <template> --use-bookmarks --name-list <file>\n"
                + "  merge      --input-directory <dir> --recursive --input-list <file>\n"
                + "             --delete-originals --strict\n"
                + "  convert    --dpi <1-2400> --image-format png|jpg|gif|bmp|tiff|webp\n"
                + "             --names <template>\n"
                + "  rotate     --rotation 90|180|270\n"
                + "  remove     --pages <pages>\n"
                + "  insert     --positions <pos:count,...> --width <pt> --height <pt>\n"
                + "  reorder    --order <p1,p2,...>\n"
                + "  extract-attachments  --index <n>\n"
                + "  watermark  --text <text> | --image <file> --font <name> --font-size <pt>\n"
                + "             --color R,G,B --opacity <0-255> --angle <deg> --scale <factor>\n"
                + "Examples:\n"
                + "  pdf-toolkit split --input book.pdf --output pages --use-bookmarks\n"
                + "  pdf-toolkit merge --input a.pdf --input b.pdf --output ab.pdf\n"
                + "  pdf-toolkit convert --input book.pdf --dpi 150 --image-format jpg\n"
                + "  pdf-toolkit bookmarks --input book.pdf --format json";
    }
}
