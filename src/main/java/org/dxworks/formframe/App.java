package org.dxworks.formframe;

import org.dxworks.formframe.metadata.DocumentMetadataCodec;
import org.dxworks.formframe.metadata.Json;
import org.dxworks.formframe.model.FormDocument;
import org.dxworks.formframe.parser.HtmlDocumentParser;
import org.dxworks.formframe.parser.MalformedInputException;
import org.dxworks.formframe.parser.ParseResult;
import org.dxworks.formframe.serializer.ExportResult;
import org.dxworks.formframe.serializer.HtmlDocumentSerializer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class App {

    public static void main(String[] args) throws Exception {
        if (args.length < 3 || !(args[0].equals("import") || args[0].equals("export"))) {
            printUsage();
            System.exit(2);
        }

        Path input = Paths.get(args[1]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path output = Paths.get(args[2]);
        // Create parent directories if they don't exist
        if (output.getParent() != null) {
            Files.createDirectories(output.getParent());
        }

        FormframeConfig config = FormframeConfig.load();
        Instant startTime = Instant.now();
        int exitCode = args[0].equals("import")
                ? importHtml(input, output, config)
                : exportHtml(input, output, config, args.length > 3 && args[3].equals("--body"));
        if (exitCode == 0) {
            System.out.println("Done in " + Duration.between(startTime, Instant.now()).toMillis() + " ms");
        }
        System.exit(exitCode);
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar formframe.jar import <input.html> <output.json>");
        System.err.println("       java -jar formframe.jar export <input.json> <output.html> [--body]");
        System.err.println("  import: parses an HTML document into sections and writes them as JSON");
        System.err.println("  export: renders a JSON document as HTML with round-trip metadata");
        System.err.println("  --body: write only the body fragment instead of a full document");
    }

    static int importHtml(Path input, Path output, FormframeConfig config) throws IOException {
        System.out.println("Importing " + input.toAbsolutePath());
        String html = Files.readString(input, StandardCharsets.UTF_8);
        ParseResult result;
        try {
            result = new HtmlDocumentParser(config).parse(html);
        } catch (MalformedInputException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
        for (String warning : result.getWarnings()) {
            System.out.println("  Warning: " + warning);
        }
        String json = Json.MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(new FormDocument(result.getSections()));
        Files.writeString(output, json, StandardCharsets.UTF_8);
        System.out.println("Parsed " + result.getSections().size() + " section(s) from " + result.getSource()
                + " markup into " + output.toAbsolutePath());
        return 0;
    }

    static int exportHtml(Path input, Path output, FormframeConfig config, boolean bodyOnly) throws IOException {
        System.out.println("Exporting " + input.toAbsolutePath());
        List<String> warnings = new ArrayList<>();
        Optional<FormDocument> document = new DocumentMetadataCodec()
                .decode(Files.readString(input, StandardCharsets.UTF_8), warnings);
        if (document.isEmpty()) {
            warnings.forEach(warning -> System.err.println("Error: " + warning));
            return 1;
        }
        ExportResult result = new HtmlDocumentSerializer(config).export(document.get().sections, bodyOnly);
        warnings.addAll(result.getWarnings());
        for (String warning : warnings) {
            System.out.println("  Warning: " + warning);
        }
        Files.writeString(output, result.getHtml(), StandardCharsets.UTF_8);
        System.out.println("Wrote " + (bodyOnly ? "body fragment" : "document") + " to " + output.toAbsolutePath());
        return 0;
    }
}
