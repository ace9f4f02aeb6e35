package im.arun.finstream.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.finstream.config.ConfigLoader;
import im.arun.finstream.config.StreamerConfig;
import im.arun.finstream.layout.AnchorPolicy;
import im.arun.finstream.layout.ColumnMatchPolicy;
import im.arun.finstream.model.DocumentStream;
import im.arun.finstream.service.FinStreamService;
import im.arun.finstream.text.NumericMatchPolicy;
import picocli.CommandLine;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command-line interface for FinStream using Picocli.
 */
@Command(
    name = "finstream",
    description = "Reconstruct row/column layout of financial PDF pages as a column-tagged text stream",
    mixinStandardHelpOptions = true,
    version = "FinStream 1.0"
)
public class FinStreamCLI implements Callable<Integer> {

    enum OutputFormat { TEXT, JSON }

    static class InputSource {
        @Option(names = {"--pdf"}, description = "Path to PDF file", required = true)
        String pdfPath;

        @Option(names = {"--tokens"}, description = "Path to pre-extracted token JSON (one array per page)", required = true)
        String tokensPath;
    }

    @Spec
    private CommandSpec spec;

    @ArgGroup(exclusive = true, multiplicity = "1")
    private InputSource input;

    @Option(names = {"--config"}, description = "YAML configuration file")
    private String configPath;

    @Option(names = {"--x-tolerance"}, description = "Horizontal tolerance for column baselines (points)")
    private Float xTolerance;

    @Option(names = {"--y-tolerance"}, description = "Vertical tolerance for row grouping (points)")
    private Float yTolerance;

    @Option(names = {"--word-gap"}, description = "Glyph gap that splits words during PDF extraction (points)")
    private Float wordGap;

    @Option(names = {"--mask"}, description = "Mask numeric payloads inside value markers")
    private Boolean mask;

    @Option(names = {"--mask-char"}, description = "Character replacing digits when masking")
    private Character maskChar;

    @Option(names = {"--numeric-policy"}, description = "EMBEDDED or WHOLE_TOKEN")
    private NumericMatchPolicy numericPolicy;

    @Option(names = {"--column-policy"}, description = "FIRST_MATCH or NEAREST")
    private ColumnMatchPolicy columnPolicy;

    @Option(names = {"--anchor-policy"}, description = "FIRST_MEMBER or RUNNING_CENTROID")
    private AnchorPolicy anchorPolicy;

    @Option(names = {"--format"}, description = "Output format: ${COMPLETION-CANDIDATES}", defaultValue = "TEXT")
    private OutputFormat format;

    @Option(names = {"--output"}, description = "Output file path (stdout when omitted)")
    private String outputPath;

    @Override
    public Integer call() throws Exception {
        PrintWriter err = spec.commandLine().getErr();
        PrintWriter out = spec.commandLine().getOut();

        Path inputPath = Paths.get(input.pdfPath != null ? input.pdfPath : input.tokensPath);
        if (!Files.exists(inputPath)) {
            err.println("Error: input file not found: " + inputPath);
            return 1;
        }
        if (input.pdfPath != null && !input.pdfPath.toLowerCase().endsWith(".pdf")) {
            err.println("Error: File must be a PDF: " + input.pdfPath);
            return 1;
        }

        StreamerConfig config = new ConfigLoader(configPath).load(collectOverrides());

        DocumentStream result;
        try {
            FinStreamService service = new FinStreamService(config);
            result = input.pdfPath != null
                ? service.processPdf(inputPath)
                : service.processTokenFile(inputPath);
        } catch (Exception e) {
            err.println("Error processing document: " + e.getMessage());
            return 1;
        }

        String rendered;
        if (format == OutputFormat.JSON) {
            ObjectMapper mapper = new ObjectMapper();
            mapper.enable(SerializationFeature.INDENT_OUTPUT);
            rendered = mapper.writeValueAsString(result);
        } else {
            rendered = result.render();
        }

        if (outputPath != null) {
            Files.writeString(Paths.get(outputPath), rendered);
            err.println("Output written to: " + outputPath);
        } else {
            out.println(rendered);
            out.flush();
        }
        return 0;
    }

    Map<String, Object> collectOverrides() {
        Map<String, Object> overrides = new HashMap<>();
        if (xTolerance != null) overrides.put("horizontalTolerance", xTolerance);
        if (yTolerance != null) overrides.put("verticalTolerance", yTolerance);
        if (wordGap != null) overrides.put("wordGapTolerance", wordGap);
        if (mask != null) overrides.put("maskValues", mask);
        if (maskChar != null) overrides.put("maskChar", maskChar);
        if (numericPolicy != null) overrides.put("numericMatchPolicy", numericPolicy);
        if (columnPolicy != null) overrides.put("columnMatchPolicy", columnPolicy);
        if (anchorPolicy != null) overrides.put("anchorPolicy", anchorPolicy);
        return overrides;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new FinStreamCLI())
            .setCaseInsensitiveEnumValuesAllowed(true)
            .execute(args);
        System.exit(exitCode);
    }
}
