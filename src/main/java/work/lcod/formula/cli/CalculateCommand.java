package work.lcod.formula.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.formula.api.CalculationResult;
import work.lcod.formula.api.CalculatorConfiguration;
import work.lcod.formula.api.CatalogLoader;
import work.lcod.formula.api.LogLevel;
import work.lcod.formula.api.WorkbookCalculator;
import work.lcod.formula.model.SheetCatalog;
import work.lcod.formula.runtime.FormulaException;

@CommandLine.Command(
    name = "lcod-formula",
    description = "Evaluate every formula cell of a workbook in dependency order.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class CalculateCommand implements Callable<Integer> {
    static final String SIMPLE_LOGGER_LEVEL = "org.slf4j.simpleLogger.defaultLogLevel";
    private static final ObjectWriter JSON_WRITER = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-c", "--catalog"},
        required = true,
        paramLabel = "PATH",
        description = "Workbook catalog: a .json/.yaml file or a directory of .csv sheets."
    )
    private Path catalogPath;

    @CommandLine.Option(
        names = "--config",
        paramLabel = "TOML",
        description = "TOML file with a [calculator] table.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path configPath;

    @CommandLine.Option(
        names = "--max-depth",
        description = "Nesting limit applied when parsing and evaluating formulas.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Integer maxDepth;

    @CommandLine.Option(
        names = "--keep-going",
        description = "Record failing cells and keep evaluating the rest.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Boolean keepGoing;

    @CommandLine.Option(
        names = "--include-constants",
        description = "List constant cells in the output values.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Boolean includeConstants;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevel;

    @CommandLine.Option(
        names = "--order-only",
        description = "Print the evaluation order without evaluating."
    )
    private boolean orderOnly;

    @Override
    public Integer call() throws Exception {
        CalculatorConfiguration configuration = resolveConfiguration();
        if (System.getProperty(SIMPLE_LOGGER_LEVEL) == null) {
            System.setProperty(SIMPLE_LOGGER_LEVEL, configuration.logLevel().simpleLoggerName());
        }

        if (!Files.exists(catalogPath)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Catalog not found: " + catalogPath);
        }
        SheetCatalog catalog = CatalogLoader.load(catalogPath);
        WorkbookCalculator calculator = new WorkbookCalculator(configuration);
        PrintWriter out = spec.commandLine().getOut();

        if (orderOnly) {
            try {
                List<String> order = calculator.order(catalog);
                out.println(JSON_WRITER.writeValueAsString(order));
                out.flush();
                return CalculationResult.Status.SUCCESS.exitCode();
            } catch (FormulaException ex) {
                spec.commandLine().getErr().println(ex.code().wireName() + ": " + ex.getMessage());
                return CalculationResult.Status.FAILURE.exitCode();
            }
        }

        CalculationResult result = calculator.run(catalog);
        out.println(result.toPrettyJson());
        out.flush();
        return result.status().exitCode();
    }

    CalculatorConfiguration resolveConfiguration() {
        CalculatorConfiguration.Builder builder = CalculatorConfiguration.builder();
        if (configPath != null) {
            builder.fromToml(configPath);
        }
        if (maxDepth != null) {
            builder.maxDepth(maxDepth);
        }
        if (keepGoing != null) {
            builder.keepGoing(keepGoing);
        }
        if (includeConstants != null) {
            builder.includeConstants(includeConstants);
        }
        if (logLevel != null) {
            builder.logLevel(LogLevel.from(logLevel));
        }
        return builder.build();
    }
}
