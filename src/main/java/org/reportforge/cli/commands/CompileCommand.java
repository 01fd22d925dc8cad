package org.reportforge.cli.commands;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import org.reportforge.cli.CommandLineInterface;
import org.reportforge.compiler.LayoutCompiler;
import org.reportforge.compiler.api.CompilationException;
import org.reportforge.compiler.api.CompilerErrorCode;
import org.reportforge.compiler.api.DocumentOptions;
import org.reportforge.compiler.api.FieldMode;
import org.reportforge.compiler.api.RenderOptions;
import org.reportforge.compiler.data.MapDataContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(name = "compile", description = "Compiles a report definition to Typst markup.")
public class CompileCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(CompileCommand.class);
    private static final String FIELD_MODE_PATH = "renderer.field-mode";

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the report definition (HOCON).")
    private File file;

    @Option(names = {"-d", "--data"}, description = "A JSON file with the record that fields are resolved against.")
    private File dataFile;

    @Option(names = {"-o", "--output"}, description = "Write the markup to this file instead of standard output.")
    private File output;

    @Option(names = "--refs", description = "Emit runtime field references instead of values.")
    private boolean references;

    @Option(names = "--no-preamble", description = "Omit the page and text directives.")
    private boolean noPreamble;

    @Option(names = "--page-size", description = "Paper name for the preamble, overriding renderer.page-size.")
    private String pageSize;

    @Option(names = "--margin", description = "Page margin for the preamble, overriding renderer.margin.")
    private String margin;

    @Option(names = "--font", description = "Default font family, overriding renderer.font.")
    private String font;

    @Option(names = "--font-size", description = "Default font size, overriding renderer.font-size.")
    private String fontSize;

    @Option(names = {"-v", "--verbosity"}, description = "Compiler verbosity, 0 (errors) to 4 (trace).")
    private Integer verbosity;

    @CommandLine.ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        Config config = parent.getConfig();
        PrintWriter err = spec.commandLine().getErr();

        LayoutCompiler compiler = new LayoutCompiler();
        compiler.setVerbosity(verbosity != null ? verbosity : config.getInt("compiler.verbosity"));

        DocumentOptions documentOptions = noPreamble ? DocumentOptions.none() : documentOptions(config);
        FieldMode mode;
        try {
            mode = references ? FieldMode.REFERENCES : fieldMode(config);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.flush();
            return 2;
        }

        try {
            RenderOptions options = mode == FieldMode.REFERENCES
                    ? RenderOptions.references()
                    : RenderOptions.values(readData());
            String markup = compiler.compile(file.toPath(), options, documentOptions);
            if (output != null) {
                Files.writeString(output.toPath(), markup + "\n");
                LOGGER.info("Wrote {}", output.getAbsolutePath());
            } else {
                PrintWriter out = spec.commandLine().getOut();
                out.println(markup);
                out.flush();
            }
            return 0;
        } catch (CompilationException e) {
            err.println(e.getMessage());
            err.flush();
            return e.errorCode() == CompilerErrorCode.IO_ERROR_READING_FILE ? 1 : 2;
        } catch (IOException e) {
            err.println("I/O error: " + e.getMessage());
            err.flush();
            return 1;
        }
    }

    private DocumentOptions documentOptions(Config config) {
        DocumentOptions options = DocumentOptions.fromConfig(config);
        if (pageSize != null) {
            options = options.withPageSize(pageSize);
        }
        if (margin != null) {
            options = options.withMargin(margin);
        }
        if (font != null) {
            options = options.withFont(font);
        }
        if (fontSize != null) {
            options = options.withFontSize(fontSize);
        }
        return options;
    }

    private static FieldMode fieldMode(Config config) {
        String declared = config.getString(FIELD_MODE_PATH);
        try {
            return FieldMode.valueOf(declared.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + FIELD_MODE_PATH + " '" + declared
                    + "', expected one of " + Arrays.toString(FieldMode.values()), e);
        }
    }

    private MapDataContext readData() throws IOException {
        if (dataFile == null) {
            return MapDataContext.empty();
        }
        Map<String, Object> record = new ObjectMapper().readValue(dataFile, new TypeReference<Map<String, Object>>() {});
        return new MapDataContext(record);
    }
}
