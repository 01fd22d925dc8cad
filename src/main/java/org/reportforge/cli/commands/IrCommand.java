package org.reportforge.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.typesafe.config.Config;
import org.reportforge.cli.CommandLineInterface;
import org.reportforge.compiler.LayoutCompiler;
import org.reportforge.compiler.api.CompilationException;
import org.reportforge.compiler.api.CompilerErrorCode;
import org.reportforge.compiler.frontend.parser.ast.ReportNode;
import org.reportforge.compiler.ir.IrLayout;
import org.reportforge.compiler.ir.IrTreePrinter;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "ir", description = "Prints the normalized intermediate representation of a report definition.")
public class IrCommand implements Callable<Integer> {

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the report definition (HOCON).")
    private File file;

    @Option(names = "--json", description = "Print the IR as JSON instead of an indented tree.")
    private boolean json;

    @CommandLine.ParentCommand
    private CommandLineInterface parent;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        Config config = parent.getConfig();
        PrintWriter out = spec.commandLine().getOut();
        LayoutCompiler compiler = new LayoutCompiler();
        compiler.setVerbosity(config.getInt("compiler.verbosity"));
        try {
            String source;
            try {
                source = Files.readString(file.toPath());
            } catch (IOException e) {
                throw new CompilationException(CompilerErrorCode.IO_ERROR_READING_FILE,
                        "Cannot read layout definition " + file, e);
            }
            ReportNode report = compiler.parse(source, file.getPath());
            List<IrLayout> layouts = compiler.transform(report);
            if (json) {
                out.println(toJson(layouts));
            } else {
                for (IrLayout layout : layouts) {
                    out.print(IrTreePrinter.print(layout));
                }
            }
            out.flush();
            return 0;
        } catch (CompilationException e) {
            PrintWriter err = spec.commandLine().getErr();
            err.println(e.getMessage());
            err.flush();
            return e.errorCode() == CompilerErrorCode.IO_ERROR_READING_FILE ? 1 : 2;
        }
    }

    private static String toJson(List<IrLayout> layouts) {
        Gson gson = new GsonBuilder().setPrettyPrinting().create();
        JsonArray array = new JsonArray();
        for (IrLayout layout : layouts) {
            JsonObject entry = new JsonObject();
            entry.addProperty("kind", layout.kind().keyword());
            entry.add("layout", gson.toJsonTree(layout));
            array.add(entry);
        }
        return gson.toJson(array);
    }
}
