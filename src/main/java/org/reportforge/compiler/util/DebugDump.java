package org.reportforge.compiler.util;

import org.reportforge.compiler.diagnostics.CompilerLogger;
import org.reportforge.compiler.ir.IrLayout;
import org.reportforge.compiler.ir.IrTreePrinter;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Utility class for dumping debug information during compilation.
 */
public final class DebugDump {

    private DebugDump() {}

    /**
     * Dumps the IR trees of a report to {@code build/compiler-dumps/<report>/ir.txt}.
     * Failures are logged and otherwise ignored; a dump never fails a compilation.
     *
     * @param reportName The name of the report, used for creating the dump directory.
     * @param layouts The IR trees to dump.
     * @return The written file, or null if it could not be written.
     */
    public static Path dumpIr(String reportName, List<IrLayout> layouts) {
        Path root = Path.of("build", "compiler-dumps", sanitize(reportName));
        try {
            Files.createDirectories(root);
            Path f = root.resolve("ir.txt");
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < layouts.size(); i++) {
                sb.append("# layout ").append(i).append('\n');
                sb.append(IrTreePrinter.print(layouts.get(i)));
            }
            Files.writeString(f, sb.toString());
            return f;
        } catch (IOException e) {
            CompilerLogger.warn("Could not write IR dump to " + root + ": " + e.getMessage());
            return null;
        }
    }

    private static String sanitize(String s) { return s.replaceAll("[^A-Za-z0-9_.-]", "_"); }
}
