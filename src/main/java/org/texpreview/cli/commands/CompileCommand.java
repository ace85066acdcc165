package org.texpreview.cli.commands;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.texpreview.cli.CommandLineInterface;
import org.texpreview.cli.rendering.HtmlPageRenderer;
import org.texpreview.compiler.Compiler;
import org.texpreview.compiler.CompilerSettings;
import org.texpreview.compiler.api.CompilationException;
import org.texpreview.compiler.api.CompileResult;
import org.texpreview.compiler.diagnostics.Diagnostic;
import org.texpreview.project.ProjectSnapshot;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

@Command(name = "compile",
        mixinStandardHelpOptions = true,
        description = "Compiles a LaTeX project directory into an HTML preview page or a JSON result.")
public class CompileCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(CompileCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-d", "--directory"}, required = true, description = "The project directory.")
    private File directory;

    @Option(names = {"-e", "--entry"}, description = "The entry file (default: configured entry, then any .tex file).")
    private String entry;

    @Option(names = {"-o", "--output"}, description = "Output file (default: standard output).")
    private File output;

    @Option(names = "--json", description = "Write the compile result as JSON instead of an HTML page.")
    private boolean json;

    @Option(names = {"-v", "--verbosity"}, description = "Compiler log verbosity (0=error ... 4=trace).")
    private int verbosity = -1;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        try {
            Config config = parent.getConfig();
            Compiler compiler = new Compiler(CompilerSettings.fromConfig(config.getConfig(CompilerSettings.CONFIG_PATH)));
            compiler.setVerbosity(verbosity);

            ProjectSnapshot snapshot = loadProject(directory.toPath());
            CompileResult result = compiler.compile(entry, snapshot.fileResolver(), snapshot.assetResolver());
            logDiagnostics(result);

            String text = json
                    ? toJson(result)
                    : new HtmlPageRenderer().render(result, directory.getAbsoluteFile().getName());
            write(text);
            return result.hasErrors() ? 1 : 0;
        } catch (CompilationException e) {
            log.error("Compilation failed: {}", e.getMessage());
            return 1;
        } catch (ConfigException e) {
            log.error("Failed to load or parse configuration: {}", e.getMessage());
            return 1;
        }
    }

    /**
     * Reads a project directory into a snapshot.
     * @param directory The project directory.
     * @return The snapshot.
     * @throws CompilationException if the directory cannot be read.
     */
    public static ProjectSnapshot loadProject(Path directory) throws CompilationException {
        try {
            return ProjectSnapshot.fromDirectory(directory);
        } catch (IOException e) {
            throw new CompilationException("Cannot read project directory " + directory.toAbsolutePath() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Serializes a compile result.
     * @param result The result.
     * @return Pretty-printed JSON.
     */
    public static String toJson(CompileResult result) {
        Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
        return gson.toJson(result);
    }

    /**
     * Logs every diagnostic at the level matching its type.
     * @param result The result.
     */
    public static void logDiagnostics(CompileResult result) {
        for (Diagnostic d : result.diagnostics()) {
            switch (d.type()) {
                case ERROR -> log.error("{}", d);
                case WARNING -> log.warn("{}", d);
                default -> log.info("{}", d);
            }
        }
    }

    private void write(String text) throws CompilationException {
        if (output == null) {
            PrintWriter out = spec.commandLine().getOut();
            out.println(text);
            out.flush();
            return;
        }
        try {
            Files.writeString(output.toPath(), text, StandardCharsets.UTF_8);
            log.info("Wrote {}", output.getAbsolutePath());
        } catch (IOException e) {
            throw new CompilationException("Cannot write " + output.getAbsolutePath() + ": " + e.getMessage(), e);
        }
    }
}
