package org.texpreview.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.texpreview.cli.CommandLineInterface;
import org.texpreview.cli.rendering.HtmlPageRenderer;
import org.texpreview.compiler.Compiler;
import org.texpreview.compiler.CompilerSettings;
import org.texpreview.compiler.api.CompileResult;
import org.texpreview.preview.PreviewScheduler;
import org.texpreview.project.ProjectSnapshot;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardWatchEventKinds;
import java.nio.file.WatchEvent;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import java.util.stream.Stream;

@Command(name = "watch",
        mixinStandardHelpOptions = true,
        description = "Recompiles a LaTeX project into an HTML preview page whenever one of its files changes.")
public class WatchCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(WatchCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-d", "--directory"}, required = true, description = "The project directory.")
    private File directory;

    @Option(names = {"-o", "--output"}, required = true, description = "The HTML file rewritten after every pass.")
    private File output;

    @Option(names = {"-e", "--entry"}, description = "The entry file (default: configured entry, then any .tex file).")
    private String entry;

    @Override
    public Integer call() {
        final Config config;
        try {
            config = parent.getConfig();
        } catch (ConfigException e) {
            log.error("Failed to load or parse configuration: {}", e.getMessage());
            return 1;
        }
        Path root = directory.toPath();
        if (!Files.isDirectory(root)) {
            log.error("Not a directory: {}", root.toAbsolutePath());
            return 1;
        }

        Compiler compiler = new Compiler(CompilerSettings.fromConfig(config.getConfig(CompilerSettings.CONFIG_PATH)));
        HtmlPageRenderer renderer = new HtmlPageRenderer();
        String title = root.toAbsolutePath().getFileName().toString();

        try (WatchService watcher = FileSystems.getDefault().newWatchService();
             PreviewScheduler scheduler = PreviewScheduler.fromConfig(config, compiler,
                     () -> ProjectSnapshot.fromDirectory(root), entry)) {
            scheduler.addListener(result -> publish(result, renderer, title));
            for (Path dir : directories(root)) {
                register(watcher, dir);
            }
            log.info("Watching {} (output: {})", root.toAbsolutePath(), output.getAbsolutePath());
            scheduler.requestCompile();
            watch(watcher, scheduler);
            return 0;
        } catch (IOException e) {
            log.error("Cannot watch {}: {}", root.toAbsolutePath(), e.getMessage());
            return 1;
        }
    }

    private void watch(WatchService watcher, PreviewScheduler scheduler) throws IOException {
        while (!Thread.currentThread().isInterrupted()) {
            WatchKey key;
            try {
                key = watcher.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (ClosedWatchServiceException e) {
                log.debug("Watch service closed");
                break;
            }
            Path dir = (Path) key.watchable();
            for (WatchEvent<?> event : key.pollEvents()) {
                if (event.kind() == StandardWatchEventKinds.OVERFLOW) {
                    scheduler.requestCompile();
                    continue;
                }
                Path changed = dir.resolve((Path) event.context());
                if (changed.toAbsolutePath().normalize().equals(output.toPath().toAbsolutePath().normalize())) {
                    continue;
                }
                if (event.kind() == StandardWatchEventKinds.ENTRY_CREATE && Files.isDirectory(changed)) {
                    for (Path sub : directories(changed)) {
                        register(watcher, sub);
                    }
                }
                log.debug("{} {}", event.kind().name(), changed);
                scheduler.requestCompile();
            }
            key.reset();
        }
    }

    private void publish(CompileResult result, HtmlPageRenderer renderer, String title) {
        CompileCommand.logDiagnostics(result);
        try {
            Files.writeString(output.toPath(), renderer.render(result, title), StandardCharsets.UTF_8);
            log.info("Preview updated: {}", output.getAbsolutePath());
        } catch (IOException e) {
            log.error("Cannot write {}: {}", output.getAbsolutePath(), e.getMessage());
        }
    }

    private static List<Path> directories(Path root) throws IOException {
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isDirectory)
                    .filter(p -> !isHidden(root.relativize(p)))
                    .collect(Collectors.toList());
        }
    }

    private static boolean isHidden(Path relative) {
        for (Path part : relative) {
            if (part.toString().startsWith(".")) return true;
        }
        return false;
    }

    private static void register(WatchService watcher, Path dir) throws IOException {
        dir.register(watcher,
                StandardWatchEventKinds.ENTRY_CREATE,
                StandardWatchEventKinds.ENTRY_MODIFY,
                StandardWatchEventKinds.ENTRY_DELETE);
    }
}
