package com.codeprism.cli;

import com.codeprism.core.analyzer.pattern.PatternProbe;
import com.codeprism.core.analyzer.pattern.PatternRegistry;
import com.codeprism.core.generator.DiagramGenerator;
import com.codeprism.core.renderer.OutputRenderer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * Command to list available pattern probes, generators, or renderers.
 *
 * <p>Generators and renderers are discovered via Java Service Provider Interface
 * (SPI); probes come from the built-in pattern registry.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * codeprism list probes
 * codeprism list generators
 * codeprism list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available probes, generators, or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        description = "Type to list: probes, generators, or renderers"
    )
    private String type;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "probes", "probe" -> listProbes();
            case "generators", "generator" -> listGenerators();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: probes, generators, or renderers", type);
                yield 1;
            }
        };
    }

    private int listProbes() {
        System.out.println("Available Probes:");
        System.out.println();

        String category = null;
        for (PatternProbe probe : PatternRegistry.builtins().probes()) {
            if (!probe.category().equals(category)) {
                category = probe.category();
                System.out.printf("  %s%n", category);
            }
            System.out.printf("    • %s - %s%n", probe.flag(), probe.description());
        }

        return 0;
    }

    private int listGenerators() {
        List<DiagramGenerator> generators = ServiceLoader.load(DiagramGenerator.class).stream()
            .map(ServiceLoader.Provider::get)
            .sorted(Comparator.comparing(DiagramGenerator::getId))
            .toList();
        log.debug("Discovered {} generator(s)", generators.size());

        System.out.println("Available Generators:");
        System.out.println();
        if (generators.isEmpty()) {
            System.out.println("  No generators found.");
            return 0;
        }
        for (DiagramGenerator generator : generators) {
            String documents = generator.getSupportedDiagramTypes().stream()
                .sorted()
                .map(type -> type.fileStem() + "." + generator.getFileExtension())
                .collect(Collectors.joining(", "));
            System.out.printf("  • %-10s %s%n", generator.getId(), generator.getDisplayName());
            System.out.printf("    writes: %s%n", documents);
        }
        return 0;
    }

    private int listRenderers() {
        List<String> ids = ServiceLoader.load(OutputRenderer.class).stream()
            .map(ServiceLoader.Provider::get)
            .map(OutputRenderer::getId)
            .sorted()
            .toList();

        System.out.println("Available Renderers:");
        System.out.println();
        if (ids.isEmpty()) {
            System.out.println("  No renderers found.");
        }
        ids.forEach(id -> System.out.printf("  • %s%n", id));
        return 0;
    }
}
