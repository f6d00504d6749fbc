package com.swiftship.cli;

import com.swiftship.SwiftShipCLI;
import com.swiftship.core.catalog.ComponentCatalog;
import com.swiftship.core.catalog.ComponentCategory;
import com.swiftship.core.catalog.ComponentKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to list supported component kinds, grouped by category.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * swiftship list
 * swiftship list --category input
 * }</pre>
 */
@Command(
    name = "list",
    description = "List supported component kinds",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @ParentCommand
    private SwiftShipCLI parent;

    @Option(names = {"-c", "--category"}, description = "Only list one category: primitives, layout, input, navigation")
    private String category;

    @Override
    public Integer call() {
        if (parent != null) {
            parent.configureLogging();
        }

        ComponentCategory filter = null;
        if (category != null) {
            try {
                filter = ComponentCategory.valueOf(category.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                log.error("Unknown category: {}. Use: primitives, layout, input, or navigation", category);
                return 1;
            }
        }

        for (ComponentCategory group : ComponentCategory.values()) {
            if (filter != null && filter != group) {
                continue;
            }
            System.out.println(group.name().charAt(0) + group.name().substring(1).toLowerCase(Locale.ROOT) + ":");
            for (ComponentKind kind : ComponentKind.values()) {
                if (kind.category() == group) {
                    System.out.printf("  • %-20s %-16s props: %s%n", kind.type(), kind.viewName(),
                        ComponentCatalog.schemaFor(kind).names());
                }
            }
            System.out.println();
        }
        return 0;
    }
}
