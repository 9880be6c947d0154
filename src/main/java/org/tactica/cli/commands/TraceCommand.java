package org.tactica.cli.commands;

import java.io.File;
import java.io.PrintWriter;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tactica.cli.CommandLineInterface;
import org.tactica.runtime.action.ActionKind;
import org.tactica.runtime.action.PlayerAction;
import org.tactica.runtime.scheduling.ActionController;
import org.tactica.runtime.scheduling.ActionQueue;
import org.tactica.runtime.scheduling.QueueEntry;
import org.tactica.runtime.scheduling.SubmissionResult;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import it.unimi.dsi.fastutil.longs.Long2ObjectOpenHashMap;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Replays a scheduling script through an {@link ActionController} and prints the order in which
 * actions run.
 * <p>
 * Script format (HOCON):
 * <pre>{@code
 * queues = [
 *   { name = "A", action-points = 20, actions = [ { kind = MOVEMENT, cost = 5 } ] }
 *   { name = "B", action-points = 15, actions = [ { kind = ATTACK, cost = 10 } ] }
 * ]
 * }</pre>
 * Queues are registered in script order. Empty queues that block the head of the order are
 * cleaned away so the remaining work can run.
 */
@Command(
    name = "trace",
    description = "Replay a scheduling script and print the execution order"
)
public class TraceCommand implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(TraceCommand.class);

    @Option(
        names = {"-s", "--script"},
        required = true,
        description = "HOCON file describing the queues to schedule"
    )
    private File script;

    @Option(
        names = {"--max-steps"},
        description = "Stop after this many executed actions (default: tactica.trace.max-steps)"
    )
    private Integer maxSteps;

    @ParentCommand
    private CommandLineInterface parent;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        if (!script.isFile()) {
            err.println("Error: script not found: " + script.getAbsolutePath());
            return 1;
        }

        int limit;
        ActionController controller = new ActionController();
        Long2ObjectOpenHashMap<String> names = new Long2ObjectOpenHashMap<>();
        try {
            limit = maxSteps != null ? maxSteps : parent.getConfig().getInt("tactica.trace.max-steps");
            loadScript(ConfigFactory.parseFile(script).resolve(), controller, names, out);
        } catch (ConfigException | IllegalArgumentException e) {
            err.println("Error: invalid script " + script.getName() + ": " + e.getMessage());
            LOG.debug("Script load failed", e);
            return 1;
        }

        out.println("Initial order: " + describeOrder(controller, names));
        int executed = 0;
        while (executed < limit) {
            if (!executeNext(controller, names, executed + 1, out)) {
                break;
            }
            executed++;
        }

        int pending = 0;
        for (ActionQueue queue : controller.snapshot()) {
            pending += queue.numOfActions();
        }
        out.println("Executed " + executed + " action(s), " + pending + " pending");
        out.println("Final order: " + describeOrder(controller, names));
        return 0;
    }

    private static void loadScript(Config scriptConfig, ActionController controller,
                                   Long2ObjectOpenHashMap<String> names, PrintWriter out) {
        List<? extends Config> queues = scriptConfig.getConfigList("queues");
        long ownerId = 1L;
        for (Config queueConfig : queues) {
            String name = queueConfig.hasPath("name") ? queueConfig.getString("name") : "Q" + ownerId;
            ActionQueue queue = new ActionQueue(ownerId, queueConfig.getInt("action-points"));
            names.put(ownerId, name);
            if (queueConfig.hasPath("actions")) {
                for (Config actionConfig : queueConfig.getConfigList("actions")) {
                    ActionKind kind = actionConfig.getEnum(ActionKind.class, "kind");
                    long actor = ownerId;
                    PlayerAction action = new PlayerAction(actor, 0L, null, 0, 0,
                            (actorId, targetId, map, dx, dy) -> LOG.debug("{} performed {}", name, kind));
                    SubmissionResult result = queue.addAction(action, actionConfig.getInt("cost"), kind);
                    if (result == SubmissionResult.DEDUPLICATED) {
                        out.println("Note: " + name + " already has a " + kind + " action, duplicate dropped");
                    }
                }
            }
            controller.addActionQueue(queue);
            ownerId++;
        }
    }

    private static boolean executeNext(ActionController controller, Long2ObjectOpenHashMap<String> names,
                                       int stepNumber, PrintWriter out) {
        Optional<ActionQueue> head = controller.peekFirst();
        if (head.isEmpty()) {
            return false;
        }
        if (head.get().numOfActions() == 0) {
            if (!controller.hasPendingActions()) {
                return false;
            }
            int removed = controller.cleanController();
            out.println("Cleaned " + removed + " empty queue(s)");
            head = controller.peekFirst();
            if (head.isEmpty()) {
                return false;
            }
        }
        ActionQueue queue = head.get();
        Optional<QueueEntry> entry = queue.peek();
        int before = queue.getTotalActionPoints();
        if (entry.isEmpty() || !controller.executeFirst()) {
            return false;
        }
        out.printf("%3d. %s %s (cost %d) %d -> %d%n", stepNumber, names.get(queue.getOwnerId()),
                entry.get().kind(), entry.get().cost(), before, queue.getTotalActionPoints());
        return true;
    }

    private static String describeOrder(ActionController controller, Long2ObjectOpenHashMap<String> names) {
        return controller.snapshot().stream()
                .map(q -> names.get(q.getOwnerId()) + "(" + q.getTotalActionPoints() + ")")
                .collect(Collectors.joining(" "));
    }
}
