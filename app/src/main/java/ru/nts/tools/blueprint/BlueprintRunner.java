/*
 * Copyright 2025 Aristo
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package ru.nts.tools.blueprint;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import ru.nts.tools.blueprint.core.*;
import ru.nts.tools.blueprint.core.chronicle.Chronicle;
import ru.nts.tools.blueprint.core.logic.ResolvedCommand;
import ru.nts.tools.blueprint.core.materialize.ConflictPolicy;
import ru.nts.tools.blueprint.core.materialize.WriteResult;
import ru.nts.tools.blueprint.core.reconcile.ChangeKind;
import ru.nts.tools.blueprint.core.reconcile.PlannedChange;
import ru.nts.tools.blueprint.core.reconcile.ReconciliationPlan;

import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

/**
 * Точка входа: применяет blueprint и печатает машинный отчет (JSON) в stdout.
 *
 * <pre>
 * BlueprintRunner [plan] &lt;blueprint&gt; [--root DIR] [--dry-run] [--policy abort|skip|force]
 *                 [--var NAME=VALUE]... [--virtual-root PREFIX] [--no-secondary]
 * </pre>
 *
 * Коды выхода: 0 успех, 1 конфликты или сбои записи, 2 фатальная ошибка.
 */
public class BlueprintRunner {

    public static final int EXIT_OK = 0;
    public static final int EXIT_FAILED = 1;
    public static final int EXIT_FATAL = 2;

    private static final ObjectMapper mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static void main(String[] args) {
        // Принудительно UTF-8: на Windows стандартные потоки используют системную кодировку
        System.setOut(new PrintStream(System.out, true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(System.err, true, StandardCharsets.UTF_8));
        System.exit(run(args, System.getenv(), System.out));
    }

    /**
     * Выполняет прогон и возвращает код выхода.
     */
    static int run(String[] args, Map<String, String> env, PrintStream out) {
        Invocation invocation;
        try {
            invocation = Invocation.parse(args, EngineConfig.fromEnvironment(env));
        } catch (IllegalArgumentException e) {
            EngineLog.error(e.getMessage());
            EngineLog.error(usage());
            return EXIT_FATAL;
        }

        BlueprintEngine engine = new BlueprintEngine(invocation.config());
        try {
            if (invocation.planOnly()) {
                PlanningResult planning = engine.plan(invocation.blueprint());
                out.println(write(planJson(planning)));
                boolean clean = !planning.plan().hasConflicts()
                        && planning.diagnostics().stream().noneMatch(d -> d.severity().atLeast(Severity.ERROR));
                return clean ? EXIT_OK : EXIT_FAILED;
            }
            ApplyReport report = engine.apply(invocation.blueprint());
            out.println(write(reportJson(report)));
            return report.exitCode();
        } catch (BlueprintException e) {
            EngineLog.error(e.toLogMessage());
            out.println(write(errorJson(e)));
            return e.getCode() == BlueprintErrorCode.CONFLICTS_PRESENT ? EXIT_FAILED : EXIT_FATAL;
        } catch (RuntimeException e) {
            EngineLog.error("Unexpected failure: " + e);
            out.println(write(errorJson(new BlueprintException(BlueprintErrorCode.INTERNAL_ERROR, e))));
            return EXIT_FATAL;
        }
    }

    static String usage() {
        return "Usage: BlueprintRunner [plan] <blueprint> [--root DIR] [--dry-run] [--policy abort|skip|force] "
                + "[--var NAME=VALUE]... [--virtual-root PREFIX] [--no-secondary]";
    }

    // ==================== Arguments ====================

    record Invocation(Path blueprint, EngineConfig config, boolean planOnly) {

        static Invocation parse(String[] args, EngineConfig base) {
            EngineConfig config = base;
            Path root = null;
            String blueprint = null;
            boolean planOnly = false;
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "--root" -> root = Paths.get(value(args, ++i, arg));
                    case "--dry-run" -> config = config.withDryRun(true);
                    case "--no-secondary" -> config = config.withSecondaryStore(false);
                    case "--virtual-root" -> config = config.withVirtualRoot(value(args, ++i, arg));
                    case "--policy" -> {
                        String policy = value(args, ++i, arg).toUpperCase(Locale.ROOT);
                        try {
                            config = config.withConflictPolicy(ConflictPolicy.valueOf(policy));
                        } catch (IllegalArgumentException e) {
                            throw new IllegalArgumentException("Unknown conflict policy: " + policy);
                        }
                    }
                    case "--var" -> {
                        String pair = value(args, ++i, arg);
                        int eq = pair.indexOf('=');
                        if (eq <= 0) throw new IllegalArgumentException("Expected NAME=VALUE after --var, got: " + pair);
                        config = config.withVariable(pair.substring(0, eq).trim(), pair.substring(eq + 1));
                    }
                    default -> {
                        if (arg.startsWith("--")) throw new IllegalArgumentException("Unknown option: " + arg);
                        if (blueprint == null && !planOnly && arg.equalsIgnoreCase("plan")) {
                            planOnly = true;
                        } else if (blueprint == null) {
                            blueprint = arg;
                        } else {
                            throw new IllegalArgumentException("Unexpected argument: " + arg);
                        }
                    }
                }
            }
            if (blueprint == null) {
                throw new IllegalArgumentException("Blueprint path is required");
            }
            if (root != null) {
                config = config.withProjectRoot(root);
            }
            return new Invocation(Paths.get(blueprint), config, planOnly);
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length) throw new IllegalArgumentException("Missing value for " + option);
            return args[index];
        }
    }

    // ==================== JSON ====================

    static ObjectNode reportJson(ApplyReport report) {
        ObjectNode root = mapper.createObjectNode();
        root.put("success", report.success());
        root.put("committed", report.committed());
        root.put("simulated", report.simulated());
        if (report.aborted() != null) root.put("aborted", report.aborted());
        ObjectNode summary = root.putObject("summary");
        report.summary().forEach(summary::put);

        ArrayNode results = root.putArray("results");
        for (WriteResult r : report.results()) {
            ObjectNode node = results.addObject();
            node.put("path", r.path());
            node.put("action", r.action().name().toLowerCase(Locale.ROOT));
            if (r.origin() != null) node.put("origin", r.origin());
            node.put("directory", r.directory());
            node.put("success", r.success());
            if (r.hash() != null) node.put("hash", r.hash());
            if (r.permission() != null) node.put("permission", r.permission());
            if (r.severity() != null) node.put("severity", r.severity().name());
            if (r.message() != null) node.put("message", r.message());
        }
        root.set("plan", changesJson(report.plan()));
        root.set("diagnostics", diagnosticsJson(report.diagnostics()));
        ArrayNode commands = root.putArray("commands");
        for (ResolvedCommand c : report.commands()) {
            commands.addObject().put("line", c.line()).put("command", c.command());
        }
        Chronicle chronicle = report.chronicle();
        if (report.committed() && chronicle != null && chronicle.provenance() != null) {
            root.putObject("chronicle")
                    .put("runId", chronicle.provenance().runId())
                    .put("seal", chronicle.seal())
                    .put("paths", chronicle.manifest().size());
        }
        return root;
    }

    static ObjectNode planJson(PlanningResult planning) {
        ObjectNode root = mapper.createObjectNode();
        ObjectNode counts = root.putObject("summary");
        planning.plan().counts().forEach((kind, n) -> counts.put(kind.name().toLowerCase(Locale.ROOT), n));
        root.set("plan", changesJson(planning.plan()));
        root.set("diagnostics", diagnosticsJson(planning.diagnostics()));
        ArrayNode commands = root.putArray("commands");
        for (ResolvedCommand c : planning.resolution().commands()) {
            commands.addObject().put("line", c.line()).put("command", c.command());
        }
        return root;
    }

    private static ArrayNode changesJson(ReconciliationPlan plan) {
        ArrayNode changes = mapper.createArrayNode();
        for (PlannedChange c : plan.changes()) {
            if (c.kind() == ChangeKind.UNCHANGED) continue;
            ObjectNode node = changes.addObject();
            node.put("path", c.path());
            node.put("kind", c.kind().name().toLowerCase(Locale.ROOT));
            node.put("directory", c.directory());
            if (c.origin() != null) node.put("origin", c.origin());
            if (c.reason() != null) node.put("reason", c.reason());
            if (c.diff() != null) node.put("diff", c.diff());
        }
        return changes;
    }

    private static ArrayNode diagnosticsJson(Iterable<Diagnostic> diagnostics) {
        ArrayNode array = mapper.createArrayNode();
        for (Diagnostic d : diagnostics) {
            array.addObject()
                    .put("line", d.line())
                    .put("severity", d.severity().name())
                    .put("code", d.code())
                    .put("message", d.message());
        }
        return array;
    }

    static ObjectNode errorJson(BlueprintException e) {
        ObjectNode root = mapper.createObjectNode();
        root.put("success", false);
        ObjectNode error = root.putObject("error");
        error.put("code", e.getCode().name());
        error.put("message", e.getCode().getMessage());
        error.put("details", e.toUserMessage());
        ObjectNode context = error.putObject("context");
        e.getContext().forEach((k, v) -> context.put(k, String.valueOf(v)));
        return root;
    }

    private static String write(ObjectNode node) {
        try {
            return mapper.writeValueAsString(node);
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new BlueprintException(BlueprintErrorCode.INTERNAL_ERROR, e);
        }
    }
}
