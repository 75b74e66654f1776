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
package ru.nts.tools.blueprint.core.logic;

import ru.nts.tools.blueprint.core.*;
import ru.nts.tools.blueprint.core.parser.*;

import java.util.*;

/**
 * Логический резолвер (Traversal Engine): обходит AST с областью видимости на каждую ветвь,
 * вычисляет условия, подставляет шаблоны и превращает дерево в упорядоченный список
 * {@link PlannedEntry} и список команд.
 *
 * Обход рекурсивный, но ограничен потолком глубины: превышение дает FATAL-диагностику
 * и {@link BlueprintErrorCode#RECURSION_LIMIT}.
 */
public class LogicResolver {

    private final EngineConfig config;
    private final PathSanitizer sanitizer;

    public LogicResolver(EngineConfig config) {
        this.config = config;
        this.sanitizer = PathSanitizer.forConfig(config);
    }

    public ResolutionResult resolve(CompileResult compiled) {
        return new Pass(compiled).run();
    }

    /**
     * Состояние одного прохода: контекст переменных, виртуальный манифест и накопители результата.
     */
    private final class Pass {
        private final CompileResult compiled;
        private final BlueprintAst ast;
        private final VariableContext context = new VariableContext();
        private final VirtualManifest manifest = new VirtualManifest(config.getProjectRoot());
        private final TemplateAlchemist alchemist = new TemplateAlchemist(context);
        private final ConditionEvaluator evaluator = new ConditionEvaluator(context, manifest);

        private final LinkedHashMap<String, PlannedEntry> planned = new LinkedHashMap<>();
        private final List<ResolvedCommand> commands = new ArrayList<>();
        private final Map<Integer, Boolean> visibility = new TreeMap<>();
        private final List<Diagnostic> diagnostics = new ArrayList<>();

        Pass(CompileResult compiled) {
            this.compiled = compiled;
            this.ast = compiled.ast();
        }

        ResolutionResult run() {
            defineVariables();
            walk(BlueprintAst.ROOT, LogicScope.root());

            List<Diagnostic> all = new ArrayList<>(compiled.diagnostics());
            all.addAll(diagnostics);
            all.sort(Diagnostic.BY_LINE);
            return new ResolutionResult(new ArrayList<>(planned.values()), commands, context.globals(), visibility, all);
        }

        // ==================== Variables ====================

        private void defineVariables() {
            Map<String, String> overrides = config.getVariableOverrides();
            overrides.forEach((name, value) -> context.define(name, LogicValues.parseLiteral(value)));

            for (VariableDefinition def : compiled.variables()) {
                if (overrides.containsKey(def.name())) {
                    continue; // значение вызывающей стороны побеждает
                }
                Object value = LogicValues.parseLiteral(def.rawValue());
                context.define(def.name(), expandValue(value, def.line(), def.rawValue()));
            }
        }

        private Object expandValue(Object value, int line, String source) {
            if (value instanceof String s) {
                return expand(s, line, source);
            }
            if (value instanceof List<?> list) {
                List<Object> expanded = new ArrayList<>();
                for (Object item : list) expanded.add(expandValue(item, line, source));
                return expanded;
            }
            return value;
        }

        // ==================== Traversal ====================

        private void walk(int nodeId, LogicScope scope) {
            if (scope.depth() > config.getRecursionLimit()) {
                AstNode node = ast.node(nodeId);
                diagnostics.add(Diagnostic.fatal(node.getLine(), "RECURSION_LIMIT",
                        "Nesting exceeds " + config.getRecursionLimit() + " levels", node.getSource() == null ? "" : node.getSource().raw()));
                throw new BlueprintException(BlueprintErrorCode.RECURSION_LIMIT,
                        Map.of("limit", config.getRecursionLimit(), "line", node.getLine()));
            }

            ChainStatus chain = null;
            for (int childId : ast.node(nodeId).getChildren()) {
                AstNode child = ast.node(childId);
                switch (child.getKind()) {
                    case LOGIC -> chain = visitLogic(child, scope, chain);
                    case FORM -> {
                        chain = null;
                        visitForm(child, scope);
                    }
                    case COMMAND_ANCHOR -> {
                        chain = null;
                        visitCommands(child, scope);
                    }
                    default -> {
                    }
                }
            }
        }

        /**
         * Машина состояний цепочки условий.
         *
         * @return новое состояние цепочки для следующего брата
         */
        private ChainStatus visitLogic(AstNode node, LogicScope scope, ChainStatus chain) {
            LogicKeyword keyword = node.getLogic().keyword();
            if (keyword == null) {
                // Неизвестная директива: тело поглощается невидимым
                mark(node, false);
                walk(node.getId(), scope.enter(false));
                return null;
            }

            switch (keyword) {
                case IF -> {
                    ChainStatus next = ChainStatus.CLOSED;
                    boolean enter = false;
                    if (scope.visible()) {
                        Boolean result = test(node);
                        if (result != null) {
                            enter = result;
                            next = result ? ChainStatus.ENTERED : ChainStatus.PENDING;
                        }
                    }
                    branch(node, scope, enter);
                    return next;
                }
                case ELIF -> {
                    boolean enter = false;
                    ChainStatus next = ChainStatus.CLOSED;
                    if (chain == ChainStatus.PENDING && scope.visible()) {
                        Boolean result = test(node);
                        if (result != null) {
                            enter = result;
                            next = result ? ChainStatus.ENTERED : ChainStatus.PENDING;
                        }
                    }
                    branch(node, scope, enter);
                    return next;
                }
                case ELSE -> {
                    branch(node, scope, chain == ChainStatus.PENDING && scope.visible());
                    return ChainStatus.CLOSED;
                }
                case FOR -> {
                    visitLoop(node, scope);
                    return null;
                }
                default -> {
                    // @endif / @endfor обрывают цепочку
                    mark(node, scope.visible());
                    return null;
                }
            }
        }

        private void branch(AstNode node, LogicScope scope, boolean enter) {
            mark(node, scope.visible() && enter);
            walk(node.getId(), scope.enter(enter));
        }

        /**
         * Сбой условия фиксируется на строке и дает null: ветвь невидима, цепочка закрывается.
         */
        private Boolean test(AstNode node) {
            String expression = node.getLogic().expression();
            if (expression == null) {
                return null; // уже отражено компилятором
            }
            try {
                return evaluator.test(expression);
            } catch (EvaluationException e) {
                logicFault(node, e);
                return null;
            }
        }

        private void visitLoop(AstNode node, LogicScope scope) {
            ClassifiedLine.LogicSpec logic = node.getLogic();
            List<Object> items = List.of();
            if (scope.visible() && logic.expression() != null) {
                try {
                    items = LogicValues.asIterable(evaluator.evaluate(logic.expression()));
                } catch (EvaluationException e) {
                    logicFault(node, e);
                }
            }
            mark(node, scope.visible() && !items.isEmpty());
            if (items.isEmpty()) {
                walk(node.getId(), scope.enter(false));
                return;
            }
            for (Object item : items) {
                context.bind(logic.loopVariable(), item);
                try {
                    walk(node.getId(), scope.enter(true));
                } finally {
                    context.unbind();
                }
            }
        }

        private void logicFault(AstNode node, EvaluationException e) {
            diagnostics.add(Diagnostic.error(node.getLine(), "LOGIC_FAULT", e.getMessage(), node.getSource().raw()));
            EngineLog.debug("L" + node.getLine() + " logic fault: " + e.getMessage());
        }

        // ==================== Forms ====================

        private void visitForm(AstNode node, LogicScope scope) {
            ClassifiedLine.FormSpec form = node.getForm();
            String raw = node.getSource().raw();
            String path = PathSanitizer.normalize(scope.join(expand(form.path(), node.getLine(), raw)));
            mark(node, scope.visible());

            if (!scope.visible()) {
                if (form.directory()) walk(node.getId(), new LogicScope(false, path, scope.depth() + 1));
                return;
            }
            if (!checkPath(path, node)) {
                if (form.directory()) walk(node.getId(), new LogicScope(false, path, scope.depth() + 1));
                return;
            }

            PlannedEntry entry;
            if (form.directory()) {
                entry = PlannedEntry.directory(path, form.permission(), node.getLine());
            } else if (form.operator() == FormOperator.SEED) {
                if (form.payload() == null) return;
                String seed = PathSanitizer.normalize(expand(form.payload(), node.getLine(), raw));
                if (!checkPath(seed, node)) return;
                entry = PlannedEntry.seeded(path, seed, form.permission(), node.getLine());
            } else if (form.operator().isMutation()) {
                String payload = form.operator() == FormOperator.REWRITE ? form.payload() : node.getContent();
                if (form.operator() == FormOperator.REWRITE && payload == null) return;
                entry = PlannedEntry.mutation(path, MutationKind.of(form.operator()),
                        expand(payload, node.getLine(), raw), expand(form.replacement(), node.getLine(), raw),
                        form.permission(), node.getLine());
            } else {
                entry = PlannedEntry.file(path, expand(node.getContent(), node.getLine(), raw), form.permission(), node.getLine());
            }

            register(entry, raw);
            if (form.directory()) {
                walk(node.getId(), scope.enterDirectory(path));
            }
        }

        private boolean checkPath(String path, AstNode node) {
            try {
                sanitizer.resolve(path);
                return true;
            } catch (BlueprintException e) {
                diagnostics.add(Diagnostic.error(node.getLine(), e.getCode().name(), e.getCode().format(e.getContext()), node.getSource().raw()));
                return false;
            }
        }

        /**
         * Регистрация с политикой коллизий: более поздняя запись побеждает,
         * мутация берет более раннюю запись того же пути как базу.
         */
        private void register(PlannedEntry entry, String raw) {
            PlannedEntry previous = planned.get(entry.path());
            if (previous != null) {
                if (entry.isMutation() && !previous.directory()) {
                    entry = entry.withBase(previous);
                } else if (entry.directory() && previous.directory()) {
                    // Повторно открытая директория остается на месте; права берутся из последнего объявления, если указаны
                    if (entry.permission() != null) planned.put(entry.path(), entry);
                    return;
                } else {
                    String message = "Path '" + entry.path() + "' from line " + previous.line() + " is replaced by line " + entry.line();
                    diagnostics.add(Diagnostic.warning(entry.line(), "PATH_COLLISION", message, raw));
                    EngineLog.warn(message);
                }
                planned.remove(entry.path());
            }
            planned.put(entry.path(), entry);
            manifest.register(entry.path());
        }

        // ==================== Commands ====================

        private void visitCommands(AstNode node, LogicScope scope) {
            mark(node, scope.visible());
            if (!scope.visible()) return;
            for (int line : node.getCommandLines()) {
                CommandLine command = compiled.commands().get(line);
                if (command == null) continue;
                commands.add(new ResolvedCommand(line, expand(command.text(), line, command.text())));
            }
        }

        // ==================== Helpers ====================

        private String expand(String template, int line, String source) {
            return alchemist.expand(template, (code, message) -> {
                Diagnostic d = Diagnostic.warning(line, code, message, source);
                if (!diagnostics.contains(d)) diagnostics.add(d);
            });
        }

        /**
         * Строка видима, если видима хотя бы в одной итерации цикла.
         */
        private void mark(AstNode node, boolean visible) {
            visibility.merge(node.getLine(), visible, Boolean::logicalOr);
        }
    }
}
