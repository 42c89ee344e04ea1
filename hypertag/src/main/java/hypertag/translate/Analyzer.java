// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.translate;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import hypertag.ast.Block;
import hypertag.ast.Document;
import hypertag.ast.Expression;
import hypertag.ast.TagOccurrence;
import hypertag.dom.Tag;
import hypertag.runtime.Environment;
import hypertag.scope.ReferenceDepth;
import hypertag.scope.ScopeStack;
import hypertag.scope.UndefinedSymbolCondition;
import hypertag.util.Trace;
import hypertag.util.condition.ConditionContext;
import hypertag.util.condition.UnhandledErrorError;

/**
 * The semantic analyzer: resolves every name of a document once, lays out frames, computes block indentation and
 * reference depths, and builds the fragments that later produce the document tree.
 * <p>
 * Names live in a {@link ScopeStack} keyed by marked symbol, {@code %tag} or {@code $variable}. Structural blocks and
 * hypertag bodies are local scopes; control blocks aren't, so names bound inside them stay visible afterwards.
 * <p>
 * An analyzer is good for a single document.
 */
final class Analyzer {
    Analyzer(final Environment environment, final String indentStep) {
        this.environment = environment;
        this.indentStep = indentStep;
    }

    /**
     * Analyzes a document.
     * <p>
     * On error, a fatal condition is signaled:
     * <ul>
     * <li>{@link UndefinedSymbolCondition} if a name can't be resolved, here or in the environment.
     * <li>{@link AnalysisErrorCondition} if a construct is used where it's not allowed.
     * </ul>
     */
    Program analyze(final Document document) {
        try (final var trace = new Trace("Analyzing document")) {
            trace.use();
            for (final var entry : environment.importDefault().entrySet()) {
                scope.push(entry.getKey(), new Symbol.External(entry.getValue()));
            }
            final var documentScope = scope.checkpoint();
            final var fragment = analyzeBlocks(document.blocks(), "");
            final var hypertags = new LinkedHashMap<String, HypertagDefinition>();
            for (final var binding : scope.bindingsSince(documentScope).values()) {
                if (binding instanceof Symbol.Hypertag hypertag) {
                    hypertags.put(hypertag.definition().name(), hypertag.definition());
                }
            }
            return new Program(fragment, frame.slotCount, hypertags);
        }
    }

    private Fragment analyzeBlocks(final List<Block> blocks, final String defaultIndent) {
        final var fragments = new ArrayList<Fragment>(blocks.size());
        for (final var block : blocks) {
            fragments.add(analyzeBlock(block, defaultIndent));
        }
        return new Fragment.Blocks(fragments);
    }

    private Fragment analyzeBlock(final Block block, final String defaultIndent) {
        final var layout = block.layout();
        final var layoutIndent = layout.indent();
        final String relativeIndent;
        if (layoutIndent != null) {
            relativeIndent = layoutIndent;
        } else {
            relativeIndent = layout.outline() ? defaultIndent : "";
        }
        for (int i = 0; i < relativeIndent.length(); i += 1) {
            scope.indent(relativeIndent.charAt(i));
        }
        final var fragment = analyzeIndentedBlock(block);
        for (int i = relativeIndent.length() - 1; i >= 0; i -= 1) {
            scope.dedent(relativeIndent.charAt(i));
        }
        if (fragment instanceof Fragment.Nothing || fragment instanceof Fragment.Assign) {
            return fragment;
        }
        return new Fragment.Placed(fragment, layout.outline(), layout.margin());
    }

    private Fragment analyzeIndentedBlock(final Block block) {
        if (block instanceof Block.Text text) {
            return new Fragment.Text(text.mode(), analyzeExpressions(text.parts()), environment, scope.indentation());
        } else if (block instanceof Block.Struct struct) {
            return analyzeStruct(struct);
        } else if (block instanceof Block.Hypertag hypertag) {
            analyzeHypertag(hypertag);
            return nothing;
        } else if (block instanceof Block.Import importBlock) {
            analyzeImport(importBlock);
            return nothing;
        } else if (block instanceof Block.If ifBlock) {
            return analyzeIf(ifBlock);
        } else if (block instanceof Block.For forBlock) {
            final var iterable = analyzeExpression(forBlock.iterable());
            final var slot = bindVariable(forBlock.variable());
            return new Fragment.For(slot, iterable, analyzeControlBody(forBlock.body()));
        } else if (block instanceof Block.While whileBlock) {
            final var test = analyzeExpression(whileBlock.test());
            return new Fragment.While(test, analyzeControlBody(whileBlock.body()));
        } else if (block instanceof Block.Try tryBlock) {
            final var alternatives = new ArrayList<Fragment>();
            for (final var alternative : tryBlock.alternatives()) {
                alternatives.add(analyzeControlBody(alternative));
            }
            return new Fragment.Try(alternatives);
        } else if (block instanceof Block.Assignment assignment) {
            final var value = analyzeExpression(assignment.value());
            return new Fragment.Assign(bindVariable(assignment.variable()), value);
        } else if (block instanceof Block.Embed embed) {
            return new Fragment.Embed(analyzeExpression(embed.expression()), scope.indentation());
        }
        throw new IllegalArgumentException("Unknown block type " + block.getClass().getName());
    }

    private Fragment analyzeStruct(final Block.Struct struct) {
        final var tagName = struct.chain().get(0).name();
        try (final var trace = new Trace(() -> "Analyzing structural block " + tagName)) {
            trace.use();
            final var indentation = scope.indentation();
            final var chain = new ArrayList<TagApplication>(struct.chain().size());
            for (final var occurrence : struct.chain()) {
                chain.add(analyzeOccurrence(occurrence, indentation));
            }
            final var body = inLocalScope(() -> analyzeBlocks(struct.body(), indentStep));
            return new Fragment.Struct(chain, body, indentation);
        }
    }

    private TagApplication analyzeOccurrence(final TagOccurrence occurrence, final String indentation) {
        final var positional = analyzeExpressions(occurrence.positional());
        final var named = new ArrayList<TagApplication.Arguments.Named>(occurrence.named().size());
        for (final var attribute : occurrence.named()) {
            named.add(new TagApplication.Arguments.Named(attribute.name(), analyzeExpression(attribute.value())));
        }
        final var arguments = new TagApplication.Arguments(positional, named);

        final var name = occurrence.name();
        if (!name.isEmpty() && name.charAt(0) == Environment.VARIABLE_MARK) {
            final var variableName = name.substring(1);
            return new TagApplication.Dynamic(
                analyzeVariable(variableName),
                variableName,
                arguments,
                indentation
            );
        }
        final var symbol = lookup(Environment.tagSymbol(name), "Undefined tag '" + name + "'");
        if (symbol instanceof Symbol.Hypertag hypertag) {
            referenceDepth.merge(hypertag.definition().referenceDepth());
            return new TagApplication.Native(hypertag.definition(), arguments, indentation);
        } else if (symbol instanceof Symbol.External external && external.value() instanceof Tag tag) {
            if (!tag.isPure()) {
                referenceDepth.add(externalDepth);
            }
            return new TagApplication.External(tag, arguments);
        }
        throw signalError("Symbol %" + name + " doesn't name a tag");
    }

    private void analyzeHypertag(final Block.Hypertag hypertag) {
        if (controlDepth > 0) {
            throw signalError("Hypertag definition inside a control block is not allowed: " + hypertag.name());
        }
        try (final var trace = new Trace(() -> "Analyzing hypertag definition " + hypertag.name())) {
            trace.use();
            checkParameterNames(hypertag);

            final var outerReferenceDepth = referenceDepth;
            final var outerFrame = frame;
            final var outerControlDepth = controlDepth;
            referenceDepth = new ReferenceDepth();

            // Defaults see the scope of the definition, not the attributes.
            final var parameters = new ArrayList<HypertagDefinition.Parameter>(hypertag.parameters().size());
            for (final var parameter : hypertag.parameters()) {
                final var defaultValue = parameter.defaultValue();
                parameters.add(new HypertagDefinition.Parameter(
                    parameter.name(),
                    (defaultValue == null) ? null : analyzeExpression(defaultValue)
                ));
            }

            frame = new FrameLayout(outerFrame.depth + 1);
            controlDepth = 0;
            final var body = inLocalScope(() -> {
                final var bodyParameter = hypertag.bodyParameter();
                if (bodyParameter != null) {
                    bindVariable(bodyParameter);
                }
                for (final var parameter : hypertag.parameters()) {
                    bindVariable(parameter.name());
                }
                return analyzeBlocks(hypertag.body(), indentStep);
            });
            final var definition = new HypertagDefinition(
                hypertag.name(),
                outerFrame.depth,
                hypertag.bodyParameter(),
                parameters,
                frame.slotCount,
                body,
                referenceDepth.value()
            );

            final var innerReferenceDepth = referenceDepth.value();
            referenceDepth = outerReferenceDepth;
            referenceDepth.merge(innerReferenceDepth);
            frame = outerFrame;
            controlDepth = outerControlDepth;

            // Bound after the body: a hypertag can't refer to itself.
            scope.push(Environment.tagSymbol(hypertag.name()), new Symbol.Hypertag(definition));
        }
    }

    private static void checkParameterNames(final Block.Hypertag hypertag) {
        final var names = new HashSet<String>();
        final var bodyParameter = hypertag.bodyParameter();
        if (bodyParameter != null) {
            names.add(bodyParameter);
        }
        for (final var parameter : hypertag.parameters()) {
            if (!names.add(parameter.name())) {
                throw signalError(
                    "Duplicate attribute '" + parameter.name() + "' in hypertag definition '" + hypertag.name() + "'"
                );
            }
        }
    }

    private void analyzeImport(final Block.Import importBlock) {
        if (controlDepth > 0) {
            throw signalError("Import inside a control block is not allowed");
        }
        final var path = importBlock.path();
        for (final var symbol : importBlock.symbols()) {
            if (symbol.equals(Block.Import.WILDCARD)) {
                for (final var entry : environment.importAll(path).entrySet()) {
                    scope.push(entry.getKey(), new Symbol.External(entry.getValue()));
                }
            } else {
                final var marked = Environment.markedSymbol(symbol);
                scope.push(marked, new Symbol.External(environment.importOne(marked, path)));
            }
        }
    }

    private Fragment analyzeIf(final Block.If ifBlock) {
        final var clauses = new ArrayList<Fragment.If.Clause>(ifBlock.clauses().size());
        for (final var clause : ifBlock.clauses()) {
            final var test = analyzeExpression(clause.test());
            clauses.add(new Fragment.If.Clause(test, analyzeControlBody(clause.body())));
        }
        final var elseBody = ifBlock.elseBody().isEmpty() ? null : analyzeControlBody(ifBlock.elseBody());
        return new Fragment.If(clauses, elseBody);
    }

    // Control block bodies produce output at the block's own indentation.
    private Fragment analyzeControlBody(final List<Block> blocks) {
        controlDepth += 1;
        try {
            return analyzeBlocks(blocks, "");
        } finally {
            controlDepth -= 1;
        }
    }

    private Fragment inLocalScope(final BodyAnalysis analysis) {
        final var checkpoint = scope.checkpoint();
        final var outerLocalScope = localScope;
        scopeCounter += 1;
        localScope = scopeCounter;
        try {
            return analysis.analyze();
        } finally {
            localScope = outerLocalScope;
            scope.reset(checkpoint);
        }
    }

    /**
     * Returns the slot for an assignment to the variable: the slot of its binding if that was made in the current
     * local scope, otherwise a new one.
     */
    private int bindVariable(final String name) {
        final var key = Environment.variableSymbol(name);
        final var existing = scope.get(key);
        if (existing instanceof Symbol.Variable variable
            && variable.frameDepth() == frame.depth
            && variable.localScope() == localScope) {
            return variable.slot();
        }
        final var slot = frame.slotCount;
        frame.slotCount += 1;
        scope.push(key, new Symbol.Variable(frame.depth, localScope, slot, name));
        return slot;
    }

    private List<Evaluator> analyzeExpressions(final List<Expression> expressions) {
        final var result = new ArrayList<Evaluator>(expressions.size());
        for (final var expression : expressions) {
            result.add(analyzeExpression(expression));
        }
        return result;
    }

    private Evaluator analyzeExpression(final Expression expression) {
        if (expression instanceof Expression.Literal literal) {
            return new Evaluator.Constant(literal.value());
        } else if (expression instanceof Expression.Variable variable) {
            return analyzeVariable(variable.name());
        } else if (expression instanceof Expression.TagValue tagValue) {
            return analyzeTagValue(tagValue.name());
        } else if (expression instanceof Expression.ListOf list) {
            return new Evaluator.ListOf(analyzeExpressions(list.elements()));
        } else if (expression instanceof Expression.Unary unary) {
            final var operand = analyzeExpression(unary.operand());
            return switch (unary.operator()) {
                case NOT -> new Evaluator.Not(operand);
                case NEGATE -> new Evaluator.Negate(operand);
            };
        } else if (expression instanceof Expression.Binary binary) {
            return new Evaluator.Binary(
                binary.operator(),
                analyzeExpression(binary.left()),
                analyzeExpression(binary.right())
            );
        } else if (expression instanceof Expression.Conditional conditional) {
            return new Evaluator.Conditional(
                analyzeExpression(conditional.test()),
                analyzeExpression(conditional.then()),
                analyzeExpression(conditional.otherwise())
            );
        } else if (expression instanceof Expression.Index index) {
            return new Evaluator.Index(analyzeExpression(index.target()), analyzeExpression(index.key()));
        }
        throw new IllegalArgumentException("Unknown expression type " + expression.getClass().getName());
    }

    private Evaluator analyzeVariable(final String name) {
        final var symbol = lookup(Environment.variableSymbol(name), "Undefined variable '" + name + "'");
        if (symbol instanceof Symbol.Variable variable) {
            referenceDepth.add(variable.frameDepth());
            return new Evaluator.Load(frame.depth - variable.frameDepth(), variable.slot(), name);
        } else if (symbol instanceof Symbol.External external) {
            referenceDepth.add(externalDepth);
            return new Evaluator.Constant(external.value());
        }
        throw signalError("Symbol $" + name + " doesn't name a variable");
    }

    private Evaluator analyzeTagValue(final String name) {
        final var symbol = lookup(Environment.tagSymbol(name), "Undefined tag '" + name + "'");
        if (symbol instanceof Symbol.Hypertag hypertag) {
            referenceDepth.merge(hypertag.definition().referenceDepth());
            return new Evaluator.HypertagValue(hypertag.definition());
        } else if (symbol instanceof Symbol.External external) {
            if (!(external.value() instanceof Tag tag && tag.isPure())) {
                referenceDepth.add(externalDepth);
            }
            return new Evaluator.Constant(external.value());
        }
        throw signalError("Symbol %" + name + " doesn't name a tag");
    }

    private Symbol lookup(final String symbol, final String message) {
        final var result = scope.get(symbol);
        if (result == null) {
            throw ConditionContext.error(new UndefinedSymbolCondition(symbol, message));
        }
        return result;
    }

    private static UnhandledErrorError signalError(final String message) {
        return ConditionContext.error(new AnalysisErrorCondition(message));
    }

    private final Environment environment;
    private final String indentStep;
    private final ScopeStack<Symbol> scope = new ScopeStack<>();
    private FrameLayout frame = new FrameLayout(0);
    private ReferenceDepth referenceDepth = new ReferenceDepth();
    private int controlDepth = 0;
    private int localScope = 0;
    private int scopeCounter = 0;

    private static final Fragment nothing = new Fragment.Nothing();
    // Names from the environment are shallower than any frame.
    private static final int externalDepth = -1;

    @FunctionalInterface
    private interface BodyAnalysis {
        Fragment analyze();
    }

    private static final class FrameLayout {
        private FrameLayout(final int depth) {
            this.depth = depth;
        }

        private final int depth;
        private int slotCount = 0;
    }
}
