// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.translate;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import hypertag.dom.ArgumentErrorCondition;
import hypertag.dom.Sequence;
import hypertag.dom.VoidBodyCondition;
import hypertag.scope.Frame;
import hypertag.scope.LazyValue;
import hypertag.scope.ScopedTag;
import hypertag.util.Trace;
import hypertag.util.condition.ConditionContext;
import hypertag.util.condition.UnhandledErrorError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A hypertag defined in a template.
 * <p>
 * An expansion opens a frame one level deeper than the frame the hypertag was defined in, linked to that frame, with
 * the body attribute (if declared) in the first slot, the regular attributes after it and the body's own variables
 * after those. Defaults of omitted attributes are evaluated lazily in the defining frame.
 */
public final class HypertagDefinition implements ScopedTag {
    HypertagDefinition(
        final String name,
        final int depth,
        final @Nullable String bodyParameter,
        final List<Parameter> parameters,
        final int slotCount,
        final Fragment body,
        final @Nullable Integer referenceDepth
    ) {
        this.name = name;
        this.depth = depth;
        this.bodyParameter = bodyParameter;
        this.parameters = List.copyOf(parameters);
        this.slotCount = slotCount;
        this.body = body;
        this.referenceDepth = referenceDepth;
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * Depth of the frame the hypertag was defined in; 0 for the document level.
     */
    public int depth() {
        return depth;
    }

    /**
     * The shallowest frame depth the hypertag reads from, directly or through other hypertags; -1 if it reads
     * anything from the environment that isn't a pure tag, {@code null} if it reads nothing at all.
     */
    public @Nullable Integer referenceDepth() {
        return referenceDepth;
    }

    /**
     * Checks whether the expansion depends on nothing but the hypertag's attributes and body, so that equal
     * arguments always produce equal output.
     */
    public boolean isPureExpansion() {
        final var reference = referenceDepth;
        return reference == null || reference > depth;
    }

    @Override
    public boolean acceptsBody() {
        return bodyParameter != null;
    }

    /**
     * Names of the regular attributes, in declaration order.
     */
    public List<String> parameterNames() {
        return parameters.stream().map(Parameter::name).toList();
    }

    /**
     * Expands the hypertag.
     * <p>
     * On error, a fatal condition is signaled:
     * <ul>
     * <li>{@link ArgumentErrorCondition} if the attributes don't match the declared ones.
     * <li>{@link VoidBodyCondition} if a hypertag without a body attribute is given a non-empty body.
     * <li>Any condition the translation of the hypertag's body signals.
     * </ul>
     */
    @Override
    public Sequence expand(
        final Frame caller,
        final Sequence body,
        final List<@Nullable Object> attributes,
        final Map<String, @Nullable Object> namedAttributes
    ) {
        try (final var trace = new Trace(() -> "Expanding hypertag " + name)) {
            trace.use();
            final var enclosing = caller.outer(caller.depth() - depth);
            final var frame = Frame.open(
                caller.stack(),
                depth + 1,
                enclosing.pointer(),
                bindArguments(enclosing, body, attributes, namedAttributes),
                slotCount
            );
            try {
                return this.body.translate(frame);
            } finally {
                frame.close();
            }
        }
    }

    @Override
    public String toString() {
        return "HypertagDefinition[" + name + ", depth " + depth + "]";
    }

    private List<@Nullable Object> bindArguments(
        final Frame enclosing,
        final Sequence body,
        final List<@Nullable Object> attributes,
        final Map<String, @Nullable Object> namedAttributes
    ) {
        if (attributes.size() > parameters.size()) {
            throw signalArgumentError(
                "takes " + parameters.size() + " positional attributes but " + attributes.size() + " were given"
            );
        }
        if (bodyParameter != null && namedAttributes.containsKey(bodyParameter)) {
            throw signalArgumentError("doesn't allow direct assignment to its body attribute '" + bodyParameter + "'");
        }
        final var assigned = new HashMap<String, @Nullable Object>();
        for (final var entry : namedAttributes.entrySet()) {
            if (parameters.stream().noneMatch(parameter -> parameter.name().equals(entry.getKey()))) {
                throw signalArgumentError("got an unexpected attribute '" + entry.getKey() + "'");
            }
            assigned.put(entry.getKey(), entry.getValue());
        }
        for (int i = 0; i < attributes.size(); i += 1) {
            final var parameterName = parameters.get(i).name();
            if (assigned.containsKey(parameterName)) {
                throw signalArgumentError("got multiple values for attribute '" + parameterName + "'");
            }
            assigned.put(parameterName, attributes.get(i));
        }

        final var values = new ArrayList<@Nullable Object>(parameters.size() + 1);
        if (bodyParameter != null) {
            values.add(body);
        } else if (!body.isEmpty()) {
            throw ConditionContext.error(new VoidBodyCondition(name));
        }
        for (final var parameter : parameters) {
            if (assigned.containsKey(parameter.name())) {
                values.add(assigned.get(parameter.name()));
                continue;
            }
            final var defaultValue = parameter.defaultValue();
            if (defaultValue == null) {
                throw signalArgumentError("is missing a required attribute '" + parameter.name() + "'");
            }
            values.add(LazyValue.of(() -> defaultValue.evaluate(enclosing)));
        }
        return values;
    }

    private UnhandledErrorError signalArgumentError(final String message) {
        return ConditionContext.error(new ArgumentErrorCondition(name, "Hypertag '" + name + "' " + message));
    }

    private final String name;
    private final int depth;
    private final @Nullable String bodyParameter;
    private final List<Parameter> parameters;
    private final int slotCount;
    private final Fragment body;
    private final @Nullable Integer referenceDepth;

    /**
     * A regular attribute; a {@code null} default makes it required.
     */
    record Parameter(String name, @Nullable Evaluator defaultValue) {
    }
}
