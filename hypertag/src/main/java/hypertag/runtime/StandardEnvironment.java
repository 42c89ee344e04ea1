// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import edu.umd.cs.findbugs.annotations.CheckReturnValue;
import hypertag.dom.Tag;
import hypertag.markup.BuiltinTags;
import hypertag.markup.Escaping;
import hypertag.markup.HtmlTags;
import hypertag.markup.MarkupMode;
import hypertag.scope.UndefinedSymbolCondition;
import hypertag.util.condition.ConditionContext;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The (X)HTML environment.
 * <p>
 * Modules, by path:
 * <ul>
 *     <li>{@value Environment#CONTEXT_PATH}: the context tags and variables given to the builder;</li>
 *     <li>{@code html}: the element tags of the configured dialect;</li>
 *     <li>{@code builtins}: {@code dedent} and {@code javascript};</li>
 *     <li>any module registered with {@link Builder#module(String, Map)}.</li>
 * </ul>
 * Every document sees the element tags and the built-ins by default. Text is HTML-escaped.
 */
public final class StandardEnvironment implements Environment {
    private StandardEnvironment(final Builder builder) {
        markupMode = builder.markupMode;
        final var allModules = new LinkedHashMap<String, Map<String, @Nullable Object>>();
        allModules.put(CONTEXT_PATH, Collections.unmodifiableMap(new LinkedHashMap<>(builder.context)));
        allModules.put(HTML_PATH, tagModule(HtmlTags.forMode(markupMode)));
        allModules.put(BUILTINS_PATH, tagModule(BuiltinTags.all()));
        allModules.putAll(builder.modules);
        modules = Collections.unmodifiableMap(allModules);

        final var defaults = new LinkedHashMap<String, @Nullable Object>();
        defaults.putAll(modules.get(HTML_PATH));
        defaults.putAll(modules.get(BUILTINS_PATH));
        defaultSymbols = Collections.unmodifiableMap(defaults);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns an HTML environment with an empty context.
     */
    public static StandardEnvironment html() {
        return builder().build();
    }

    public MarkupMode markupMode() {
        return markupMode;
    }

    @Override
    public @Nullable Object importOne(final String symbol, final @Nullable String path) {
        final var marked = Environment.markedSymbol(symbol);
        final var module = module(path);
        if (!module.containsKey(marked)) {
            throw ConditionContext.error(new UndefinedSymbolCondition(
                marked,
                "Symbol '" + marked + "' not found in module '" + modulePath(path) + "'"
            ));
        }
        return module.get(marked);
    }

    @Override
    public Map<String, @Nullable Object> importAll(final @Nullable String path) {
        final var result = new LinkedHashMap<String, @Nullable Object>();
        for (final var entry : module(path).entrySet()) {
            if (!Environment.isPrivate(entry.getKey())) {
                result.put(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    @Override
    public Map<String, @Nullable Object> importDefault() {
        return defaultSymbols;
    }

    @Override
    public String escape(final String text) {
        return Escaping.escapeText(text);
    }

    private Map<String, @Nullable Object> module(final @Nullable String path) {
        final var module = modules.get(modulePath(path));
        if (module == null) {
            throw ConditionContext.error(new UndefinedSymbolCondition(
                modulePath(path),
                "Import path '" + path + "' not found"
            ));
        }
        return module;
    }

    private static String modulePath(final @Nullable String path) {
        return (path == null) ? CONTEXT_PATH : path;
    }

    private static Map<String, @Nullable Object> tagModule(final Map<String, Tag> tags) {
        final var result = new LinkedHashMap<String, @Nullable Object>();
        for (final var entry : tags.entrySet()) {
            result.put(Environment.tagSymbol(entry.getKey()), entry.getValue());
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Path of the module holding the dialect's element tags.
     */
    public static final String HTML_PATH = "html";
    /**
     * Path of the module holding the dialect-independent built-in tags.
     */
    public static final String BUILTINS_PATH = "builtins";

    private final MarkupMode markupMode;
    private final Map<String, Map<String, @Nullable Object>> modules;
    private final Map<String, @Nullable Object> defaultSymbols;

    /**
     * Builder for {@link StandardEnvironment}.
     */
    public static final class Builder {
        private Builder() {
        }

        @CheckReturnValue
        public Builder markupMode(final MarkupMode mode) {
            markupMode = mode;
            return this;
        }

        /**
         * Adds a tag to the context module.
         */
        @CheckReturnValue
        public Builder tag(final String name, final Tag tag) {
            context.put(Environment.tagSymbol(name), tag);
            return this;
        }

        /**
         * Adds a variable to the context module.
         */
        @CheckReturnValue
        public Builder variable(final String name, final @Nullable Object value) {
            context.put(Environment.variableSymbol(name), value);
            return this;
        }

        /**
         * Registers a module; its keys must be marked symbols.
         */
        @CheckReturnValue
        public Builder module(final String path, final Map<String, ? extends @Nullable Object> symbols) {
            modules.put(path, Collections.unmodifiableMap(new LinkedHashMap<String, @Nullable Object>(symbols)));
            return this;
        }

        public StandardEnvironment build() {
            return new StandardEnvironment(this);
        }

        private MarkupMode markupMode = MarkupMode.HTML;
        private final LinkedHashMap<String, @Nullable Object> context = new LinkedHashMap<>();
        private final LinkedHashMap<String, Map<String, @Nullable Object>> modules = new LinkedHashMap<>();
    }
}
