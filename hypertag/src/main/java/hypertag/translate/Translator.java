// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.translate;

import hypertag.ast.Document;
import hypertag.dom.Node;
import hypertag.runtime.Environment;

/**
 * The entry point of template translation.
 * <p>
 * On error, every method signals a fatal condition: {@link hypertag.scope.UndefinedSymbolCondition} or
 * {@link AnalysisErrorCondition} while analyzing, and whatever the document's expressions and tags signal while
 * translating or rendering.
 */
public final class Translator {
    /**
     * Initializes a new translator using the default indentation step of two spaces.
     */
    public Translator(final Environment environment) {
        this(environment, DEFAULT_INDENT_STEP);
    }

    /**
     * Initializes a new translator.
     *
     * @param indentStep Indentation of nested outline blocks whose layout doesn't give one; spaces and tabs only.
     */
    public Translator(final Environment environment, final String indentStep) {
        if (!indentStep.chars().allMatch(c -> c == ' ' || c == '\t')) {
            throw new IllegalArgumentException("Indentation step must consist of spaces and tabs");
        }
        this.environment = environment;
        this.indentStep = indentStep;
    }

    /**
     * Analyzes the document without translating it.
     */
    public Program compile(final Document document) {
        return new Analyzer(environment, indentStep).analyze(document);
    }

    /**
     * Analyzes and translates the document into a tree.
     */
    public Node.Root translate(final Document document) {
        return compile(document).execute();
    }

    /**
     * Analyzes, translates and renders the document.
     */
    public String render(final Document document) {
        return translate(document).render();
    }

    public Environment environment() {
        return environment;
    }

    public static final String DEFAULT_INDENT_STEP = "  ";

    private final Environment environment;
    private final String indentStep;
}
