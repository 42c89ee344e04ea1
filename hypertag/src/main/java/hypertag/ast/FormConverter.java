// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.ast;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import hypertag.sexp.Sexp;
import hypertag.sexp.Sexps;
import hypertag.sexp.SymbolTable;
import hypertag.sexp.reader.ByteStream;
import hypertag.sexp.reader.Reader;
import hypertag.util.Trace;
import hypertag.util.condition.ConditionContext;
import hypertag.util.condition.UnhandledErrorError;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Converts the S-expression form of a template into its syntax tree.
 * <p>
 * Block forms:
 * <pre>
 * "text"                                  plain text
 * (text|markup|verbatim|comment part...)  text block; parts are strings or expressions
 * (TAG block...)                          structural block with a single tag
 * ((TAG arg... :name value...) block...)  ... with attributes
 * ((: TAG1 (TAG2 ...) ...) block...)      ... with a chain of tags, outermost first
 * (def NAME (@body $x ($y default)) block...)
 * (import ["path"] * | $var | %tag | tag ...)
 * (if (TEST block...)... [(else block...)])
 * (for $x EXPR block...)
 * (while EXPR block...)
 * (try (block...) (block...)...)
 * (= $x EXPR)
 * (@ EXPR)
 * </pre>
 * Any block producing output may start with layout options right after its head: {@code :inline true},
 * {@code :indent "    "}, {@code :margin 1}.
 * <p>
 * Expressions: strings, integers, {@code true}, {@code false}, {@code null}, {@code $var}, {@code @body},
 * {@code %tag}, {@code (list ...)}, {@code (not x)}, {@code (neg x)}, {@code (if c a b)}, {@code (get x key)} and
 * binary operators {@code + - * / mod == != < <= > >= and or}, which fold left over more than two operands.
 * <p>
 * Malformed forms signal a fatal {@link FormConversionErrorCondition}.
 */
public final class FormConverter {
    private FormConverter() {
    }

    /**
     * Reads all forms from the stream and converts them into a document.
     */
    public static Document read(final ByteStream stream) {
        return convert(new Reader(stream, new SymbolTable()).readAll());
    }

    /**
     * Converts top-level forms into a document.
     */
    public static Document convert(final List<Sexp> forms) {
        return new Document(convertBlocks(forms));
    }

    /**
     * Converts a single block form.
     */
    public static Block convertBlock(final Sexp form) {
        if (form instanceof Sexp.String string) {
            return Block.Text.of(string.value());
        }
        final var list = Sexps.asList(form);
        if (list == null || list.isEmpty()) {
            throw signalError("This doesn't appear to be a valid block: " + Sexps.prettyPrint(form));
        }
        final var head = list.get(0);
        final var rest = new Cursor(list.subList(1, list.size()));
        if (head instanceof Sexp.KnownSymbol known && blockHeads.contains(known)) {
            try (final var trace = new Trace(() -> "Converting " + known.symbolName() + " block")) {
                trace.use();
                return convertSpecialBlock(known, rest, form);
            }
        }
        return convertStruct(head, rest);
    }

    /**
     * Converts a single expression form.
     */
    public static Expression convertExpression(final Sexp form) {
        if (form instanceof Sexp.String string) {
            return new Expression.Literal(string.value());
        } else if (form instanceof Sexp.Integer integer) {
            return new Expression.Literal(integer.value());
        } else if (form == Sexp.KnownSymbol.TRUE) {
            return new Expression.Literal(true);
        } else if (form == Sexp.KnownSymbol.FALSE) {
            return new Expression.Literal(false);
        } else if (form == Sexp.KnownSymbol.NULL) {
            return new Expression.Literal(null);
        } else if (form instanceof Sexp.Symbol symbol) {
            return convertNameReference(symbol);
        }
        final var list = Sexps.asList(form);
        if (list == null || list.isEmpty() || !(list.get(0) instanceof Sexp.Symbol head)) {
            throw signalError("This doesn't appear to be a valid expression: " + Sexps.prettyPrint(form));
        }
        final var operands = convertExpressions(list.subList(1, list.size()));
        if (head == Sexp.KnownSymbol.LIST) {
            return new Expression.ListOf(operands);
        } else if (head == Sexp.KnownSymbol.NOT) {
            requireArity(form, operands, 1);
            return new Expression.Unary(Expression.UnaryOperator.NOT, operands.get(0));
        } else if (head == Sexp.KnownSymbol.NEGATE) {
            requireArity(form, operands, 1);
            return new Expression.Unary(Expression.UnaryOperator.NEGATE, operands.get(0));
        } else if (head == Sexp.KnownSymbol.IF) {
            requireArity(form, operands, 3);
            return new Expression.Conditional(operands.get(0), operands.get(1), operands.get(2));
        } else if (head == Sexp.KnownSymbol.GET) {
            requireArity(form, operands, 2);
            return new Expression.Index(operands.get(0), operands.get(1));
        }
        final var operator = Expression.BinaryOperator.bySymbol(head.symbolName());
        if (operator == null) {
            throw signalError("Unknown operator " + head.symbolName() + " in " + Sexps.prettyPrint(form));
        }
        if (operator == Expression.BinaryOperator.MINUS && operands.size() == 1) {
            return new Expression.Unary(Expression.UnaryOperator.NEGATE, operands.get(0));
        }
        if (operands.size() < 2) {
            throw signalError("Operator " + operator.symbol() + " needs at least two operands");
        }
        var result = operands.get(0);
        for (final var operand : operands.subList(1, operands.size())) {
            result = new Expression.Binary(operator, result, operand);
        }
        return result;
    }

    private static List<Block> convertBlocks(final List<Sexp> forms) {
        final var result = new ArrayList<Block>(forms.size());
        for (final var form : forms) {
            result.add(convertBlock(form));
        }
        return result;
    }

    private static List<Expression> convertExpressions(final List<Sexp> forms) {
        final var result = new ArrayList<Expression>(forms.size());
        for (final var form : forms) {
            result.add(convertExpression(form));
        }
        return result;
    }

    private static Block convertSpecialBlock(final Sexp.KnownSymbol head, final Cursor rest, final Sexp form) {
        return switch (head) {
            case TEXT -> convertText(Block.TextMode.NORMAL, rest);
            case MARKUP -> convertText(Block.TextMode.MARKUP, rest);
            case VERBATIM -> convertText(Block.TextMode.VERBATIM, rest);
            case COMMENT -> convertText(Block.TextMode.COMMENT, rest);
            case DEF -> convertHypertag(rest, form);
            case IMPORT -> convertImport(rest);
            case IF -> convertIf(rest);
            case FOR -> convertFor(rest, form);
            case WHILE -> {
                final var layout = convertLayout(rest);
                final var test = convertExpression(rest.next(form, "a loop condition"));
                yield new Block.While(test, convertBlocks(rest.remaining()), layout);
            }
            case TRY -> convertTry(rest);
            case ASSIGN -> {
                final var variable = variableName(rest.next(form, "a variable"));
                final var value = convertExpression(rest.next(form, "a value"));
                rest.requireEnd(form);
                yield new Block.Assignment(variable, value);
            }
            case EMBED -> {
                final var layout = convertLayout(rest);
                final var expression = convertExpression(rest.next(form, "an expression"));
                rest.requireEnd(form);
                yield new Block.Embed(expression, layout);
            }
            default -> throw signalError("Not a block keyword: " + head.symbolName());
        };
    }

    private static Block.Text convertText(final Block.TextMode mode, final Cursor rest) {
        final var layout = convertLayout(rest);
        final var parts = new ArrayList<Expression>();
        for (final var part : rest.remaining()) {
            if (mode == Block.TextMode.VERBATIM && !(part instanceof Sexp.String)) {
                throw signalError("Verbatim text accepts only strings: " + Sexps.prettyPrint(part));
            }
            parts.add(convertExpression(part));
        }
        return new Block.Text(mode, parts, layout);
    }

    private static Block.Struct convertStruct(final Sexp head, final Cursor rest) {
        final var chain = new ArrayList<TagOccurrence>();
        final var headList = Sexps.asList(head);
        if (headList != null && !headList.isEmpty() && headList.get(0) == Sexp.KnownSymbol.CHAIN) {
            for (final var element : headList.subList(1, headList.size())) {
                chain.add(convertOccurrence(element));
            }
            if (chain.isEmpty()) {
                throw signalError("Empty tag chain: " + Sexps.prettyPrint(head));
            }
        } else {
            chain.add(convertOccurrence(head));
        }
        final var tagName = chain.get(0).name();
        try (final var trace = new Trace(() -> "Converting structural block " + tagName)) {
            trace.use();
            final var layout = convertLayout(rest);
            return new Block.Struct(chain, convertBlocks(rest.remaining()), layout);
        }
    }

    private static TagOccurrence convertOccurrence(final Sexp form) {
        final var symbol = Sexps.asSymbol(form);
        if (symbol != null) {
            return TagOccurrence.of(tagName(symbol, form));
        }
        final var list = Sexps.asList(form);
        if (list == null || list.isEmpty() || !(list.get(0) instanceof Sexp.Symbol nameSymbol)) {
            throw signalError("This doesn't appear to be a valid tag head: " + Sexps.prettyPrint(form));
        }
        final var positional = new ArrayList<Expression>();
        final var named = new ArrayList<TagOccurrence.NamedAttribute>();
        for (final var it = list.subList(1, list.size()).iterator(); it.hasNext(); ) {
            final var argument = it.next();
            final var keyword = Sexps.asKeyword(argument);
            if (keyword == null) {
                if (!named.isEmpty()) {
                    throw signalError("Positional attribute after named ones in " + Sexps.prettyPrint(form));
                }
                positional.add(convertExpression(argument));
            } else {
                if (!it.hasNext()) {
                    throw signalError("Missing value of attribute " + keyword.symbolName());
                }
                named.add(new TagOccurrence.NamedAttribute(
                    keyword.symbolName().substring(1),
                    convertExpression(it.next())
                ));
            }
        }
        return new TagOccurrence(tagName(nameSymbol, form), positional, named);
    }

    private static Block.Hypertag convertHypertag(final Cursor rest, final Sexp form) {
        final var nameForm = rest.next(form, "a hypertag name");
        final var nameSymbol = Sexps.asSymbol(nameForm);
        if (nameSymbol == null || nameSymbol instanceof Sexp.KnownSymbol) {
            throw signalError("This doesn't appear to be a valid hypertag name: " + Sexps.prettyPrint(nameForm));
        }
        final var parametersForm = rest.next(form, "an attribute list");
        final var parameterForms = Sexps.asList(parametersForm);
        if (parameterForms == null) {
            throw signalError("This doesn't appear to be an attribute list: " + Sexps.prettyPrint(parametersForm));
        }
        @Nullable String bodyParameter = null;
        final var parameters = new ArrayList<Parameter>();
        for (final var parameterForm : parameterForms) {
            final var symbol = Sexps.asSymbol(parameterForm);
            if (symbol != null && symbol.symbolName().startsWith("@") && symbol.symbolName().length() > 1) {
                if (bodyParameter != null || !parameters.isEmpty()) {
                    throw signalError("The body attribute must come first and only once in " + nameSymbol);
                }
                bodyParameter = symbol.symbolName().substring(1);
            } else if (symbol != null) {
                parameters.add(Parameter.required(variableName(symbol)));
            } else {
                final var pair = Sexps.asList(parameterForm);
                if (pair == null || pair.size() != 2) {
                    throw signalError("This doesn't appear to be an attribute: " + Sexps.prettyPrint(parameterForm));
                }
                parameters.add(new Parameter(variableName(pair.get(0)), convertExpression(pair.get(1))));
            }
        }
        final var name = nameSymbol.symbolName();
        try (final var trace = new Trace(() -> "Converting hypertag definition " + name)) {
            trace.use();
            return new Block.Hypertag(name, bodyParameter, parameters, convertBlocks(rest.remaining()));
        }
    }

    private static Block.Import convertImport(final Cursor rest) {
        final var forms = rest.remaining();
        @Nullable String path = null;
        var start = 0;
        if (!forms.isEmpty() && forms.get(0) instanceof Sexp.String pathString) {
            path = pathString.value();
            start = 1;
        }
        final var symbols = new ArrayList<String>();
        for (final var symbolForm : forms.subList(start, forms.size())) {
            final var symbol = Sexps.asSymbol(symbolForm);
            if (symbol == null) {
                throw signalError("This doesn't appear to be an importable symbol: " + Sexps.prettyPrint(symbolForm));
            }
            if (symbol == Sexp.KnownSymbol.WILDCARD) {
                symbols.add(Block.Import.WILDCARD);
            } else {
                final var name = symbol.symbolName();
                symbols.add(name.startsWith("$") || name.startsWith("%") ? name : "%" + name);
            }
        }
        if (symbols.isEmpty()) {
            throw signalError("Import of nothing");
        }
        return new Block.Import(path, symbols);
    }

    private static Block.If convertIf(final Cursor rest) {
        final var layout = convertLayout(rest);
        final var clauses = new ArrayList<Block.If.Clause>();
        List<Block> elseBody = List.of();
        final var clauseForms = rest.remaining();
        for (int i = 0; i < clauseForms.size(); i += 1) {
            final var clauseForm = clauseForms.get(i);
            final var clause = Sexps.asList(clauseForm);
            if (clause == null || clause.isEmpty()) {
                throw signalError("This doesn't appear to be an if clause: " + Sexps.prettyPrint(clauseForm));
            }
            final var body = convertBlocks(clause.subList(1, clause.size()));
            if (clause.get(0) == Sexp.KnownSymbol.ELSE) {
                if (i != clauseForms.size() - 1) {
                    throw signalError("The else clause must be the last one");
                }
                elseBody = body;
            } else {
                clauses.add(new Block.If.Clause(convertExpression(clause.get(0)), body));
            }
        }
        if (clauses.isEmpty()) {
            throw signalError("An if block needs at least one condition");
        }
        return new Block.If(clauses, elseBody, layout);
    }

    private static Block.For convertFor(final Cursor rest, final Sexp form) {
        final var layout = convertLayout(rest);
        final var variable = variableName(rest.next(form, "a loop variable"));
        final var iterable = convertExpression(rest.next(form, "an iterable"));
        return new Block.For(variable, iterable, convertBlocks(rest.remaining()), layout);
    }

    private static Block.Try convertTry(final Cursor rest) {
        final var layout = convertLayout(rest);
        final var alternatives = new ArrayList<List<Block>>();
        for (final var alternativeForm : rest.remaining()) {
            final var alternative = Sexps.asList(alternativeForm);
            if (alternative == null) {
                throw signalError("A try alternative must be a list of blocks: " + Sexps.prettyPrint(alternativeForm));
            }
            alternatives.add(convertBlocks(alternative));
        }
        if (alternatives.isEmpty()) {
            throw signalError("A try block needs at least one alternative");
        }
        return new Block.Try(alternatives, layout);
    }

    private static Layout convertLayout(final Cursor rest) {
        var layout = Layout.outlined();
        while (rest.hasNext()) {
            final var option = rest.peek();
            if (option == Sexp.KnownSymbol.KW_INLINE) {
                rest.skip();
                final var value = rest.next(option, "true or false");
                if (value != Sexp.KnownSymbol.TRUE && value != Sexp.KnownSymbol.FALSE) {
                    throw signalError(":inline expects true or false, got " + Sexps.prettyPrint(value));
                }
                layout = new Layout(layout.indent(), value == Sexp.KnownSymbol.FALSE, layout.margin());
            } else if (option == Sexp.KnownSymbol.KW_INDENT) {
                rest.skip();
                final var value = Sexps.asString(rest.next(option, "a string"));
                if (value == null || !value.chars().allMatch(c -> c == ' ' || c == '\t')) {
                    throw signalError(":indent expects a string of spaces and tabs");
                }
                layout = layout.withIndent(value);
            } else if (option == Sexp.KnownSymbol.KW_MARGIN) {
                rest.skip();
                final var value = Sexps.asInteger(rest.next(option, "an integer"));
                if (value == null || value.signum() < 0 || value.bitLength() > 16) {
                    throw signalError(":margin expects a small non-negative integer");
                }
                layout = layout.withMargin(value.intValueExact());
            } else {
                break;
            }
        }
        return layout;
    }

    private static Expression convertNameReference(final Sexp.Symbol symbol) {
        final var name = symbol.symbolName();
        if (name.length() > 1) {
            switch (name.charAt(0)) {
                case '$', '@' -> {
                    return new Expression.Variable(name.substring(1));
                }
                case '%' -> {
                    return new Expression.TagValue(name.substring(1));
                }
                default -> {
                }
            }
        }
        throw signalError("Bare symbol " + name + " in an expression; variables need a $ mark, tags a % mark");
    }

    private static String variableName(final Sexp form) {
        final var symbol = Sexps.asSymbol(form);
        if (symbol == null || !symbol.symbolName().startsWith("$") || symbol.symbolName().length() < 2) {
            throw signalError("This doesn't appear to be a variable: " + Sexps.prettyPrint(form));
        }
        return symbol.symbolName().substring(1);
    }

    private static String tagName(final Sexp.Symbol symbol, final Sexp form) {
        final var name = symbol.symbolName();
        if (name.startsWith("%") && name.length() > 1) {
            return name.substring(1);
        }
        if (name.startsWith(":") || name.startsWith("@") || name.equals("%")) {
            throw signalError("This doesn't appear to be a valid tag name: " + Sexps.prettyPrint(form));
        }
        return name;
    }

    private static void requireArity(final Sexp form, final List<Expression> operands, final int arity) {
        if (operands.size() != arity) {
            throw signalError("Expected " + arity + " operands in " + Sexps.prettyPrint(form));
        }
    }

    private static UnhandledErrorError signalError(final String message) {
        return ConditionContext.error(new FormConversionErrorCondition(message));
    }

    private static final Set<Sexp.KnownSymbol> blockHeads = Set.of(
        Sexp.KnownSymbol.TEXT,
        Sexp.KnownSymbol.MARKUP,
        Sexp.KnownSymbol.VERBATIM,
        Sexp.KnownSymbol.COMMENT,
        Sexp.KnownSymbol.DEF,
        Sexp.KnownSymbol.IMPORT,
        Sexp.KnownSymbol.IF,
        Sexp.KnownSymbol.FOR,
        Sexp.KnownSymbol.WHILE,
        Sexp.KnownSymbol.TRY,
        Sexp.KnownSymbol.ASSIGN,
        Sexp.KnownSymbol.EMBED
    );

    private static final class Cursor {
        private Cursor(final List<Sexp> forms) {
            this.forms = forms;
        }

        private boolean hasNext() {
            return position < forms.size();
        }

        private Sexp peek() {
            return forms.get(position);
        }

        private void skip() {
            position += 1;
        }

        private Sexp next(final Sexp context, final String expected) {
            if (!hasNext()) {
                throw signalError("Expected " + expected + " in " + Sexps.prettyPrint(context));
            }
            final var result = forms.get(position);
            position += 1;
            return result;
        }

        private List<Sexp> remaining() {
            final var result = forms.subList(position, forms.size());
            position = forms.size();
            return result;
        }

        private void requireEnd(final Sexp context) {
            if (hasNext()) {
                throw signalError("Unexpected " + Sexps.prettyPrint(peek()) + " in " + Sexps.prettyPrint(context));
            }
        }

        private final List<Sexp> forms;
        private int position = 0;
    }
}
