// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package hypertag.sexp.reader;

import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import hypertag.sexp.Sexp;
import hypertag.sexp.SymbolTable;
import hypertag.util.UnreachableCodeReachedError;
import hypertag.util.condition.ConditionContext;
import hypertag.util.condition.UnhandledErrorError;
import hypertag.util.condition.exception.IOExceptionCondition;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The S-expression reader, turning a stream of bytes into {@link Sexp} objects.
 * <p>
 * The syntax: lists in parentheses, strings in double quotes with {@code \n}, {@code \t} and backslash-escaped
 * literal characters, integers with an optional sign, and symbols made of any other run of bytes. A semicolon starts
 * a comment running to the end of the line. The characters {@code ' # | \} and NUL are reserved outside strings.
 */
public final class Reader {
    /**
     * Initializes a new reader over the given byte stream, interning symbols into the given table.
     */
    public Reader(final ByteStream stream, final SymbolTable symbolTable) {
        this.stream = stream;
        this.symbolTable = symbolTable;
    }

    /**
     * Parses the next top-level S-expression.
     *
     * <ul>
     * <li>Returns the parsed form, or {@code null} at the end of input.
     * <li>Signals a fatal {@link ReadErrorCondition} on malformed input.
     * <li>Signals a fatal {@link IOExceptionCondition} if reading fails.
     * </ul>
     */
    public @Nullable Sexp readTopLevelForm() {
        if (skipSkippables().hitEof()) {
            return null;
        }
        topLevelFormLine = stream.lineNumber();
        currentDepth = 0;
        return readForm();
    }

    /**
     * Parses all remaining top-level forms.
     */
    public List<Sexp> readAll() {
        final var result = new ArrayList<Sexp>();
        for (var form = readTopLevelForm(); form != null; form = readTopLevelForm()) {
            result.add(form);
        }
        return result;
    }

    private HitEof skipSkippables() {
        while (true) {
            if (stream.reachedEnd()) {
                return HitEof.YES;
            }
            final var b = stream.peek();
            if (ByteClass.of(b) != ByteClass.SKIPPABLE) {
                return HitEof.NO;
            }
            stream.discardPeek();
            if (b == ';' && stream.skipToLineFeed().hitEof()) {
                return HitEof.YES;
            }
        }
    }

    private @Nullable Sexp readForm() {
        currentDepth += 1;
        try {
            if (currentDepth > maxDepth) {
                throw signalReadError("Recursion limit reached, try to limit nesting");
            }
            if (stream.reachedEnd()) {
                return null;
            }
            final var b = stream.peek();
            final var byteClass = ByteClass.of(b);
            if (byteClass == ByteClass.RESERVED) {
                throw signalReservedCharacterError(b);
            } else if (byteClass == ByteClass.SKIPPABLE) {
                throw new UnreachableCodeReachedError("readForm called without preceding skipSkippables");
            }
            stream.discardPeek();

            return switch (b) {
                case ')' -> throw signalReadError("Expected a form, but found ')' instead");
                case '(' -> readList();
                case '"' -> readString();
                default -> readSymbol(b);
            };
        } finally {
            currentDepth -= 1;
        }
    }

    private Sexp.List readList() {
        final var list = new ArrayList<Sexp>();
        while (true) {
            if (skipSkippables().hitEof()) {
                throw signalUnterminatedListError();
            }
            if (stream.peek() == ')') {
                stream.discardPeek();
                break;
            }
            final var form = readForm();
            if (form == null) {
                throw signalUnterminatedListError();
            }
            list.add(form);
        }
        return new Sexp.List(list);
    }

    private Sexp.String readString() {
        final var contentsBytes = new ByteArrayOutputStream(initialStringCapacity);
        var inEscapeSequence = false;
        while (true) {
            if (stream.reachedEnd()) {
                throw signalReadError("Expected closing '\"' but found end of input instead");
            }
            final var b = stream.peek();
            stream.discardPeek();
            if (inEscapeSequence) {
                inEscapeSequence = false;
                contentsBytes.write(switch (b) {
                    case 'n' -> '\n';
                    case 't' -> '\t';
                    default -> b;
                });
            } else if (b == '"') {
                break;
            } else if (b == '\\') {
                inEscapeSequence = true;
            } else {
                contentsBytes.write(b);
            }
        }
        return new Sexp.String(convertUtf8(contentsBytes.toByteArray()));
    }

    private Sexp readSymbol(final byte firstByte) {
        final var symbolNameBytes = new ByteArrayOutputStream(initialSymbolCapacity);
        symbolNameBytes.write(firstByte);
        while (!stream.reachedEnd()) {
            final var b = stream.peek();
            if (ByteClass.of(b) != ByteClass.REGULAR) {
                break;
            }
            stream.discardPeek();
            symbolNameBytes.write(b);
        }
        return resolveSymbol(convertUtf8(symbolNameBytes.toByteArray()));
    }

    private Sexp resolveSymbol(final String symbolName) {
        final var digitsStart = (symbolName.startsWith("+") || symbolName.startsWith("-")) ? 1 : 0;
        if (symbolName.length() > digitsStart && allAsciiDigits(symbolName, digitsStart)) {
            return new Sexp.Integer(new BigInteger(symbolName));
        }
        return symbolTable.intern(symbolName);
    }

    private String convertUtf8(final byte[] bytes) {
        try {
            return utf8Decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (final CharacterCodingException e) {
            throw signalReadError("Invalid UTF-8 byte sequence detected");
        }
    }

    private UnhandledErrorError signalUnterminatedListError() {
        throw signalReadError("Expected closing ')' but found end of input instead");
    }

    private UnhandledErrorError signalReservedCharacterError(final byte b) {
        final var message = (b >= 0 && b <= lastControlByte)
            ? String.format("Reserved control character U+%04X found", b)
            : ("Reserved character '" + (char) b + "' found");
        throw signalReadError(message);
    }

    private UnhandledErrorError signalReadError(final String message) {
        throw ConditionContext.error(
            new ReadErrorCondition(message, new SourceLocation(stream.lineNumber(), topLevelFormLine))
        );
    }

    private static boolean allAsciiDigits(final String string, final int startIndex) {
        final var length = string.length();
        for (int i = startIndex; i < length; i += 1) {
            final var ch = string.charAt(i);
            if (ch < '0' || ch > '9') {
                return false;
            }
        }
        return true;
    }

    private static CharsetDecoder newUtf8Decoder() {
        final var decoder = StandardCharsets.UTF_8.newDecoder();
        decoder.onMalformedInput(CodingErrorAction.REPORT);
        decoder.onUnmappableCharacter(CodingErrorAction.REPORT);
        return decoder;
    }

    private static final byte lastControlByte = 0x1F;
    private static final int initialStringCapacity = 256;
    private static final int initialSymbolCapacity = 16;
    private static final int maxDepth = 150;

    private final ByteStream stream;
    private final SymbolTable symbolTable;
    private final CharsetDecoder utf8Decoder = newUtf8Decoder();
    private int topLevelFormLine = 0;
    private int currentDepth = 0;

    private enum ByteClass {
        REGULAR,
        SKIPPABLE,
        SEPARATOR,
        RESERVED;

        private static ByteClass of(final byte b) {
            return byteClasses[Byte.toUnsignedInt(b)];
        }

        private static final ByteClass[] byteClasses;

        static {
            final var classes = new ByteClass[256];
            Arrays.fill(classes, REGULAR);
            classes[' '] = SKIPPABLE;
            classes['\r'] = SKIPPABLE;
            classes['\n'] = SKIPPABLE;
            classes['\t'] = SKIPPABLE;
            classes['\u000B'] = SKIPPABLE;
            classes['\u000C'] = SKIPPABLE;
            classes[';'] = SKIPPABLE;
            classes['('] = SEPARATOR;
            classes[')'] = SEPARATOR;
            classes['"'] = SEPARATOR;
            classes['\''] = RESERVED;
            classes['#'] = RESERVED;
            classes['|'] = RESERVED;
            classes['\\'] = RESERVED;
            classes['\0'] = RESERVED;
            byteClasses = classes;
        }
    }
}
