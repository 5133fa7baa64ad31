package org.jfront.api;

import org.jfront.diagnostics.DiagnosticsEngine;
import org.jfront.frontend.lexer.Lexer;
import org.jfront.frontend.lexer.LexerException;
import org.jfront.frontend.lexer.Token;
import org.jfront.frontend.parser.Parser;
import org.jfront.frontend.parser.ParserUsageException;
import org.jfront.frontend.parser.SyntaxException;
import org.jfront.frontend.parser.TokenCursor;
import org.jfront.frontend.parser.ast.CompilationUnit;
import org.jfront.frontend.parser.ast.Expression;
import org.jfront.frontend.parser.ast.Type;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Iterator;
import java.util.List;

/**
 * The entry points into the front end. The static methods cover the common calls; an instance
 * applies a set of {@link FrontEndOptions} and reports failures to a {@link DiagnosticsEngine}.
 * <p>
 * Lexical errors surface as {@link LexerException}, parse errors as
 * {@link SyntaxException} and misuse of the API as {@link ParserUsageException}. A failed parse never
 * yields a partial tree.
 */
public class JavaFrontEnd {

    private static final Logger LOG = LoggerFactory.getLogger(JavaFrontEnd.class);

    private final FrontEndOptions options;

    public JavaFrontEnd() {
        this(FrontEndOptions.defaults());
    }

    public JavaFrontEnd(FrontEndOptions options) {
        this.options = options;
    }

    public FrontEndOptions getOptions() {
        return options;
    }

    /**
     * Splits source text into tokens. The returned lexer is a lazy sequence: each token is scanned
     * when it is requested.
     *
     * @param source The source text.
     * @param ignoreErrors If {@code true}, lexical errors are recorded in {@link Lexer#errors()} and
     *                     scanning continues with the best recoverable guess.
     * @return The token sequence.
     */
    public static Lexer tokenize(String source, boolean ignoreErrors) {
        if (source == null) {
            throw new ParserUsageException("Source text must not be null");
        }
        return new Lexer(source, ignoreErrors);
    }

    /**
     * Splits the bytes of a source file into tokens. UTF-8 is tried first, then ISO-8859-1.
     *
     * @param source The raw source bytes.
     * @param ignoreErrors If {@code true}, lexical errors after decoding are recorded and scanning continues.
     * @return The token sequence.
     * @throws LexerException if the bytes cannot be decoded.
     */
    public static Lexer tokenize(byte[] source, boolean ignoreErrors) {
        if (source == null) {
            throw new ParserUsageException("Source data must not be null");
        }
        return new Lexer(Lexer.decode(source), ignoreErrors);
    }

    public static Lexer tokenize(String source) {
        return tokenize(source, false);
    }

    /**
     * Parses a token sequence into a compilation unit.
     *
     * @param tokens The tokens, typically from {@link #tokenize(String, boolean)}.
     * @param debug If {@code true}, parse procedures are traced at DEBUG level.
     * @return The root of the syntax tree.
     */
    public static CompilationUnit parse(Iterator<Token> tokens, boolean debug) {
        if (tokens == null) {
            throw new ParserUsageException("Token sequence must not be null");
        }
        return new Parser(tokens, debug).parse();
    }

    public static CompilationUnit parse(List<Token> tokens, boolean debug) {
        if (tokens == null) {
            throw new ParserUsageException("Token sequence must not be null");
        }
        return parse(tokens.iterator(), debug);
    }

    public static CompilationUnit parse(Iterator<Token> tokens) {
        return parse(tokens, false);
    }

    /**
     * Tokenizes and parses source text in one step, failing on the first lexical error.
     * @param source The source text of a compilation unit.
     * @return The root of the syntax tree.
     */
    public static CompilationUnit parseSource(String source) {
        return parse(tokenize(source, false), false);
    }

    /**
     * Parses a single expression that must span the whole text.
     * @param source The expression text, e.g. {@code "a + b * c"}.
     * @return The expression.
     */
    public static Expression parseExpression(String source) {
        Parser parser = new Parser(new TokenCursor(tokenize(source, false)));
        Expression expression = parser.parseExpression();
        parser.expectEndOfInput();
        return expression;
    }

    /**
     * Parses a single type that must span the whole text.
     * @param source The type text, e.g. {@code "Map<String, List<int[]>>"}.
     * @return The type.
     */
    public static Type parseType(String source) {
        Parser parser = new Parser(new TokenCursor(tokenize(source, false)));
        Type type = parser.parseType();
        parser.expectEndOfInput();
        return type;
    }

    /**
     * Parses the bytes of one source file, decoded as UTF-8 or else ISO-8859-1.
     * @see #parseUnit(String, String, DiagnosticsEngine)
     */
    public CompilationUnit parseUnit(byte[] source, String fileName, DiagnosticsEngine diagnostics) {
        String text;
        try {
            text = Lexer.decode(source);
        } catch (LexerException e) {
            diagnostics.reportError(e.getMessage(), fileName, e.getLine());
            throw e;
        }
        return parseUnit(text, fileName, diagnostics);
    }

    /**
     * Parses one source file with this front end's options. Lexical errors and the syntax error,
     * if any, are reported to {@code diagnostics} as well.
     *
     * @param source The source text.
     * @param fileName The file name used in diagnostics.
     * @param diagnostics Collects the problems found.
     * @return The root of the syntax tree.
     * @throws SyntaxException if the source does not parse.
     */
    public CompilationUnit parseUnit(String source, String fileName, DiagnosticsEngine diagnostics) {
        long start = System.nanoTime();
        Lexer lexer = new Lexer(source, diagnostics, fileName, options.ignoreLexErrors());
        CompilationUnit unit;
        try {
            unit = new Parser(lexer, options.debug()).parse();
        } catch (SyntaxException e) {
            diagnostics.reportError(e.getMessage(), fileName, e.getToken() == null ? -1 : e.getToken().line());
            throw e;
        }
        if (LOG.isDebugEnabled()) {
            LOG.debug("Parsed {}: {} type declaration(s), {} import(s), {} recovered lexical error(s) in {} ms",
                    fileName, unit.types().size(), unit.imports().size(), lexer.errors().size(),
                    (System.nanoTime() - start) / 1_000_000);
        }
        return unit;
    }
}
