package io.proddata.stencil;

import io.proddata.stencil.parsing.Dialect;
import io.proddata.stencil.parsing.Lexer;
import io.proddata.stencil.parsing.LexerOptions;
import io.proddata.stencil.parsing.LogMessage;
import io.proddata.stencil.parsing.Parser;
import io.proddata.stencil.parsing.ParserOptions;
import io.proddata.stencil.parsing.ScriptMode;
import io.proddata.stencil.syntax.ScriptPage;
import io.proddata.stencil.syntax.ScriptPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.Collectors;

/**
 * Entry point for parsing template text.
 */
public final class Template {
    private static final Logger logger = LoggerFactory.getLogger(Template.class);

    private Template() {
    }

    public static ParseResult parse(String text) {
        return parse(text, null, LexerOptions.DEFAULT, ParserOptions.DEFAULT);
    }

    public static ParseResult parse(String text, String sourcePath, Dialect dialect) {
        return parse(text, sourcePath, LexerOptions.builder().dialect(dialect).build(), ParserOptions.DEFAULT);
    }

    /**
     * Parses a template. Errors are reported in the result, never thrown.
     */
    public static ParseResult parse(String text, String sourcePath, LexerOptions lexerOptions, ParserOptions parserOptions) {
        String path = sourcePath == null ? Lexer.DEFAULT_SOURCE_PATH : sourcePath;
        LexerOptions options = lexerOptions == null ? LexerOptions.DEFAULT : lexerOptions;
        logger.debug("Parsing {} (dialect: {}, mode: {})", path, options.getDialect(), options.getMode());

        Parser parser = new Parser(new Lexer(text == null ? "" : text, path, options), parserOptions);
        ScriptPage page = parser.run();

        logger.debug("Parsed {} with {} diagnostic(s)", path, parser.getMessages().size());
        return new ParseResult(page, parser.getMessages(), parser.hasErrors());
    }

    /**
     * Same as {@link #parse(String, String, LexerOptions, ParserOptions)} but fails on the first error.
     */
    public static ScriptPage parseOrThrow(String text, String sourcePath, LexerOptions lexerOptions, ParserOptions parserOptions)
        throws TemplateException {
        ParseResult result = parse(text, sourcePath, lexerOptions, parserOptions);
        if (result.hasErrors()) {
            String details = result.messages().stream()
                .filter(LogMessage::isError)
                .map(LogMessage::toString)
                .collect(Collectors.joining("\n"));
            throw new TemplateException("Unable to parse the template:\n" + details, result.messages());
        }
        return result.page();
    }

    /**
     * Prints a page back to template text, using the options it was parsed with. With trivia kept,
     * the output matches the input.
     */
    public static String print(ScriptPage page, LexerOptions lexerOptions) {
        LexerOptions options = lexerOptions == null ? LexerOptions.DEFAULT : lexerOptions;
        return ScriptPrinter.print(page, options.getMode() == ScriptMode.SCRIPT_ONLY, options.isKeepTrivia());
    }
}
