package io.proddata.stencil;

import io.proddata.stencil.parsing.LogMessage;
import io.proddata.stencil.syntax.ScriptPage;

import java.util.List;

/**
 * @param page     the parsed page, {@code null} when parsing was aborted
 * @param messages errors and warnings, in source order
 */
public record ParseResult(ScriptPage page, List<LogMessage> messages, boolean hasErrors) {
    public ParseResult {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }
}
