package io.proddata.stencil.parsing;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
public class LexerOptions {
    public static final String DEFAULT_FRONT_MATTER_MARKER = "+++";
    public static final LexerOptions DEFAULT = LexerOptions.builder().build();

    @Builder.Default
    private final Dialect dialect = Dialect.DEFAULT;

    @Builder.Default
    private final ScriptMode mode = ScriptMode.DEFAULT;

    @Builder.Default
    private final String frontMatterMarker = DEFAULT_FRONT_MATTER_MARKER;

    @Builder.Default
    private final TextPosition startPosition = TextPosition.ZERO;

    /** Emit whitespace inside code blocks as tokens so the parser can keep it as trivia. */
    private final boolean keepTrivia;

    /** In liquid, {@code include a/b.html} lexes its path argument as an implicit string. */
    private final boolean enableIncludeImplicitString;

    public boolean isLiquid() {
        return dialect == Dialect.LIQUID;
    }
}
