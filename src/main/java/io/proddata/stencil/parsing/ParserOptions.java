package io.proddata.stencil.parsing;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
public class ParserOptions {
    public static final ParserOptions DEFAULT = ParserOptions.builder().build();

    /** Maximum nesting of expressions and blocks, {@code null} disables the check. */
    @Builder.Default
    private final Integer expressionDepthLimit = 250;

    /** Rewrite liquid filter names ({@code upcase}) to qualified builtin names ({@code string.upcase}). */
    private final boolean qualifyLiquidFunctions;

    /** Literals with a fractional part are parsed as {@link java.math.BigDecimal}. */
    private final boolean parseFloatAsDecimal;
}
