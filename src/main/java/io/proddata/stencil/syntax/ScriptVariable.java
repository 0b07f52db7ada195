package io.proddata.stencil.syntax;

import lombok.Getter;
import lombok.Setter;

import java.util.Objects;

@Getter
@Setter
@ScriptSyntax(name = "variable", example = "<variable_name>")
public class ScriptVariable extends ScriptExpression implements ScriptVariablePath, ScriptTerminal {
    private String name;
    private ScriptVariableScope scope;
    /** The identifier as written, when it differs from the canonical name (liquid {@code forloop}). */
    private String sourceText;
    private ScriptTrivias trivias;

    public ScriptVariable(String name, ScriptVariableScope scope) {
        this.name = Objects.requireNonNull(name, "name");
        this.scope = scope == null ? ScriptVariableScope.GLOBAL : scope;
    }

    public static ScriptVariable global(String name) {
        return new ScriptVariable(name, ScriptVariableScope.GLOBAL);
    }

    /**
     * The name as written in a template, with the {@code $} prefix of local variables.
     */
    public String toSourceName() {
        if (sourceText != null) {
            return sourceText;
        }
        return scope == ScriptVariableScope.LOCAL ? "$" + name : name;
    }

    @Override
    public String getFirstPath() {
        return name;
    }

    @Override
    public <R> R accept(ScriptVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ScriptVariable other)) {
            return false;
        }
        return name.equals(other.name) && scope == other.scope;
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, scope);
    }
}
