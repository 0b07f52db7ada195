package io.proddata.stencil.syntax;

import java.util.List;

/**
 * A node that maps to a single token of the source and owns the trivia around it.
 */
public interface ScriptTerminal {
    ScriptTrivias getTrivias();

    void setTrivias(ScriptTrivias trivias);

    default void addTrivias(List<ScriptTrivia> trivias, boolean before) {
        if (trivias == null || trivias.isEmpty()) {
            return;
        }
        ScriptTrivias current = getTrivias();
        if (current == null) {
            current = new ScriptTrivias();
            setTrivias(current);
        }
        (before ? current.getBefore() : current.getAfter()).addAll(trivias);
    }

    default void addTrivia(ScriptTrivia trivia, boolean before) {
        addTrivias(List.of(trivia), before);
    }
}
