package io.proddata.stencil.syntax;

import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

@Getter
public class ScriptTrivias {
    private final List<ScriptTrivia> before = new ArrayList<>();
    private final List<ScriptTrivia> after = new ArrayList<>();
}
