package io.proddata.stencil.syntax;

/**
 * An expression that designates a storage location: a variable, a member or an indexer.
 */
public interface ScriptVariablePath {
    String getFirstPath();
}
