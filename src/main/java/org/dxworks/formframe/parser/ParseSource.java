package org.dxworks.formframe.parser;

/** Where the parsed sections were reconstructed from. */
public enum ParseSource {
    /** The embedded round-trip metadata comment. */
    METADATA,
    /** Section, column and block markers written on exported elements. */
    EDITOR_MARKUP,
    /** Heuristic classification of arbitrary HTML. */
    EXTERNAL
}
