package com.zzf.bashnorm.syntax;

import java.util.List;

/**
 * Turns shell command text into raw parse trees, one per top-level command line.
 */
public interface ShellParser {

    List<RawNode> parse(String text);
}
