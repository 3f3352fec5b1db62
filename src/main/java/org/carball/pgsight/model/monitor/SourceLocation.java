package org.carball.pgsight.model.monitor;

/**
 * Application code location that issued a captured query.
 */
public record SourceLocation(String file, int line, String method) {

    @Override
    public String toString() {
        return method != null ? file + ":" + line + " in " + method : file + ":" + line;
    }
}
