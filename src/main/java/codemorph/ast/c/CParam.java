package codemorph.ast.c;

/**
 * Function parameter. {@code isArray} marks a {@code name[]} parameter.
 */
public record CParam(String name, String type, boolean isArray) {
}
