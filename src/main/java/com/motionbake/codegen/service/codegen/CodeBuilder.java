package com.motionbake.codegen.service.codegen;

/**
 * Line-oriented text buffer that tracks indentation for generated source.
 */
public final class CodeBuilder {

    private static final String INDENT = "    ";

    private final StringBuilder sb = new StringBuilder();
    private int indentLevel = 0;

    public CodeBuilder writeLine() {
        sb.append('\n');
        return this;
    }

    public CodeBuilder writeLine(String line) {
        if (line.isEmpty()) {
            return writeLine();
        }
        for (int i = 0; i < indentLevel; i++) {
            sb.append(INDENT);
        }
        sb.append(line).append('\n');
        return this;
    }

    /**
     * Writes each line of {@code comment} as a line comment. Blank comments write nothing.
     */
    public CodeBuilder writeComment(String comment) {
        if (comment == null || comment.isBlank()) {
            return this;
        }
        for (String line : comment.split("\\r?\\n", -1)) {
            writeLine("// " + line);
        }
        return this;
    }

    public CodeBuilder openScope() {
        writeLine("{");
        indent();
        return this;
    }

    public CodeBuilder closeScope() {
        unIndent();
        writeLine("}");
        return this;
    }

    public CodeBuilder indent() {
        indentLevel++;
        return this;
    }

    public CodeBuilder unIndent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
        return this;
    }

    public int getIndentLevel() {
        return indentLevel;
    }

    @Override
    public String toString() {
        return sb.toString();
    }
}
