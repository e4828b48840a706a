package com.motionbake.codegen.service.codegen;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CodeBuilderTest {

    @Test
    void indentsLinesInsideScopes() {
        CodeBuilder builder = new CodeBuilder();
        builder.writeLine("class A");
        builder.openScope();
        builder.writeLine("int x;");
        builder.closeScope();

        assertThat(builder.toString()).isEqualTo("class A\n{\n    int x;\n}\n");
        assertThat(builder.getIndentLevel()).isZero();
    }

    @Test
    void writesEmptyLinesWithoutIndentation() {
        CodeBuilder builder = new CodeBuilder();
        builder.indent();
        builder.writeLine("");
        builder.writeLine("a;");

        assertThat(builder.toString()).isEqualTo("\n    a;\n");
    }

    @Test
    void writesEveryLineOfAComment_andSkipsBlankComments() {
        CodeBuilder builder = new CodeBuilder();
        builder.writeComment(null);
        builder.writeComment("  ");
        builder.writeComment("first\r\n  second");

        assertThat(builder.toString()).isEqualTo("// first\n//   second\n");
    }

    @Test
    void neverUnindentsBelowZero() {
        CodeBuilder builder = new CodeBuilder();
        builder.unIndent();
        builder.writeLine("x");

        assertThat(builder.toString()).isEqualTo("x\n");
    }
}
