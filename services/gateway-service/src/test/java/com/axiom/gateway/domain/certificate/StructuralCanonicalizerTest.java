package com.axiom.gateway.domain.certificate;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("StructuralCanonicalizer")
class StructuralCanonicalizerTest {

    private static final String FUNCTION = """
            def add(a, b):
                return a + b
            """;

    @Test
    @DisplayName("should emit typed tokens with line and indentation markers")
    void tokens() {
        assertThat(StructuralCanonicalizer.tokenize(FUNCTION)).containsExactly(
                "ID:def", "ID:add", "SYM:(", "ID:a", "SYM:,", "ID:b", "SYM:)", "SYM::", "NL",
                "INDENT", "ID:return", "ID:a", "SYM:+", "ID:b", "NL",
                "DEDENT");
    }

    @Nested
    @DisplayName("is insensitive to")
    class Insensitive {

        @Test
        @DisplayName("spacing within a line")
        void spacing() {
            String spaced = """
                    def   add( a,b ) :
                        return a+b
                    """;

            assertThat(StructuralCanonicalizer.canonicalize(spaced))
                    .isEqualTo(StructuralCanonicalizer.canonicalize(FUNCTION));
        }

        @Test
        @DisplayName("comments and blank lines")
        void comments() {
            String commented = """
                    # adds two numbers
                    def add(a, b):  # inline

                        /* block */ return a + b  // trailing
                    """;

            assertThat(StructuralCanonicalizer.canonicalize(commented))
                    .isEqualTo(StructuralCanonicalizer.canonicalize(FUNCTION));
        }

        @Test
        @DisplayName("line breaks inside brackets")
        void bracketContinuation() {
            String wrapped = """
                    def add(a,
                            b):
                        return a + b
                    """;

            assertThat(StructuralCanonicalizer.canonicalize(wrapped))
                    .isEqualTo(StructuralCanonicalizer.canonicalize(FUNCTION));
        }

        @Test
        @DisplayName("tabs versus four spaces")
        void tabs() {
            String tabbed = "def add(a, b):\n\treturn a + b\n";

            assertThat(StructuralCanonicalizer.canonicalize(tabbed))
                    .isEqualTo(StructuralCanonicalizer.canonicalize(FUNCTION));
        }
    }

    @Nested
    @DisplayName("is sensitive to")
    class Sensitive {

        @Test
        @DisplayName("renamed identifiers")
        void renaming() {
            assertThat(StructuralCanonicalizer.canonicalize(FUNCTION.replace("b", "c")))
                    .isNotEqualTo(StructuralCanonicalizer.canonicalize(FUNCTION));
        }

        @Test
        @DisplayName("changed nesting")
        void nesting() {
            String flat = "def add(a, b):\nreturn a + b\n";

            assertThat(StructuralCanonicalizer.canonicalize(flat))
                    .isNotEqualTo(StructuralCanonicalizer.canonicalize(FUNCTION));
        }
    }

    @Test
    @DisplayName("should keep string literals whole, including comment markers inside them")
    void strings() {
        assertThat(StructuralCanonicalizer.tokenize("x = \"a # not a comment\" + 'b\\'c'"))
                .containsExactly("ID:x", "SYM:=", "STR:\"a # not a comment\"", "SYM:+", "STR:'b\\'c'", "NL");
    }

    @Test
    @DisplayName("should read triple-quoted strings across lines")
    void tripleQuoted() {
        assertThat(StructuralCanonicalizer.tokenize("doc = \"\"\"line one\nline two\"\"\"\n"))
                .containsExactly("ID:doc", "SYM:=", "STR:\"\"\"line one\nline two\"\"\"", "NL");
    }

    @Test
    @DisplayName("should close every open indentation level at the end")
    void closesLevels() {
        String nested = "if a:\n    if b:\n        c()\n";

        assertThat(StructuralCanonicalizer.tokenize(nested))
                .endsWith("ID:c", "SYM:(", "SYM:)", "NL", "DEDENT", "DEDENT");
    }

    @Test
    @DisplayName("should canonicalize empty and null input to nothing")
    void empty() {
        assertThat(StructuralCanonicalizer.canonicalize("")).isEmpty();
        assertThat(StructuralCanonicalizer.canonicalize(null)).isEmpty();
    }

    @Test
    @DisplayName("should read numbers with decimal points and suffixes as one token")
    void numbers() {
        assertThat(StructuralCanonicalizer.tokenize("x = 3.14e0 + 10_000L"))
                .containsExactly("ID:x", "SYM:=", "NUM:3.14e0", "SYM:+", "NUM:10_000L", "NL");
    }
}
