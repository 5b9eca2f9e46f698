package eu.virtualparadox.knowledgebase.ingest.chunker.code;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CodeLanguagesTest {

    @Test
    void testDetectByExtension() {
        assertThat(CodeLanguages.detect("src/main.PY", "")).isEqualTo("python");
        assertThat(CodeLanguages.detect("C:\\work\\App.java", "")).isEqualTo("java");
        assertThat(CodeLanguages.detect("lib.rs", "")).isEqualTo("rust");
    }

    @Test
    void testDetectByContent() {
        assertThat(CodeLanguages.detect(null, "package main\n\nfunc main() {\n}\n")).isEqualTo("go");
        assertThat(CodeLanguages.detect("notes", "def run(x):\n    return x\n")).isEqualTo("python");
        assertThat(CodeLanguages.detect(null, "#include <stdio.h>\n")).isEqualTo("c");
        assertThat(CodeLanguages.detect(null, "hello world")).isEqualTo("unknown");
    }

    @Test
    void testParserAvailability() {
        assertThat(CodeLanguages.parserFor("python")).containsInstanceOf(IndentLanguageParser.class);
        assertThat(CodeLanguages.parserFor("typescript")).containsInstanceOf(BraceLanguageParser.class);
        assertThat(CodeLanguages.parserFor("ruby")).isEmpty();
    }
}
