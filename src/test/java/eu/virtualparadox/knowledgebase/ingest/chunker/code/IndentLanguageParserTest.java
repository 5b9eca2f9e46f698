package eu.virtualparadox.knowledgebase.ingest.chunker.code;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IndentLanguageParserTest {

    private final IndentLanguageParser parser = new IndentLanguageParser();

    @Test
    void testClassWithMethod() {
        final String code = "class A:\n    def m(self):\n        pass\n";
        final List<CodeUnit> units = parser.parse(code, 0, code.length(), null);

        assertThat(units).hasSize(1);
        final CodeUnit type = units.get(0);
        assertThat(type.kind()).isEqualTo("class");
        assertThat(type.name()).isEqualTo("A");
        assertThat(type.bodyStart()).isEqualTo(code.indexOf("    def"));

        final List<CodeUnit> members = parser.parse(code, type.bodyStart(), type.bodyEnd(), type);
        assertThat(members).extracting(CodeUnit::name).containsExactly("m");
        assertThat(members.get(0).kind()).isEqualTo("method");
    }

    @Test
    void testDecoratorsAndCommentsBelongToFunction() {
        final String code = "x = 1\n# cached\n@lru_cache\ndef f():\n    return 1\n";
        final List<CodeUnit> units = parser.parse(code, 0, code.length(), null);

        assertThat(units).hasSize(1);
        assertThat(units.get(0).start()).isEqualTo(code.indexOf("# cached"));
    }

    @Test
    void testDefInsideStringIsIgnored() {
        final String code = "doc = \"\"\"\ndef fake():\n\"\"\"\n\ndef real():\n    return 2\n";
        final List<CodeUnit> units = parser.parse(code, 0, code.length(), null);

        assertThat(units).extracting(CodeUnit::name).containsExactly("real");
    }

    @Test
    void testMissingBodyIsRejected() {
        final String code = "def f():\n";
        assertThatThrownBy(() -> parser.parse(code, 0, code.length(), null)).isInstanceOf(CodeParseException.class);
    }
}
