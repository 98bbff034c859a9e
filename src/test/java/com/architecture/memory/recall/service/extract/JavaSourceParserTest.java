package com.architecture.memory.recall.service.extract;

import com.architecture.memory.recall.config.ExtractionSettings.CodeTextMode;
import com.architecture.memory.recall.model.RetrievalUnit;
import com.architecture.memory.recall.model.UnitType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class JavaSourceParserTest {

    private static final List<String> GREETER = List.of(
            "package demo;",                                  // 1
            "",                                               // 2
            "import java.util.List;",                         // 3
            "import java.util.concurrent.*;",                 // 4
            "",                                               // 5
            "/**",                                            // 6
            " * Greets people.",                              // 7
            " */",                                            // 8
            "public class Greeter implements Runnable {",     // 9
            "",                                               // 10
            "    private final String name = \"x\";",         // 11
            "",                                               // 12
            "    // builds the greeting",                     // 13
            "    // for one person",                          // 14
            "    public String greet(String who) {",          // 15
            "        return \"Hello \" + who;",               // 16
            "    }",                                          // 17
            "",                                               // 18
            "    @Async",                                     // 19
            "    public void send() {",                       // 20
            "    }",                                          // 21
            "",                                               // 22
            "    public CompletableFuture<String> later() {", // 23
            "        return null;",                           // 24
            "    }",                                          // 25
            "",                                               // 26
            "    public void run() {",                        // 27
            "    }",                                          // 28
            "}");                                             // 29

    private final JavaSourceParser verbatimParser = new JavaSourceParser(new CodeTextExtractor(CodeTextMode.VERBATIM));
    private final JavaSourceParser structuredParser = new JavaSourceParser(new CodeTextExtractor(CodeTextMode.STRUCTURED));

    @Test
    void emitsDeclarationsInSourceOrder() {
        ParsedSource parsed = verbatimParser.parse("src/demo/Greeter.java", String.join("\n", GREETER));

        assertThat(parsed.getSyntaxError()).isNull();
        assertThat(parsed.getUnits()).extracting(RetrievalUnit::getSymbol)
                .containsExactly("Greeter", "greet", "send", "later", "run");
        assertThat(parsed.getUnits()).extracting(RetrievalUnit::getType)
                .containsExactly(UnitType.CLASS, UnitType.FUNCTION, UnitType.ASYNC_FUNCTION,
                        UnitType.ASYNC_FUNCTION, UnitType.FUNCTION);
        assertThat(parsed.getUnits()).extracting(RetrievalUnit::getName)
                .startsWith("src/demo/Greeter.java::Greeter", "src/demo/Greeter.java::greet");
    }

    @Test
    void verbatimCodeIsTheExactLineRange() {
        ParsedSource parsed = verbatimParser.parse("Greeter.java", String.join("\n", GREETER));
        RetrievalUnit greet = parsed.getUnits().get(1);

        assertThat(greet.getStartLine()).isEqualTo(15);
        assertThat(greet.getEndLine()).isEqualTo(17);
        assertThat(greet.getCode()).isEqualTo(String.join("\n", GREETER.subList(14, 17)));
    }

    @Test
    void structuredCodeIsPrintedFromTheSyntaxTree() {
        ParsedSource parsed = structuredParser.parse("Greeter.java", String.join("\n", GREETER));
        RetrievalUnit greet = parsed.getUnits().get(1);

        assertThat(greet.getCode()).contains("public String greet(String who) {");
        assertThat(greet.getCode()).contains("return \"Hello \" + who;");
    }

    @Test
    void attachesJavadocCommentsAndBases() {
        ParsedSource parsed = verbatimParser.parse("Greeter.java", String.join("\n", GREETER));
        RetrievalUnit greeter = parsed.getUnits().get(0);
        RetrievalUnit greet = parsed.getUnits().get(1);

        assertThat(greeter.getDocstring()).isEqualTo("Greets people.");
        assertThat(greeter.getBases()).containsExactly("Runnable");
        assertThat(greet.getDocstring()).isEmpty();
        assertThat(greet.getPrecedingComments()).containsExactly("builds the greeting", "for one person");
        assertThat(greet.getLanguage()).isEqualTo("java");
    }

    @Test
    void recordsImportsAndFields() {
        ParsedSource parsed = verbatimParser.parse("Greeter.java", String.join("\n", GREETER));

        assertThat(parsed.getImports()).containsExactly("java.util.List", "java.util.concurrent.*");
        assertThat(parsed.getGlobalVariables()).containsExactly("name");
    }

    @Test
    void nestedTypesFollowTheirOuterType() {
        String source = String.join("\n",
                "class Outer {",
                "    void a() {}",
                "    enum Mode { ON, OFF }",
                "    record Point(int x, int y) {}",
                "}");

        ParsedSource parsed = verbatimParser.parse("Outer.java", source);

        assertThat(parsed.getUnits()).extracting(RetrievalUnit::getSymbol)
                .containsExactly("Outer", "a", "Mode", "Point");
    }

    @Test
    void reportsParseProblem_withoutUnits() {
        ParsedSource parsed = verbatimParser.parse("Broken.java", "public class Broken { void x( { }");

        assertThat(parsed.getSyntaxError()).startsWith("ParseProblem: ");
        assertThat(parsed.getUnits()).isEmpty();
    }

    @Test
    void deeplyNestedExpressionFailsTheFileInsteadOfThrowing() {
        ParsedSource parsed = verbatimParser.parse("Deep.java", deepConcatenation(50_000));

        assertThat(parsed.getSyntaxError()).isNotNull();
        assertThat(parsed.getUnits()).isEmpty();
    }

    static String deepConcatenation(int terms) {
        return "class Deep {\n    String s = \"a\"" + " + \"x\"".repeat(terms) + ";\n}\n";
    }
}
