package com.architecture.memory.recall.service.extract;

import com.architecture.memory.recall.model.RetrievalUnit;
import com.architecture.memory.recall.model.UnitType;
import com.github.javaparser.JavaParser;
import com.github.javaparser.ParseResult;
import com.github.javaparser.ParserConfiguration;
import com.github.javaparser.Problem;
import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.ImportDeclaration;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.AnnotationDeclaration;
import com.github.javaparser.ast.body.ClassOrInterfaceDeclaration;
import com.github.javaparser.ast.body.ConstructorDeclaration;
import com.github.javaparser.ast.body.EnumDeclaration;
import com.github.javaparser.ast.body.FieldDeclaration;
import com.github.javaparser.ast.body.MethodDeclaration;
import com.github.javaparser.ast.body.RecordDeclaration;
import com.github.javaparser.ast.nodeTypes.NodeWithJavadoc;
import com.github.javaparser.ast.type.Type;
import com.github.javaparser.ast.visitor.VoidVisitorAdapter;
import com.github.javaparser.javadoc.Javadoc;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Syntactic pass for Java sources.
 * <ul>
 *   <li>class, interface, enum, record and annotation declarations become {@link UnitType#CLASS} units</li>
 *   <li>methods and constructors become {@link UnitType#FUNCTION} units</li>
 *   <li>methods annotated {@code @Async} or returning a future/publisher type become
 *       {@link UnitType#ASYNC_FUNCTION} units</li>
 * </ul>
 * Units are emitted in source order, outer declarations before the ones nested in them.
 */
@Slf4j
public class JavaSourceParser implements SourceParser {

    static final String NESTING_TOO_DEEP = "StackOverflowError: expression nesting too deep to parse";

    private static final Set<String> ASYNC_RETURN_TYPES = Set.of(
            "CompletableFuture", "CompletionStage", "Future", "ListenableFuture", "Mono", "Flux");

    // Javadoc and block comment lines are skipped; only // lines are collected.
    private static final PrecedingCommentCollector COMMENTS =
            new PrecedingCommentCollector(List.of("//"), List.of("/*", "*"));

    private final ParserConfiguration configuration = new ParserConfiguration()
            .setLanguageLevel(ParserConfiguration.LanguageLevel.JAVA_17);

    private final CodeTextExtractor codeTextExtractor;

    public JavaSourceParser(CodeTextExtractor codeTextExtractor) {
        this.codeTextExtractor = codeTextExtractor;
    }

    @Override
    public boolean supports(String extension) {
        return ".java".equals(extension);
    }

    @Override
    public ParsedSource parse(String relPath, String content) {
        ParseResult<CompilationUnit> result;
        try {
            // JavaParser instances keep per-parse state, so each call gets its own.
            result = new JavaParser(configuration).parse(content);
        } catch (RuntimeException e) {
            log.warn("[Extractor] Parser crashed on {}: {}", relPath, e.getMessage());
            return ParsedSource.failed(e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (StackOverflowError e) {
            log.warn("[Extractor] Source of {} nests too deeply to parse", relPath);
            return ParsedSource.failed(NESTING_TOO_DEEP);
        }

        if (!result.isSuccessful() || result.getResult().isEmpty()) {
            String message = result.getProblems().stream()
                    .findFirst()
                    .map(Problem::getVerboseMessage)
                    .orElse("unknown parse failure");
            return ParsedSource.failed("ParseProblem: " + message);
        }

        DeclarationVisitor visitor = new DeclarationVisitor(relPath, SourceLines.of(content));
        try {
            result.getResult().get().accept(visitor, null);
        } catch (StackOverflowError e) {
            log.warn("[Extractor] Syntax tree of {} nests too deeply to walk", relPath);
            return ParsedSource.failed(NESTING_TOO_DEEP);
        }

        return ParsedSource.builder()
                .units(visitor.units)
                .imports(visitor.imports)
                .globalVariables(visitor.globalVariables)
                .build();
    }

    private static boolean isAsync(MethodDeclaration method) {
        if (method.isAnnotationPresent("Async")) {
            return true;
        }
        Type type = method.getType();
        return type.isClassOrInterfaceType()
                && ASYNC_RETURN_TYPES.contains(type.asClassOrInterfaceType().getNameAsString());
    }

    private class DeclarationVisitor extends VoidVisitorAdapter<Void> {

        private final String relPath;
        private final SourceLines lines;
        private final List<RetrievalUnit> units = new ArrayList<>();
        private final List<String> imports = new ArrayList<>();
        private final List<String> globalVariables = new ArrayList<>();

        DeclarationVisitor(String relPath, SourceLines lines) {
            this.relPath = relPath;
            this.lines = lines;
        }

        @Override
        public void visit(ImportDeclaration n, Void arg) {
            imports.add(n.isAsterisk() ? n.getNameAsString() + ".*" : n.getNameAsString());
            super.visit(n, arg);
        }

        @Override
        public void visit(FieldDeclaration n, Void arg) {
            n.getVariables().forEach(variable -> globalVariables.add(variable.getNameAsString()));
            super.visit(n, arg);
        }

        @Override
        public void visit(ClassOrInterfaceDeclaration n, Void arg) {
            List<String> bases = Stream.concat(n.getExtendedTypes().stream(), n.getImplementedTypes().stream())
                    .map(Node::toString)
                    .collect(Collectors.toList());
            addType(n, n.getNameAsString(), bases);
            super.visit(n, arg);
        }

        @Override
        public void visit(EnumDeclaration n, Void arg) {
            addType(n, n.getNameAsString(), n.getImplementedTypes().stream().map(Node::toString).collect(Collectors.toList()));
            super.visit(n, arg);
        }

        @Override
        public void visit(RecordDeclaration n, Void arg) {
            addType(n, n.getNameAsString(), n.getImplementedTypes().stream().map(Node::toString).collect(Collectors.toList()));
            super.visit(n, arg);
        }

        @Override
        public void visit(AnnotationDeclaration n, Void arg) {
            addType(n, n.getNameAsString(), List.of());
            super.visit(n, arg);
        }

        @Override
        public void visit(MethodDeclaration n, Void arg) {
            units.add(unit(n, n, n.getNameAsString(), isAsync(n) ? UnitType.ASYNC_FUNCTION : UnitType.FUNCTION).build());
            super.visit(n, arg);
        }

        @Override
        public void visit(ConstructorDeclaration n, Void arg) {
            units.add(unit(n, n, n.getNameAsString(), UnitType.FUNCTION).build());
            super.visit(n, arg);
        }

        private void addType(Node node, String symbol, List<String> bases) {
            units.add(unit(node, (NodeWithJavadoc<?>) node, symbol, UnitType.CLASS)
                    .bases(bases)
                    .build());
        }

        private RetrievalUnit.RetrievalUnitBuilder unit(Node node, NodeWithJavadoc<?> documented,
                                                        String symbol, UnitType type) {
            int start = Math.max(1, node.getBegin().map(position -> position.line).orElse(1));
            int end = Math.max(start, node.getEnd().map(position -> position.line).orElse(start));
            return RetrievalUnit.builder()
                    .type(type)
                    .name(RetrievalUnit.qualifiedName(relPath, symbol))
                    .symbol(symbol)
                    .startLine(start)
                    .endLine(end)
                    .docstring(documented.getJavadoc().map(Javadoc::toText).map(String::trim).orElse(""))
                    .code(codeTextExtractor.extract(node, lines, start, end))
                    .precedingComments(COMMENTS.collect(lines, start))
                    .language(SourceLanguage.JAVA);
        }
    }
}
