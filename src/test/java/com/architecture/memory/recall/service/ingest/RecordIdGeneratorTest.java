package com.architecture.memory.recall.service.ingest;

import com.architecture.memory.recall.model.RetrievalUnit;
import com.architecture.memory.recall.model.UnitType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class RecordIdGeneratorTest {

    private final RecordIdGenerator generator = new RecordIdGenerator();

    @Test
    void matchesNameBasedUuidOfUnitKey() {
        assertThat(generator.generate("src/app.py", "Function", "main", "src/app.py::main", 3, 9))
                .isEqualTo("f42e869a-01a6-588f-97e4-9e7034a0e4df");
    }

    @Test
    void windowWithoutSymbolUsesEmptySegment() {
        RetrievalUnit chunk = RetrievalUnit.builder()
                .type(UnitType.FILE_CHUNK)
                .name("src/app.py::chunk_1_200")
                .startLine(1)
                .endLine(200)
                .build();

        assertThat(generator.generate("src/app.py", chunk)).isEqualTo("6b741ad4-d27a-544b-8e22-7d1f8bfbc1ab");
    }

    @Test
    void differsWhenLineRangeChanges() {
        String first = generator.generate("A.java", "Function", "run", "A.java::run", 3, 9);
        String moved = generator.generate("A.java", "Function", "run", "A.java::run", 4, 10);

        assertThat(first).isNotEqualTo(moved);
        assertThat(generator.generate("A.java", "Function", "run", "A.java::run", 3, 9)).isEqualTo(first);
    }

    @Test
    void producesVersionFiveUuids() {
        UUID id = UUID.fromString(generator.generate("A.java", "Class", "A", "A.java::A", 1, 40));

        assertThat(id.version()).isEqualTo(5);
        assertThat(id.variant()).isEqualTo(2);
    }

    @Test
    void differsWhenAnySingleKeyFieldChanges() {
        String base = generator.generate("A.java", "Function", "run", "A.java::run", 3, 9);

        assertThat(List.of(
                generator.generate("B.java", "Function", "run", "A.java::run", 3, 9),
                generator.generate("A.java", "AsyncFunction", "run", "A.java::run", 3, 9),
                generator.generate("A.java", "Function", "walk", "A.java::run", 3, 9),
                generator.generate("A.java", "Function", "run", "A.java::walk", 3, 9),
                generator.generate("A.java", "Function", "run", "A.java::run", 4, 9),
                generator.generate("A.java", "Function", "run", "A.java::run", 3, 10)))
                .doesNotContain(base)
                .doesNotHaveDuplicates();
    }

    @Test
    void missingTypeIsKeyedAsUnknown() {
        RetrievalUnit untyped = RetrievalUnit.builder()
                .name("docs/guide.md::intro")
                .startLine(1)
                .endLine(4)
                .build();

        assertThat(generator.generate("docs/guide.md", untyped))
                .isEqualTo(generator.generate("docs/guide.md", "Unknown", "", "docs/guide.md::intro", 1, 4));
    }
}
