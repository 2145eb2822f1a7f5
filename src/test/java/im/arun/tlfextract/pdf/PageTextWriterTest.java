package im.arun.tlfextract.pdf;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PageTextWriterTest {

    @TempDir
    Path tempDir;

    private final PageTextWriter writer = new PageTextWriter();

    @Test
    void separatesPagesWithRelativePageNumbers() throws Exception {
        InMemorySourceDocument document = new InMemorySourceDocument(List.of("p1", "p2", "p3", "p4"));

        String text = writer.render(document, 2, 4);

        assertThat(text).isEqualTo("p2\n--- Page 2 ---\np3\n--- Page 3 ---\np4");
    }

    @Test
    void singlePageHasNoSeparator() throws Exception {
        InMemorySourceDocument document = new InMemorySourceDocument(List.of("only page"));

        assertThat(writer.render(document, 1, 1)).isEqualTo("only page");
    }

    @Test
    void writesPlaceholderWhenExtractionFails() throws Exception {
        InMemorySourceDocument document = new InMemorySourceDocument(List.of("p1", "p2", "p3")).failTextOn(3);
        Path target = tempDir.resolve("broken.txt");

        boolean written = writer.write(document, 2, 3, target);

        assertThat(written).isFalse();
        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("[TEXT EXTRACTION FAILED ON PAGE 2]");
    }
}
