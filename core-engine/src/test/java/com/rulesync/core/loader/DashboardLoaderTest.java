package com.rulesync.core.loader;

import com.rulesync.core.model.DashboardRecord;
import com.rulesync.core.model.LoadResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link DashboardLoader}.
 */
class DashboardLoaderTest {

    @TempDir
    Path root;

    private final DashboardLoader loader = new DashboardLoader();

    @Test
    @DisplayName("Should load JSON objects and strip compound extensions")
    void shouldLoadDashboards() throws IOException {
        write("boards/node.json", "{\"title\": \"Node\", \"panels\": []}");
        write("boards/team/api.json.tmpl", "{\"title\": \"API\", \"panels\": [{\"expr\": \"rate(x[5m])\"}]}");

        LoadResult<DashboardRecord> result = loader.load(root, "boards");

        assertThat(result.getErrors()).isEmpty();
        assertThat(result.getRecords()).extracting(DashboardRecord::getName).containsExactly("node", "team_api");
        assertThat(result.getRecords()).extracting(DashboardRecord::getTitle).containsExactly("Node", "API");
    }

    @Test
    @DisplayName("Payload is canonical: key order and whitespace do not matter")
    void shouldCanonicalizePayload() throws IOException {
        write("a/board.json", "{\"title\":\"X\",\"uid\":\"u1\"}");
        write("b/board.json", "{\n  \"uid\": \"u1\",\n  \"title\": \"X\"\n}");

        assertThat(loader.load(root, "a").getRecords().get(0).getPayload())
                .isEqualTo(loader.load(root, "b").getRecords().get(0).getPayload())
                .isEqualTo("{\"title\":\"X\",\"uid\":\"u1\"}");
    }

    @Test
    @DisplayName("Invalid JSON, empty files and non-objects are rejected individually")
    void shouldRejectMalformedFiles() throws IOException {
        write("boards/broken.json", "{\"title\": ");
        write("boards/empty.json", "");
        write("boards/array.json", "[1, 2]");
        write("boards/good.json", "{\"title\": \"Good\"}");

        LoadResult<DashboardRecord> result = loader.load(root, "boards");

        assertThat(result.getRecords()).extracting(DashboardRecord::getName).containsExactly("good");
        assertThat(result.getErrors()).hasSize(3);
    }

    @Test
    @DisplayName("Dashboard without a title is still accepted")
    void shouldAcceptUntitledDashboard() throws IOException {
        write("boards/untitled.json", "{\"panels\": []}");

        DashboardRecord record = loader.load(root, "boards").getRecords().get(0);

        assertThat(record.getTitle()).isNull();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private void write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
