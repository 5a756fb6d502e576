package com.rulesync.core.loader;

import com.rulesync.core.model.DownstreamKind;
import com.rulesync.core.model.FileError;
import com.rulesync.core.model.LoadResult;
import com.rulesync.core.model.RuleRecord;
import com.rulesync.core.support.CanonicalJson;
import com.rulesync.core.support.ContentReadException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link RuleLoader}.
 */
class RuleLoaderTest {

    private static final String GROUP_FILE = """
            groups:
              - name: node
                rules:
                  - alert: HighLoad
                    expr: node_load1 > 4
                    for: 5m
                    labels:
                      severity: warning
                  - record: job:up:sum
                    expr: sum by (job) (up)
            """;

    private static final String FREE_STANDING = """
            alert: InstanceDown
            expr: up == 0
            """;

    @TempDir
    Path root;

    private final RuleLoader loader = new RuleLoader(DownstreamKind.METRIC_RULES);

    @Test
    @DisplayName("Two valid files and one malformed file give 2 records and 1 error")
    void shouldIsolateMalformedFile() throws IOException {
        write("rules/a.rule", GROUP_FILE);
        write("rules/b.rule", FREE_STANDING);
        write("rules/c.rule", "groups: [ unclosed");

        LoadResult<RuleRecord> result = loader.load(root, "rules");

        assertThat(result.getRecords()).extracting(RuleRecord::getName).containsExactly("a", "b");
        assertThat(result.getErrors()).hasSize(1);
        assertThat(result.getErrors().get(0).getSourcePath()).isEqualTo("c.rule");
        assertThat(result.getErrors().get(0).getType()).isEqualTo(FileError.Type.FILE_VALIDATION);
    }

    @Test
    @DisplayName("Group names are prefixed with the record name")
    void shouldQualifyGroupNames() throws IOException {
        write("rules/team/node.rules", GROUP_FILE);

        RuleRecord record = loader.load(root, "rules").getRecords().get(0);

        assertThat(record.getName()).isEqualTo("team_node");
        assertThat(record.getGroupNames()).containsExactly("team_node_node");
        assertThat(record.getRuleCount()).isEqualTo(2);
        assertThat(record.getSourcePath()).isEqualTo("team/node.rules");
    }

    @Test
    @DisplayName("Free-standing rule is wrapped into a group named after the record")
    @SuppressWarnings("unchecked")
    void shouldWrapFreeStandingRule() throws IOException {
        write("rules/instance.yaml", FREE_STANDING);

        RuleRecord record = loader.load(root, "rules").getRecords().get(0);
        Map<String, Object> payload = (Map<String, Object>) CanonicalJson.read(record.getPayload());
        List<Map<String, Object>> groups = (List<Map<String, Object>>) payload.get("groups");

        assertThat(groups).hasSize(1);
        assertThat(groups.get(0)).containsEntry("name", "instance");
        assertThat((List<Map<String, Object>>) groups.get(0).get("rules"))
                .singleElement()
                .satisfies(rule -> assertThat(rule).containsEntry("alert", "InstanceDown"));
    }

    @Test
    @DisplayName("Key order in the file does not change the payload")
    void shouldProduceCanonicalPayload() throws IOException {
        write("one/x.rule", "alert: A\nexpr: up == 0\nlabels: {b: 2, a: 1}\n");
        write("two/x.rule", "labels: {a: 1, b: 2}\nexpr: up == 0\nalert: A\n");

        String first = loader.load(root, "one").getRecords().get(0).getPayload();
        String second = loader.load(root, "two").getRecords().get(0).getPayload();

        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("Rule without expr or with both alert and record is rejected")
    void shouldValidateRuleFields() throws IOException {
        write("rules/no-expr.rule", "alert: A\n");
        write("rules/both.rule", "alert: A\nrecord: r\nexpr: up\n");
        write("rules/neither.rule", "expr: up\n");

        LoadResult<RuleRecord> result = loader.load(root, "rules");

        assertThat(result.getRecords()).isEmpty();
        assertThat(result.getErrors()).extracting(FileError::getSourcePath)
                .containsExactly("both.rule", "neither.rule", "no-expr.rule");
        assertThat(result.getErrors().get(2).getMessage()).contains("'expr'");
    }

    @Test
    @DisplayName("Duplicate group names and duplicate keys are rejected")
    void shouldRejectDuplicates() throws IOException {
        write("rules/groups.rule", """
                groups:
                  - name: g
                    rules: []
                  - name: g
                    rules: []
                """);
        write("rules/keys.rule", "alert: A\nalert: B\nexpr: up\n");

        LoadResult<RuleRecord> result = loader.load(root, "rules");

        assertThat(result.getRecords()).isEmpty();
        assertThat(result.getErrors()).hasSize(2);
        assertThat(result.getErrors().get(0).getMessage()).contains("Duplicate group name 'g'");
    }

    @Test
    @DisplayName("Empty file and non-mapping document are rejected")
    void shouldRejectEmptyAndScalarDocuments() throws IOException {
        write("rules/empty.rule", "");
        write("rules/list.rule", "- alert: A\n  expr: up\n");

        LoadResult<RuleRecord> result = loader.load(root, "rules");

        assertThat(result.getRecords()).isEmpty();
        assertThat(result.getErrors()).extracting(FileError::getMessage)
                .anySatisfy(m -> assertThat(m).contains("no rules"))
                .anySatisfy(m -> assertThat(m).contains("mapping"));
    }

    @Test
    @DisplayName("Files with other extensions are ignored")
    void shouldIgnoreOtherExtensions() throws IOException {
        write("rules/README.md", "# docs");
        write("rules/a.rule", FREE_STANDING);

        LoadResult<RuleRecord> result = loader.load(root, "rules");

        assertThat(result.getRecords()).hasSize(1);
        assertThat(result.getErrors()).isEmpty();
    }

    @Test
    @DisplayName("Absent and empty subpaths give an empty result without errors")
    void shouldTolerateAbsentAndEmptySubpath() throws IOException {
        Files.createDirectories(root.resolve("empty"));

        assertThat(loader.load(root, "missing").getRecords()).isEmpty();
        assertThat(loader.load(root, "missing").getErrors()).isEmpty();
        assertThat(loader.load(root, "empty").getRecords()).isEmpty();
        assertThat(loader.load(root, "empty").getErrors()).isEmpty();
    }

    @Test
    @DisplayName("Subpath escaping the root is refused")
    void shouldRefuseEscapingSubpath() {
        assertThatThrownBy(() -> loader.load(root, "../elsewhere"))
                .isInstanceOf(ContentReadException.class)
                .hasMessageContaining("escapes");
    }

    @Test
    @DisplayName("RuleLoader cannot be created for dashboards")
    void shouldRejectDashboardKind() {
        assertThatThrownBy(() -> new RuleLoader(DownstreamKind.DASHBOARDS))
                .isInstanceOf(IllegalArgumentException.class);
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
