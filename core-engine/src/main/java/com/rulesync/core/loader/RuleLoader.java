package com.rulesync.core.loader;

import com.rulesync.core.model.DownstreamKind;
import com.rulesync.core.model.RuleRecord;
import com.rulesync.core.support.CanonicalJson;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads alerting and recording rules for the metrics or log rule store.
 *
 * <p>
 * Expected YAML structure, either rule groups:
 * </p>
 *
 * <pre>
 * groups:
 *   - name: node
 *     rules:
 *       - alert: HighLoad
 *         expr: node_load1 &gt; 4
 *         for: 5m
 * </pre>
 *
 * <p>
 * or a single free-standing rule:
 * </p>
 *
 * <pre>
 * alert: HighLoad
 * expr: node_load1 &gt; 4
 * </pre>
 *
 * <h3>Grouping</h3>
 * <p>
 * Each file becomes one record holding all its groups. Group names are
 * prefixed with the record name ({@code <record>_<group>}) so groups from
 * different files never clash downstream. A free-standing rule is placed in
 * a group named after the record.
 * </p>
 *
 * <h3>Validation</h3>
 * <p>
 * Every rule needs exactly one non-blank {@code alert} or {@code record}
 * and a non-blank {@code expr}; {@code labels} and {@code annotations}, when
 * present, must be mappings. Group names must be non-blank and unique per
 * file. All problems of a file are reported together.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleLoader extends AbstractFileLoader<RuleRecord> {

    private static final List<String> EXTENSIONS = List.of(".rule", ".rules", ".yml", ".yaml");

    /**
     * @param kind {@link DownstreamKind#METRIC_RULES} or
     *             {@link DownstreamKind#LOG_RULES}
     * @throws IllegalArgumentException for {@link DownstreamKind#DASHBOARDS}
     */
    public RuleLoader(DownstreamKind kind) {
        super(kind);
        if (kind == DownstreamKind.DASHBOARDS) {
            throw new IllegalArgumentException("RuleLoader cannot load " + kind);
        }
    }

    @Override
    protected List<String> extensions() {
        return EXTENSIONS;
    }

    @Override
    protected RuleRecord parse(String name, String relativePath, String content) {
        Object document = newYaml().load(content);
        if (document == null) {
            throw new IllegalStateException("File contains no rules");
        }
        if (!(document instanceof Map<?, ?> top)) {
            throw new IllegalStateException("Expected a mapping at the top level, got "
                    + document.getClass().getSimpleName());
        }

        List<String> errors = new ArrayList<>();
        List<Map<String, Object>> groups = new ArrayList<>();
        int ruleCount = 0;

        if (top.containsKey("groups")) {
            Object rawGroups = top.get("groups");
            if (!(rawGroups instanceof List<?> groupList) || groupList.isEmpty()) {
                throw new IllegalStateException("'groups' must be a non-empty list");
            }
            Set<String> seen = new HashSet<>();
            for (int i = 0; i < groupList.size(); i++) {
                Map<String, Object> group = toGroup(name, i, groupList.get(i), seen, errors);
                if (group != null) {
                    groups.add(group);
                    ruleCount += ((List<?>) group.get("rules")).size();
                }
            }
        } else {
            validateRule("rule", top, errors);
            Map<String, Object> group = new LinkedHashMap<>();
            group.put("name", name);
            group.put("rules", List.of(top));
            groups.add(group);
            ruleCount = 1;
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("; ", errors));
        }

        List<String> groupNames = groups.stream()
                .map(g -> (String) g.get("name"))
                .toList();
        return new RuleRecord(name, CanonicalJson.write(Map.of("groups", groups)),
                relativePath, groupNames, ruleCount);
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    private static Map<String, Object> toGroup(String recordName, int index, Object raw,
            Set<String> seen, List<String> errors) {
        if (!(raw instanceof Map<?, ?> source)) {
            errors.add("Group at index " + index + " is not a mapping");
            return null;
        }
        Object groupName = source.get("name");
        if (!(groupName instanceof String s) || s.isBlank()) {
            errors.add("Group at index " + index + " requires 'name'");
            return null;
        }
        if (!seen.add(s)) {
            errors.add("Duplicate group name '" + s + "'");
            return null;
        }
        Object rules = source.get("rules");
        if (!(rules instanceof List<?> ruleList)) {
            errors.add("Group '" + s + "' requires a 'rules' list");
            return null;
        }
        for (int i = 0; i < ruleList.size(); i++) {
            Object rule = ruleList.get(i);
            String label = "Rule " + i + " of group '" + s + "'";
            if (rule instanceof Map<?, ?> ruleMap) {
                validateRule(label, ruleMap, errors);
            } else {
                errors.add(label + " is not a mapping");
            }
        }

        Map<String, Object> group = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            group.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        group.put("name", recordName + "_" + s);
        return group;
    }

    private static void validateRule(String label, Map<?, ?> rule, List<String> errors) {
        boolean hasAlert = isNonBlankString(rule.get("alert"));
        boolean hasRecord = isNonBlankString(rule.get("record"));
        if (hasAlert == hasRecord) {
            errors.add(label + " requires exactly one of 'alert' or 'record'");
        }

        Object expr = rule.get("expr");
        if (!(isNonBlankString(expr) || expr instanceof Number)) {
            errors.add(label + " requires 'expr'");
        }

        for (String key : List.of("labels", "annotations")) {
            Object value = rule.get(key);
            if (value != null && !(value instanceof Map)) {
                errors.add(label + " '" + key + "' must be a mapping");
            }
        }
    }

    private static boolean isNonBlankString(Object value) {
        return value instanceof String s && !s.isBlank();
    }

    private static Yaml newYaml() {
        LoaderOptions options = new LoaderOptions();
        options.setAllowDuplicateKeys(false);
        return new Yaml(new SafeConstructor(options));
    }
}
