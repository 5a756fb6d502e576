package com.rulesync.core.loader;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.rulesync.core.model.DashboardRecord;
import com.rulesync.core.model.DownstreamKind;
import com.rulesync.core.support.CanonicalJson;

import java.util.List;

/**
 * Loads dashboard documents.
 *
 * <p>
 * A file is accepted when it parses to a JSON object. The document itself
 * is passed through untouched; panels and queries are the dashboard store's
 * concern.
 * </p>
 *
 * @since 1.0.0
 */
public class DashboardLoader extends AbstractFileLoader<DashboardRecord> {

    private static final List<String> EXTENSIONS = List.of(".json", ".json.tmpl");

    public DashboardLoader() {
        super(DownstreamKind.DASHBOARDS);
    }

    @Override
    protected List<String> extensions() {
        return EXTENSIONS;
    }

    @Override
    protected DashboardRecord parse(String name, String relativePath, String content) {
        JsonNode document;
        try {
            document = CanonicalJson.mapper().readTree(content);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (document == null || document.isMissingNode()) {
            throw new IllegalStateException("File is empty");
        }
        if (!document.isObject()) {
            throw new IllegalStateException("Expected a JSON object, got " + document.getNodeType());
        }

        String title = document.hasNonNull("title") ? document.get("title").asText() : null;
        return new DashboardRecord(name, CanonicalJson.write(document), relativePath, title);
    }
}
