package com.nursingjobs.pipeline.ingest.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.nursingjobs.pipeline.config.PipelineProperties.Selectors;
import com.nursingjobs.pipeline.ingest.model.ListingPage;
import com.nursingjobs.pipeline.ingest.model.RawListing;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Reads listing pages from JSON APIs. Field names are dotted paths ({@code bulletFields.0},
 * {@code data.jobs}).
 */
public class JsonListingPageParser implements ListingPageParser {
    private final String employerSlug;
    private final Selectors selectors;
    private final ObjectMapper objectMapper;

    public JsonListingPageParser(String employerSlug, Selectors selectors, ObjectMapper objectMapper) {
        if (selectors == null || selectors.getItemsPath() == null || selectors.getItemsPath().isBlank()) {
            throw new IllegalArgumentException("JSON source " + employerSlug + " requires an items-path");
        }
        this.employerSlug = employerSlug;
        this.selectors = selectors;
        this.objectMapper = objectMapper;
    }

    @Override
    public ListingPage parse(String body, String pageUrl) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            throw new AdapterFetchException(employerSlug, pageUrl, "response is not valid JSON", e);
        }
        if (root == null || root.isMissingNode()) {
            throw new AdapterFetchException(employerSlug, pageUrl, "empty JSON response");
        }
        JsonNode items = at(root, selectors.getItemsPath());
        if (items == null || !items.isArray()) {
            throw new AdapterFetchException(
                employerSlug,
                pageUrl,
                "expected array at '" + selectors.getItemsPath() + "' not found; response layout changed?"
            );
        }

        List<RawListing> listings = new ArrayList<>();
        for (JsonNode item : items) {
            listings.add(toListing(item, pageUrl));
        }
        String next = text(root, selectors.getNextField());
        return new ListingPage(listings, next, false, null);
    }

    @Override
    public String acceptHeader() {
        return "application/json";
    }

    private RawListing toListing(JsonNode item, String pageUrl) {
        return new RawListing(
            employerSlug,
            text(item, selectors.getIdField()),
            text(item, selectors.getTitleField()),
            text(item, selectors.getLocationField()),
            resolveUrl(text(item, selectors.getUrlField()), pageUrl),
            text(item, selectors.getPostedDateField()),
            text(item, selectors.getSalaryField()),
            text(item, selectors.getDepartmentField()),
            text(item, selectors.getEmploymentTypeField()),
            text(item, selectors.getDescriptionField())
        );
    }

    private String resolveUrl(String value, String pageUrl) {
        if (value == null) {
            return null;
        }
        if (value.startsWith("http://") || value.startsWith("https://")) {
            return value;
        }
        String prefix = selectors.getUrlPrefix();
        if (prefix != null && !prefix.isBlank()) {
            if (prefix.endsWith("/") && value.startsWith("/")) {
                return prefix + value.substring(1);
            }
            return prefix + value;
        }
        if (pageUrl == null || pageUrl.isBlank()) {
            return value;
        }
        try {
            return URI.create(pageUrl).resolve(value).toString();
        } catch (IllegalArgumentException e) {
            return value;
        }
    }

    private JsonNode at(JsonNode node, String path) {
        if (path == null || path.isBlank()) {
            return null;
        }
        JsonNode value = node.at("/" + path.trim().replace('.', '/'));
        return value.isMissingNode() || value.isNull() ? null : value;
    }

    private String text(JsonNode node, String path) {
        JsonNode value = at(node, path);
        return value == null ? null : flatten(value);
    }

    private String flatten(JsonNode node) {
        if (node.isValueNode()) {
            String text = node.asText().trim();
            return text.isEmpty() ? null : text;
        }
        LinkedHashSet<String> parts = new LinkedHashSet<>();
        for (JsonNode child : node) {
            String text = flatten(child);
            if (text != null) {
                parts.add(text);
            }
        }
        if (parts.isEmpty()) {
            return null;
        }
        return String.join(node.isArray() ? " | " : ", ", parts);
    }
}
