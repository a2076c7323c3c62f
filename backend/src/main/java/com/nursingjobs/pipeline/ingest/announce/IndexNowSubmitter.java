package com.nursingjobs.pipeline.ingest.announce;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.nursingjobs.pipeline.config.PipelineProperties;
import com.nursingjobs.pipeline.ingest.http.PoliteHttpClient;
import com.nursingjobs.pipeline.ingest.model.HttpFetchResult;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.List;

/**
 * IndexNow protocol: one JSON POST per batch carrying host, key, key location and URL list.
 */
@Component
public class IndexNowSubmitter implements SearchIndexSubmitter {
    private final PoliteHttpClient httpClient;
    private final PipelineProperties properties;
    private final ObjectMapper objectMapper;

    public IndexNowSubmitter(PoliteHttpClient httpClient, PipelineProperties properties, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public HttpFetchResult submit(String endpoint, List<String> urls) {
        return httpClient.postJson(endpoint, payload(urls), "application/json");
    }

    String payload(List<String> urls) {
        PipelineProperties.Announce announce = properties.getAnnounce();
        ObjectNode root = objectMapper.createObjectNode();
        root.put("host", URI.create(properties.getSiteUrl()).getHost());
        root.put("key", announce.getKey());
        String keyLocation = announce.getKeyLocation();
        if (keyLocation == null || keyLocation.isBlank()) {
            keyLocation = properties.getSiteUrl() + "/" + announce.getKey() + ".txt";
        }
        root.put("keyLocation", keyLocation);
        ArrayNode urlList = root.putArray("urlList");
        urls.forEach(urlList::add);
        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to encode IndexNow payload", e);
        }
    }
}
