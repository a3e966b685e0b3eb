package com.textlens.backend.oracle.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.textlens.backend.oracle.EncodedInput;
import com.textlens.backend.oracle.OracleException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.*;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON client for one model hosted by the model serving endpoint.
 *
 * <p>Every operation is a {@code POST {baseUrl}/models/{model}/{operation}} carrying a JSON body.
 * The client keeps no per-request state, so one instance serves concurrent requests.</p>
 */
@Slf4j
public class RemoteModelClient {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final RestTemplate restTemplate;
    private final String baseUrl;
    private final String model;

    public RemoteModelClient(RestTemplate restTemplate, String baseUrl, String model) {
        this.restTemplate = restTemplate;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model;
    }

    public String model() {
        return model;
    }

    public ObjectNode newBody() {
        return MAPPER.createObjectNode();
    }

    public EncodedInput tokenize(String text, int maxTokens, boolean truncate) {
        ObjectNode body = newBody()
                .put("text", text == null ? "" : text)
                .put("maxLength", maxTokens)
                .put("truncation", truncate);
        JsonNode ids = call("tokenize", body).path("inputIds");
        return new EncodedInput(readIds(ids, "inputIds"));
    }

    public String detokenize(List<Integer> tokenIds) {
        ObjectNode body = newBody().put("skipSpecialTokens", true);
        body.set("ids", toArray(tokenIds));
        JsonNode text = call("detokenize", body).path("text");
        if (text.isMissingNode() || text.isNull()) {
            throw new OracleException("No text in detokenize response of " + model);
        }
        return text.asText();
    }

    public ArrayNode toArray(List<Integer> ids) {
        ArrayNode arr = MAPPER.createArrayNode();
        ids.forEach(arr::add);
        return arr;
    }

    public JsonNode call(String operation, ObjectNode body) {
        String url = baseUrl + "/models/" + model + "/" + operation;
        try {
            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);
            headers.setAccept(List.of(MediaType.APPLICATION_JSON));
            HttpEntity<String> request = new HttpEntity<>(MAPPER.writeValueAsString(body), headers);

            ResponseEntity<String> response = restTemplate.exchange(url, HttpMethod.POST, request, String.class);
            if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
                throw new OracleException("Model " + model + " " + operation + " HTTP " + response.getStatusCode().value());
            }
            return MAPPER.readTree(response.getBody());
        } catch (OracleException e) {
            throw e;
        } catch (RestClientException e) {
            log.debug("Model call {} failed", url, e);
            throw new OracleException("Model " + model + " " + operation + " failed: " + e.getMessage(), e);
        } catch (Exception e) {
            throw new OracleException("Model " + model + " " + operation + " returned an unreadable body: " + e.getMessage(), e);
        }
    }

    public static List<Integer> readIds(JsonNode node, String field) {
        if (!node.isArray()) {
            throw new OracleException("Expected array '" + field + "' in model response");
        }
        List<Integer> ids = new ArrayList<>(node.size());
        for (JsonNode id : node) {
            if (!id.isIntegralNumber() || !id.canConvertToInt()) {
                throw new OracleException("Non integer token id in '" + field + "'");
            }
            ids.add(id.intValue());
        }
        return ids;
    }
}
