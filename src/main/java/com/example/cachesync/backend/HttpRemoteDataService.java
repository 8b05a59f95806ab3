package com.example.cachesync.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Calls {@code POST {baseUrl}/{name}} with the parameters as a JSON body.
 *
 * <p>Answers wrapped as {@code {"data": ...}} are unwrapped and their object keys are
 * turned from snake_case into camelCase. Non-2xx statuses raise a
 * {@link RemoteServiceException}.
 */
public class HttpRemoteDataService implements RemoteDataService {

    private static final Pattern SNAKE_SEGMENT = Pattern.compile("_([a-z])");

    private final HttpClient client;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final Duration timeout;

    public HttpRemoteDataService(HttpClient client, ObjectMapper objectMapper, String baseUrl, Duration timeout) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.timeout = timeout;
    }

    @Override
    public Object call(String name, Map<String, ?> params) throws IOException, InterruptedException,
            RemoteServiceException {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/" + name))
            .timeout(timeout)
            .header("Content-Type", "application/json")
            .header("Accept", "application/json")
            .POST(HttpRequest.BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(params == null ? Map.of() : params)))
            .build();

        HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new RemoteServiceException("HTTP error! status: " + response.statusCode() + " calling " + name,
                response.statusCode());
        }
        if (response.body().length == 0) {
            return null;
        }

        JsonNode json = objectMapper.readTree(response.body());
        if (json.isObject() && json.has("data")) {
            json = json.get("data");
        }
        return objectMapper.treeToValue(toCamelCase(json), Object.class);
    }

    private JsonNode toCamelCase(JsonNode node) {
        if (node.isArray()) {
            ArrayNode array = objectMapper.createArrayNode();
            for (JsonNode item : node) {
                array.add(toCamelCase(item));
            }
            return array;
        }
        if (node.isObject()) {
            ObjectNode object = objectMapper.createObjectNode();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                object.set(camelCase(field.getKey()), toCamelCase(field.getValue()));
            }
            return object;
        }
        return node;
    }

    static String camelCase(String key) {
        Matcher matcher = SNAKE_SEGMENT.matcher(key);
        StringBuilder sb = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(sb, matcher.group(1).toUpperCase());
        }
        matcher.appendTail(sb);
        return sb.toString();
    }
}
