package com.chanakya.vault.extraction;

import com.chanakya.vault.config.VaultProperties;
import com.chanakya.vault.exception.ExtractionException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Calls the Gemini {@code generateContent} API to pull structured data out of an uploaded
 * medical document. The result is returned as untyped JSON for {@link ExtractionNormalizer}.
 */
@Service
public class DocumentExtractionClient {

    private static final Logger log = LoggerFactory.getLogger(DocumentExtractionClient.class);

    static final String EXTRACTION_PROMPT = """
            You are a highly specialized medical AI assistant. Extract specific data points from the provided medical report.
            Output the data strictly as a JSON object, adhering to the specified schema.
            Infer the 'reportType' (e.g. 'CBC', 'Lipid Panel', 'CT Coronary Angiography', 'Discharge Summary') and 'hospital' name from the document.
            For 'extractedValues', identify lab tests or key metrics with their numeric or string value, unit and reference range ('ref'). \
            Mark 'isAbnormal' as true if the value falls outside the reference range or is explicitly noted as abnormal.
            Identify all 'diagnosis' entries, 'medications' mentioned, and any explicit 'abnormalities' or significant findings.
            Generate two summaries: 'patientSummary' in simple, non-medical language and 'doctorSummary', clinically detailed and concise.
            Extract the most relevant 'timestamp' (the report or order date) in YYYY-MM-DD format. If only a year is available, use YYYY-01-01.
            If a field cannot be found, return an empty array or an empty string as appropriate.
            """;

    private static final List<String> REQUIRED_FIELDS = List.of(
            "extractedValues", "diagnosis", "medications", "abnormalities",
            "patientSummary", "doctorSummary", "timestamp");

    private static final String JSON_FENCE = "```json";
    private static final String FENCE = "```";

    private final VaultProperties properties;
    private final ObjectMapper objectMapper;
    private WebClient webClient;

    public DocumentExtractionClient(VaultProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        this.webClient = WebClient.builder()
                .baseUrl(properties.extraction().baseUrl())
                .defaultHeader("x-goog-api-key", properties.extraction().apiKey())
                .defaultHeader("Content-Type", MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    static boolean isSupportedMimeType(String mimeType) {
        return mimeType != null
                && (mimeType.startsWith("image/") || "application/pdf".equals(mimeType));
    }

    /**
     * Extracts raw report data from the document at {@code documentUri}.
     * Errors with {@link ExtractionException} on any upstream or parsing failure; never retries.
     */
    public Mono<JsonNode> extract(String documentUri, String mimeType) {
        if (!isSupportedMimeType(mimeType)) {
            return Mono.error(new IllegalArgumentException("Unsupported MIME type: " + mimeType));
        }
        String path = "/v1beta/models/" + properties.extraction().model() + ":generateContent";

        return Mono.fromCallable(() -> buildRequest(documentUri, mimeType))
                .flatMap(body -> webClient.post()
                        .uri(path)
                        .bodyValue(body)
                        .retrieve()
                        .bodyToMono(JsonNode.class))
                .map(this::parseResponse)
                .timeout(properties.extraction().timeout())
                .doOnError(e -> log.error("event=extraction_failed mimeType={} error={}", mimeType, e.getMessage()))
                .onErrorMap(e -> !(e instanceof ExtractionException),
                        e -> new ExtractionException("Document extraction failed: " + e.getMessage(), e));
    }

    ObjectNode buildRequest(String documentUri, String mimeType) {
        ObjectNode request = objectMapper.createObjectNode();
        ArrayNode parts = request.putArray("contents").addObject().putArray("parts");
        parts.addObject().put("text", EXTRACTION_PROMPT);
        ObjectNode fileData = parts.addObject().putObject("fileData");
        fileData.put("mimeType", mimeType);
        fileData.put("fileUri", documentUri);

        ObjectNode generationConfig = request.putObject("generationConfig");
        generationConfig.put("responseMimeType", "application/json");
        generationConfig.put("temperature", 0.2);
        generationConfig.set("responseSchema", responseSchema());
        return request;
    }

    JsonNode parseResponse(JsonNode response) {
        JsonNode text = response.path("candidates").path(0).path("content").path("parts").path(0).path("text");
        if (!text.isTextual()) {
            throw new ExtractionException("Extraction response contained no candidate text");
        }
        try {
            return objectMapper.readTree(stripCodeFence(text.textValue()));
        } catch (Exception e) {
            throw new ExtractionException("Extraction response was not valid JSON", e);
        }
    }

    static String stripCodeFence(String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith(JSON_FENCE) || trimmed.startsWith(FENCE)) {
            int start = trimmed.startsWith(JSON_FENCE) ? JSON_FENCE.length() : FENCE.length();
            int end = trimmed.lastIndexOf(FENCE);
            return (end > start ? trimmed.substring(start, end) : trimmed.substring(start)).trim();
        }
        return trimmed;
    }

    private ObjectNode responseSchema() {
        ObjectNode schema = objectMapper.createObjectNode();
        schema.put("type", "OBJECT");
        ObjectNode props = schema.putObject("properties");
        props.putObject("reportType").put("type", "STRING");
        props.putObject("hospital").put("type", "STRING");

        ObjectNode measurement = objectMapper.createObjectNode();
        measurement.put("type", "OBJECT");
        ObjectNode measurementProps = measurement.putObject("properties");
        measurementProps.putObject("value").put("type", "STRING");
        measurementProps.putObject("unit").put("type", "STRING");
        measurementProps.putObject("ref").put("type", "STRING");
        measurementProps.putObject("isAbnormal").put("type", "BOOLEAN");
        measurement.putArray("required").add("value");
        ObjectNode values = props.putObject("extractedValues");
        values.put("type", "OBJECT");
        values.set("additionalProperties", measurement);

        for (String list : List.of("diagnosis", "medications", "abnormalities")) {
            ObjectNode array = props.putObject(list);
            array.put("type", "ARRAY");
            array.putObject("items").put("type", "STRING");
        }
        props.putObject("patientSummary").put("type", "STRING");
        props.putObject("doctorSummary").put("type", "STRING");
        props.putObject("timestamp").put("type", "STRING");

        ArrayNode required = schema.putArray("required");
        REQUIRED_FIELDS.forEach(required::add);
        return schema;
    }
}
