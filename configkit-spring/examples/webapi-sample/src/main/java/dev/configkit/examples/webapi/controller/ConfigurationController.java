package dev.configkit.examples.webapi.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.configkit.core.ValidationReport;
import dev.configkit.examples.webapi.config.ApplicationProperties;
import dev.configkit.examples.webapi.config.DatabaseProperties;
import dev.configkit.examples.webapi.config.ExternalApiProperties;
import dev.configkit.examples.webapi.config.LoggingProperties;
import dev.configkit.examples.webapi.config.SecurityProperties;
import dev.configkit.spring.ConfigValidationRunner;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/configuration")
public class ConfigurationController {

    private final ApplicationProperties application;
    private final DatabaseProperties database;
    private final ExternalApiProperties externalApi;
    private final LoggingProperties logging;
    private final SecurityProperties security;
    private final ConfigValidationRunner validationRunner;
    private final ObjectMapper objectMapper;

    public ConfigurationController(ApplicationProperties application,
                                   DatabaseProperties database,
                                   ExternalApiProperties externalApi,
                                   LoggingProperties logging,
                                   SecurityProperties security,
                                   ConfigValidationRunner validationRunner,
                                   ObjectMapper objectMapper) {
        this.application = application;
        this.database = database;
        this.externalApi = externalApi;
        this.logging = logging;
        this.security = security;
        this.validationRunner = validationRunner;
        this.objectMapper = objectMapper;
    }

    @GetMapping("/application")
    public ResponseEntity<Map<String, Object>> getApplication() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", application.getName());
        body.put("version", application.getVersion());
        body.put("maxConcurrentRequests", application.getMaxConcurrentRequests());
        body.put("requestTimeoutSeconds", application.getRequestTimeoutSeconds());
        body.put("enableMetrics", application.isEnableMetrics());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/database")
    public ResponseEntity<Map<String, Object>> getDatabase() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("hasConnectionString", StringUtils.hasText(database.getConnectionString()));
        body.put("commandTimeoutSeconds", database.getCommandTimeoutSeconds());
        body.put("maxPoolSize", database.getMaxPoolSize());
        body.put("enableSensitiveDataLogging", database.isEnableSensitiveDataLogging());
        body.put("requireSsl", database.isRequireSsl());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/external-api")
    public ResponseEntity<Map<String, Object>> getExternalApi() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("baseUrl", externalApi.getBaseUrl());
        body.put("hasApiKey", StringUtils.hasText(externalApi.getApiKey()));
        body.put("timeoutSeconds", externalApi.getTimeoutSeconds());
        body.put("maxRetries", externalApi.getMaxRetries());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/logging")
    public ResponseEntity<Map<String, Object>> getLogging() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("logDirectory", logging.getLogDirectory());
        body.put("minimumLevel", logging.getMinimumLevel());
        body.put("retentionDays", logging.getRetentionDays());
        body.put("maxFileSizeMb", logging.getMaxFileSizeMb());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/security")
    public ResponseEntity<Map<String, Object>> getSecurity() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("environment", security.getEnvironment());
        body.put("hasCertificate", StringUtils.hasText(security.getCertificatePath()));
        body.put("requireHttps", security.isRequireHttps());
        body.put("allowedOriginsCount", security.getAllowedOrigins().size());
        return ResponseEntity.ok(body);
    }

    /**
     * Re-runs every registered validation against the current configuration.
     */
    @GetMapping("/validation")
    public ResponseEntity<ObjectNode> getValidation() {
        List<ValidationReport> reports = validationRunner.validateAll();

        ObjectNode body = objectMapper.createObjectNode();
        body.put("valid", reports.stream().allMatch(ValidationReport::valid));
        ArrayNode sections = body.putArray("sections");
        reports.forEach(report -> sections.add(report.toJsonNode(objectMapper)));
        return ResponseEntity.ok(body);
    }
}
