package com.vidnyan.guardian.adapter.out.policy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.vidnyan.guardian.application.port.out.PolicyRepository;
import com.vidnyan.guardian.config.GuardianProperties;
import com.vidnyan.guardian.domain.error.GuardianException;
import com.vidnyan.guardian.domain.policy.CompliancePolicy;
import com.vidnyan.guardian.domain.policy.CompliancePolicy.ToolThreshold;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Reads the compliance policy from a JSON or YAML file ({@code .yml}/{@code .yaml}).
 * A missing or empty file means no limits.
 * {@code guardian.policy.block-on-high-risk} switches the high-risk gate on regardless of the file.
 *
 * <p>Besides the native layout, a document grouping tools by language is accepted:
 * <pre>
 * python:
 *   bandit: {threshold: 0}
 * javascript:
 *   eslint: {threshold: 10}
 * </pre>
 * Tools listed under several languages keep the strictest threshold.
 */
@Slf4j
@Component
public class FileSystemPolicyRepository implements PolicyRepository {

    private static final Set<String> POLICY_FIELDS = Set.of("maxRiskScore", "blockOnHighRisk", "tools");

    private final ObjectMapper objectMapper;
    private final ObjectMapper yamlMapper = new YAMLMapper();
    private final Path policyPath;
    private final boolean blockOnHighRisk;

    @Autowired
    public FileSystemPolicyRepository(ObjectMapper objectMapper, GuardianProperties properties) {
        this(objectMapper, Path.of(properties.getPolicy().getPath()), properties.getPolicy().isBlockOnHighRisk());
    }

    public FileSystemPolicyRepository(ObjectMapper objectMapper, Path policyPath, boolean blockOnHighRisk) {
        this.objectMapper = objectMapper;
        this.policyPath = policyPath;
        this.blockOnHighRisk = blockOnHighRisk;
    }

    @Override
    public CompliancePolicy load() {
        CompliancePolicy policy = CompliancePolicy.permissive();
        if (Files.isRegularFile(policyPath)) {
            try {
                policy = read();
                log.info("Loaded compliance policy from {}: {} tool thresholds", policyPath, policy.tools().size());
            } catch (IOException e) {
                throw new GuardianException("Invalid compliance policy " + policyPath + ": " + e.getMessage(), e);
            }
        } else {
            log.debug("No compliance policy at {}", policyPath);
        }
        if (blockOnHighRisk && !policy.blockOnHighRisk()) {
            policy = new CompliancePolicy(policy.maxRiskScore(), true, policy.tools());
        }
        return policy;
    }

    private CompliancePolicy read() throws IOException {
        ObjectMapper mapper = isYaml(policyPath) ? yamlMapper : objectMapper;
        JsonNode root = mapper.readTree(policyPath.toFile());
        if (root == null || root.isMissingNode() || root.isNull()) {
            return CompliancePolicy.permissive();
        }
        if (!root.isObject()) {
            throw new GuardianException("Invalid compliance policy " + policyPath + ": expected a mapping");
        }
        if (isLanguageLayout(root)) {
            log.debug("Reading {} as per-language tool thresholds", policyPath);
            return fromLanguageLayout(root);
        }
        return mapper.treeToValue(root, CompliancePolicy.class);
    }

    static boolean isYaml(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".yml") || name.endsWith(".yaml");
    }

    private static boolean isLanguageLayout(JsonNode root) {
        if (root.isEmpty()) {
            return false;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (POLICY_FIELDS.contains(field.getKey()) || !field.getValue().isObject()) {
                return false;
            }
        }
        return true;
    }

    private static CompliancePolicy fromLanguageLayout(JsonNode root) {
        Map<String, ToolThreshold> tools = new TreeMap<>();
        root.fields().forEachRemaining(language -> language.getValue().fields().forEachRemaining(tool -> {
            JsonNode threshold = tool.getValue().path("threshold");
            if (threshold.isNumber()) {
                tools.merge(tool.getKey(), new ToolThreshold(threshold.asInt()),
                        (a, b) -> a.threshold() <= b.threshold() ? a : b);
            }
        }));
        return new CompliancePolicy(null, false, tools);
    }
}
