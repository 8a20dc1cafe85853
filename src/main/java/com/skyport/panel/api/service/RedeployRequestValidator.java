package com.skyport.panel.api.service;

import com.skyport.panel.api.model.RedeployQuery;
import com.skyport.panel.api.model.RedeployRequest;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Boundary check for redeploy requests. Produces a typed {@link RedeployRequest} or throws an
 * {@link RedeployFailureKind#INVALID_INPUT} failure; never touches the store or a node.
 */
@Component
public class RedeployRequestValidator {

    static final Pattern PORTS_PATTERN = Pattern.compile("^(\\d+:\\d+)(,\\d+:\\d+)*$");
    private static final Pattern LEADING_INTEGER = Pattern.compile("^\\s*([+-]?\\d+)");
    private static final Pattern IMAGE_NAME_IN_PARENS = Pattern.compile("\\(([^)]+)\\)");

    public RedeployRequest validate(String instanceId, RedeployQuery query) {
        if (!StringUtils.hasText(instanceId)) {
            throw new RedeploymentException(RedeployFailureKind.INVALID_INPUT, "missing_instance_id");
        }

        List<String> missing = new ArrayList<>();
        collectMissing(missing, "image", query.image());
        collectMissing(missing, "memory", query.memory());
        collectMissing(missing, "cpu", query.cpu());
        collectMissing(missing, "ports", query.ports());
        collectMissing(missing, "name", query.name());
        collectMissing(missing, "user", query.user());
        collectMissing(missing, "primary", query.primary());
        if (!missing.isEmpty()) {
            throw RedeploymentException.missingParameters(missing);
        }

        if (!PORTS_PATTERN.matcher(query.ports()).matches()) {
            throw new RedeploymentException(
                    RedeployFailureKind.INVALID_INPUT,
                    "Invalid port format",
                    "Ports must be in format \"hostPort:containerPort\" separated by commas"
            );
        }

        int memory = requireInt(query.memory(), "Invalid memory value", "Memory");
        int cpu = requireInt(query.cpu(), "Invalid CPU value", "CPU");

        return new RedeployRequest(
                instanceId,
                query.image(),
                memory,
                cpu,
                query.ports(),
                query.name(),
                query.user(),
                query.primary()
        );
    }

    /**
     * Parses the leading integer of {@code value}, ignoring any trailing text: {@code "512abc"} is 512.
     * Empty when there is no leading integer or it does not fit in an {@code int}.
     */
    public static OptionalInt parseLeadingInt(String value) {
        if (value == null) {
            return OptionalInt.empty();
        }
        Matcher matcher = LEADING_INTEGER.matcher(value);
        if (!matcher.find()) {
            return OptionalInt.empty();
        }
        try {
            return OptionalInt.of(Integer.parseInt(matcher.group(1)));
        } catch (NumberFormatException ex) {
            return OptionalInt.empty();
        }
    }

    /**
     * Extracts the actual image reference from a display value such as {@code "Node 20 (ghcr.io/skyport/node:20)"}.
     */
    public static Optional<String> extractImageName(String image) {
        if (image == null) {
            return Optional.empty();
        }
        Matcher matcher = IMAGE_NAME_IN_PARENS.matcher(image);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(matcher.group(1));
    }

    private static int requireInt(String value, String reason, String label) {
        OptionalInt parsed = parseLeadingInt(value);
        if (parsed.isPresent()) {
            return parsed.getAsInt();
        }
        if (LEADING_INTEGER.matcher(value).find()) {
            throw new RedeploymentException(RedeployFailureKind.INVALID_INPUT, reason, label + " is out of range");
        }
        throw new RedeploymentException(RedeployFailureKind.INVALID_INPUT, reason, label + " must be a number");
    }

    private void collectMissing(List<String> missing, String name, String value) {
        if (value == null || value.isEmpty()) {
            missing.add(name);
        }
    }
}
