package com.zephyrus.agent.service;

import com.zephyrus.agent.model.ContractFunction;
import com.zephyrus.agent.model.FunctionParameter;
import com.zephyrus.agent.model.ParameterRule;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Checks decision-supplied arguments against a function's per-parameter rules.
 * Reports only the first violated constraint.
 */
@Component
public class ParameterValidator {

    /**
     * Fills in declared defaults, in declaration order.
     */
    public Map<String, Object> resolveArguments(ContractFunction function, Map<String, Object> supplied) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (FunctionParameter parameter : function.getParameters()) {
            Object value = supplied.get(parameter.getName());
            resolved.put(parameter.getName(), value != null ? value : parameter.getDefaultValue());
        }
        return resolved;
    }

    public Optional<String> firstViolation(ContractFunction function, Map<String, Object> supplied) {
        for (String name : supplied.keySet()) {
            boolean declared = function.getParameters().stream().anyMatch(p -> p.getName().equals(name));
            if (!declared) {
                return Optional.of("unknown parameter '" + name + "' for " + function.getName());
            }
        }

        Map<String, Object> arguments = resolveArguments(function, supplied);
        for (FunctionParameter parameter : function.getParameters()) {
            String name = parameter.getName();
            Object value = arguments.get(name);
            ParameterRule rule = function.getValidationRules().get(name);

            if (value == null) {
                return Optional.of(rule != null && rule.isRequired()
                    ? "parameter '" + name + "' is required"
                    : "parameter '" + name + "' has no value and no default");
            }
            if (rule != null) {
                Optional<String> violation = check("parameter '" + name + "'", value, rule);
                if (violation.isPresent()) {
                    return violation;
                }
            }
        }
        return Optional.empty();
    }

    public Optional<String> checkReturnValue(ContractFunction function, Object value) {
        ParameterRule rule = function.getReturnRule();
        if (rule == null) {
            return Optional.empty();
        }
        if (value == null) {
            return rule.isRequired() ? Optional.of("return value is required") : Optional.empty();
        }
        return check("return value", value, rule);
    }

    public List<Object> orderedArguments(ContractFunction function, Map<String, Object> supplied) {
        return new ArrayList<>(resolveArguments(function, supplied).values());
    }

    Optional<String> check(String label, Object value, ParameterRule rule) {
        String text = String.valueOf(value);

        if (rule.getAllowedValues() != null && !rule.getAllowedValues().isEmpty()
            && !rule.getAllowedValues().contains(text)) {
            return Optional.of(label + " must be one of " + rule.getAllowedValues());
        }

        if (rule.getPattern() != null) {
            try {
                if (!Pattern.compile(rule.getPattern()).matcher(text).matches()) {
                    return Optional.of(label + " does not match pattern " + rule.getPattern());
                }
            } catch (PatternSyntaxException e) {
                return Optional.of(label + " has an invalid pattern rule: " + e.getDescription());
            }
        }

        if (rule.getMin() != null || rule.getMax() != null) {
            BigDecimal number = toNumber(value);
            if (number == null) {
                return Optional.of(label + " must be numeric");
            }
            if (rule.getMin() != null && number.compareTo(rule.getMin()) < 0) {
                return Optional.of(label + " is below minimum " + rule.getMin().toPlainString());
            }
            if (rule.getMax() != null && number.compareTo(rule.getMax()) > 0) {
                return Optional.of(label + " exceeds maximum " + rule.getMax().toPlainString());
            }
        }
        return Optional.empty();
    }

    private static BigDecimal toNumber(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        try {
            return new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
