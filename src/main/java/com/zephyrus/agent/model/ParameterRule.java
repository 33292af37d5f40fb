package com.zephyrus.agent.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * Constraint attached to one parameter (or to a read function's return value).
 * Numeric bounds are inclusive; {@code pattern} must match the whole string form.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParameterRule {
    private boolean required;
    private BigDecimal min;
    private BigDecimal max;
    @JsonAlias({"regex"})
    private String pattern;
    @JsonAlias({"allowedValues", "enum"})
    private List<String> allowedValues;
}
