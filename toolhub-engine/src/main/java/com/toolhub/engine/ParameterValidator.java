package com.toolhub.engine;

import com.toolhub.tools.spec.ParameterKind;
import com.toolhub.tools.spec.ParameterSchema;
import com.toolhub.tools.spec.ParameterSpec;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Checks call arguments against a {@link ParameterSchema}.
 * <ul>
 *   <li>every required parameter must be present and non-null; all missing ones are reported</li>
 *   <li>present values must match a declared kind exactly (a numeric string is not a number)</li>
 *   <li>values of parameters with an enumeration must be one of its values</li>
 *   <li>arguments the schema does not declare are passed through unchecked</li>
 * </ul>
 * Stateless and thread-safe.
 */
public final class ParameterValidator {

    public ValidationResult validate(ParameterSchema schema, Map<String, Object> arguments) {
        if (schema == null || schema.isEmpty()) {
            return ValidationResult.valid();
        }
        Map<String, Object> args = arguments != null ? arguments : Map.of();
        List<String> errors = new ArrayList<>();

        for (String name : schema.getRequiredNames()) {
            if (args.get(name) == null) {
                errors.add("Missing required parameter: " + name);
            }
        }
        for (ParameterSpec param : schema.getParameters().values()) {
            String name = param.getName();
            if (!args.containsKey(name)) continue;
            Object value = args.get(name);
            if (value == null && !param.getKinds().contains(ParameterKind.NULL)) {
                // Absent for optional parameters; already reported for required ones.
                continue;
            }
            if (!param.acceptsKind(value)) {
                errors.add("Parameter '" + name + "' must be of type " + describe(param.getKinds())
                        + " but was " + kindOf(value));
                continue;
            }
            if (!param.getEnumValues().isEmpty() && !inEnum(value, param.getEnumValues())) {
                errors.add("Parameter '" + name + "' must be one of " + param.getEnumValues() + " but was " + value);
            }
        }
        return ValidationResult.of(errors);
    }

    private static boolean inEnum(Object value, List<Object> allowed) {
        for (Object candidate : allowed) {
            if (candidate == null ? value == null : candidate.equals(value)) return true;
            if (candidate instanceof Number && value instanceof Number
                    && toBigDecimal((Number) candidate).compareTo(toBigDecimal((Number) value)) == 0) {
                return true;
            }
        }
        return false;
    }

    private static BigDecimal toBigDecimal(Number n) {
        if (n instanceof BigDecimal) return (BigDecimal) n;
        if (n instanceof Double || n instanceof Float) return BigDecimal.valueOf(n.doubleValue());
        return new BigDecimal(n.toString());
    }

    private static String describe(List<ParameterKind> kinds) {
        if (kinds.size() == 1) return kinds.get(0).toJson();
        return kinds.stream().map(ParameterKind::toJson).collect(Collectors.joining(" or "));
    }

    private static String kindOf(Object value) {
        for (ParameterKind k : new ParameterKind[] {ParameterKind.NULL, ParameterKind.BOOLEAN, ParameterKind.STRING,
                ParameterKind.INTEGER, ParameterKind.NUMBER, ParameterKind.ARRAY, ParameterKind.OBJECT}) {
            if (k.matches(value)) return k.toJson();
        }
        return value.getClass().getSimpleName();
    }
}
