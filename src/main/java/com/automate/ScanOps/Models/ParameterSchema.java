package com.automate.ScanOps.Models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One entry of a manifest's {@code argsSchema}.
 *
 * @param type         declared runtime type of the value
 * @param required     whether the caller must supply a non-null value
 * @param enumValues   allowed values (compared on their text form), or null
 * @param pattern      regular expression a string value must contain a match for, or null
 * @param defaultValue value filled in when the caller omits the parameter, or null
 * @param description  free text for clients
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParameterSchema(
        ParameterType type,
        boolean required,
        @JsonProperty("enum") List<Object> enumValues,
        String pattern,
        @JsonProperty("default") Object defaultValue,
        String description
) {

    public static ParameterSchema of(ParameterType type) {
        return new ParameterSchema(type, false, null, null, null, null);
    }

    public ParameterSchema asRequired() {
        return new ParameterSchema(type, true, enumValues, pattern, defaultValue, description);
    }

    public ParameterSchema withEnum(List<Object> values) {
        return new ParameterSchema(type, required, values, pattern, defaultValue, description);
    }

    public ParameterSchema withPattern(String regex) {
        return new ParameterSchema(type, required, enumValues, regex, defaultValue, description);
    }

    public ParameterSchema withDefault(Object value) {
        return new ParameterSchema(type, required, enumValues, pattern, value, description);
    }
}
