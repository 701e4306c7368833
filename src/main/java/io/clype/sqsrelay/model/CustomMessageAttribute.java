package io.clype.sqsrelay.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single message attribute as it appears inside a topic notification envelope.
 *
 * @param type  the attribute data type (for example {@code String})
 * @param value the attribute value
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CustomMessageAttribute(
    @JsonProperty("Type") String type,
    @JsonProperty("Value") String value
) {}
