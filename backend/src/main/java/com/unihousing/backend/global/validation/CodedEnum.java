package com.unihousing.backend.global.validation;

/**
 * Enum exposed on the wire as a lower-case code ({@code in_progress}) while stored by name.
 * Implementations annotate {@link #getCode()} with {@code @JsonValue}.
 */
public interface CodedEnum {

    String getCode();
}
