package com.phillippitts.transcodeguard.domain;

import java.util.Objects;

/**
 * Caller's request to convert one input into one output.
 */
public record ConversionRequest(InputDescriptor input, OutputTarget output) {

    public ConversionRequest {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(output, "output");
    }
}
