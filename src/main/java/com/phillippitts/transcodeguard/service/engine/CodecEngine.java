package com.phillippitts.transcodeguard.service.engine;

import com.phillippitts.transcodeguard.domain.InputDescriptor;
import com.phillippitts.transcodeguard.domain.OutputTarget;
import com.phillippitts.transcodeguard.exception.EngineException;

/**
 * Transcoding backend. The coordinator drives it and observes it; it never encodes itself.
 *
 * <p>After {@link #begin} returns, the engine reports {@link ProgressEvent}s and exactly one
 * terminal {@link EngineResult} to the listener, from a thread of its choosing.
 */
public interface CodecEngine {

    /**
     * Starts converting {@code input} into {@code output}.
     *
     * @param input source description
     * @param output destination and encode parameters
     * @param listener receives progress and the terminal result
     * @return handle for controlling the running conversion
     * @throws EngineException if the conversion could not be started
     */
    EngineHandle begin(InputDescriptor input, OutputTarget output, EngineListener listener);

    /**
     * Engine name used in logs and failure reasons.
     */
    String getEngineName();
}
