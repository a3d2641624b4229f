package com.phillippitts.transcodeguard.service.engine;

/**
 * Engine-side callbacks. Implementations handed out by the coordinator only enqueue.
 */
public interface EngineListener {

    void onProgress(ProgressEvent event);

    /** Called exactly once per conversion. */
    void onResult(EngineResult result);
}
