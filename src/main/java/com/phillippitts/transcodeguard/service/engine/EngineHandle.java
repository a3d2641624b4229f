package com.phillippitts.transcodeguard.service.engine;

import java.util.concurrent.CompletableFuture;

/**
 * Control surface for one running conversion.
 */
public interface EngineHandle {

    /**
     * Asks the engine to stop. Cooperative: the returned future completes when the engine has
     * actually stopped and may never complete if the engine is wedged.
     *
     * @return completes on stop acknowledgement
     */
    CompletableFuture<Void> stop();

    /**
     * Runs the conversion at reduced intensity while {@code throttled} is true.
     */
    void setThrottled(boolean throttled);

    /** Suspends work without discarding progress. */
    void pause();

    /** Continues after {@link #pause()}. */
    void resume();
}
