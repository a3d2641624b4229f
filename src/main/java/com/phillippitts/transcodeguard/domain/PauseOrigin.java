package com.phillippitts.transcodeguard.domain;

/**
 * Who paused a job. Only policy pauses resume automatically.
 */
public enum PauseOrigin { POLICY, USER }
