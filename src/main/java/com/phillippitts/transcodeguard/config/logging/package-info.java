/**
 * Logging support: request correlation values in the Log4j2 ThreadContext.
 */
package com.phillippitts.transcodeguard.config.logging;
