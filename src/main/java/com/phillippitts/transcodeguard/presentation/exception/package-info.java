/**
 * Maps domain exceptions to HTTP error responses.
 */
package com.phillippitts.transcodeguard.presentation.exception;
