/**
 * Failure tracking for remote speech engines.
 *
 * <p>{@link com.phillippitts.interviewpilot.service.speech.watchdog.EngineWatchdog} consumes
 * {@link com.phillippitts.interviewpilot.service.speech.watchdog.EngineFailureEvent}s and disables
 * an engine for a cooldown after repeated failures.
 */
package com.phillippitts.interviewpilot.service.speech.watchdog;
