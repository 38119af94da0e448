/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.interviewpilot.exception.InterviewPilotException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.interviewpilot.exception.InvalidPlanException} - Thrown when a
 *       question plan is malformed; rejected at session start</li>
 *   <li>{@link com.phillippitts.interviewpilot.exception.SpeechException} - Thrown when a speech
 *       engine call fails; {@link com.phillippitts.interviewpilot.exception.SpeechTimeoutException}
 *       when it times out</li>
 *   <li>{@link com.phillippitts.interviewpilot.exception.ScoringException} - Thrown when answer
 *       scoring fails or times out</li>
 *   <li>{@link com.phillippitts.interviewpilot.exception.SessionNotFoundException} and
 *       {@link com.phillippitts.interviewpilot.exception.IllegalSessionStateException} - REST
 *       boundary errors for unknown sessions and out-of-phase control signals</li>
 * </ul>
 *
 * <p>Speech and scoring exceptions are absorbed inside the session flow and never reach a caller.
 * Only plan and session-lookup errors are mapped to HTTP responses by {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.interviewpilot.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.interviewpilot.exception;
