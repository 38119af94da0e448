/**
 * Suspend points and cancellation.
 *
 * <p>All async calls a session makes are started through
 * {@link com.phillippitts.interviewpilot.service.async.TimedCalls}, which ties each one to the
 * session's {@link com.phillippitts.interviewpilot.service.async.CancellationScope} and a clock
 * timeout. Session steps run on a per-session
 * {@link com.phillippitts.interviewpilot.service.async.SerialExecutor}.
 */
package com.phillippitts.interviewpilot.service.async;
