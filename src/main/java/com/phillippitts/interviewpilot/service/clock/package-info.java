/**
 * Time source and timers.
 *
 * <p>Every time-dependent decision in a session reads {@link
 * com.phillippitts.interviewpilot.service.clock.InterviewClock#now()} and every timeout is a timer
 * from the same clock.
 */
package com.phillippitts.interviewpilot.service.clock;
