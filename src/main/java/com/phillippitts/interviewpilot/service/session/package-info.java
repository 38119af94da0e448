/**
 * Session core: the state machine that owns session state, the conductor that drives it through
 * speech and decisions, and the registry of live and archived sessions.
 */
package com.phillippitts.interviewpilot.service.session;
