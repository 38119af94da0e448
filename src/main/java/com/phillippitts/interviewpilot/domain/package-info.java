/**
 * Immutable domain values of an interview session: plan items, exchanges, decisions and budget
 * snapshots.
 *
 * <p>Mutable session state lives in {@code service.session} and is written only by the session
 * state machine; everything in this package is a value that can be shared across threads.
 */
package com.phillippitts.interviewpilot.domain;
