/**
 * Speech I/O: synthesis and transcription behind one async adapter.
 *
 * <p>Candidate audio is PCM16LE mono at 16 kHz. A
 * {@link com.phillippitts.interviewpilot.service.speech.ListeningWindow} buffers one answer and
 * decides when the turn ends; {@link com.phillippitts.interviewpilot.service.speech.SpeechIoAdapter}
 * transcribes it under a timeout. Engine failures are reported to the watchdog and never reach the
 * session as exceptions other than {@code SpeechException}/{@code SpeechTimeoutException}.
 */
package com.phillippitts.interviewpilot.service.speech;
