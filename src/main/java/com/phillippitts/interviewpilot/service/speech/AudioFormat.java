package com.phillippitts.interviewpilot.service.speech;

import java.time.Duration;

/**
 * Audio format used on the candidate channel and for engine uploads.
 *
 * <p>Format: 16 kHz, 16-bit signed PCM, mono, little-endian.
 */
public final class AudioFormat {

    public static final int REQUIRED_SAMPLE_RATE = 16_000;
    public static final int REQUIRED_BITS_PER_SAMPLE = 16;
    public static final int REQUIRED_CHANNELS = 1;
    public static final int REQUIRED_BLOCK_ALIGN = REQUIRED_CHANNELS * (REQUIRED_BITS_PER_SAMPLE / 8);
    public static final int REQUIRED_BYTE_RATE = REQUIRED_SAMPLE_RATE * REQUIRED_BLOCK_ALIGN;

    private AudioFormat() {
    }

    /**
     * Number of PCM bytes that cover {@code duration}, aligned to whole samples.
     */
    public static long bytesFor(Duration duration) {
        long bytes = duration.toMillis() * REQUIRED_BYTE_RATE / 1000;
        return bytes - (bytes % REQUIRED_BLOCK_ALIGN);
    }

    /**
     * Playback length of {@code bytes} PCM bytes.
     */
    public static Duration durationOf(long bytes) {
        return Duration.ofMillis(bytes * 1000 / REQUIRED_BYTE_RATE);
    }
}
