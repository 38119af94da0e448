package com.phillippitts.interviewpilot.service.speech;

/**
 * Voice activity analysis of PCM16LE mono chunks.
 *
 * <p><b>Algorithm:</b>
 * <ol>
 *   <li>Divide the chunk into 20 ms windows (the last window may be shorter)</li>
 *   <li>Calculate RMS amplitude for each window</li>
 *   <li>Windows with RMS below the threshold are silence (typically 500-1000 for 16-bit PCM)</li>
 *   <li>Report whether any window was voiced and how many bytes of silence end the chunk</li>
 * </ol>
 *
 * <p>Callers accumulate results across chunks to detect a trailing-silence end of turn.
 */
public final class AudioSilenceDetector {

    /**
     * Default RMS amplitude threshold for silence detection.
     */
    public static final int DEFAULT_SILENCE_THRESHOLD = 800;

    /**
     * Window size for RMS analysis (milliseconds).
     */
    static final int WINDOW_MS = 20;

    private static final int WINDOW_BYTES =
            (AudioFormat.REQUIRED_SAMPLE_RATE * WINDOW_MS / 1000) * AudioFormat.REQUIRED_BLOCK_ALIGN;

    private AudioSilenceDetector() {
        // Utility class
    }

    /**
     * Result of analysing one chunk.
     *
     * @param voiced              whether any window exceeded the threshold
     * @param trailingSilentBytes bytes of silence at the end of the chunk (the whole chunk if not voiced)
     */
    public record ChunkAnalysis(boolean voiced, int trailingSilentBytes) {
    }

    /**
     * Analyses one PCM16LE mono chunk.
     *
     * @param pcm              chunk bytes (odd trailing byte is ignored)
     * @param silenceThreshold RMS amplitude threshold for silence (0-32767 for 16-bit PCM)
     * @return analysis result; an empty or null chunk is silent with zero length
     */
    public static ChunkAnalysis analyze(byte[] pcm, int silenceThreshold) {
        if (pcm == null || pcm.length < 2) {
            return new ChunkAnalysis(false, pcm == null ? 0 : pcm.length);
        }
        boolean voiced = false;
        int trailingSilent = 0;
        int pos = 0;
        while (pos < pcm.length) {
            int length = Math.min(WINDOW_BYTES, pcm.length - pos);
            double rms = calculateRMS(pcm, pos, length);
            if (rms < silenceThreshold) {
                trailingSilent += length;
            } else {
                voiced = true;
                trailingSilent = 0;
            }
            pos += length;
        }
        return new ChunkAnalysis(voiced, trailingSilent);
    }

    /**
     * Calculates RMS (Root Mean Square) amplitude for a PCM audio window.
     *
     * @param pcmData PCM16LE audio buffer
     * @param offset  starting byte position
     * @param length  number of bytes to analyze
     * @return RMS amplitude (0-32767 range for 16-bit PCM)
     */
    static double calculateRMS(byte[] pcmData, int offset, int length) {
        long sumSquares = 0;
        int sampleCount = 0;

        for (int i = offset; i + 1 < offset + length && i + 1 < pcmData.length; i += 2) {
            // little-endian signed 16-bit sample
            int sample = (pcmData[i] & 0xFF) | (pcmData[i + 1] << 8);
            sumSquares += (long) sample * sample;
            sampleCount++;
        }

        if (sampleCount == 0) {
            return 0;
        }

        return Math.sqrt((double) sumSquares / sampleCount);
    }
}
