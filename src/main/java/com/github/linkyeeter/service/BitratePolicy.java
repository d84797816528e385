package com.github.linkyeeter.service;

import com.github.linkyeeter.config.LinkYeeterProperties;
import com.github.linkyeeter.exception.QualityDegradationException;
import com.github.linkyeeter.model.BitrateDecision;
import com.github.linkyeeter.model.ProbeMetadata;
import com.github.linkyeeter.util.MediaConstants;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Decides the video bitrate a source is encoded at so the result fits the upload limit.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BitratePolicy {

    private final LinkYeeterProperties properties;

    /**
     * Highest video bitrate fitting the upload limit over the given duration, audio and
     * container overhead subtracted. Never negative.
     *
     * @param durationSeconds Clip duration
     * @return Bitrate in kbps, or empty when the duration is unknown
     */
    public Optional<Long> maxBitrateKbps(long durationSeconds) {
        if (durationSeconds <= 0) {
            return Optional.empty();
        }
        LinkYeeterProperties.Processing processing = properties.getProcessing();

        double capacityKbps = (double) (processing.getUploadLimitMb() * MediaConstants.KILOBITS_PER_MB)
                / durationSeconds;
        double withAudioReserved = capacityKbps - processing.getAudioBitrateKbps();
        long maxBitrate = (long) Math.floor(withAudioReserved * processing.getContainerOverheadFactor());

        return Optional.of(Math.max(0, maxBitrate));
    }

    /**
     * Decide how to encode a source.
     *
     * @param metadata Probe result of the source
     * @param enableFallback Whether the requester accepts any quality loss
     * @return Decision with the target bitrate
     * @throws QualityDegradationException if the quality loss exceeds the cutoff and fallback is off
     */
    public BitrateDecision decide(@NonNull ProbeMetadata metadata, boolean enableFallback) {
        if (!metadata.hasDuration()) {
            log.debug("Duration unknown, encoding without a bitrate constraint");
            return BitrateDecision.unconstrained(null);
        }

        long maxBitrate = maxBitrateKbps(metadata.getDurationSeconds()).orElseThrow();
        long originalBitrate = metadata.getBitrateKbps();

        // an unknown original bitrate yields a zero cutoff, which never rejects
        long cutoff = (long) Math.floor(originalBitrate * properties.getProcessing().getQualityCutoffRatio());
        if (maxBitrate < cutoff) {
            if (!enableFallback) {
                throw new QualityDegradationException(maxBitrate, cutoff, originalBitrate);
            }
            log.warn("Bitrate {} kbps is below cutoff {} kbps (original {} kbps), proceeding in fallback mode",
                    maxBitrate, cutoff, originalBitrate);
        }

        if (originalBitrate < maxBitrate) {
            return BitrateDecision.unconstrained(maxBitrate);
        }
        return BitrateDecision.reducedTo(maxBitrate);
    }
}
