package com.demanddna.engine;

import java.util.Arrays;
import java.util.Optional;

/**
 * Campaign-response curves. {@code elapsed} is whole days since the shock started and
 * {@code duration} the inclusive day count, so {@code p = elapsed / duration} stays below 1.
 */
public enum ShockShape {

    FRONT_LOADED("Email Campaign") {
        @Override
        public double weight(double elapsed, double duration) {
            return Math.exp(-3.0 * progress(elapsed, duration));
        }
    },
    LINEAR_FADE("Flash Sale") {
        @Override
        public double weight(double elapsed, double duration) {
            return 1.0 - progress(elapsed, duration);
        }
    },
    DELAYED_PEAK("Product Launch") {
        @Override
        public double weight(double elapsed, double duration) {
            double centre = 0.4 * duration;
            double sigma = 0.3 * duration;
            if (sigma <= 0) {
                return 0.0;
            }
            return Math.exp(-Math.pow(elapsed - centre, 2) / (2 * sigma * sigma));
        }
    },
    STEP("Awareness Drive") {
        @Override
        public double weight(double elapsed, double duration) {
            return 1.0;
        }
    };

    private final String campaignLabel;

    ShockShape(String campaignLabel) {
        this.campaignLabel = campaignLabel;
    }

    public String getCampaignLabel() {
        return campaignLabel;
    }

    public abstract double weight(double elapsed, double duration);

    public static Optional<ShockShape> fromCampaignLabel(String label) {
        return Arrays.stream(values())
            .filter(shape -> shape.campaignLabel.equalsIgnoreCase(label) || shape.name().equalsIgnoreCase(label))
            .findFirst();
    }

    static double progress(double elapsed, double duration) {
        return duration > 0 ? elapsed / duration : 0.0;
    }
}
