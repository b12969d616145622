package com.hegel.fusion.core;

/**
 * Maps a crisp value to a membership degree in [0,1].
 * <p>
 * Bounded shapes ({@link Triangular}, {@link Trapezoidal}) return 0 outside their outer bounds.
 * A shoulder whose foot coincides with its peak (e.g. {@code low == peak}) is treated as fully
 * satisfied at the peak itself, so the edge terms of a universe reach 1 at the universe bounds.
 * </p>
 */
public sealed interface MembershipFunction
        permits MembershipFunction.Triangular,
                MembershipFunction.Trapezoidal,
                MembershipFunction.Gaussian,
                MembershipFunction.Sigmoid {

    double membership(double value);

    record Triangular(double low, double peak, double high) implements MembershipFunction {
        @Override
        public double membership(double value) {
            if (value == peak) return 1.0;
            if (value <= low || value >= high) return 0.0;
            if (value < peak) {
                return (value - low) / (peak - low);
            }
            return (high - value) / (high - peak);
        }
    }

    record Trapezoidal(double low, double lowPeak, double highPeak, double high) implements MembershipFunction {
        @Override
        public double membership(double value) {
            if (value >= lowPeak && value <= highPeak) return 1.0;
            if (value <= low || value >= high) return 0.0;
            if (value < lowPeak) {
                return (value - low) / (lowPeak - low);
            }
            return (high - value) / (high - highPeak);
        }
    }

    record Gaussian(double center, double sigma) implements MembershipFunction {
        @Override
        public double membership(double value) {
            double z = (value - center) / sigma;
            return Math.exp(-0.5 * z * z);
        }
    }

    record Sigmoid(double center, double slope) implements MembershipFunction {
        @Override
        public double membership(double value) {
            return 1.0 / (1.0 + Math.exp(-slope * (value - center)));
        }
    }
}
