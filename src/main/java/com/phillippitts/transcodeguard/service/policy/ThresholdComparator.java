package com.phillippitts.transcodeguard.service.policy;

/**
 * How a measured value is compared with a threshold limit. The rule trips when
 * {@code value <op> limit} holds.
 */
public enum ThresholdComparator {
    LESS_THAN {
        @Override
        public boolean test(double value, double limit) {
            return value < limit;
        }
    },
    LESS_THAN_OR_EQUAL {
        @Override
        public boolean test(double value, double limit) {
            return value <= limit;
        }
    },
    GREATER_THAN {
        @Override
        public boolean test(double value, double limit) {
            return value > limit;
        }
    },
    GREATER_THAN_OR_EQUAL {
        @Override
        public boolean test(double value, double limit) {
            return value >= limit;
        }
    };

    public abstract boolean test(double value, double limit);
}
