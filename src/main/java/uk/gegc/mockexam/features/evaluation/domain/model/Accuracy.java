package uk.gegc.mockexam.features.evaluation.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Accuracy {

    private Accuracy() {
    }

    public static double percent(int correct, int attempted) {
        if (attempted <= 0) {
            return 0.0;
        }
        return round2(correct * 100.0 / attempted);
    }

    public static double round2(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
