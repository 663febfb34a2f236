package com.propertyintel.poi.rules;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Normalised popularity in [0, 1].
 *
 * score = ((rating - 1) / 4) * min(1, reviews / 1000), rounded to 2 decimals.
 * The product pulls both well-rated-but-unreviewed and heavily-reviewed-but-poorly-rated
 * places towards zero.
 */
@Component
public class PopularityScorer {

    private static final double REVIEW_SATURATION = 1000.0;

    public double score(Number rating, Number reviewCount) {
        if (!isFinite(rating) || !isFinite(reviewCount)) return 0.0;

        double normalizedRating = clamp((rating.doubleValue() - 1.0) / 4.0);
        double cappedReviews = clamp(reviewCount.doubleValue() / REVIEW_SATURATION);

        return BigDecimal.valueOf(normalizedRating * cappedReviews)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    private boolean isFinite(Number n) {
        return n != null && Double.isFinite(n.doubleValue());
    }

    private double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
