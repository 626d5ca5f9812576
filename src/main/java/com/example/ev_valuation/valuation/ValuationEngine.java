package com.example.ev_valuation.valuation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import com.example.ev_valuation.catalog.ReferenceCatalog;
import com.example.ev_valuation.catalog.VehicleArchetype;

import lombok.RequiredArgsConstructor;

/**
 * Depreciation model: exponential by elapsed years, linear by mileage, clamped
 * to [0.8 x MIN_RETENTION, 1.05] of the archetype base price.
 *
 * <p>Stateless; "now" comes from the injected clock.
 */
@Component
@RequiredArgsConstructor
public class ValuationEngine {

    private static final Logger log = LoggerFactory.getLogger(ValuationEngine.class);

    public static final String CURRENCY = "EUR";

    static final double ANNUAL_DEPRECIATION = 0.07;
    static final double PER_10K_DEPRECIATION = 0.015;
    static final double MILEAGE_BUCKET = 10000;
    static final double MIN_RETENTION = 0.35;

    static final BigDecimal DEFAULT_ESTIMATE = new BigDecimal("10000.00");
    static final BigDecimal DEFAULT_CONFIDENCE = new BigDecimal("0.50");

    private static final BigDecimal CONFIDENCE_MAX = new BigDecimal("0.9");
    private static final BigDecimal CONFIDENCE_MIN = new BigDecimal("0.5");
    private static final BigDecimal CONFIDENCE_PER_YEAR_GAP = new BigDecimal("0.06");
    private static final BigDecimal MILEAGE_PENALTY_CAP = new BigDecimal("0.5");
    private static final BigDecimal MILEAGE_PENALTY_KM = new BigDecimal("200000");

    private final ReferenceCatalog catalog;
    private final Clock clock;

    public ValuationResult evaluate(ValuationRequest req) {
        int mileage = req.getMileageKm() == null ? 0 : req.getMileageKm();
        LocalDate now = LocalDate.now(clock);
        LocalDate registered = parseRegistration(req.getFirstRegistration());
        double years = registered == null ? 0.0 : yearsSince(registered, now);

        Optional<VehicleArchetype> match = catalog.find(req.getMake(), req.getModel());
        if (match.isEmpty()) {
            log.info("No archetype for '{}' / '{}', returning default valuation",
                    req.getMake(), req.getModel());
            return ValuationResult.builder()
                    .estimate(DEFAULT_ESTIMATE)
                    .confidence(DEFAULT_CONFIDENCE)
                    .path(ValuationPath.DEFAULT)
                    .registrationParsed(registered != null)
                    .years(years)
                    .build();
        }

        VehicleArchetype a = match.get();
        double basePrice = a.getBasePrice().doubleValue();

        double yearFactor = Math.pow(1 - ANNUAL_DEPRECIATION, years);
        double mileageBlocks = mileage / MILEAGE_BUCKET;
        // unbounded below; the clamp floor absorbs very high mileage
        double mileageFactor = 1 - PER_10K_DEPRECIATION * mileageBlocks;

        double raw = basePrice * yearFactor * mileageFactor;
        double minValue = basePrice * MIN_RETENTION;
        double estimate = clamp(raw, minValue * 0.8, basePrice * 1.05);

        int registrationYear = registered == null ? now.getYear() : registered.getYear();
        int yearGap = Math.abs(registrationYear - a.getYear0());

        BigDecimal mileagePenalty = BigDecimal.valueOf(mileage)
                .divide(MILEAGE_PENALTY_KM, 10, RoundingMode.HALF_UP)
                .min(MILEAGE_PENALTY_CAP);
        BigDecimal confidence = CONFIDENCE_MAX
                .subtract(CONFIDENCE_PER_YEAR_GAP.multiply(BigDecimal.valueOf(yearGap)))
                .subtract(mileagePenalty)
                .max(CONFIDENCE_MIN)
                .min(CONFIDENCE_MAX);

        ValuationResult result = ValuationResult.builder()
                .estimate(BigDecimal.valueOf(estimate).setScale(2, RoundingMode.HALF_UP))
                .confidence(confidence.setScale(2, RoundingMode.HALF_UP))
                .path(ValuationPath.MATCHED)
                .registrationParsed(registered != null)
                .years(years)
                .build();

        log.debug("Valuation {} / {}: years={}, km={}, base={}, raw={}, estimate={}, confidence={}",
                a.getMake(), a.getModel(), years, mileage, a.getBasePrice(), raw,
                result.getEstimate(), result.getConfidence());
        return result;
    }

    /**
     * Whole months between the two dates (day-of-month ignored) in years,
     * never negative.
     */
    static double yearsSince(LocalDate registered, LocalDate now) {
        int months = (now.getYear() - registered.getYear()) * 12
                + (now.getMonthValue() - registered.getMonthValue());
        return Math.max(0.0, months / 12.0);
    }

    /**
     * Only the date portion (first 10 chars) is significant. Returns null when
     * absent or unparseable.
     */
    static LocalDate parseRegistration(String iso) {
        if (iso == null || iso.isBlank()) {
            return null;
        }
        String s = iso.trim();
        try {
            return LocalDate.parse(s.length() > 10 ? s.substring(0, 10) : s);
        } catch (DateTimeParseException e) {
            log.debug("Unparseable firstRegistration '{}', treating elapsed time as zero", iso);
            return null;
        }
    }

    private static double clamp(double v, double lo, double hi) {
        return Math.max(lo, Math.min(hi, v));
    }
}
