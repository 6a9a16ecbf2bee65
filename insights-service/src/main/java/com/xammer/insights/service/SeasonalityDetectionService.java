package com.xammer.insights.service;

import com.xammer.insights.dto.PatternType;
import com.xammer.insights.dto.SeasonalPattern;
import com.xammer.insights.dto.SeasonalityCheck;
import com.xammer.insights.exception.InsufficientDataException;
import com.xammer.insights.exception.InvalidInputException;
import com.xammer.insights.util.Statistics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.TextStyle;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Detects daily, weekly and monthly periodicity in utilization series.
 */
@Service
public class SeasonalityDetectionService {

    private static final Logger logger = LoggerFactory.getLogger(SeasonalityDetectionService.class);

    static final int DAILY_LAG = 24;
    static final int WEEKLY_LAG = 168;
    static final double DAILY_CORRELATION = 0.5;
    static final double WEEKLY_CORRELATION = 0.4;
    static final double MIN_PATTERN_STRENGTH = 0.3;

    private static final long WEEK_MILLIS = Duration.ofDays(7).toMillis();

    private final Clock clock;

    public SeasonalityDetectionService(Clock clock) {
        this.clock = clock;
    }

    /**
     * Autocorrelation check assuming one sample per hour. Daily periodicity is accepted at a
     * lower correlation than weekly since it is the common case.
     */
    public SeasonalityCheck detectSeasonalPattern(double[] series) {
        Statistics.requireNonNull(series, "Series");
        if (series.length < DAILY_LAG) {
            throw new InsufficientDataException("seasonality detection", series.length, DAILY_LAG);
        }
        double dailyCorrelation = Statistics.autocorrelation(series, DAILY_LAG);
        double weeklyCorrelation = series.length >= WEEKLY_LAG ? Statistics.autocorrelation(series, WEEKLY_LAG) : 0;

        if (dailyCorrelation > DAILY_CORRELATION) {
            return new SeasonalityCheck(PatternType.DAILY, dailyCorrelation);
        }
        if (weeklyCorrelation > WEEKLY_CORRELATION) {
            return new SeasonalityCheck(PatternType.WEEKLY, weeklyCorrelation);
        }
        return SeasonalityCheck.NONE;
    }

    public SeasonalityCheck detectSeasonalPattern(List<Double> series) {
        return detectSeasonalPattern(Statistics.toArray(series));
    }

    /**
     * Profiles a timestamped series by hour of day, weekday and 7-day bucket and reports the
     * strongest of the three.
     */
    public SeasonalPattern analyzeSeasonalPatterns(List<Double> series, List<Instant> timestamps) {
        try {
            double[] values = Statistics.toArray(series);
            Statistics.requireNoNullElements(timestamps, "Timestamps");
            if (values.length != timestamps.size()) {
                throw new InvalidInputException("Metric history and timestamps must have the same length");
            }
            if (values.length == 0) {
                throw new InsufficientDataException("seasonal pattern analysis", 0, 1);
            }

            List<ZonedDateTime> times = timestamps.stream()
                    .map(ts -> ts.atZone(clock.getZone()))
                    .collect(Collectors.toList());

            Profile hourly = hourlyProfile(values, times);
            Profile daily = dailyProfile(values, times);
            Profile weekly = weeklyProfile(values, timestamps);

            Profile strongest = hourly;
            for (Profile candidate : List.of(daily, weekly)) {
                if (candidate.strength > strongest.strength) {
                    strongest = candidate;
                }
            }
            logger.debug("Seasonality strengths - hourly: {}, daily: {}, weekly: {}",
                    hourly.strength, daily.strength, weekly.strength);

            if (strongest.strength < MIN_PATTERN_STRENGTH) {
                return SeasonalPattern.NONE;
            }

            return SeasonalPattern.builder()
                    .pattern(strongest.type)
                    .peakHours(strongest.type == PatternType.DAILY ? hourly.peakHours : null)
                    .peakDays(strongest.type == PatternType.WEEKLY ? daily.peakDays : null)
                    .seasonalityStrength(strongest.strength)
                    .nextPeakPrediction(strongest.type == PatternType.DAILY ? nextPeak(hourly.peakHours.get(0)) : null)
                    .build();
        } catch (RuntimeException e) {
            logger.error("Error analyzing seasonal patterns", e);
            throw e;
        }
    }

    private Profile hourlyProfile(double[] values, List<ZonedDateTime> times) {
        Map<Integer, List<Double>> byHour = new TreeMap<>();
        for (int i = 0; i < values.length; i++) {
            byHour.computeIfAbsent(times.get(i).getHour(), hour -> new ArrayList<>()).add(values[i]);
        }
        Map<Integer, Double> averages = averages(byHour);
        Profile profile = new Profile(PatternType.DAILY, strength(averages));
        profile.peakHours = topKeys(averages, 0.25);
        return profile;
    }

    private Profile dailyProfile(double[] values, List<ZonedDateTime> times) {
        // Sunday first, so equal averages rank Sunday ahead of Monday
        Map<Integer, List<Double>> byDay = new TreeMap<>();
        for (int i = 0; i < values.length; i++) {
            int day = times.get(i).getDayOfWeek().getValue() % 7;
            byDay.computeIfAbsent(day, d -> new ArrayList<>()).add(values[i]);
        }
        Map<Integer, Double> averages = averages(byDay);
        Profile profile = new Profile(PatternType.WEEKLY, strength(averages));
        profile.peakDays = topKeys(averages, 0.3).stream()
                .map(SeasonalityDetectionService::dayName)
                .collect(Collectors.toList());
        return profile;
    }

    private Profile weeklyProfile(double[] values, List<Instant> timestamps) {
        Map<Long, List<Double>> byWeek = new TreeMap<>();
        for (int i = 0; i < values.length; i++) {
            long week = Math.floorDiv(timestamps.get(i).toEpochMilli(), WEEK_MILLIS);
            byWeek.computeIfAbsent(week, w -> new ArrayList<>()).add(values[i]);
        }
        if (byWeek.size() < 2) {
            return new Profile(PatternType.MONTHLY, 0);
        }
        return new Profile(PatternType.MONTHLY, strength(averages(byWeek)));
    }

    /**
     * Next time the given hour starts, rolling over to tomorrow when it has already begun today.
     */
    private Instant nextPeak(int hour) {
        ZonedDateTime now = ZonedDateTime.now(clock);
        ZonedDateTime peak = now.truncatedTo(ChronoUnit.DAYS).withHour(hour);
        if (!peak.isAfter(now)) {
            peak = peak.plusDays(1);
        }
        return peak.toInstant();
    }

    private static <K> Map<K, Double> averages(Map<K, List<Double>> grouped) {
        Map<K, Double> averages = new TreeMap<>();
        grouped.forEach((key, bucket) -> averages.put(key,
                bucket.stream().mapToDouble(Double::doubleValue).average().orElse(0)));
        return averages;
    }

    private static double strength(Map<?, Double> averages) {
        double[] values = averages.values().stream().mapToDouble(Double::doubleValue).toArray();
        return Statistics.variationStrength(values);
    }

    // keys ordered by descending average; the sort is stable, so ties keep ascending key order
    private static List<Integer> topKeys(Map<Integer, Double> averages, double fraction) {
        int count = (int) Math.ceil(averages.size() * fraction);
        return averages.entrySet().stream()
                .sorted(Map.Entry.<Integer, Double>comparingByValue(Comparator.reverseOrder()))
                .limit(count)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    private static String dayName(int sundayBasedDay) {
        DayOfWeek day = sundayBasedDay == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(sundayBasedDay);
        return day.getDisplayName(TextStyle.FULL, Locale.ENGLISH);
    }

    private static final class Profile {
        private final PatternType type;
        private final double strength;
        private List<Integer> peakHours;
        private List<String> peakDays;

        private Profile(PatternType type, double strength) {
            this.type = type;
            this.strength = strength;
        }
    }
}
