package at.sv.solar.time;

import at.sv.solar.FormatUtil;
import at.sv.solar.SunEvent;
import at.sv.solar.SunTimes;
import at.sv.solar.SunTimesCalculator;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.stream.Collectors;

@Slf4j
public final class SunTimesProviderImpl implements SunTimesProvider {

    private static final long MAX_CACHED_DAYS = 366;

    private final double lat;
    private final double lng;

    private final Cache<LocalDate, SunTimes> cache;

    public SunTimesProviderImpl(double lat, double lng) {
        this.lat = lat;
        this.lng = lng;
        cache = Caffeine.newBuilder()
                        .maximumSize(MAX_CACHED_DAYS)
                        .build();
    }

    @Override
    public SunTimes getSunTimes(LocalDate date) {
        return cache.get(date, this::calculate);
    }

    private SunTimes calculate(LocalDate date) {
        SunTimes sunTimes = SunTimesCalculator.calculate(lat, lng, date);
        log.debug("Calculated sun times for {} at {},{}: noon={}, sunrise={}, sunset={}", date, lat, lng,
                sunTimes.noon(), sunTimes.sunrise().orElse(null), sunTimes.sunset().orElse(null));
        return sunTimes;
    }

    @Override
    public String toDebugString(LocalDate date) {
        SunTimes sunTimes = getSunTimes(date);
        return Arrays.stream(SunEvent.values())
                     .map(event -> event.getKeyword() + ": " + FormatUtil.formatTimeOfDay(sunTimes.get(event)))
                     .collect(Collectors.joining("\n"));
    }

    @Override
    public void clearCache() {
        cache.invalidateAll();
    }
}
