package at.sv.solar.astro;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class JulianDayTest {

    @Test
    void fromDate_unixEpoch_isClassicalOffset() {
        assertThat(JulianDay.fromDate(LocalDate.of(1970, 1, 1)).days()).isEqualTo(2440587.5);
    }

    @Test
    void fromDate_isAtUtcMidnight() {
        assertThat(JulianDay.fromDate(LocalDate.of(2000, 1, 1)).days()).isEqualTo(2451544.5);
        assertThat(JulianDay.fromDate(LocalDate.of(2022, 10, 15)).days()).isEqualTo(2459867.5);
    }

    @Test
    void fromDate_beforeUnixEpoch() {
        assertThat(JulianDay.fromDate(LocalDate.of(1969, 12, 31)).days()).isEqualTo(2440586.5);
    }

    @Test
    void fromAngle_fullTurnIsOneDay() {
        assertThat(JulianDay.fromAngle(Angle.ofDegrees(360)).days()).isCloseTo(1.0, within(1e-15));
        assertThat(JulianDay.fromAngle(Angle.ofDegrees(90)).days()).isCloseTo(0.25, within(1e-15));
        assertThat(JulianDay.fromAngle(Angle.ofRadians(Math.PI)).days()).isCloseTo(0.5, within(1e-15));
        assertThat(JulianDay.fromAngle(Angle.ofDegrees(-180)).days()).isCloseTo(-0.5, within(1e-15));
    }

    @Test
    void fromAngle_nan_staysNaN() {
        assertThat(JulianDay.fromAngle(Angle.ofRadians(Double.NaN)).isNaN()).isTrue();
    }

    @Test
    void toDuration_wholeSeconds() {
        assertThat(new JulianDay(0.25).toDuration()).isEqualTo(Duration.ofHours(6));
        assertThat(new JulianDay(1.5).toDuration()).isEqualTo(Duration.ofHours(36));
    }

    @Test
    void toDuration_floorsSubSecondRemainder() {
        assertThat(new JulianDay(1.5 / 86400).toDuration()).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void toDuration_negative_floorsTowardsEarlierSecond() {
        assertThat(new JulianDay(-0.5 / 86400).toDuration()).isEqualTo(Duration.ofSeconds(-1));
        assertThat(new JulianDay(-1e-9).toDuration()).isEqualTo(Duration.ofSeconds(-1));
        assertThat(new JulianDay(-0.25).toDuration()).isEqualTo(Duration.ofHours(-6));
    }

    @Test
    void toDuration_nan_throws() {
        JulianDay nan = new JulianDay(Double.NaN);

        assertThatThrownBy(nan::toDuration).isInstanceOf(ArithmeticException.class);
    }

    @Test
    void centuryConversion_isLinearScaling() {
        assertThat(new JulianDay(36525.0).toCentury().centuries()).isEqualTo(1.0);
        assertThat(new JulianCentury(2.0).toDay().days()).isEqualTo(73050.0);
    }

    @ParameterizedTest
    @ValueSource(doubles = {0.0, 1.0, -1.0, 0.5, 2451545.0, 2459867.5, 1e-9, -123456.789, 0.46640935024113})
    void dayToCenturyAndBack_roundTrips(double days) {
        JulianDay day = new JulianDay(days);

        assertThat(day.toCentury().toDay().days()).isCloseTo(days, within(Math.ulp(days) * 4 + Double.MIN_VALUE));
    }

    @Test
    void centuryFromDate_isDayDividedByCentury() {
        LocalDate date = LocalDate.of(2022, 10, 15);

        assertThat(JulianCentury.fromDate(date).centuries()).isEqualTo(2459867.5 / 36525.0);
    }

    @Test
    void centuryArithmetic_withDays_convertsDaysFirst() {
        JulianCentury century = new JulianCentury(1.0);

        assertThat(century.plus(new JulianDay(36525.0)).centuries()).isEqualTo(2.0);
        assertThat(century.minus(new JulianDay(18262.5)).centuries()).isEqualTo(0.5);
        assertThat(century.plus(new JulianCentury(0.25)).centuries()).isEqualTo(1.25);
        assertThat(century.minus(new JulianCentury(0.25)).centuries()).isEqualTo(0.75);
    }

    @Test
    void centuriesSinceJ2000_atJ2000_isZero() {
        JulianCentury century = new JulianDay(2451545.0).toCentury().minus(JulianDay.J2000);

        assertThat(century.centuries()).isEqualTo(0.0);
    }
}
