package ou.capstone.geopoints.print;

import java.io.PrintStream;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

import org.apache.commons.lang3.StringUtils;

import ou.capstone.geopoints.locator.LocatorPrecision;
import ou.capstone.geopoints.point.NamedPoint;
import ou.capstone.geopoints.point.Point;
import ou.capstone.geopoints.route.BearingFormat;
import ou.capstone.geopoints.route.FlightPlan;
import ou.capstone.geopoints.route.Inverse;
import ou.capstone.geopoints.solar.SunMode;
import ou.capstone.geopoints.solar.Zenith;

/**
 * Console output for the command line tool.
 *
 * Each {@code render...} method builds the complete output of one command as
 * a String, for tests; {@link #print(String)} writes it to the configured
 * stream. Pairwise commands expect at least two locations.
 */
public class LocationPrinter {

    /** Written for a missing sun event when not verbose. */
    static final String NO_EVENT = "-";

    private final OutputConfig config;
    private final PrintStream out;

    public LocationPrinter(final OutputConfig config) {
        this(config, System.out);
    }

    public LocationPrinter(final OutputConfig config, final PrintStream out) {
        this.config = config;
        this.out = out;
    }

    public void print(final String rendered) {
        out.print(rendered);
    }

    /**
     * @param locator locator precision, or null to use the configured format
     */
    public String renderDisplay(final List<NamedPoint> locations, final LocatorPrecision locator) {
        final List<String> lines = new ArrayList<>();
        for (final NamedPoint location : locations) {
            final String output = describe(location.point(), locator);
            lines.add(config.verbose()
                    ? String.format(Locale.ROOT, "Location %s is %s", location.name(), output)
                    : output);
        }
        return join(lines);
    }

    public String renderDistance(final List<NamedPoint> locations) {
        final List<String> lines = new ArrayList<>();
        final String unit = config.units().displayName();
        double total = 0;
        for (int i = 0; i < locations.size() - 1; i++) {
            final double distance = locations.get(i).point().distance(locations.get(i + 1).point());
            total += distance;
            if (config.verbose()) {
                lines.add(String.format(Locale.ROOT, "Location %s to %s is %d %s",
                        locations.get(i).name(), locations.get(i + 1).name(), (long) distance, unit));
            }
        }
        if (!config.verbose()) {
            lines.add(String.valueOf(total));
        } else if (locations.size() > 2) {
            lines.add(String.format(Locale.ROOT, "Total distance is %d %s", (long) total, unit));
        }
        return join(lines);
    }

    /**
     * @param finalBearing true for the bearing on arrival, false for the initial bearing
     */
    public String renderBearings(final List<NamedPoint> locations, final boolean finalBearing,
                                 final BearingFormat format) {
        final String sentence = finalBearing
                ? "Final bearing from location %s to %s is %s"
                : "Location %s to %s is %s";
        final List<String> lines = new ArrayList<>();
        for (int i = 0; i < locations.size() - 1; i++) {
            final Point from = locations.get(i).point();
            final Point to = locations.get(i + 1).point();
            final String bearing = finalBearing ? from.finalBearing(to, format) : from.bearing(to, format);
            lines.add(config.verbose()
                    ? String.format(Locale.ROOT, sentence, locations.get(i).name(), locations.get(i + 1).name(), bearing)
                    : bearing);
        }
        return join(lines);
    }

    /**
     * Reports whether each location lies within {@code distance} of the first.
     */
    public String renderRange(final List<NamedPoint> locations, final double distance) {
        final NamedPoint origin = locations.get(0);
        final List<String> lines = new ArrayList<>();
        for (final NamedPoint location : locations.subList(1, locations.size())) {
            final boolean inRange = origin.point().isWithin(location.point(), distance);
            if (config.verbose()) {
                lines.add(String.format(Locale.ROOT, "Location %s is %swithin %d %s of location %s",
                        location.name(), inRange ? "" : "not ", (long) distance,
                        config.units().displayName(), origin.name()));
            } else {
                lines.add(String.valueOf(inRange));
            }
        }
        return join(lines);
    }

    /**
     * @param locator locator precision, or null to use the configured format
     */
    public String renderDestinations(final List<NamedPoint> locations, final double distance,
                                     final double bearing, final LocatorPrecision locator) {
        final List<String> lines = new ArrayList<>();
        for (final NamedPoint location : locations) {
            final String output = describe(location.point().destination(bearing, distance), locator);
            lines.add(config.verbose()
                    ? String.format(Locale.ROOT, "Destination from location %s is %s", location.name(), output)
                    : output);
        }
        return join(lines);
    }

    public String renderSunEvents(final List<NamedPoint> locations, final LocalDate date, final SunMode mode) {
        final String event = mode == SunMode.RISE ? "rise" : "set";
        final List<String> lines = new ArrayList<>();
        for (final NamedPoint location : locations) {
            final Optional<LocalTime> time = mode == SunMode.RISE
                    ? location.point().sunrise(date, Zenith.OFFICIAL)
                    : location.point().sunset(date, Zenith.OFFICIAL);
            if (!config.verbose()) {
                lines.add(time.map(LocalTime::toString).orElse(NO_EVENT));
            } else if (time.isPresent()) {
                lines.add(String.format(Locale.ROOT, "%s at %s UTC in location %s",
                        StringUtils.capitalize("sun" + event), time.get(), location.name()));
            } else {
                lines.add(String.format(Locale.ROOT, "The sun doesn't %s at location %s on this date",
                        event, location.name()));
            }
        }
        return join(lines);
    }

    /**
     * Writes the plan as CSV: one row per waypoint, plus overall and direct
     * summary rows when verbose. Summary rows are marked with {@code #} when
     * no speed was given.
     */
    public String renderFlightPlan(final List<NamedPoint> locations, final FlightPlan plan) {
        final List<String> lines = new ArrayList<>();
        if (config.verbose()) {
            lines.add(String.format(Locale.ROOT,
                    "WAYPOINT,BEARING[°],DISTANCE[%s],ELAPSED_TIME[%s],LATITUDE[d.dd],LONGITUDE[d.dd]",
                    config.units().abbreviation(), plan.getTimeUnit().token()));
        }
        final Point start = locations.get(0).point();
        lines.add(String.format(Locale.ROOT, "%s,,,,%f,%f",
                locations.get(0).name(), start.getLatitude(), start.getLongitude()));
        for (int i = 0; i < plan.getLegs().size(); i++) {
            final FlightPlan.Leg leg = plan.getLegs().get(i);
            lines.add(String.format(Locale.ROOT, "%s,%d,%.1f,%s,%f,%f",
                    locations.get(i + 1).name(), (long) leg.bearing(), leg.distance(), elapsed(leg.elapsed()),
                    leg.to().getLatitude(), leg.to().getLongitude()));
        }
        if (config.verbose()) {
            final String marker = plan.hasSpeed() ? "" : "#";
            final Inverse direct = plan.direct();
            lines.add(String.format(Locale.ROOT, "-- OVERALL --%s,,%.1f,%s,,",
                    marker, plan.overallDistance(), elapsed(plan.overallElapsed())));
            lines.add(String.format(Locale.ROOT, "-- DIRECT --%s,%d,%.1f,%s,,",
                    marker, (long) direct.bearing(), direct.distance(), elapsed(plan.directElapsed())));
        }
        return join(lines);
    }

    private static String elapsed(final OptionalDouble elapsed) {
        return elapsed.isPresent() ? String.format(Locale.ROOT, "%.1f", elapsed.getAsDouble()) : "";
    }

    private String describe(final Point point, final LocatorPrecision locator) {
        return locator != null ? point.toGridLocator(locator) : point.format(config.format());
    }

    private static String join(final List<String> lines) {
        final StringBuilder sb = new StringBuilder();
        for (final String line : lines) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }
}
