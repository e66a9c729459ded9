package ou.capstone.geopoints;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ou.capstone.geopoints.config.LocationsFileReader;
import ou.capstone.geopoints.config.LocationsFileReader.CsvLocations;
import ou.capstone.geopoints.exceptions.LocationsException;
import ou.capstone.geopoints.locator.GridLocator;
import ou.capstone.geopoints.locator.LocatorPrecision;
import ou.capstone.geopoints.point.DistanceUnit;
import ou.capstone.geopoints.point.LatLon;
import ou.capstone.geopoints.point.LocationParser;
import ou.capstone.geopoints.point.NamedPoint;
import ou.capstone.geopoints.point.Point;
import ou.capstone.geopoints.point.PointFormat;
import ou.capstone.geopoints.print.LocationPrinter;
import ou.capstone.geopoints.print.OutputConfig;
import ou.capstone.geopoints.route.BearingFormat;
import ou.capstone.geopoints.route.ElapsedTimeUnit;
import ou.capstone.geopoints.route.FlightPlan;
import ou.capstone.geopoints.solar.SunMode;

/**
 * Command line driver for geopoints.
 *
 * Usage: {@code geopoints [options] <command> [arguments]}, with locations
 * given as {@code -l '52.015;-0.221'}, as Maidenhead locators, as names from
 * the locations file, or read from a gpsbabel CSV file.
 *
 * Exit status is 0 on success, 1 for a bad value and 2 for a location error.
 */
public final class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    static final List<String> COMMANDS = List.of("bearing", "destination", "display", "distance",
            "final-bearing", "flight-plan", "range", "sunrise", "sunset");

    private static ExitHandler exitHandler = new ExitHandler();
    private static Clock clock = Clock.systemUTC();

    public static void setExitHandler( final ExitHandler exitHandler )
    {
        App.exitHandler = exitHandler;
    }

    /** Clock supplying today's date for sunrise and sunset. */
    public static void setClock( final Clock clock )
    {
        App.clock = clock;
    }

    private App() {
        // Prevent instantiation
    }

    public static void main(final String[] args) throws ParseException {
        final Option locationOption = Option.builder("l")
                .longOpt("location").hasArg()
                .desc("Location to operate on; may be repeated").get();
        final Option formatOption = Option.builder("o")
                .longOpt("format").hasArg()
                .desc("Produce output in dms, dm or dd format (default: dms)").get();
        final Option unitsOption = Option.builder("u")
                .longOpt("units").hasArg()
                .desc("Display distances in kilometres (km), statute miles (sm) or nautical miles (nm) (default: km)")
                .get();
        final Option verboseOption = Option.builder("v")
                .longOpt("verbose")
                .desc("Describe results in sentences").get();
        final Option configOption = Option.builder()
                .longOpt("config").hasArg()
                .desc("JSON file to read named locations from (default: ~/.geopoints.json)").get();
        final Option csvFileOption = Option.builder()
                .longOpt("csv-file").hasArg()
                .desc("CSV file (gpsbabel format) to read route/locations from").get();
        final Option stringOption = Option.builder("g")
                .longOpt("string")
                .desc("Display named bearings").get();
        final Option locatorOption = Option.builder()
                .longOpt("locator").hasArg()
                .desc("Maidenhead locator accuracy for display and destination: square, subsquare or extsquare")
                .get();
        final Option speedOption = Option.builder("s")
                .longOpt("speed").hasArg()
                .desc("Speed per hour for flight plan elapsed times (default: 0, no times)").get();
        final Option timeOption = Option.builder("t")
                .longOpt("time").hasArg()
                .desc("Flight plan elapsed time in hours (h), minutes (m) or seconds (s) (default: h)").get();
        final Option helpOption = Option.builder("h").longOpt("help")
                .desc("Display help").get();

        final Options options = new Options();
        options.addOption( locationOption );
        options.addOption( formatOption );
        options.addOption( unitsOption );
        options.addOption( verboseOption );
        options.addOption( configOption );
        options.addOption( csvFileOption );
        options.addOption( stringOption );
        options.addOption( locatorOption );
        options.addOption( speedOption );
        options.addOption( timeOption );
        options.addOption( helpOption );

        final CommandLineParser cliParser = new DefaultParser();
        final CommandLine line;
        try {
            line = cliParser.parse(options, args);
        } catch (final ParseException e) {
            logger.error("Parsing args failed for reason: {}",
                    e.getMessage());
            throw e;
        }

        if (line.hasOption(helpOption) || args.length == 0) {
            HelpFormatter helpFormatter = HelpFormatter.builder().get();
            helpFormatter.printHelp("geopoints [options] <command> [arguments]",
                    "Commands: " + String.join(", ", COMMANDS), options,
                    "Please report bugs to the project issue tracker",
                    false);
            exitHandler.exit(0);
            return;
        }

        final List<String> positional = line.getArgList();
        if (positional.isEmpty()) {
            throw new ParseException("Invalid options: a command is required");
        }
        final String command = positional.get(0);
        if (!COMMANDS.contains(command)) {
            throw new ParseException("Unknown command: " + command);
        }
        final List<String> commandArgs = positional.subList(1, positional.size());

        logger.info("geopoints starting command {}", command);

        try {
            final OutputConfig config = new OutputConfig(
                    PointFormat.fromString(line.getOptionValue(formatOption, "dms")),
                    DistanceUnit.fromString(line.getOptionValue(unitsOption, "km")),
                    line.hasOption(verboseOption));

            // Named locations come from the CSV file when given, else the config file
            final Map<String, LatLon> namedLocations;
            final List<String> locationArgs = new ArrayList<>();
            final LocationsFileReader reader = new LocationsFileReader();
            if (line.hasOption(csvFileOption)) {
                final CsvLocations csv = reader.readCsv(Paths.get(line.getOptionValue(csvFileOption)));
                namedLocations = csv.locations();
                locationArgs.addAll(csv.names());
            } else {
                final Path configFile = line.hasOption(configOption)
                        ? Paths.get(line.getOptionValue(configOption))
                        : Paths.get(System.getProperty("user.home"), ".geopoints.json");
                namedLocations = reader.readLocations(configFile);
            }
            final String[] given = line.getOptionValues(locationOption);
            if (given != null) {
                locationArgs.addAll(Arrays.asList(given));
            }

            final List<NamedPoint> locations = importLocations(locationArgs, namedLocations, config.units());
            final LocationPrinter printer = new LocationPrinter(config);
            final LocatorPrecision locator = line.hasOption(locatorOption)
                    ? LocatorPrecision.fromString(line.getOptionValue(locatorOption))
                    : null;
            final BearingFormat bearingFormat = line.hasOption(stringOption)
                    ? BearingFormat.STRING
                    : BearingFormat.NUMERIC;

            switch (command) {
                case "display":
                    printer.print(printer.renderDisplay(locations, locator));
                    break;
                case "distance":
                    requirePairs(command, locations);
                    printer.print(printer.renderDistance(locations));
                    break;
                case "bearing":
                    requirePairs(command, locations);
                    printer.print(printer.renderBearings(locations, false, bearingFormat));
                    break;
                case "final-bearing":
                    requirePairs(command, locations);
                    printer.print(printer.renderBearings(locations, true, bearingFormat));
                    break;
                case "range":
                    requirePairs(command, locations);
                    printer.print(printer.renderRange(locations,
                            numberArgument(commandArgs, 0, "distance")));
                    break;
                case "destination":
                    printer.print(printer.renderDestinations(locations,
                            numberArgument(commandArgs, 0, "distance"),
                            numberArgument(commandArgs, 1, "bearing"),
                            locator));
                    break;
                case "sunrise":
                case "sunset":
                    printer.print(printer.renderSunEvents(locations, LocalDate.now(clock),
                            "sunrise".equals(command) ? SunMode.RISE : SunMode.SET));
                    break;
                case "flight-plan":
                default:
                    requirePairs(command, locations);
                    final double speed = line.hasOption(speedOption)
                            ? parseNumber(line.getOptionValue(speedOption), "speed")
                            : 0;
                    final ElapsedTimeUnit timeUnit =
                            ElapsedTimeUnit.fromString(line.getOptionValue(timeOption, "h"));
                    final List<Point> waypoints = new ArrayList<>(locations.size());
                    for (final NamedPoint location : locations) {
                        waypoints.add(location.point());
                    }
                    printer.print(printer.renderFlightPlan(locations,
                            FlightPlan.plan(waypoints, speed, timeUnit)));
                    break;
            }

            logger.info("geopoints completed command {}", command);
        } catch (final LocationsException e) {
            logger.error("Location error: {}", e.getMessage());
            System.err.println(e.getMessage());
            exitHandler.exit(2);

        } catch (final IllegalArgumentException e) {
            logger.error("Invalid input: {}", e.getMessage());
            System.err.println("Error: " + e.getMessage());
            exitHandler.exit(1);
        }
    }

    /**
     * Resolves each location argument: a configured name first, then a
     * coordinate string, then a Maidenhead locator. Unnamed locations are
     * named by their 1-based position.
     */
    static List<NamedPoint> importLocations(final List<String> arguments,
                                            final Map<String, LatLon> namedLocations,
                                            final DistanceUnit units) throws LocationsException {
        final List<NamedPoint> locations = new ArrayList<>(arguments.size());
        for (int i = 0; i < arguments.size(); i++) {
            final String argument = arguments.get(i);
            try {
                final LatLon named = namedLocations.get(argument);
                if (named != null) {
                    locations.add(new NamedPoint(argument, named.toPoint(units)));
                } else {
                    final LatLon parsed = LocationParser.parse(argument)
                            .orElseGet(() -> GridLocator.decode(argument));
                    locations.add(new NamedPoint(String.valueOf(i + 1), parsed.toPoint(units)));
                }
            } catch (final IllegalArgumentException e) {
                throw LocationsException.parseFailure(i + 1, argument, e);
            }
        }
        logger.debug("Imported {} locations", locations.size());
        return Collections.unmodifiableList(locations);
    }

    private static void requirePairs(final String command, final List<NamedPoint> locations)
            throws LocationsException {
        if (locations.size() < 2) {
            throw LocationsException.tooFew(command);
        }
    }

    private static double numberArgument(final List<String> commandArgs, final int index, final String name) {
        if (commandArgs.size() <= index) {
            throw new IllegalArgumentException("Missing " + name + " argument");
        }
        return parseNumber(commandArgs.get(index), name);
    }

    private static double parseNumber(final String value, final String name) {
        try {
            return Double.parseDouble(value);
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + name + " value '" + value + "'", e);
        }
    }

    public static class ExitHandler
    {
        public void exit( final int code )
        {
            System.exit( code );
        }
    }
}
