package ou.capstone.geopoints.config;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import ou.capstone.geopoints.exceptions.LocationsException;
import ou.capstone.geopoints.locator.GridLocator;
import ou.capstone.geopoints.point.LatLon;

/**
 * Reads named locations for the command line tool.
 *
 * Two sources are supported:
 * <ul>
 *   <li>a JSON locations file, keyed by name, each entry holding either
 *       {@code latitude} and {@code longitude} or a Maidenhead {@code locator}</li>
 *   <li>gpsbabel's CSV output, {@code latitude, longitude, name} per line</li>
 * </ul>
 */
public class LocationsFileReader {
    private static final Logger logger = LoggerFactory.getLogger(LocationsFileReader.class);

    private static final String FIELD_LATITUDE = "latitude";
    private static final String FIELD_LONGITUDE = "longitude";
    private static final String FIELD_LOCATOR = "locator";

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Locations read from a gpsbabel CSV file, with their names in file order.
     */
    public record CsvLocations(Map<String, LatLon> locations, List<String> names) {
    }

    /**
     * Reads a JSON locations file.
     *
     * @param file JSON file; a missing file yields no locations
     * @return locations by name, in file order
     * @throws LocationsException if the file cannot be read or an entry is malformed
     */
    public Map<String, LatLon> readLocations(final Path file) throws LocationsException {
        if (file == null || !Files.exists(file)) {
            logger.debug("Locations file {} not found", file);
            return Collections.emptyMap();
        }

        final JsonNode root;
        try {
            root = mapper.readTree(file.toFile());
        } catch (final IOException e) {
            logger.error("Failed to read locations file {}: {}", file, e.getMessage());
            throw new LocationsException("Unable to read locations file " + file, e);
        }

        final Map<String, LatLon> locations = new LinkedHashMap<>();
        if (root == null || root.isMissingNode() || root.isEmpty()) {
            logger.debug("Locations file {} is empty", file);
            return locations;
        }
        if (!root.isObject()) {
            throw new LocationsException("Locations file " + file + " must hold a JSON object");
        }

        final Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            final Map.Entry<String, JsonNode> entry = fields.next();
            locations.put(entry.getKey(), parseEntry(entry.getKey(), entry.getValue()));
        }
        logger.debug("Read {} locations from {}", locations.size(), file);
        return locations;
    }

    private LatLon parseEntry(final String name, final JsonNode node) throws LocationsException {
        final JsonNode locator = node.get(FIELD_LOCATOR);
        if (locator != null && !locator.isNull()) {
            try {
                return GridLocator.decode(locator.asText());
            } catch (final IllegalArgumentException e) {
                throw new LocationsException("Invalid locator for location '" + name + "'", e);
            }
        }
        final JsonNode latitude = node.get(FIELD_LATITUDE);
        final JsonNode longitude = node.get(FIELD_LONGITUDE);
        if (latitude == null || !latitude.isNumber() || longitude == null || !longitude.isNumber()) {
            throw new LocationsException("Location '" + name + "' needs numeric "
                    + FIELD_LATITUDE + " and " + FIELD_LONGITUDE + ", or a " + FIELD_LOCATOR);
        }
        return new LatLon(latitude.asDouble(), longitude.asDouble());
    }

    /**
     * Reads gpsbabel CSV output. Each row is named {@code NN:name}, with NN the
     * two digit, 1-based row number.
     *
     * @throws LocationsException if the file cannot be read or a row is malformed
     */
    public CsvLocations readCsv(final Path file) throws LocationsException {
        final Map<String, LatLon> locations = new LinkedHashMap<>();
        final List<String> names = new ArrayList<>();

        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int index = 0;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                index++;
                final List<String> fields = parseCsvLine(line);
                if (fields.size() < 2) {
                    throw new LocationsException("Too few fields in CSV row " + index + ": " + line);
                }
                final String rowName = fields.size() > 2 ? fields.get(2) : "";
                final String name = String.format(Locale.ROOT, "%02d:%s", index, rowName);
                try {
                    locations.put(name, new LatLon(Double.parseDouble(fields.get(0)),
                            Double.parseDouble(fields.get(1))));
                } catch (final NumberFormatException e) {
                    throw new LocationsException("Invalid coordinates in CSV row " + index + ": " + line, e);
                }
                names.add(name);
            }
        } catch (final IOException e) {
            logger.error("Failed to read CSV file {}: {}", file, e.getMessage());
            throw new LocationsException("Unable to read CSV file " + file, e);
        }
        logger.debug("Read {} locations from {}", names.size(), file);
        return new CsvLocations(locations, names);
    }

    /**
     * Splits one CSV line, honouring double quotes. Leading spaces of each
     * field are dropped.
     */
    static List<String> parseCsvLine(final String line) {
        final List<String> out = new ArrayList<>();
        final StringBuilder sb = new StringBuilder();
        boolean inQuotes = false;
        for (int i = 0; i < line.length(); i++) {
            final char c = line.charAt(i);
            if (inQuotes) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        sb.append('"');
                        i++;
                    } else {
                        inQuotes = false;
                    }
                } else {
                    sb.append(c);
                }
            } else if (c == ',') {
                out.add(sb.toString());
                sb.setLength(0);
            } else if (c == '"') {
                inQuotes = true;
            } else if (c != ' ' || sb.length() > 0) {
                sb.append(c);
            }
        }
        out.add(sb.toString());
        return out;
    }
}
