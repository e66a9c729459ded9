package ou.capstone.geopoints.exceptions;

public class LocationsException extends Exception
{
    public LocationsException( final Exception e )
    {
        super( e );
    }

    public LocationsException( final String msg )
    {
        super( msg );
    }

    public LocationsException( final String msg, final Exception e )
    {
        super( msg, e );
    }

    /**
     * Builds the error for a location argument that could not be parsed.
     *
     * @param index 1-based position of the location on the command line
     * @param location the offending text
     */
    public static LocationsException parseFailure( final int index, final String location,
                                                   final Exception cause )
    {
        return new LocationsException( "Location parsing failure in location "
                + index + " '" + location + "'.", cause );
    }

    public static LocationsException tooFew( final String command )
    {
        return new LocationsException( "More than one location is required for "
                + command + "." );
    }
}
