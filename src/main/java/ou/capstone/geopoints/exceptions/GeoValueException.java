package ou.capstone.geopoints.exceptions;

/**
 * Raised when a coordinate, token or encoded string is not acceptable.
 * The {@link ErrorCode} tells callers which check failed.
 */
public class GeoValueException extends IllegalArgumentException
{
    private final ErrorCode code;

    public GeoValueException( final ErrorCode code, final String msg )
    {
        super( msg );
        this.code = code;
    }

    public GeoValueException( final ErrorCode code, final String msg, final Exception e )
    {
        super( msg, e );
        this.code = code;
    }

    public ErrorCode getCode()
    {
        return code;
    }
}
