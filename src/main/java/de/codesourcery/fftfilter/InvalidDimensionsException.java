package de.codesourcery.fftfilter;

/**
 * Thrown when a raster, spectrum or mask is created with non-positive
 * dimensions or when two operands of different shape are combined.
 */
public class InvalidDimensionsException extends IllegalArgumentException
{
    public InvalidDimensionsException(String message)
    {
        super(message);
    }

    public static void checkDimensions(int height,int width) 
    {
        if ( height < 1 || width < 1 ) {
            throw new InvalidDimensionsException("Dimensions must be positive, got "+height+"x"+width);
        }
    }

    public static void checkSameShape(int height1,int width1,int height2,int width2) 
    {
        if ( height1 != height2 || width1 != width2 ) {
            throw new InvalidDimensionsException("Shape mismatch: "+height1+"x"+width1+" vs. "+height2+"x"+width2);
        }
    }
}
