package de.codesourcery.fftfilter;

/**
 * Min/max-stretches a raster into the 0...255 range for display.
 * 
 * NaN and infinite samples are ignored when looking for the minimum/maximum and
 * end up as 0. A raster without spread (all samples equal or no finite samples
 * at all) maps to all zeros.
 */
public final class DisplayNormalizer
{
    public static final int MAX_INTENSITY = 255;

    public DisplayBuffer normalize(Raster raster) 
    {
        final int height = raster.getHeight();
        final int width = raster.getWidth();
        final byte[] result = new byte[ height * width ];

        final double min = raster.getMinValue();
        final double max = raster.getMaxValue();
        if ( Double.isNaN( min ) || max == min ) {
            return new DisplayBuffer( height , width , result );
        }

        final double range = max - min;
        int ptr = 0;
        for ( int row = 0 ; row < height ; row++ ) 
        {
            for ( int col = 0 ; col < width ; col++ ) 
            {
                final double value = raster.get( row , col );
                if ( ! Double.isNaN( value ) && ! Double.isInfinite( value ) ) 
                {
                    long scaled = Math.round( ( value - min ) / range * MAX_INTENSITY );
                    if ( scaled < 0 ) {
                        scaled = 0;
                    } else if ( scaled > MAX_INTENSITY ) {
                        scaled = MAX_INTENSITY;
                    }
                    result[ptr] = (byte) scaled;
                }
                ptr++;
            }
        }
        return new DisplayBuffer( height , width , result );
    }
}
