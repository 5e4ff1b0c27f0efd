package de.codesourcery.fftfilter.filter;

import java.util.Arrays;

import de.codesourcery.fftfilter.InvalidDimensionsException;

/**
 * Builds radial masks centered on the zero-frequency bin of a shifted spectrum.
 * 
 * The center is <code>(height/2,width/2)</code> using integer division, exactly where
 * {@link de.codesourcery.fftfilter.SpectralTransform} puts the DC coefficient. 
 * A pixel at offset <code>(dy,dx)</code> from the center lies inside a disk of radius 
 * <code>r</code> iff <code>dy*dy + dx*dx &lt;= r*r</code>, the boundary is included.
 */
public final class MaskBuilder
{
    public Mask buildMask(int height,int width,FilterConfiguration config) 
    {
        InvalidDimensionsException.checkDimensions( height , width );

        final byte[] mask = new byte[ height * width ];
        switch( config.getMode() ) 
        {
            case LOWPASS:
                fillDisk( mask , height , width , config.getCutoff() , (byte) 1 );
                break;
            case HIGHPASS:
                Arrays.fill( mask , (byte) 1 );
                fillDisk( mask , height , width , config.getCutoff() , (byte) 0 );
                break;
            case BANDPASS:
                // equal radii leave an annulus of zero width
                fillDisk( mask , height , width , config.getOuterRadius() , (byte) 1 );
                fillDisk( mask , height , width , config.getInnerRadius() , (byte) 0 );
                break;
            default:
                throw new RuntimeException("Unhandled filter mode: "+config.getMode());
        }
        return new Mask( height , width , mask );
    }

    private static void fillDisk(byte[] mask,int height,int width,int radius,byte value) 
    {
        if ( radius < 0 ) {
            return;
        }
        final int centerRow = height / 2;
        final int centerCol = width / 2;
        final long radiusSquared = (long) radius * radius;

        // only visit rows that can intersect the disk
        final int firstRow = (int) Math.max( 0 , (long) centerRow - radius );
        final int lastRow = (int) Math.min( height - 1 , (long) centerRow + radius );
        for ( int row = firstRow ; row <= lastRow ; row++ ) 
        {
            final long dy = row - centerRow;
            final int offset = row * width;
            for ( int col = 0 ; col < width ; col++ ) 
            {
                final long dx = col - centerCol;
                if ( dy*dy + dx*dx <= radiusSquared ) {
                    mask[ offset + col ] = value;
                }
            }
        }
    }
}
