package de.codesourcery.fftfilter;

import de.codesourcery.fftfilter.filter.Mask;

/**
 * Centered ("shifted") 2D Fourier spectrum of a {@link Raster}.
 * 
 * The zero-frequency coefficient lives at row <code>height/2</code> and
 * column <code>width/2</code> (integer division).
 */
public final class Spectrum extends ComplexRaster
{
    Spectrum(int height,int width,double[][] data)
    {
        super( height , width , data );
    }

    public int getCenterRow() 
    {
        return height / 2;
    }

    public int getCenterColumn() 
    {
        return width / 2;
    }

    /**
     * Multiplies each coefficient with the corresponding mask value.
     * 
     * @return new spectrum, this instance is left untouched
     */
    public Spectrum applyMask(Mask mask) 
    {
        InvalidDimensionsException.checkSameShape( height , width , mask.getHeight() , mask.getWidth() );

        final double[][] result = new double[ height ][ 2*width ];
        for ( int row = 0 ; row < height ; row++ ) 
        {
            final double[] in = data[row];
            final double[] out = result[row];
            int ptr = 0;
            for ( int col = 0 ; col < width ; col++ , ptr+=2 ) 
            {
                final int factor = mask.get( row , col );
                out[ptr] = in[ptr] * factor;
                out[ptr+1] = in[ptr+1] * factor;
            }
        }
        return new Spectrum( height , width , result );
    }

    /**
     * Returns <code>log(1+|F|)</code> for every coefficient, used to preview the spectrum.
     */
    public Raster logMagnitude() 
    {
        final double[] result = new double[ height * width ];
        int ptr = 0;
        for ( int row = 0 ; row < height ; row++ ) 
        {
            for ( int col = 0 ; col < width ; col++ ) {
                result[ptr++] = Math.log1p( getMagnitude( row , col ) );
            }
        }
        return Raster.wrap( height , width , result );
    }
}
