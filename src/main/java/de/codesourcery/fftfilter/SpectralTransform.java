package de.codesourcery.fftfilter;

import edu.emory.mathcs.jtransforms.fft.DoubleFFT_1D;
import edu.emory.mathcs.jtransforms.fft.DoubleFFT_2D;

/**
 * Forward and inverse 2D discrete Fourier transform of single-channel rasters.
 * 
 * The forward transform returns a centered spectrum (DC coefficient moved to 
 * <code>(height/2,width/2)</code>, the same convention as numpy's <code>fftshift</code>),
 * the inverse transform undoes the shift before transforming back. Both directions
 * work for any size, JTransforms falls back to Bluestein's algorithm for
 * non power-of-two lengths.
 * 
 * NaN or infinite samples are not treated specially and spread across the result.
 */
public final class SpectralTransform
{
    public Spectrum forward(Raster raster) 
    {
        final int height = raster.getHeight();
        final int width = raster.getWidth();

        // copy sample data to an array
        // where element(k) = real part (k) and element(k+1) = imaginary part (k)
        final double[][] fftData = new double[ height ][ 2*width ];
        for ( int row = 0 ; row < height ; row++ ) 
        {
            final double[] line = fftData[row];
            int ptr = 0;
            for ( int col = 0 ; col < width ; col++ , ptr+=2 ) {
                line[ptr] = raster.get( row , col );
            }
        }

        transform( fftData , height , width , true );
        return new Spectrum( height , width , shift( fftData , height , width , true ) );
    }

    /**
     * Reverses {@link #forward(Raster)}.
     * 
     * @return complex result, use {@link ComplexRaster#magnitude()} to get a real raster
     */
    public ComplexRaster inverse(Spectrum spectrum) 
    {
        final int height = spectrum.getHeight();
        final int width = spectrum.getWidth();

        final double[][] fftData = shift( spectrum.data , height , width , false );
        transform( fftData , height , width , false );
        return new ComplexRaster( height , width , fftData );
    }

    private static void transform(double[][] data,int height,int width,boolean forward) 
    {
        if ( height > 1 && width > 1 ) 
        {
            final DoubleFFT_2D fft = new DoubleFFT_2D( height , width );
            if ( forward ) {
                fft.complexForward( data );
            } else {
                fft.complexInverse( data , true );
            }
            return;
        }

        // DoubleFFT_2D needs at least 2 rows and columns, transform the single non-trivial axis instead.
        // A DFT of length 1 is the identity.
        if ( width > 1 ) 
        {
            transform1D( data[0] , width , forward );
        } 
        else if ( height > 1 ) 
        {
            final double[] column = new double[ 2*height ];
            for ( int row = 0 , ptr = 0 ; row < height ; row++ , ptr+=2 ) 
            {
                column[ptr] = data[row][0];
                column[ptr+1] = data[row][1];
            }
            transform1D( column , height , forward );
            for ( int row = 0 , ptr = 0 ; row < height ; row++ , ptr+=2 ) 
            {
                data[row][0] = column[ptr];
                data[row][1] = column[ptr+1];
            }
        }
    }

    private static void transform1D(double[] data,int size,boolean forward) 
    {
        final DoubleFFT_1D fft = new DoubleFFT_1D( size );
        if ( forward ) {
            fft.complexForward( data );
        } else {
            fft.complexInverse( data , true );
        }
    }

    /**
     * Swaps diagonally opposite quadrants.
     * 
     * The forward shift moves element (0,0) to (height/2,width/2), the reverse shift
     * moves it back. For odd sizes the two are not the same permutation.
     * 
     * @return new array, input is not modified
     */
    static double[][] shift(double[][] data,int height,int width,boolean forward) 
    {
        final int rowOffset = height / 2;
        final int colOffset = width / 2;

        final double[][] result = new double[ height ][ 2*width ];
        for ( int row = 0 ; row < height ; row++ ) 
        {
            final int shiftedRow = ( row + rowOffset ) % height;
            for ( int col = 0 ; col < width ; col++ ) 
            {
                final int shiftedCol = ( col + colOffset ) % width;
                if ( forward ) 
                {
                    result[shiftedRow][2*shiftedCol] = data[row][2*col];
                    result[shiftedRow][2*shiftedCol+1] = data[row][2*col+1];
                } else {
                    result[row][2*col] = data[shiftedRow][2*shiftedCol];
                    result[row][2*col+1] = data[shiftedRow][2*shiftedCol+1];
                }
            }
        }
        return result;
    }
}
