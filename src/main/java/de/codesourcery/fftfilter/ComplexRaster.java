package de.codesourcery.fftfilter;

/**
 * Immutable 2D array of complex values.
 * 
 * Uses the interleaved layout JTransforms works on: each row holds 
 * <code>2*width</code> doubles where element(2k) = Re(k) and element(2k+1) = Im(k).
 */
public class ComplexRaster
{
    protected final int height;
    protected final int width;
    protected final double[][] data;

    ComplexRaster(int height,int width,double[][] data)
    {
        InvalidDimensionsException.checkDimensions( height , width );
        if ( data.length != height ) {
            throw new InvalidDimensionsException("Expected "+height+" rows, got "+data.length);
        }
        for ( int row = 0 ; row < height ; row++ ) 
        {
            if ( data[row].length != 2*width ) {
                throw new InvalidDimensionsException("Row "+row+" needs "+(2*width)+" elements, got "+data[row].length);
            }
        }
        this.height = height;
        this.width = width;
        this.data = data;
    }

    public final int getHeight()
    {
        return height;
    }

    public final int getWidth()
    {
        return width;
    }

    public final double getReal(int row,int col) 
    {
        return data[row][2*col];
    }

    public final double getImaginary(int row,int col) 
    {
        return data[row][2*col+1];
    }

    public final double getMagnitude(int row,int col) 
    {
        final double re = data[row][2*col];
        final double im = data[row][2*col+1];
        return Math.sqrt( re*re + im*im );
    }

    /**
     * Returns the absolute value of each element.
     * 
     * Any imaginary residue (rounding noise or the result of a non-symmetric mask) is
     * folded into the magnitude, the sign of real values is lost.
     */
    public final Raster magnitude() 
    {
        final double[] result = new double[ height * width ];
        int ptr = 0;
        for ( int row = 0 ; row < height ; row++ ) 
        {
            for ( int col = 0 ; col < width ; col++ ) {
                result[ptr++] = getMagnitude( row , col );
            }
        }
        return Raster.wrap( height , width , result );
    }

    /**
     * Returns a deep copy of the interleaved data.
     */
    public final double[][] toArray() 
    {
        final double[][] copy = new double[ height ][];
        for ( int row = 0 ; row < height ; row++ ) {
            copy[row] = data[row].clone();
        }
        return copy;
    }

    @Override
    public String toString()
    {
        return getClass().getSimpleName()+" [height=" + height + ", width=" + width + "]";
    }
}
