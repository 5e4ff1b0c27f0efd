package de.codesourcery.fftfilter;

import java.util.Arrays;

/**
 * Immutable single-channel raster of real-valued samples, stored row-major.
 * 
 * Samples keep whatever range the source delivered, they are not
 * bounded to [0,255].
 */
public final class Raster
{
    private final int height;
    private final int width;
    private final double[] data;

    public Raster(int height,int width,double[] data)
    {
        this( height , width , data , true );
    }

    private Raster(int height,int width,double[] data,boolean copyData)
    {
        InvalidDimensionsException.checkDimensions( height , width );
        if ( data == null || data.length != height*width ) {
            throw new InvalidDimensionsException("Expected "+(height*width)+" samples for "+height+"x"+width+
                    " raster, got "+( data == null ? "NULL" : Integer.toString( data.length ) ) );
        }
        this.height = height;
        this.width = width;
        this.data = copyData ? data.clone() : data;
    }

    public static Raster of(double[][] rows) 
    {
        if ( rows == null || rows.length == 0 || rows[0] == null ) {
            throw new InvalidDimensionsException("Raster needs at least one row");
        }
        final int height = rows.length;
        final int width = rows[0].length;
        final double[] data = new double[ height * width ];
        for ( int row = 0 ; row < height ; row++ ) 
        {
            if ( rows[row] == null || rows[row].length != width ) {
                throw new InvalidDimensionsException("Row "+row+" does not have "+width+" columns");
            }
            System.arraycopy( rows[row] , 0 , data , row*width , width );
        }
        return new Raster( height , width , data );
    }

    /**
     * Wraps an array without copying it, callers must hand over ownership.
     */
    static Raster wrap(int height,int width,double[] data) 
    {
        return new Raster( height , width , data , false );
    }

    public int getHeight()
    {
        return height;
    }

    public int getWidth()
    {
        return width;
    }

    public double get(int row,int col) 
    {
        return data[ row*width + col ];
    }

    public double[] toArray() 
    {
        return data.clone();
    }

    /**
     * Returns the smallest finite sample or <code>NaN</code> if there is none.
     */
    public double getMinValue() 
    {
        double min = Double.NaN;
        for ( double v : data ) 
        {
            if ( ! Double.isNaN( v ) && ! Double.isInfinite( v ) && ( Double.isNaN( min ) || v < min ) ) {
                min = v;
            }
        }
        return min;
    }

    /**
     * Returns the largest finite sample or <code>NaN</code> if there is none.
     */
    public double getMaxValue() 
    {
        double max = Double.NaN;
        for ( double v : data ) 
        {
            if ( ! Double.isNaN( v ) && ! Double.isInfinite( v ) && ( Double.isNaN( max ) || v > max ) ) {
                max = v;
            }
        }
        return max;
    }

    @Override
    public boolean equals(Object obj)
    {
        if ( this == obj ) {
            return true;
        }
        if ( ! (obj instanceof Raster) ) {
            return false;
        }
        final Raster other = (Raster) obj;
        return height == other.height && width == other.width && Arrays.equals( data , other.data );
    }

    @Override
    public int hashCode()
    {
        return 31*(31*height+width)+Arrays.hashCode( data );
    }

    @Override
    public String toString()
    {
        return "Raster [height=" + height + ", width=" + width + ", min=" + getMinValue() + ", max=" + getMaxValue() + "]";
    }
}
