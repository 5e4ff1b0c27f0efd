package de.codesourcery.fftfilter.filter;

/**
 * Binary frequency mask, 1 = coefficient passes, 0 = coefficient is zeroed.
 */
public final class Mask
{
    private final int height;
    private final int width;
    private final byte[] data;

    Mask(int height, int width, byte[] data)
    {
        this.height = height;
        this.width = width;
        this.data = data;
    }

    public int getHeight()
    {
        return height;
    }

    public int getWidth()
    {
        return width;
    }

    public int get(int row,int col) 
    {
        return data[ row*width + col ];
    }

    public int getPassCount() 
    {
        int count = 0;
        for ( byte b : data ) {
            count += b;
        }
        return count;
    }

    @Override
    public String toString()
    {
        return "Mask [height=" + height + ", width=" + width + ", passing=" + getPassCount() + "]";
    }
}
