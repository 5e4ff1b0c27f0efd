package de.codesourcery.fftfilter;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;

/**
 * 8-bit grayscale image, one byte per pixel, row-major.
 */
public final class DisplayBuffer
{
    private final int height;
    private final int width;
    private final byte[] data;

    DisplayBuffer(int height, int width, byte[] data)
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

    /**
     * Returns the pixel value (0...255).
     */
    public int getSample(int row,int col) 
    {
        return data[ row*width + col ] & 0xff;
    }

    public byte[] getData() 
    {
        return data.clone();
    }

    public BufferedImage toImage() 
    {
        final BufferedImage image = new BufferedImage( width , height , BufferedImage.TYPE_BYTE_GRAY );
        final byte[] pixels = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
        // TYPE_BYTE_GRAY has no row padding
        System.arraycopy( data , 0 , pixels , 0 , data.length );
        return image;
    }

    @Override
    public String toString()
    {
        return "DisplayBuffer [height=" + height + ", width=" + width + "]";
    }
}
