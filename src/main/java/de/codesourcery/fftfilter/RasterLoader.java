package de.codesourcery.fftfilter;

import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;

import org.apache.commons.lang.StringUtils;

/**
 * Decodes image files into {@link Raster}s.
 * 
 * <p>TIFF files are treated as scientific single-band rasters: the first band is read
 * with its original sample values (16-bit, 32-bit and floating point samples are kept 
 * as they are). Other formats are decoded with ImageIO, single-band images keep their 
 * samples, color and palette images are converted to luminance 
 * (<code>0.299 R + 0.587 G + 0.114 B</code>).</p>
 */
public final class RasterLoader
{
    public static final List<String> TIFF_SUFFIXES = Arrays.asList( "tif" , "tiff" );

    public static final List<String> IMAGE_SUFFIXES = Arrays.asList( "png" , "jpg" , "jpeg" , "bmp" , "gif" );

    public Raster load(File file) throws IOException 
    {
        if ( ! file.isFile() ) {
            throw new FileNotFoundException("File does not exist: "+file.getAbsolutePath());
        }

        final String suffix = getSuffix( file );
        if ( TIFF_SUFFIXES.contains( suffix ) ) {
            return loadTiff( file );
        }
        if ( IMAGE_SUFFIXES.contains( suffix ) ) {
            return loadImage( file );
        }
        throw new IOException("Unsupported file type: "+file.getName());
    }

    private static String getSuffix(File file) 
    {
        return StringUtils.lowerCase( StringUtils.substringAfterLast( file.getName() , "." ) );
    }

    private Raster loadTiff(File file) throws IOException 
    {
        final Iterator<ImageReader> readers = ImageIO.getImageReadersByFormatName( "tiff" );
        if ( ! readers.hasNext() ) {
            throw new IOException("No TIFF reader available");
        }
        final ImageReader reader = readers.next();
        try ( ImageInputStream in = ImageIO.createImageInputStream( file ) ) 
        {
            if ( in == null ) {
                throw new IOException("Failed to open "+file.getAbsolutePath());
            }
            reader.setInput( in );

            final java.awt.image.Raster raster;
            if ( reader.canReadRaster() ) {
                raster = reader.readRaster( 0 , null );
            } else {
                raster = reader.read( 0 ).getRaster();
            }
            return firstBand( raster );
        } 
        finally {
            reader.dispose();
        }
    }

    private static Raster firstBand(java.awt.image.Raster raster) 
    {
        final int width = raster.getWidth();
        final int height = raster.getHeight();
        final double[] data = new double[ width * height ];
        final int minX = raster.getMinX();
        final int minY = raster.getMinY();
        int ptr = 0;
        for ( int y = 0 ; y < height ; y++ ) 
        {
            for ( int x = 0 ; x < width ; x++ ) {
                data[ptr++] = raster.getSampleDouble( minX + x , minY + y , 0 );
            }
        }
        return Raster.wrap( height , width , data );
    }

    private Raster loadImage(File file) throws IOException 
    {
        final BufferedImage image = ImageIO.read( file );
        if ( image == null ) {
            throw new IOException("Failed to read image "+file.getAbsolutePath());
        }

        // getRGB() would run gray samples through a color space conversion
        if ( image.getRaster().getNumBands() == 1 && ! ( image.getColorModel() instanceof IndexColorModel ) ) {
            return firstBand( image.getRaster() );
        }

        final int width = image.getWidth();
        final int height = image.getHeight();
        final double[] data = new double[ width * height ];
        int ptr = 0;
        for ( int y = 0 ; y < height ; y++ ) 
        {
            for ( int x = 0 ; x < width ; x++ ) 
            {
                final int rgb = image.getRGB( x , y );
                final int r = ( rgb >> 16 ) & 0xff;
                final int g = ( rgb >> 8 ) & 0xff;
                final int b = rgb & 0xff;
                data[ptr++] = Math.round( 0.299*r + 0.587*g + 0.114*b );
            }
        }
        return Raster.wrap( height , width , data );
    }
}
