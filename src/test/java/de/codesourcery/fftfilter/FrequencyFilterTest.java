package de.codesourcery.fftfilter;

import java.util.Arrays;

import junit.framework.TestCase;
import de.codesourcery.fftfilter.filter.FilterConfiguration;

public class FrequencyFilterTest extends TestCase {

	private final FrequencyFilter filter = new FrequencyFilter();

	public void testLowPassBlursCenteredPoint() 
	{
		final int size = 64;
		final int center = size / 2;
		final double[] data = new double[ size * size ];
		data[ center * size + center ] = 1.0;
		final Raster point = new Raster( size , size , data );

		final FilterConfiguration config = FilterConfiguration.lowPass( 5 );

		// unnormalized peak is (number of passing coefficients) / (number of pixels)
		int passing = 0;
		for ( int dy = -5 ; dy <= 5 ; dy++ ) 
		{
			for ( int dx = -5 ; dx <= 5 ; dx++ ) 
			{
				if ( dy*dy + dx*dx <= 25 ) {
					passing++;
				}
			}
		}
		final Raster reconstructed = filter.reconstruct( point , config );
		assertEquals( passing / (double) ( size * size ) , reconstructed.get( center , center ) , 1e-12 );

		final DisplayBuffer out = filter.apply( point , config );

		// peak stays where the point was
		assertEquals( 255 , out.getSample( center , center ) );
		for ( int row = 0 ; row < size ; row++ ) 
		{
			for ( int col = 0 ; col < size ; col++ ) 
			{
				if ( row != center || col != center ) {
					assertTrue( "("+row+","+col+")" , out.getSample( row , col ) < 255 );
				}
			}
		}

		// no longer a point
		assertTrue( out.getSample( center , center + 1 ) > 200 );
		assertTrue( out.getSample( center + 2 , center ) > 100 );

		// intensity falls off from the center and is radially symmetric
		for ( int d = 1 ; d <= 5 ; d++ ) 
		{
			final int value = out.getSample( center , center + d );
			assertTrue( "d="+d , value < out.getSample( center , center + d - 1 ) );
			assertClose( value , out.getSample( center , center - d ) );
			assertClose( value , out.getSample( center + d , center ) );
			assertClose( value , out.getSample( center - d , center ) );
		}
		assertClose( out.getSample( center + 3 , center + 4 ) , out.getSample( center - 4 , center - 3 ) );
	}

	public void testAllPassReturnsInput() 
	{
		final Raster raster = SpectralTransformTest.randomRaster( 20 , 15 , 17 );
		final Raster result = filter.reconstruct( raster , FilterConfiguration.lowPass( 1000 ) );
		for ( int row = 0 ; row < 20 ; row++ ) 
		{
			for ( int col = 0 ; col < 15 ; col++ ) {
				assertEquals( raster.get( row , col ) , result.get( row , col ) , 1e-6 );
			}
		}
	}

	public void testHighPassWithZeroCutoffRemovesMean() 
	{
		final Raster raster = SpectralTransformTest.randomRaster( 8 , 12 , 23 );
		double mean = 0;
		for ( double v : raster.toArray() ) {
			mean += v;
		}
		mean /= 8*12;

		final Raster result = filter.reconstruct( raster , FilterConfiguration.highPass( 0 ) );
		for ( int row = 0 ; row < 8 ; row++ ) 
		{
			for ( int col = 0 ; col < 12 ; col++ ) {
				assertEquals( Math.abs( raster.get( row , col ) - mean ) , result.get( row , col ) , 1e-6 );
			}
		}
	}

	public void testDegenerateBandBlocksEverything() 
	{
		final Raster raster = SpectralTransformTest.randomRaster( 16 , 16 , 11 );
		final Raster result = filter.reconstruct( raster , FilterConfiguration.bandPass( 4 , 4 ) );
		for ( double v : result.toArray() ) {
			assertEquals( 0.0 , v , 0.0 );
		}
		assertTrue( Arrays.equals( new byte[ 16*16 ] , filter.apply( raster , FilterConfiguration.bandPass( 4 , 4 ) ).getData() ) );
	}

	public void testInvertedBandPassGivesSameResult() 
	{
		final Raster raster = SpectralTransformTest.randomRaster( 24 , 24 , 13 );
		final byte[] expected = filter.apply( raster , FilterConfiguration.bandPass( 3 , 9 ) ).getData();
		final byte[] actual = filter.apply( raster , FilterConfiguration.bandPass( 9 , 3 ) ).getData();
		assertTrue( Arrays.equals( expected , actual ) );
	}

	public void testFilterResult() 
	{
		final Raster raster = SpectralTransformTest.randomRaster( 32 , 32 , 19 );
		final FilterConfiguration config = FilterConfiguration.lowPass( 6 );
		final FilterResult result = filter.filter( raster , config );

		assertEquals( config , result.getConfiguration() );
		assertTrue( Arrays.equals( filter.apply( raster , config ).getData() , result.getOutput().getData() ) );

		// masked spectrum: DC dominates for non-negative input, blocked coefficients are black
		final DisplayBuffer spectrum = result.getSpectrum();
		assertEquals( 32 , spectrum.getHeight() );
		assertEquals( 32 , spectrum.getWidth() );
		assertEquals( 255 , spectrum.getSample( 16 , 16 ) );
		assertEquals( 0 , spectrum.getSample( 0 , 0 ) );
		assertEquals( 0 , spectrum.getSample( 16 , 23 ) );
	}

	public void testInputIsNotModified() 
	{
		final Raster raster = SpectralTransformTest.randomRaster( 10 , 10 , 29 );
		final double[] before = raster.toArray();
		filter.apply( raster , FilterConfiguration.highPass( 2 ) );
		assertTrue( Arrays.equals( before , raster.toArray() ) );
	}

	private static void assertClose(int expected,int actual) 
	{
		assertTrue( "expected "+expected+" but got "+actual , Math.abs( expected - actual ) <= 1 );
	}
}
