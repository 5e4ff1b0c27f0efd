package de.codesourcery.fftfilter;

import java.util.Random;

import junit.framework.TestCase;

public class SpectralTransformTest extends TestCase {

	private final SpectralTransform transform = new SpectralTransform();

	public void testRoundTripEvenSize() 
	{
		assertRoundTrip( randomRaster( 16 , 16 , 0xdeadbeef ) );
	}

	public void testRoundTripOddSize() 
	{
		assertRoundTrip( randomRaster( 7 , 5 , 42 ) );
	}

	public void testRoundTripNonSquareMixedParity() 
	{
		assertRoundTrip( randomRaster( 12 , 9 , 1234 ) );
	}

	public void testRoundTripSingleRow() 
	{
		assertRoundTrip( randomRaster( 1 , 9 , 7 ) );
	}

	public void testRoundTripSingleColumn() 
	{
		assertRoundTrip( randomRaster( 6 , 1 , 8 ) );
	}

	public void testRoundTripSinglePixel() 
	{
		assertRoundTrip( Raster.of( new double[][] { { 3.5 } } ) );
	}

	public void testRoundTripLargeRange() 
	{
		final Raster raster = Raster.of( new double[][] { 
				{ 0 , 65535 , 12 , 40000 } , 
				{ 1.5 , 2.25 , 30000 , 0.125 } ,
				{ 100 , 200 , 300 , 400 } } );
		assertRoundTrip( raster );
	}

	public void testNegativeSamplesComeBackAsMagnitude() 
	{
		final Raster raster = Raster.of( new double[][] { { -1 , 2 , -3 } , { 4 , -5 , 6 } } );
		final Raster result = transform.inverse( transform.forward( raster ) ).magnitude();
		for ( int row = 0 ; row < 2 ; row++ ) 
		{
			for ( int col = 0 ; col < 3 ; col++ ) {
				assertEquals( Math.abs( raster.get( row , col ) ) , result.get( row , col ) , 1e-9 );
			}
		}
	}

	public void testDcCoefficientIsCentered() 
	{
		final int height = 6;
		final int width = 5;
		final double[] data = new double[ height * width ];
		java.util.Arrays.fill( data , 2.0 );

		final Spectrum spectrum = transform.forward( new Raster( height , width , data ) );
		assertEquals( 3 , spectrum.getCenterRow() );
		assertEquals( 2 , spectrum.getCenterColumn() );

		for ( int row = 0 ; row < height ; row++ ) 
		{
			for ( int col = 0 ; col < width ; col++ ) 
			{
				final double expected = ( row == 3 && col == 2 ) ? 60.0 : 0.0;
				assertEquals( "("+row+","+col+")" , expected , spectrum.getReal( row , col ) , 1e-9 );
				assertEquals( "("+row+","+col+")" , 0.0 , spectrum.getImaginary( row , col ) , 1e-9 );
			}
		}
	}

	public void testForwardMatchesDirectDft() 
	{
		final Raster raster = randomRaster( 3 , 4 , 99 );
		final int height = raster.getHeight();
		final int width = raster.getWidth();
		final Spectrum spectrum = transform.forward( raster );

		for ( int u = 0 ; u < height ; u++ ) 
		{
			for ( int v = 0 ; v < width ; v++ ) 
			{
				double re = 0;
				double im = 0;
				for ( int y = 0 ; y < height ; y++ ) 
				{
					for ( int x = 0 ; x < width ; x++ ) 
					{
						final double angle = -2*Math.PI*( u*y / (double) height + v*x / (double) width );
						re += raster.get( y , x ) * Math.cos( angle );
						im += raster.get( y , x ) * Math.sin( angle );
					}
				}
				final int row = ( u + height / 2 ) % height;
				final int col = ( v + width / 2 ) % width;
				assertEquals( re , spectrum.getReal( row , col ) , 1e-9 );
				assertEquals( im , spectrum.getImaginary( row , col ) , 1e-9 );
			}
		}
	}

	public void testReverseShiftUndoesForwardShiftForOddSizes() 
	{
		final int height = 5;
		final int width = 3;
		final double[][] data = new double[ height ][ 2*width ];
		double value = 0;
		for ( int row = 0 ; row < height ; row++ ) 
		{
			for ( int i = 0 ; i < 2*width ; i++ ) {
				data[row][i] = value++;
			}
		}

		final double[][] shifted = SpectralTransform.shift( data , height , width , true );
		// element (0,0) moves to the center
		assertEquals( 0.0 , shifted[2][2] , 0.0 );
		assertEquals( 1.0 , shifted[2][3] , 0.0 );

		final double[][] restored = SpectralTransform.shift( shifted , height , width , false );
		for ( int row = 0 ; row < height ; row++ ) {
			assertTrue( java.util.Arrays.equals( data[row] , restored[row] ) );
		}
	}

	public void testNonFiniteSamplesPropagate() 
	{
		final Raster raster = Raster.of( new double[][] { { 1 , Double.NaN } , { 3 , 4 } } );
		final Raster result = transform.inverse( transform.forward( raster ) ).magnitude();
		assertTrue( Double.isNaN( result.get( 0 , 0 ) ) );
	}

	public void testForwardDoesNotModifyRaster() 
	{
		final Raster raster = randomRaster( 4 , 4 , 5 );
		final double[] before = raster.toArray();
		transform.forward( raster );
		assertTrue( java.util.Arrays.equals( before , raster.toArray() ) );
	}

	public void testInvalidDimensions() 
	{
		try {
			new Raster( 0 , 3 , new double[0] );
			fail("Should have failed");
		} catch(InvalidDimensionsException e) {
			// ok
		}
		try {
			new Raster( 2 , 2 , new double[3] );
			fail("Should have failed");
		} catch(InvalidDimensionsException e) {
			// ok
		}
		try {
			Raster.of( new double[][] { { 1 , 2 } , { 3 } } );
			fail("Should have failed");
		} catch(InvalidDimensionsException e) {
			// ok
		}
	}

	private void assertRoundTrip(Raster raster) 
	{
		final Raster result = transform.inverse( transform.forward( raster ) ).magnitude();
		assertEquals( raster.getHeight() , result.getHeight() );
		assertEquals( raster.getWidth() , result.getWidth() );
		for ( int row = 0 ; row < raster.getHeight() ; row++ ) 
		{
			for ( int col = 0 ; col < raster.getWidth() ; col++ ) 
			{
				final double expected = raster.get( row , col );
				final double tolerance = Math.max( 1e-9 , Math.abs( expected ) * 1e-3 );
				assertEquals( "("+row+","+col+")" , expected , result.get( row , col ) , tolerance );
			}
		}
	}

	protected static Raster randomRaster(int height,int width,long seed) 
	{
		final Random rnd = new Random( seed );
		final double[] data = new double[ height * width ];
		for ( int i = 0 ; i < data.length ; i++ ) {
			data[i] = rnd.nextDouble() * 1000;
		}
		return new Raster( height , width , data );
	}
}
