package net.preibisch.steerpyr.pyramid;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

import org.junit.Test;

public class PyramidParametersTest
{
	@Test
	public void testDefaults()
	{
		final PyramidParameters p = new PyramidParameters();

		assertEquals( 5, p.getHeight() );
		assertEquals( 4, p.getNumBands() );
		assertEquals( 2.0, p.getScaleFactor(), 0 );
		assertEquals( 3, p.getNumBandPassLevels() );
		assertEquals( 3, p.getOrder() );
		assertEquals( 1.0, p.getRadialShift(), 1e-15 );
		assertEquals( 4, p.getAngularProfile().getNumBands() );
	}

	@Test
	public void testMaxHeight()
	{
		assertEquals( 5, PyramidParameters.maxHeight( 128, 128 ) );
		assertEquals( 5, PyramidParameters.maxHeight( 255, 1000 ) );
		assertEquals( 3, PyramidParameters.maxHeight( 32, 32 ) );
		assertEquals( 2, PyramidParameters.maxHeight( 16, 31 ) );
	}

	@Test( expected = PyramidConfigurationException.class )
	public void testTooHighForImage()
	{
		new PyramidParameters( 8, 4 ).checkImageSize( 32, 32 );
	}

	@Test
	public void testFitsImage()
	{
		new PyramidParameters( 3, 4 ).checkImageSize( 32, 32 );
		new PyramidParameters( 2, 1 ).checkImageSize( 16, 16 );
	}

	@Test
	public void testRadialDepth()
	{
		assertEquals( 3.0, new PyramidParameters( 5, 4 ).getRadialDepth(), 1e-12 );
		assertEquals( 6.0, new PyramidParameters( 5, 4, 4 ).getRadialDepth(), 1e-12 );
		assertEquals( 0.0, new PyramidParameters( 2, 4, 8 ).getRadialDepth(), 0 );
		assertEquals( 5.0, PyramidParameters.maxRadialDepth( 128, 300 ), 1e-12 );

		// a scale factor of 2 never reaches the limit for any height the image admits
		for ( int size = 16; size <= 1024; size += 7 )
		{
			final int h = PyramidParameters.maxHeight( size, size );
			new PyramidParameters( h, 4 ).checkImageSize( size, size );
		}
	}

	@Test
	public void testLargerScaleFactorsThatFit()
	{
		new PyramidParameters( 5, 4, 3 ).checkImageSize( 128, 128 );
		new PyramidParameters( 4, 4, 4 ).checkImageSize( 128, 128 );
		new PyramidParameters( 3, 4, 32 ).checkImageSize( 128, 128 );
	}

	@Test( expected = PyramidConfigurationException.class )
	public void testScaleFactorTooLargeForImage()
	{
		// 3 band-pass levels of 2 octaves each, but a 128 image only supports 5
		new PyramidParameters( 5, 4, 4 ).checkImageSize( 128, 128 );
	}

	@Test( expected = PyramidConfigurationException.class )
	public void testScaleFactorTooLargeForSingleLevel()
	{
		new PyramidParameters( 3, 4, 64 ).checkImageSize( 128, 128 );
	}

	@Test( expected = PyramidConfigurationException.class )
	public void testHeightTooSmall()
	{
		new PyramidParameters( 1, 4 );
	}

	@Test( expected = PyramidConfigurationException.class )
	public void testNoOrientations()
	{
		new PyramidParameters( 4, 0 );
	}

	@Test( expected = PyramidConfigurationException.class )
	public void testScaleFactorTooSmall()
	{
		new PyramidParameters( 4, 4, 1.5 );
	}

	@Test( expected = PyramidConfigurationException.class )
	public void testScaleFactorNaN()
	{
		new PyramidParameters( 4, 4, Double.NaN );
	}

	@Test
	public void testEquality()
	{
		assertEquals( new PyramidParameters( 4, 6, 2 ), new PyramidParameters( 4, 6 ) );
		assertEquals( new PyramidParameters( 4, 6, 2 ).hashCode(), new PyramidParameters( 4, 6 ).hashCode() );
		assertNotEquals( new PyramidParameters( 4, 6 ), new PyramidParameters( 4, 5 ) );
		assertNotEquals( new PyramidParameters( 4, 6, 2 ), new PyramidParameters( 4, 6, 3 ) );
	}

	@Test
	public void testConfigurationErrorIsIllegalArgument()
	{
		try
		{
			new PyramidParameters( 0, 4 );
		}
		catch ( final IllegalArgumentException e )
		{
			assertEquals( PyramidConfigurationException.class, e.getClass() );
			return;
		}

		throw new AssertionError( "no exception thrown" );
	}
}
