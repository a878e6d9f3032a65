package net.preibisch.steerpyr.spectrum;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class CropWindowTest
{
	@Test
	public void testEvenSize()
	{
		final CropWindow w = CropWindow.nextOctave( 128, 64 );

		assertEquals( 32, w.getRowStart() );
		assertEquals( 64, w.getRows() );
		assertEquals( 96, w.getRowEnd() );

		assertEquals( 16, w.getColStart() );
		assertEquals( 32, w.getCols() );
	}

	@Test
	public void testOddSize()
	{
		// ceil(7.5/2) - ceil((ceil(6.5/2)+0.5)/2) = 4 - 3
		assertEquals( 1, CropWindow.start( 7 ) );
		assertEquals( 4, CropWindow.size( 7 ) );

		assertEquals( 1, CropWindow.start( 5 ) );
		assertEquals( 3, CropWindow.size( 5 ) );
	}

	@Test
	public void testCenterIsKept()
	{
		// the zero frequency of the cropped spectrum is the zero frequency of the source
		for ( int d = 2; d < 40; ++d )
		{
			final int center = (int)Math.ceil( ( d + 0.5 ) / 2 ) - 1;
			final int croppedCenter = (int)Math.ceil( ( CropWindow.size( d ) + 0.5 ) / 2 ) - 1;

			assertEquals( "d=" + d, center, CropWindow.start( d ) + croppedCenter );
		}
	}

	@Test( expected = IllegalStateException.class )
	public void testTooSmall()
	{
		CropWindow.nextOctave( 0, 4 );
	}
}
