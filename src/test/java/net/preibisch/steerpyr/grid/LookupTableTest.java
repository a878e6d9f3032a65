package net.preibisch.steerpyr.grid;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;
import util.ImgLib2Tools;

public class LookupTableTest
{
	@Test
	public void testInterpolationAndClamping()
	{
		final LookupTable lut = new LookupTable( new double[] { 0, 1, 3 }, new double[] { 10, 20, 0 } );

		assertEquals( 10, lut.evaluate( -5 ), 0 );
		assertEquals( 10, lut.evaluate( 0 ), 0 );
		assertEquals( 15, lut.evaluate( 0.5 ), 1e-12 );
		assertEquals( 20, lut.evaluate( 1 ), 0 );
		assertEquals( 10, lut.evaluate( 2 ), 1e-12 );
		assertEquals( 0, lut.evaluate( 3 ), 0 );
		assertEquals( 0, lut.evaluate( 100 ), 0 );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testRejectsUnsortedAbscissa()
	{
		new LookupTable( new double[] { 0, 2, 1 }, new double[] { 0, 0, 0 } );
	}

	@Test
	public void testRaisedCosine()
	{
		final LookupTable lut = LookupTable.raisedCosine( 1, -0.5 );

		assertEquals( LookupTable.RAISED_COSINE_SIZE + 3, lut.size() );

		// flat outside of [-1, 0]
		assertEquals( 0, lut.evaluate( -3 ), 1e-12 );
		assertEquals( 1, lut.evaluate( 2 ), 1e-12 );

		// the transition passes 1/2 at its center
		assertEquals( 0.5, lut.evaluate( -0.5 ), 1e-4 );

		for ( int i = 1; i < lut.size(); ++i )
			assertEquals( true, lut.y( i ) >= lut.y( i - 1 ) - 1e-15 );
	}

	@Test
	public void testShiftAndMapValues()
	{
		final LookupTable lut = LookupTable.raisedCosine( 1, -0.5 );
		final LookupTable shifted = lut.shift( -1 );
		final LookupTable squared = lut.mapValues( y -> y * y );

		assertEquals( lut.evaluate( -0.25 ), shifted.evaluate( -1.25 ), 1e-12 );
		assertEquals( lut.evaluate( -0.3 ) * lut.evaluate( -0.3 ), squared.evaluate( -0.3 ), 1e-3 );
		assertEquals( lut.x( 5 ), squared.x( 5 ), 0 );
	}

	@Test
	public void testApplyKeepsShape()
	{
		final ArrayImg< DoubleType, DoubleArray > grid = ArrayImgs.doubles( new double[] { -2, -0.5, 0, 1, 2, 3 }, 3, 2 );
		final LookupTable lut = new LookupTable( new double[] { -1, 1 }, new double[] { 0, 2 } );

		final ArrayImg< DoubleType, DoubleArray > mask = lut.apply( grid );

		assertEquals( 3, mask.dimension( 0 ) );
		assertEquals( 2, mask.dimension( 1 ) );
		assertArrayEquals( new double[] { 0, 0.5, 1, 2, 2, 2 }, ImgLib2Tools.data( mask ), 1e-12 );
	}
}
