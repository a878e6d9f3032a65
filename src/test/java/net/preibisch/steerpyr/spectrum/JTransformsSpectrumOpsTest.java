package net.preibisch.steerpyr.spectrum;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import java.util.Random;

import org.junit.Test;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.type.numeric.real.DoubleType;
import util.ImgLib2Tools;

public class JTransformsSpectrumOpsTest
{
	final SpectrumOps ops = new JTransformsSpectrumOps();

	protected static ArrayImg< ComplexDoubleType, DoubleArray > random( final int rows, final int cols, final long seed )
	{
		final Random rnd = new Random( seed );
		final double[] data = new double[ rows * cols * 2 ];

		for ( int i = 0; i < data.length; ++i )
			data[ i ] = rnd.nextDouble() * 2 - 1;

		return ArrayImgs.complexDoubles( data, cols, rows );
	}

	@Test
	public void testForwardInverse()
	{
		for ( final int[] size : new int[][] { { 8, 8 }, { 7, 12 }, { 15, 9 } } )
		{
			final ArrayImg< ComplexDoubleType, DoubleArray > img = random( size[ 0 ], size[ 1 ], 17 );
			final double[] before = ImgLib2Tools.data( img ).clone();

			final ArrayImg< ComplexDoubleType, DoubleArray > back = ops.inverseCentered( ops.forwardCentered( img ) );

			assertArrayEquals( before, ImgLib2Tools.data( img ), 0 );
			assertArrayEquals( before, ImgLib2Tools.data( back ), 1e-12 );
		}
	}

	@Test
	public void testDeltaHasFlatSpectrum()
	{
		final ArrayImg< ComplexDoubleType, DoubleArray > delta = ArrayImgs.complexDoubles( 6, 4 );
		ImgLib2Tools.data( delta )[ 0 ] = 1;

		final double[] spectrum = ImgLib2Tools.data( ops.fft( delta ) );

		for ( int i = 0; i < spectrum.length; i += 2 )
		{
			assertEquals( 1, spectrum[ i ], 1e-12 );
			assertEquals( 0, spectrum[ i + 1 ], 1e-12 );
		}
	}

	@Test
	public void testShiftMovesZeroFrequencyToCenter()
	{
		for ( final int[] size : new int[][] { { 8, 8 }, { 5, 7 }, { 6, 3 } } )
		{
			final int rows = size[ 0 ], cols = size[ 1 ];
			final ArrayImg< ComplexDoubleType, DoubleArray > img = ArrayImgs.complexDoubles( cols, rows );
			ImgLib2Tools.data( img )[ 0 ] = 1;

			final double[] shifted = ImgLib2Tools.data( ops.fftShift( img ) );
			final int center = ( rows / 2 ) * cols + cols / 2;

			assertEquals( 1, shifted[ 2 * center ], 0 );

			final ArrayImg< ComplexDoubleType, DoubleArray > r = random( rows, cols, 3 );
			assertArrayEquals( ImgLib2Tools.data( r ), ImgLib2Tools.data( ops.ifftShift( ops.fftShift( r ) ) ), 0 );
		}
	}

	@Test
	public void testCropEmbed()
	{
		final ArrayImg< ComplexDoubleType, DoubleArray > img = random( 9, 10, 42 );
		final CropWindow window = CropWindow.nextOctave( 9, 10 );

		final ArrayImg< ComplexDoubleType, DoubleArray > cropped = ops.crop( img, window );

		assertEquals( window.getCols(), cropped.dimension( 0 ) );
		assertEquals( window.getRows(), cropped.dimension( 1 ) );

		final double[] in = ImgLib2Tools.data( img );
		final double[] embedded = ImgLib2Tools.data( ops.embed( cropped, window ) );

		for ( int r = 0; r < 9; ++r )
			for ( int c = 0; c < 10; ++c )
			{
				final boolean inside = r >= window.getRowStart() && r < window.getRowEnd() && c >= window.getColStart() && c < window.getColEnd();
				final int i = 2 * ( r * 10 + c );

				assertEquals( inside ? in[ i ] : 0, embedded[ i ], 0 );
				assertEquals( inside ? in[ i + 1 ] : 0, embedded[ i + 1 ], 0 );
			}
	}

	@Test
	public void testMultiplyAndAdd()
	{
		final ArrayImg< ComplexDoubleType, DoubleArray > a = ArrayImgs.complexDoubles( new double[] { 1, 2, 3, 4 }, 2, 1 );
		final ArrayImg< DoubleType, DoubleArray > mask = ArrayImgs.doubles( new double[] { 2, 0.5 }, 2, 1 );

		assertArrayEquals( new double[] { 2, 4, 1.5, 2 }, ImgLib2Tools.data( ops.multiply( a, mask ) ), 0 );
		assertArrayEquals( new double[] { -2, 1, -4, 3 }, ImgLib2Tools.data( ops.multiply( a, ImaginaryUnit.pow( 1 ) ) ), 0 );

		final ArrayImg< ComplexDoubleType, DoubleArray > sum = ops.toComplex( ArrayImgs.doubles( new double[] { 1, 1 }, 2, 1 ) );
		ops.addTo( sum, a );

		assertArrayEquals( new double[] { 2, 2, 4, 4 }, ImgLib2Tools.data( sum ), 0 );
		assertArrayEquals( new double[] { 2, 4 }, ImgLib2Tools.data( ops.real( sum ) ), 0 );
	}

	@Test( expected = IllegalStateException.class )
	public void testSizeMismatch()
	{
		ops.multiply( random( 4, 4, 1 ), ArrayImgs.doubles( 4, 3 ) );
	}
}
