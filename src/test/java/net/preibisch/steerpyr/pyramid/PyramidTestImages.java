package net.preibisch.steerpyr.pyramid;

import java.util.Random;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Reproducible test images.
 */
public class PyramidTestImages
{
	/**
	 * @return uniform random integer intensities in [0, 255]
	 */
	public static ArrayImg< DoubleType, DoubleArray > random( final int rows, final int cols, final long seed )
	{
		final Random rnd = new Random( seed );
		final double[] data = new double[ rows * cols ];

		for ( int i = 0; i < data.length; ++i )
			data[ i ] = rnd.nextInt( 256 );

		return ArrayImgs.doubles( data, cols, rows );
	}

	/**
	 * @return a smooth blob with an oriented grating on top, values in [0, 255]
	 */
	public static ArrayImg< DoubleType, DoubleArray > grating( final int rows, final int cols, final double angle, final double period )
	{
		final double[] data = new double[ rows * cols ];
		final double dx = Math.cos( angle ), dy = Math.sin( angle );

		for ( int r = 0, i = 0; r < rows; ++r )
			for ( int c = 0; c < cols; ++c, ++i )
			{
				final double x = c - cols / 2.0, y = r - rows / 2.0;
				final double blob = Math.exp( -( x * x + y * y ) / ( rows * cols / 8.0 ) );

				data[ i ] = Math.round( 127.5 + 60 * blob + 60 * Math.cos( 2 * Math.PI * ( x * dx + y * dy ) / period ) );
			}

		return ArrayImgs.doubles( data, cols, rows );
	}
}
