/*-
 * #%L
 * Complex steerable pyramid decomposition and reconstruction
 * of two-dimensional images.
 * %%
 * Copyright (C) 2024 - 2026 Steerable Pyramid developers.
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 2 of the
 * License, or (at your option) any later version.
 * 
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-2.0.html>.
 * #L%
 */
package net.preibisch.steerpyr.grid;

import java.util.Arrays;
import java.util.function.DoubleUnaryOperator;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;
import util.ImgLib2Tools;

/**
 * A one-dimensional piecewise-linear lookup table (X,Y). X is strictly increasing. Evaluating outside of
 * [X[0], X[n-1]] returns the boundary value.
 */
public class LookupTable
{
	/**
	 * number of samples of the raised cosine between its two plateaus, large enough that the interpolated
	 * complementary profiles sqrt(Y) and sqrt(1-Y) have squares summing to one within 1e-6
	 */
	public static final int RAISED_COSINE_SIZE = 1024;

	final double[] x, y;

	public LookupTable( final double[] x, final double[] y )
	{
		if ( x.length != y.length )
			throw new IllegalArgumentException( "Abscissa and values of the lookup table differ in length: " + x.length + " != " + y.length );

		if ( x.length < 2 )
			throw new IllegalArgumentException( "A lookup table needs at least two entries." );

		for ( int i = 1; i < x.length; ++i )
			if ( !( x[ i ] > x[ i - 1 ] ) )
				throw new IllegalArgumentException( "Abscissa of the lookup table is not strictly increasing at index " + i );

		this.x = x.clone();
		this.y = y.clone();
	}

	/**
	 * A raised-cosine transition from 0 to 1: cos^2 on [-pi/2, 0] mapped onto
	 * [position - width/2, position + width/2].
	 * The end values are repeated so that evaluation beyond the transition is flat.
	 *
	 * @param width - width of the transition (in log2 frequency units)
	 * @param position - center of the transition
	 * @return the table
	 */
	public static LookupTable raisedCosine( final double width, final double position )
	{
		final int sz = RAISED_COSINE_SIZE;
		final double[] x = new double[ sz + 3 ];
		final double[] y = new double[ sz + 3 ];

		for ( int i = 0; i < x.length; ++i )
		{
			final double xi = Math.PI * ( i - sz - 1 ) / ( 2.0 * sz );
			final double c = Math.cos( xi );

			y[ i ] = c * c;
			x[ i ] = position + ( 2.0 * width / Math.PI ) * ( xi + Math.PI / 4.0 );
		}

		y[ 0 ] = y[ 1 ];
		y[ sz + 2 ] = y[ sz + 1 ];

		return new LookupTable( x, y );
	}

	/**
	 * @param op - applied to every value
	 * @return a table with the same abscissa
	 */
	public LookupTable mapValues( final DoubleUnaryOperator op )
	{
		final double[] v = new double[ y.length ];
		for ( int i = 0; i < v.length; ++i )
			v[ i ] = op.applyAsDouble( y[ i ] );

		return new LookupTable( x, v );
	}

	/**
	 * @param offset - added to every abscissa value
	 * @return a table with the same values
	 */
	public LookupTable shift( final double offset )
	{
		final double[] v = new double[ x.length ];
		for ( int i = 0; i < v.length; ++i )
			v[ i ] = x[ i ] + offset;

		return new LookupTable( v, y );
	}

	public int size() { return x.length; }
	public double x( final int i ) { return x[ i ]; }
	public double y( final int i ) { return y[ i ]; }

	public double evaluate( final double value )
	{
		final int last = x.length - 1;

		if ( value <= x[ 0 ] )
			return y[ 0 ];

		if ( value >= x[ last ] )
			return y[ last ];

		int i = Arrays.binarySearch( x, value );

		if ( i >= 0 )
			return y[ i ];

		// x[ i ] < value < x[ i + 1 ]
		i = -i - 2;

		final double t = ( value - x[ i ] ) / ( x[ i + 1 ] - x[ i ] );
		return y[ i ] + t * ( y[ i + 1 ] - y[ i ] );
	}

	/**
	 * Evaluates the table at every pixel of the grid (pointOp).
	 *
	 * @param grid - e.g. log-radius or angle of a {@link PolarGrid}
	 * @return a new mask of the same size
	 */
	public ArrayImg< DoubleType, DoubleArray > apply( final ArrayImg< DoubleType, DoubleArray > grid )
	{
		final double[] in = ImgLib2Tools.data( grid );
		final double[] out = new double[ in.length ];

		for ( int i = 0; i < in.length; ++i )
			out[ i ] = evaluate( in[ i ] );

		return ArrayImgs.doubles( out, grid.dimension( 0 ), grid.dimension( 1 ) );
	}
}
