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

import org.apache.commons.math3.util.CombinatoricsUtils;
import org.apache.commons.math3.util.FastMath;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Angular tuning curves of the oriented subbands, cos(theta)^order with order = nbands - 1, tabulated over an
 * abscissa that spans more than three periods so that shifted copies still cover (-pi, pi].
 * <p>
 * The analysis profile is one-sided: 2 * sqrt(const) * cos^order where the angle is within pi/2 of a multiple of
 * 2*pi, half of that at exactly +-pi/2, zero elsewhere. Only one of each pair of opposite frequencies is kept, which makes every subband analytic
 * (its imaginary part is the Hilbert transform of its real part). The synthesis profile is the two-sided
 * sqrt(const) * cos^order. Summed over all orientations, the product of both profiles, made symmetric by taking
 * the real part, is one everywhere.
 */
public class AngularProfile
{
	/** half the number of table entries per period */
	public static final int LUT_SIZE = 1024;

	final int nbands;
	final double normalization;
	final LookupTable analysis, synthesis;

	public AngularProfile( final int nbands )
	{
		if ( nbands < 1 )
			throw new IllegalArgumentException( "Number of orientation bands must be >= 1, got " + nbands );

		this.nbands = nbands;
		this.normalization = normalization( nbands );

		final int first = -( 2 * LUT_SIZE + 1 );
		final int last = LUT_SIZE + 1;

		final double[] xcosn = new double[ last - first + 1 ];

		final double[] ya = new double[ xcosn.length ];
		final double[] ys = new double[ xcosn.length ];

		final int order = nbands - 1;
		final double amplitude = Math.sqrt( normalization );

		for ( int i = 0; i < xcosn.length; ++i )
		{
			xcosn[ i ] = Math.PI * ( first + i ) / LUT_SIZE;

			final double c = FastMath.pow( Math.cos( xcosn[ i ] ), order );

			// node index wrapped to [-LUT_SIZE, LUT_SIZE), i.e. the angle wrapped to [-pi, pi)
			final int k = Math.abs( Math.floorMod( first + i + LUT_SIZE, 2 * LUT_SIZE ) - LUT_SIZE );

			ys[ i ] = amplitude * c;

			// the nodes at exactly +-pi/2 are shared by a frequency and its mirror, each gets half
			if ( k < LUT_SIZE / 2 )
				ya[ i ] = 2 * amplitude * c;
			else if ( k == LUT_SIZE / 2 )
				ya[ i ] = amplitude * c;
			else
				ya[ i ] = 0;
		}

		this.analysis = new LookupTable( xcosn, ya );
		this.synthesis = new LookupTable( xcosn, ys );
	}

	/**
	 * 2^(2n) * (n!)^2 / ( nbands * (2n)! ) with n = nbands - 1, evaluated in log space.
	 *
	 * @param nbands - number of orientations
	 * @return the constant that makes the squared tuning curves of all orientations sum to one
	 */
	public static double normalization( final int nbands )
	{
		final int n = nbands - 1;

		return Math.exp(
				2 * n * Math.log( 2 ) +
				2 * CombinatoricsUtils.factorialLog( n ) -
				Math.log( nbands ) -
				CombinatoricsUtils.factorialLog( 2 * n ) );
	}

	/**
	 * @param x - an angle
	 * @return the same angle in [-pi, pi)
	 */
	public static double wrap( final double x )
	{
		double m = ( x + Math.PI ) % ( 2 * Math.PI );

		if ( m < 0 )
			m += 2 * Math.PI;

		return m - Math.PI;
	}

	/**
	 * @param b - orientation index
	 * @return center angle of orientation b, pi * b / nbands
	 */
	public double centerAngle( final int b )
	{
		return Math.PI * b / nbands;
	}

	public ArrayImg< DoubleType, DoubleArray > analysisMask( final ArrayImg< DoubleType, DoubleArray > angle, final int b )
	{
		return analysis.shift( centerAngle( b ) ).apply( angle );
	}

	public ArrayImg< DoubleType, DoubleArray > synthesisMask( final ArrayImg< DoubleType, DoubleArray > angle, final int b )
	{
		return synthesis.shift( centerAngle( b ) ).apply( angle );
	}

	public int getNumBands() { return nbands; }
	public double getNormalization() { return normalization; }
	public LookupTable getAnalysisTable() { return analysis; }
	public LookupTable getSynthesisTable() { return synthesis; }
}
