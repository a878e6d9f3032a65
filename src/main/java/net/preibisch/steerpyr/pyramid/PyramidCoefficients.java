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
package net.preibisch.steerpyr.pyramid;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.ComplexType;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import util.ImgLib2Tools;

/**
 * The coefficients of a complex steerable pyramid, ordered from fine to coarse:
 * <pre>
 * level 0               high-pass residual (real, size of the image)
 * level 1 ... height-2  band-pass levels, nbands complex oriented subbands each
 * level height-1        low-pass residual (real)
 * </pre>
 * Instances are immutable, they are created by {@link PyramidBuilder} and read by {@link PyramidReconstructor}.
 * {@link #replaceBand(int, int, RandomAccessibleInterval)} returns a modified copy.
 */
public class PyramidCoefficients
{
	final PyramidParameters parameters;
	final List< PyramidLevel > levels;

	PyramidCoefficients( final PyramidParameters parameters, final List< PyramidLevel > levels )
	{
		if ( levels.size() < 2 )
			throw new ShapeMismatchException( "A pyramid has at least a high-pass and a low-pass level, got " + levels.size() + " level(s)." );

		if ( levels.get( 0 ).getKind() != PyramidLevel.Kind.HIGH_PASS )
			throw new ShapeMismatchException( "Level 0 must be the high-pass residual, got " + levels.get( 0 ) );

		if ( levels.get( levels.size() - 1 ).getKind() != PyramidLevel.Kind.LOW_PASS )
			throw new ShapeMismatchException( "Level " + ( levels.size() - 1 ) + " must be the low-pass residual, got " + levels.get( levels.size() - 1 ) );

		for ( int i = 1; i < levels.size() - 1; ++i )
			if ( levels.get( i ).getKind() != PyramidLevel.Kind.BAND_PASS )
				throw new ShapeMismatchException( "Level " + i + " must be a band-pass level, got " + levels.get( i ) );

		this.parameters = parameters;
		this.levels = Collections.unmodifiableList( new ArrayList<>( levels ) );
	}

	/** @return the parameters the pyramid was built with */
	public PyramidParameters getParameters() { return parameters; }

	/** @return number of levels including high-pass and low-pass */
	public int height() { return levels.size(); }

	/** @return number of orientations per band-pass level */
	public int nbands() { return parameters.getNumBands(); }

	public int numBandPassLevels() { return levels.size() - 2; }

	public List< PyramidLevel > getLevels() { return levels; }

	public PyramidLevel getLevel( final int level )
	{
		if ( level < 0 || level >= levels.size() )
			throw new IndexOutOfBoundsException( "Level " + level + " does not exist, the pyramid has " + levels.size() + " levels." );

		return levels.get( level );
	}

	public HighPassLevel getHighPass() { return (HighPassLevel)levels.get( 0 ); }

	public LowPassLevel getLowPass() { return (LowPassLevel)levels.get( levels.size() - 1 ); }

	/**
	 * @param level - 1 ... height-2
	 * @return the band-pass level
	 */
	public BandPassLevel getBandPass( final int level )
	{
		final PyramidLevel l = getLevel( level );

		if ( l.getKind() != PyramidLevel.Kind.BAND_PASS )
			throw new IllegalArgumentException( "Level " + level + " is not a band-pass level but " + l.getKind() );

		return (BandPassLevel)l;
	}

	/**
	 * @param level - 1 ... height-2
	 * @param b - orientation index
	 * @return a read-only view of the complex subband
	 */
	public RandomAccessibleInterval< ComplexDoubleType > getBand( final int level, final int b )
	{
		return getBandPass( level ).getBand( b );
	}

	/**
	 * @param level - any level
	 * @return { rows, cols } of the level, for band-pass levels of its first subband
	 */
	public long[] levelShape( final int level )
	{
		return getLevel( level ).getShape();
	}

	/**
	 * @param coefficients - a pyramid
	 * @param level - any level
	 * @return { rows, cols } of the level
	 */
	public static long[] levelShape( final PyramidCoefficients coefficients, final int level )
	{
		return coefficients.levelShape( level );
	}

	/**
	 * @param level - 1 ... height-2
	 * @param b - orientation index
	 * @param band - the new subband, same size as the one it replaces; it is copied
	 * @return a new pyramid sharing all other levels with this one
	 */
	public < C extends ComplexType< C > > PyramidCoefficients replaceBand( final int level, final int b, final RandomAccessibleInterval< C > band )
	{
		final BandPassLevel old = getBandPass( level );

		if ( band.numDimensions() != 2 || band.dimension( 0 ) != old.getCols() || band.dimension( 1 ) != old.getRows() )
			throw new ShapeMismatchException(
					"Replacement for subband " + b + " of level " + level + " must be " + old.getRows() + "x" + old.getCols() + "." );

		final ArrayList< ArrayImg< ComplexDoubleType, DoubleArray > > bands = new ArrayList<>( old.bands );
		bands.set( b, ImgLib2Tools.copyToComplexDouble( band ) );

		final ArrayList< PyramidLevel > newLevels = new ArrayList<>( levels );
		newLevels.set( level, new BandPassLevel( bands ) );

		return new PyramidCoefficients( parameters, newLevels );
	}

	@Override
	public String toString()
	{
		return "PyramidCoefficients" + levels;
	}
}
