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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;
import net.preibisch.steerpyr.grid.AngularProfile;
import net.preibisch.steerpyr.grid.LookupTable;
import net.preibisch.steerpyr.grid.PolarGrid;
import net.preibisch.steerpyr.spectrum.CropWindow;

/**
 * All frequency masks of a pyramid for one image size. The masks are a pure function of the parameters and the
 * size, builder and reconstructor read the same instance so decomposition and reconstruction use bit-identical
 * masks. Instances are read-only after creation and can be shared between threads.
 * <p>
 * Radial masks are raised cosines in log2-frequency. The high-pass / low-pass pair at the top satisfies
 * hi0^2 + lo0^2 = 1; every band-pass level shifts the transition down by log2( scaleFactor ).
 */
public class PyramidFilters
{
	private static final Logger LOG = LoggerFactory.getLogger( PyramidFilters.class );

	/**
	 * The masks of one band-pass level. The high-pass and angular masks have the size of the level, the low-pass
	 * mask has the size of the crop window that leads to the next level.
	 */
	public static class BandFilters
	{
		final int rows, cols;
		final ArrayImg< DoubleType, DoubleArray > hiMask;
		final List< ArrayImg< DoubleType, DoubleArray > > analysisAngleMasks;
		final List< ArrayImg< DoubleType, DoubleArray > > synthesisAngleMasks;
		final CropWindow crop;
		final ArrayImg< DoubleType, DoubleArray > loMask;

		BandFilters(
				final int rows,
				final int cols,
				final ArrayImg< DoubleType, DoubleArray > hiMask,
				final List< ArrayImg< DoubleType, DoubleArray > > analysisAngleMasks,
				final List< ArrayImg< DoubleType, DoubleArray > > synthesisAngleMasks,
				final CropWindow crop,
				final ArrayImg< DoubleType, DoubleArray > loMask )
		{
			this.rows = rows;
			this.cols = cols;
			this.hiMask = hiMask;
			this.analysisAngleMasks = Collections.unmodifiableList( analysisAngleMasks );
			this.synthesisAngleMasks = Collections.unmodifiableList( synthesisAngleMasks );
			this.crop = crop;
			this.loMask = loMask;
		}

		public int getRows() { return rows; }
		public int getCols() { return cols; }
		public ArrayImg< DoubleType, DoubleArray > getHiMask() { return hiMask; }
		public ArrayImg< DoubleType, DoubleArray > getAnalysisAngleMask( final int b ) { return analysisAngleMasks.get( b ); }
		public ArrayImg< DoubleType, DoubleArray > getSynthesisAngleMask( final int b ) { return synthesisAngleMasks.get( b ); }
		public CropWindow getCrop() { return crop; }
		public ArrayImg< DoubleType, DoubleArray > getLoMask() { return loMask; }
	}

	final PyramidParameters parameters;
	final int rows, cols;
	final ArrayImg< DoubleType, DoubleArray > hi0Mask, lo0Mask;
	final List< BandFilters > bandFilters;
	final int lowPassRows, lowPassCols;

	PyramidFilters(
			final PyramidParameters parameters,
			final int rows,
			final int cols,
			final ArrayImg< DoubleType, DoubleArray > hi0Mask,
			final ArrayImg< DoubleType, DoubleArray > lo0Mask,
			final List< BandFilters > bandFilters,
			final int lowPassRows,
			final int lowPassCols )
	{
		this.parameters = parameters;
		this.rows = rows;
		this.cols = cols;
		this.hi0Mask = hi0Mask;
		this.lo0Mask = lo0Mask;
		this.bandFilters = Collections.unmodifiableList( bandFilters );
		this.lowPassRows = lowPassRows;
		this.lowPassCols = lowPassCols;
	}

	/**
	 * The radial transition of the top level, sqrt of a raised cosine from log-radius -1 to 0.
	 */
	public static LookupTable radialTransition()
	{
		return LookupTable.raisedCosine( 1, -0.5 ).mapValues( Math::sqrt );
	}

	/**
	 * @param transition - the radial transition
	 * @return sqrt( |1 - Y^2| ), the complementary low-pass profile
	 */
	public static LookupTable complement( final LookupTable transition )
	{
		return transition.mapValues( y -> Math.sqrt( Math.abs( 1 - y * y ) ) );
	}

	/**
	 * Computes all masks for images of the given size. Does not check whether the pyramid fits the image,
	 * see {@link PyramidParameters#checkImageSize(int, int)}.
	 *
	 * @param parameters - the pyramid configuration
	 * @param rows - image height
	 * @param cols - image width
	 * @return the filter bank
	 */
	public static PyramidFilters create( final PyramidParameters parameters, final int rows, final int cols )
	{
		PolarGrid grid = PolarGrid.create( rows, cols );

		LookupTable hiProfile = radialTransition();
		LookupTable loProfile = complement( hiProfile );

		final ArrayImg< DoubleType, DoubleArray > hi0Mask = hiProfile.apply( grid.getLogRad() );
		final ArrayImg< DoubleType, DoubleArray > lo0Mask = loProfile.apply( grid.getLogRad() );

		final AngularProfile angular = parameters.getAngularProfile();
		final double shift = parameters.getRadialShift();
		final ArrayList< BandFilters > bandFilters = new ArrayList<>();

		for ( int level = 0; level < parameters.getNumBandPassLevels(); ++level )
		{
			hiProfile = hiProfile.shift( -shift );
			loProfile = loProfile.shift( -shift );

			final ArrayImg< DoubleType, DoubleArray > hiMask = hiProfile.apply( grid.getLogRad() );

			final ArrayList< ArrayImg< DoubleType, DoubleArray > > analysis = new ArrayList<>();
			final ArrayList< ArrayImg< DoubleType, DoubleArray > > synthesis = new ArrayList<>();

			for ( int b = 0; b < parameters.getNumBands(); ++b )
			{
				analysis.add( angular.analysisMask( grid.getAngle(), b ) );
				synthesis.add( angular.synthesisMask( grid.getAngle(), b ) );
			}

			final CropWindow crop = CropWindow.nextOctave( grid.getRows(), grid.getCols() );
			final int levelRows = grid.getRows();
			final int levelCols = grid.getCols();

			grid = grid.crop( crop );

			final ArrayImg< DoubleType, DoubleArray > loMask = loProfile.apply( grid.getLogRad() );

			bandFilters.add( new BandFilters( levelRows, levelCols, hiMask, analysis, synthesis, crop, loMask ) );

			LOG.debug( "Filters for band-pass level {}: {}x{}, crop {}", level + 1, levelRows, levelCols, crop );
		}

		return new PyramidFilters( parameters, rows, cols, hi0Mask, lo0Mask, bandFilters, grid.getRows(), grid.getCols() );
	}

	public PyramidParameters getParameters() { return parameters; }
	public int getRows() { return rows; }
	public int getCols() { return cols; }

	/** @return the top-level high-pass mask, do not modify */
	public ArrayImg< DoubleType, DoubleArray > getHi0Mask() { return hi0Mask; }

	/** @return the top-level low-pass mask, do not modify */
	public ArrayImg< DoubleType, DoubleArray > getLo0Mask() { return lo0Mask; }

	public int numBandPassLevels() { return bandFilters.size(); }

	/**
	 * @param index - 0 for pyramid level 1, ...
	 * @return the masks of that band-pass level
	 */
	public BandFilters getBandFilters( final int index ) { return bandFilters.get( index ); }

	public int getLowPassRows() { return lowPassRows; }
	public int getLowPassCols() { return lowPassCols; }
}
