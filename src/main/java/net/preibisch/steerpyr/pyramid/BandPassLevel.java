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
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import util.ImgLib2Tools;

/**
 * One scale of oriented subbands. Subband b is tuned to orientation pi * b / nbands. Its real part is the
 * classical steerable pyramid coefficient, its imaginary part the Hilbert-transform companion. All subbands of a
 * level have the same size.
 */
public class BandPassLevel extends PyramidLevel
{
	final List< ArrayImg< ComplexDoubleType, DoubleArray > > bands;

	BandPassLevel( final List< ArrayImg< ComplexDoubleType, DoubleArray > > bands )
	{
		super( Kind.BAND_PASS );

		if ( bands.isEmpty() )
			throw new ShapeMismatchException( "A band-pass level needs at least one oriented subband." );

		final ArrayImg< ComplexDoubleType, DoubleArray > first = bands.get( 0 );

		for ( int b = 1; b < bands.size(); ++b )
			if ( bands.get( b ).dimension( 0 ) != first.dimension( 0 ) || bands.get( b ).dimension( 1 ) != first.dimension( 1 ) )
				throw new ShapeMismatchException(
						"Subband " + b + " has size " + ImgLib2Tools.rows( bands.get( b ) ) + "x" + ImgLib2Tools.cols( bands.get( b ) ) +
						", subband 0 has size " + ImgLib2Tools.rows( first ) + "x" + ImgLib2Tools.cols( first ) );

		this.bands = Collections.unmodifiableList( new ArrayList<>( bands ) );
	}

	public int getNumBands() { return bands.size(); }

	/**
	 * @param b - orientation index
	 * @return a read-only view of the complex subband
	 */
	public RandomAccessibleInterval< ComplexDoubleType > getBand( final int b ) { return ImgLib2Tools.readOnlyComplex( bands.get( b ) ); }

	/**
	 * @return read-only views of all subbands, ordered by orientation
	 */
	public List< RandomAccessibleInterval< ComplexDoubleType > > getBands()
	{
		final ArrayList< RandomAccessibleInterval< ComplexDoubleType > > views = new ArrayList<>();

		for ( final ArrayImg< ComplexDoubleType, DoubleArray > band : bands )
			views.add( ImgLib2Tools.readOnlyComplex( band ) );

		return views;
	}

	@Override
	public int getRows() { return ImgLib2Tools.rows( bands.get( 0 ) ); }

	@Override
	public int getCols() { return ImgLib2Tools.cols( bands.get( 0 ) ); }

	@Override
	public String toString()
	{
		return super.toString() + " x " + bands.size() + " orientations";
	}
}
