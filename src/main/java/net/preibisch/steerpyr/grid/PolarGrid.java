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

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;
import net.preibisch.steerpyr.spectrum.CropWindow;
import util.ImgLib2Tools;

/**
 * Log-radius and angle of every position of a centered (shifted) spectrum. Frequencies are normalized so that
 * the Nyquist frequency along each axis has radius 1 (log-radius 0).
 * <p>
 * The zero frequency sits at row ceil((rows+0.5)/2)-1 and column ceil((cols+0.5)/2)-1. Its radius is copied from
 * the left neighbor so the log-radius stays finite.
 */
public class PolarGrid
{
	final int rows, cols;
	final ArrayImg< DoubleType, DoubleArray > logRad, angle;

	PolarGrid( final int rows, final int cols, final ArrayImg< DoubleType, DoubleArray > logRad, final ArrayImg< DoubleType, DoubleArray > angle )
	{
		this.rows = rows;
		this.cols = cols;
		this.logRad = logRad;
		this.angle = angle;
	}

	/**
	 * @param rows - height of the spectrum
	 * @param cols - width of the spectrum
	 * @return the grid of the full spectrum
	 */
	public static PolarGrid create( final int rows, final int cols )
	{
		if ( rows < 2 || cols < 2 )
			throw new IllegalArgumentException( "A polar grid needs at least 2x2 positions, got " + rows + "x" + cols );

		final int ctrRow = (int)Math.ceil( ( rows + 0.5 ) / 2.0 );
		final int ctrCol = (int)Math.ceil( ( cols + 0.5 ) / 2.0 );

		final double[] rad = new double[ rows * cols ];
		final double[] ang = new double[ rows * cols ];

		for ( int r = 0, i = 0; r < rows; ++r )
		{
			final double yv = ( r + 1 - ctrRow ) / ( rows / 2.0 );

			for ( int c = 0; c < cols; ++c, ++i )
			{
				final double xv = ( c + 1 - ctrCol ) / ( cols / 2.0 );

				rad[ i ] = Math.sqrt( xv * xv + yv * yv );
				ang[ i ] = Math.atan2( yv, xv );
			}
		}

		final int dc = ( ctrRow - 1 ) * cols + ( ctrCol - 1 );
		rad[ dc ] = rad[ dc - 1 ];

		for ( int i = 0; i < rad.length; ++i )
			rad[ i ] = Math.log( rad[ i ] ) / Math.log( 2 );

		return new PolarGrid( rows, cols, ArrayImgs.doubles( rad, cols, rows ), ArrayImgs.doubles( ang, cols, rows ) );
	}

	/**
	 * @param window - the window of the next octave
	 * @return a new grid holding the values inside the window (no re-normalization)
	 */
	public PolarGrid crop( final CropWindow window )
	{
		if ( window.getSourceRows() != rows || window.getSourceCols() != cols )
			throw new IllegalStateException( "Crop window " + window + " does not fit a " + rows + "x" + cols + " grid." );

		return new PolarGrid(
				window.getRows(),
				window.getCols(),
				crop( logRad, cols, window ),
				crop( angle, cols, window ) );
	}

	static ArrayImg< DoubleType, DoubleArray > crop( final ArrayImg< DoubleType, DoubleArray > img, final int cols, final CropWindow window )
	{
		final double[] in = ImgLib2Tools.data( img );
		final double[] out = new double[ window.getRows() * window.getCols() ];

		for ( int r = 0; r < window.getRows(); ++r )
			System.arraycopy( in, ( r + window.getRowStart() ) * cols + window.getColStart(), out, r * window.getCols(), window.getCols() );

		return ArrayImgs.doubles( out, window.getCols(), window.getRows() );
	}

	public int getRows() { return rows; }
	public int getCols() { return cols; }

	/** @return base-2 logarithm of the normalized radius, do not modify */
	public ArrayImg< DoubleType, DoubleArray > getLogRad() { return logRad; }

	/** @return polar angle in (-pi, pi], do not modify */
	public ArrayImg< DoubleType, DoubleArray > getAngle() { return angle; }
}
