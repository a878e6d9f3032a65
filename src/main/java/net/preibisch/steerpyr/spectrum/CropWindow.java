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
package net.preibisch.steerpyr.spectrum;

/**
 * The centered window of a shifted spectrum that holds the next (coarser) octave. The window keeps the zero
 * frequency at the center position of the cropped spectrum, so an inverse shift of the cropped spectrum is
 * consistent with a spectrum of the smaller size.
 */
public class CropWindow
{
	final int sourceRows, sourceCols;
	final int rowStart, colStart;
	final int rows, cols;

	CropWindow( final int sourceRows, final int sourceCols, final int rowStart, final int colStart, final int rows, final int cols )
	{
		this.sourceRows = sourceRows;
		this.sourceCols = sourceCols;
		this.rowStart = rowStart;
		this.colStart = colStart;
		this.rows = rows;
		this.cols = cols;
	}

	/**
	 * @param rows - rows of the spectrum that is cropped
	 * @param cols - columns of the spectrum that is cropped
	 * @return the window of the next octave
	 */
	public static CropWindow nextOctave( final int rows, final int cols )
	{
		final int r = size( rows );
		final int c = size( cols );

		if ( r < 1 || c < 1 )
			throw new IllegalStateException( "Cannot crop a " + rows + "x" + cols + " spectrum any further." );

		return new CropWindow( rows, cols, start( rows ), start( cols ), r, c );
	}

	static int start( final int d )
	{
		return (int)( Math.ceil( ( d + 0.5 ) / 2.0 ) - Math.ceil( ( Math.ceil( ( d - 0.5 ) / 2.0 ) + 0.5 ) / 2.0 ) );
	}

	static int size( final int d )
	{
		return (int)Math.ceil( ( d - 0.5 ) / 2.0 );
	}

	public int getSourceRows() { return sourceRows; }
	public int getSourceCols() { return sourceCols; }

	/** @return first row (inclusive) */
	public int getRowStart() { return rowStart; }

	/** @return first column (inclusive) */
	public int getColStart() { return colStart; }

	public int getRowEnd() { return rowStart + rows; }
	public int getColEnd() { return colStart + cols; }

	public int getRows() { return rows; }
	public int getCols() { return cols; }

	@Override
	public String toString()
	{
		return "[" + rowStart + ":" + getRowEnd() + ", " + colStart + ":" + getColEnd() + "] of " + sourceRows + "x" + sourceCols;
	}
}
