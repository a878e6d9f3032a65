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

/**
 * One level of a {@link PyramidCoefficients} tree. The kind tells which subclass it is.
 */
public abstract class PyramidLevel
{
	public enum Kind
	{
		HIGH_PASS, BAND_PASS, LOW_PASS
	}

	final Kind kind;

	PyramidLevel( final Kind kind )
	{
		this.kind = kind;
	}

	public Kind getKind() { return kind; }

	/** @return number of rows of the level (of each subband for band-pass levels) */
	public abstract int getRows();

	/** @return number of columns of the level (of each subband for band-pass levels) */
	public abstract int getCols();

	/** @return { rows, cols } */
	public long[] getShape() { return new long[] { getRows(), getCols() }; }

	@Override
	public String toString()
	{
		return kind + " " + getRows() + "x" + getCols();
	}
}
