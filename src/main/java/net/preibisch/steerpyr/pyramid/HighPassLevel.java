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

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;
import util.ImgLib2Tools;

/**
 * The real high-pass residual, same size as the input image.
 */
public class HighPassLevel extends PyramidLevel
{
	final ArrayImg< DoubleType, DoubleArray > img;

	HighPassLevel( final ArrayImg< DoubleType, DoubleArray > img )
	{
		super( Kind.HIGH_PASS );
		this.img = img;
	}

	/** @return a read-only view of the residual */
	public RandomAccessibleInterval< DoubleType > getImage() { return ImgLib2Tools.readOnly( img ); }

	@Override
	public int getRows() { return ImgLib2Tools.rows( img ); }

	@Override
	public int getCols() { return ImgLib2Tools.cols( img ); }
}
