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

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.ComplexType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import util.ImgLib2Tools;

/**
 * Local amplitude and phase of complex subbands.
 */
public class Subbands
{
	public static < C extends ComplexType< C > > ArrayImg< DoubleType, DoubleArray > amplitude( final RandomAccessibleInterval< C > band )
	{
		final ArrayImg< DoubleType, DoubleArray > out = ArrayImgs.doubles( band.dimension( 0 ), band.dimension( 1 ) );
		final double[] target = ImgLib2Tools.data( out );
		final Cursor< C > c = Views.flatIterable( band ).cursor();

		for ( int i = 0; c.hasNext(); ++i )
		{
			final C t = c.next();
			target[ i ] = Math.hypot( t.getRealDouble(), t.getImaginaryDouble() );
		}

		return out;
	}

	/**
	 * @return the phase in [-pi, pi]
	 */
	public static < C extends ComplexType< C > > ArrayImg< DoubleType, DoubleArray > phase( final RandomAccessibleInterval< C > band )
	{
		final ArrayImg< DoubleType, DoubleArray > out = ArrayImgs.doubles( band.dimension( 0 ), band.dimension( 1 ) );
		final double[] target = ImgLib2Tools.data( out );
		final Cursor< C > c = Views.flatIterable( band ).cursor();

		for ( int i = 0; c.hasNext(); ++i )
		{
			final C t = c.next();
			target[ i ] = Math.atan2( t.getImaginaryDouble(), t.getRealDouble() );
		}

		return out;
	}
}
