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
package util;

import net.imglib2.Cursor;
import net.imglib2.Dimensions;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.converter.Converter;
import net.imglib2.converter.read.ConvertedRandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.ComplexType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;

public class ImgLib2Tools
{
	/**
	 * @param img - a 2d image
	 * @return number of rows (dimension 1, y)
	 */
	public static int rows( final Dimensions img ) { return (int)img.dimension( 1 ); }

	/**
	 * @param img - a 2d image
	 * @return number of columns (dimension 0, x)
	 */
	public static int cols( final Dimensions img ) { return (int)img.dimension( 0 ); }

	/**
	 * @param img - an array image backed by doubles
	 * @return the storage array, interleaved (re,im) for complex types
	 */
	public static double[] data( final ArrayImg< ?, DoubleArray > img )
	{
		return img.update( null ).getCurrentStorageArray();
	}

	/**
	 * Copies any real-valued image into a new double array image in flat iteration order (x fastest),
	 * the input is never written to.
	 */
	public static final < T extends RealType< T > > ArrayImg< DoubleType, DoubleArray > copyToDouble( final RandomAccessibleInterval< T > img )
	{
		final long[] dim = new long[ img.numDimensions() ];
		img.dimensions( dim );

		final ArrayImg< DoubleType, DoubleArray > copy = ArrayImgs.doubles( dim );
		final double[] target = data( copy );

		int i = 0;
		for ( final T t : Views.flatIterable( img ) )
			target[ i++ ] = t.getRealDouble();

		return copy;
	}

	/**
	 * Copies any complex-valued image into a new complex double array image in flat iteration order.
	 */
	public static final < C extends ComplexType< C > > ArrayImg< ComplexDoubleType, DoubleArray > copyToComplexDouble( final RandomAccessibleInterval< C > img )
	{
		final long[] dim = new long[ img.numDimensions() ];
		img.dimensions( dim );

		final ArrayImg< ComplexDoubleType, DoubleArray > copy = ArrayImgs.complexDoubles( dim );
		final double[] target = data( copy );

		final Cursor< C > c = Views.flatIterable( img ).cursor();

		for ( int i = 0; c.hasNext(); i += 2 )
		{
			final C t = c.next();
			target[ i ] = t.getRealDouble();
			target[ i + 1 ] = t.getImaginaryDouble();
		}

		return copy;
	}

	/**
	 * A view that reads through to the image but never writes back to it.
	 */
	public static final RandomAccessibleInterval< DoubleType > readOnly( final RandomAccessibleInterval< DoubleType > img )
	{
		return new ConvertedRandomAccessibleInterval< DoubleType, DoubleType >(
				img,
				new Converter< DoubleType, DoubleType >()
				{
					@Override
					public void convert( final DoubleType input, final DoubleType output )
					{
						output.set( input );
					}
				},
				new DoubleType() );
	}

	/**
	 * A view that reads through to the complex image but never writes back to it.
	 */
	public static final RandomAccessibleInterval< ComplexDoubleType > readOnlyComplex( final RandomAccessibleInterval< ComplexDoubleType > img )
	{
		return new ConvertedRandomAccessibleInterval< ComplexDoubleType, ComplexDoubleType >(
				img,
				new Converter< ComplexDoubleType, ComplexDoubleType >()
				{
					@Override
					public void convert( final ComplexDoubleType input, final ComplexDoubleType output )
					{
						output.set( input );
					}
				},
				new ComplexDoubleType() );
	}
}
