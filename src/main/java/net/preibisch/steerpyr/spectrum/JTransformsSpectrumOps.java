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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.jtransforms.fft.DoubleFFT_2D;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.complex.ComplexDoubleType;
import net.imglib2.type.numeric.real.DoubleType;
import util.ImgLib2Tools;

/**
 * {@link SpectrumOps} on plain double arrays. The interleaved (re,im) storage of a complex {@link ArrayImg} is
 * exactly the row-major layout JTransforms expects, so the transforms run in place on a copy of the storage.
 * FFT plans are created once per size and shared.
 */
public class JTransformsSpectrumOps implements SpectrumOps
{
	private final Map< String, DoubleFFT_2D > plans = new ConcurrentHashMap<>();

	protected DoubleFFT_2D plan( final int rows, final int cols )
	{
		return plans.computeIfAbsent( rows + "x" + cols, k -> new DoubleFFT_2D( rows, cols ) );
	}

	@Override
	public ArrayImg< ComplexDoubleType, DoubleArray > fft( final ArrayImg< ComplexDoubleType, DoubleArray > img )
	{
		final int rows = ImgLib2Tools.rows( img );
		final int cols = ImgLib2Tools.cols( img );

		final double[] a = ImgLib2Tools.data( img ).clone();
		plan( rows, cols ).complexForward( a );

		return ArrayImgs.complexDoubles( a, cols, rows );
	}

	@Override
	public ArrayImg< ComplexDoubleType, DoubleArray > ifft( final ArrayImg< ComplexDoubleType, DoubleArray > spectrum )
	{
		final int rows = ImgLib2Tools.rows( spectrum );
		final int cols = ImgLib2Tools.cols( spectrum );

		final double[] a = ImgLib2Tools.data( spectrum ).clone();
		plan( rows, cols ).complexInverse( a, true );

		return ArrayImgs.complexDoubles( a, cols, rows );
	}

	@Override
	public ArrayImg< ComplexDoubleType, DoubleArray > fftShift( final ArrayImg< ComplexDoubleType, DoubleArray > spectrum )
	{
		return circularShift( spectrum, ImgLib2Tools.rows( spectrum ) / 2, ImgLib2Tools.cols( spectrum ) / 2 );
	}

	@Override
	public ArrayImg< ComplexDoubleType, DoubleArray > ifftShift( final ArrayImg< ComplexDoubleType, DoubleArray > spectrum )
	{
		final int rows = ImgLib2Tools.rows( spectrum );
		final int cols = ImgLib2Tools.cols( spectrum );

		return circularShift( spectrum, rows - rows / 2, cols - cols / 2 );
	}

	/*
	 * out[ ( r + dr ) % rows ][ ( c + dc ) % cols ] = in[ r ][ c ]
	 */
	protected static ArrayImg< ComplexDoubleType, DoubleArray > circularShift( final ArrayImg< ComplexDoubleType, DoubleArray > img, final int dr, final int dc )
	{
		final int rows = ImgLib2Tools.rows( img );
		final int cols = ImgLib2Tools.cols( img );

		final double[] in = ImgLib2Tools.data( img );
		final double[] out = new double[ in.length ];

		// copy each row in (at most) two contiguous pieces
		final int tail = cols - dc;

		for ( int r = 0; r < rows; ++r )
		{
			final int src = r * cols * 2;
			final int dst = ( ( r + dr ) % rows ) * cols * 2;

			System.arraycopy( in, src, out, dst + dc * 2, tail * 2 );
			System.arraycopy( in, src + tail * 2, out, dst, dc * 2 );
		}

		return ArrayImgs.complexDoubles( out, cols, rows );
	}

	@Override
	public ArrayImg< ComplexDoubleType, DoubleArray > crop( final ArrayImg< ComplexDoubleType, DoubleArray > spectrum, final CropWindow window )
	{
		final int cols = checkSource( spectrum, window );

		final double[] in = ImgLib2Tools.data( spectrum );
		final double[] out = new double[ window.getRows() * window.getCols() * 2 ];

		for ( int r = 0; r < window.getRows(); ++r )
			System.arraycopy(
					in, ( ( r + window.getRowStart() ) * cols + window.getColStart() ) * 2,
					out, r * window.getCols() * 2,
					window.getCols() * 2 );

		return ArrayImgs.complexDoubles( out, window.getCols(), window.getRows() );
	}

	@Override
	public ArrayImg< ComplexDoubleType, DoubleArray > embed( final ArrayImg< ComplexDoubleType, DoubleArray > spectrum, final CropWindow window )
	{
		if ( ImgLib2Tools.rows( spectrum ) != window.getRows() || ImgLib2Tools.cols( spectrum ) != window.getCols() )
			throw new IllegalStateException(
					"Spectrum of size " + ImgLib2Tools.rows( spectrum ) + "x" + ImgLib2Tools.cols( spectrum ) + " does not fill crop window " + window );

		final int cols = window.getSourceCols();

		final double[] in = ImgLib2Tools.data( spectrum );
		final double[] out = new double[ window.getSourceRows() * cols * 2 ];

		for ( int r = 0; r < window.getRows(); ++r )
			System.arraycopy(
					in, r * window.getCols() * 2,
					out, ( ( r + window.getRowStart() ) * cols + window.getColStart() ) * 2,
					window.getCols() * 2 );

		return ArrayImgs.complexDoubles( out, cols, window.getSourceRows() );
	}

	@Override
	public ArrayImg< ComplexDoubleType, DoubleArray > multiply( final ArrayImg< ComplexDoubleType, DoubleArray > spectrum, final ArrayImg< DoubleType, DoubleArray > mask )
	{
		checkSameSize( spectrum, mask );

		final double[] in = ImgLib2Tools.data( spectrum );
		final double[] m = ImgLib2Tools.data( mask );
		final double[] out = new double[ in.length ];

		for ( int i = 0; i < m.length; ++i )
		{
			out[ 2 * i ] = in[ 2 * i ] * m[ i ];
			out[ 2 * i + 1 ] = in[ 2 * i + 1 ] * m[ i ];
		}

		return ArrayImgs.complexDoubles( out, spectrum.dimension( 0 ), spectrum.dimension( 1 ) );
	}

	@Override
	public ArrayImg< ComplexDoubleType, DoubleArray > multiply( final ArrayImg< ComplexDoubleType, DoubleArray > spectrum, final ComplexDoubleType factor )
	{
		final double fr = factor.getRealDouble();
		final double fi = factor.getImaginaryDouble();

		final double[] in = ImgLib2Tools.data( spectrum );
		final double[] out = new double[ in.length ];

		for ( int i = 0; i < in.length; i += 2 )
		{
			final double re = in[ i ];
			final double im = in[ i + 1 ];

			out[ i ] = re * fr - im * fi;
			out[ i + 1 ] = re * fi + im * fr;
		}

		return ArrayImgs.complexDoubles( out, spectrum.dimension( 0 ), spectrum.dimension( 1 ) );
	}

	@Override
	public void addTo( final ArrayImg< ComplexDoubleType, DoubleArray > target, final ArrayImg< ComplexDoubleType, DoubleArray > summand )
	{
		checkSameSize( target, summand );

		final double[] t = ImgLib2Tools.data( target );
		final double[] s = ImgLib2Tools.data( summand );

		for ( int i = 0; i < t.length; ++i )
			t[ i ] += s[ i ];
	}

	@Override
	public ArrayImg< DoubleType, DoubleArray > real( final ArrayImg< ComplexDoubleType, DoubleArray > img )
	{
		final double[] in = ImgLib2Tools.data( img );
		final double[] out = new double[ in.length / 2 ];

		for ( int i = 0; i < out.length; ++i )
			out[ i ] = in[ 2 * i ];

		return ArrayImgs.doubles( out, img.dimension( 0 ), img.dimension( 1 ) );
	}

	@Override
	public ArrayImg< ComplexDoubleType, DoubleArray > toComplex( final ArrayImg< DoubleType, DoubleArray > img )
	{
		final double[] in = ImgLib2Tools.data( img );
		final double[] out = new double[ in.length * 2 ];

		for ( int i = 0; i < in.length; ++i )
			out[ 2 * i ] = in[ i ];

		return ArrayImgs.complexDoubles( out, img.dimension( 0 ), img.dimension( 1 ) );
	}

	protected static int checkSource( final ArrayImg< ?, ? > img, final CropWindow window )
	{
		if ( ImgLib2Tools.rows( img ) != window.getSourceRows() || ImgLib2Tools.cols( img ) != window.getSourceCols() )
			throw new IllegalStateException(
					"Crop window " + window + " does not fit an image of size " + ImgLib2Tools.rows( img ) + "x" + ImgLib2Tools.cols( img ) );

		return window.getSourceCols();
	}

	protected static void checkSameSize( final ArrayImg< ?, ? > a, final ArrayImg< ?, ? > b )
	{
		if ( a.dimension( 0 ) != b.dimension( 0 ) || a.dimension( 1 ) != b.dimension( 1 ) )
			throw new IllegalStateException(
					"Image sizes differ: " + ImgLib2Tools.rows( a ) + "x" + ImgLib2Tools.cols( a ) + " != " + ImgLib2Tools.rows( b ) + "x" + ImgLib2Tools.cols( b ) );
	}
}
